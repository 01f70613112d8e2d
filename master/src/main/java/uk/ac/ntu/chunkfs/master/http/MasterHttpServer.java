package uk.ac.ntu.chunkfs.master.http;

import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.chunkfs.common.Version;
import uk.ac.ntu.chunkfs.common.http.Wire;
import uk.ac.ntu.chunkfs.common.rpc.Heartbeat;
import uk.ac.ntu.chunkfs.master.Master;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.HashSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import static uk.ac.ntu.chunkfs.common.http.HttpRpc.endpoint;
import static uk.ac.ntu.chunkfs.common.http.HttpRpc.longParam;
import static uk.ac.ntu.chunkfs.common.http.HttpRpc.method;
import static uk.ac.ntu.chunkfs.common.http.HttpRpc.param;
import static uk.ac.ntu.chunkfs.common.http.HttpRpc.reply;

public final class MasterHttpServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MasterHttpServer.class);

    private final HttpServer server;
    private final ExecutorService workers;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public MasterHttpServer(Master master, int port, int workerCount) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.workers = Executors.newFixedThreadPool(workerCount);

        // ---- basic endpoints ----
        server.createContext("/health", endpoint(ex -> reply(ex, 200, "OK")));
        server.createContext("/version", endpoint(ex -> reply(ex, 200, Version.NAME + " " + Version.VERSION)));

        server.createContext("/metrics", endpoint(ex -> {
            var views = master.chunkservers();
            long alive = views.stream().filter(Master.ChunkserverView::alive).count();
            StringBuilder sb = new StringBuilder();
            sb.append("placement=").append(master.placementName())
                    .append(" chunkservers=").append(alive).append('/').append(views.size())
                    .append(" chunks=").append(master.chunkCount()).append('\n');
            for (var v : views) {
                sb.append(v.id()).append(' ').append(v.alive() ? "ALIVE" : "DEAD")
                        .append(" lastHeartbeat=").append(v.lastHeartbeat())
                        .append(" chunks=").append(v.reportedChunks()).append('\n');
            }
            reply(ex, 200, sb.toString());
        }));

        // ---- files: POST creates, GET describes ----
        server.createContext("/files", endpoint(ex -> {
            String path = param(ex, "path");
            if ("POST".equalsIgnoreCase(ex.getRequestMethod())) {
                master.createFile(path);
                reply(ex, 200, "CREATED " + path);
                return;
            }
            if ("GET".equalsIgnoreCase(ex.getRequestMethod())) {
                reply(ex, 200, Wire.encode(master.getFileInfo(path)));
                return;
            }
            reply(ex, 405, "METHOD_NOT_ALLOWED");
        }));

        // ---- chunks ----
        server.createContext("/chunks/allocate", endpoint(ex -> {
            if (!method(ex, "POST")) return;
            reply(ex, 200, Wire.encode(master.allocateChunk(param(ex, "path"))));
        }));

        server.createContext("/chunks/lease", endpoint(ex -> {
            if (!method(ex, "POST")) return;
            reply(ex, 200, Wire.encode(master.getOrGrantLease(longParam(ex, "handle"))));
        }));

        server.createContext("/chunks/revoke", endpoint(ex -> {
            if (!method(ex, "POST")) return;
            long handle = longParam(ex, "handle");
            master.revokeLease(handle);
            reply(ex, 200, "REVOKED " + handle);
        }));

        server.createContext("/chunks/locations", endpoint(ex -> {
            if (!method(ex, "GET")) return;
            reply(ex, 200, Wire.encode(master.getChunkLocations(longParam(ex, "handle"))));
        }));

        // ---- chunkservers ----
        server.createContext("/heartbeat", endpoint(ex -> {
            if (!method(ex, "POST")) return;
            String id = param(ex, "id");
            var handles = new HashSet<>(Wire.splitHandles(param(ex, "handles")));
            // stamped on arrival: chunkserver clocks are not trusted across processes
            master.heartbeat(new Heartbeat(id, handles, master.now()));
            reply(ex, 200, "OK");
        }));

        server.setExecutor(workers);
    }

    public void start() {
        server.start();
        log.info("Master listening on port {} (endpoints: /health, /version, /metrics, /files, /chunks/*, /heartbeat)", port());
    }

    public int port() { return server.getAddress().getPort(); }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        server.stop(0);
        workers.shutdownNow();
    }
}
