package uk.ac.ntu.chunkfs.chunkserver.http;

import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.chunkfs.chunkserver.Chunkserver;
import uk.ac.ntu.chunkfs.common.Version;
import uk.ac.ntu.chunkfs.common.http.Wire;
import uk.ac.ntu.chunkfs.common.rpc.AppendRole;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import static uk.ac.ntu.chunkfs.common.http.HttpRpc.endpoint;
import static uk.ac.ntu.chunkfs.common.http.HttpRpc.longParam;
import static uk.ac.ntu.chunkfs.common.http.HttpRpc.method;
import static uk.ac.ntu.chunkfs.common.http.HttpRpc.optParam;
import static uk.ac.ntu.chunkfs.common.http.HttpRpc.param;
import static uk.ac.ntu.chunkfs.common.http.HttpRpc.reply;
import static uk.ac.ntu.chunkfs.common.http.HttpRpc.replyBytes;

public final class ChunkserverHttpServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChunkserverHttpServer.class);

    private final Chunkserver chunkserver;
    private final HttpServer server;
    private final ExecutorService workers;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ChunkserverHttpServer(Chunkserver chunkserver, int port, int workerCount) throws IOException {
        this.chunkserver = chunkserver;
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.workers = Executors.newFixedThreadPool(workerCount);

        // ---- basic endpoints ----
        server.createContext("/health", endpoint(ex -> reply(ex, 200, "OK")));
        server.createContext("/version", endpoint(ex -> reply(ex, 200, Version.NAME + " " + Version.VERSION)));

        // ---- chunk: PUT creates, GET reads ----
        server.createContext("/chunk", endpoint(ex -> {
            if (!"/chunk".equals(ex.getRequestURI().getPath())) {
                reply(ex, 404, "NOT_FOUND");
                return;
            }
            String m = ex.getRequestMethod().toUpperCase();
            long handle = longParam(ex, "handle");

            if ("PUT".equals(m)) {
                long version = longParam(ex, "version");
                chunkserver.createChunk(handle, version);
                reply(ex, 200, "CREATED " + handle);
                return;
            }

            if ("GET".equals(m)) {
                String offset = optParam(ex, "offset");
                String length = optParam(ex, "length");
                byte[] data = offset == null && length == null
                        ? chunkserver.readChunk(handle)
                        : chunkserver.readChunk(handle,
                                offset == null ? 0 : Integer.parseInt(offset),
                                length == null ? Integer.MAX_VALUE : Integer.parseInt(length));
                replyBytes(ex, data);
                return;
            }

            reply(ex, 405, "METHOD_NOT_ALLOWED");
        }));

        server.createContext("/chunk/append", endpoint(ex -> {
            if (!method(ex, "POST")) return;
            long handle = longParam(ex, "handle");
            AppendRole role = AppendRole.valueOf(param(ex, "role").toUpperCase());
            var secondaries = Wire.splitIds(optParam(ex, "secondaries"));
            byte[] data = ex.getRequestBody().readAllBytes();
            reply(ex, 200, Wire.encode(chunkserver.append(handle, data, role, secondaries)));
        }));

        server.setExecutor(workers);
    }

    public void start() {
        server.start();
        log.info("Chunkserver {} listening on port {} (endpoints: /health, /version, /chunk, /chunk/append)",
                chunkserver.id(), port());
    }

    public int port() { return server.getAddress().getPort(); }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        server.stop(0);
        workers.shutdownNow();
    }
}
