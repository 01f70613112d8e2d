package uk.ac.ntu.chunkfs.chunkserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.chunkfs.chunkserver.http.ChunkserverHttpServer;
import uk.ac.ntu.chunkfs.common.config.Env;
import uk.ac.ntu.chunkfs.common.config.FsConfig;
import uk.ac.ntu.chunkfs.common.http.HttpMasterClient;
import uk.ac.ntu.chunkfs.common.http.PeerConfig;
import uk.ac.ntu.chunkfs.common.http.RpcClient;
import uk.ac.ntu.chunkfs.common.rpc.ChunkserverDirectory;

import java.io.IOException;
import java.time.Clock;

public final class ChunkserverMain {
    private static final Logger log = LoggerFactory.getLogger(ChunkserverMain.class);

    private ChunkserverMain() {}

    public static void main(String[] args) throws IOException {
        Env env = Env.system();
        FsConfig config = FsConfig.from(env);
        String id = env.str("CS_ID", "cs1");
        int port = env.readInt("CS_PORT", 9101);
        int workers = env.readInt("CS_WORKERS", 8);
        String masterUrl = env.str("MASTER_URL", "http://localhost:9000");

        RpcClient rpc = new RpcClient();
        ChunkserverDirectory peers = PeerConfig.directory(env.str("CHUNKSERVERS", ""), rpc);

        Chunkserver cs = new Chunkserver(id, config, peers, new HttpMasterClient(masterUrl, rpc), Clock.systemUTC());
        cs.addForwardingFailureListener(f ->
                log.warn("Chunk {} diverged from {} at offset {} (+{} bytes); no repair is attempted",
                        f.handle(), f.failedSecondaries(), f.offset(), f.length()));

        ChunkserverHttpServer server = new ChunkserverHttpServer(cs, port, workers);
        server.start();
        cs.start();

        log.info("Master: {} peers: {}", masterUrl, peers.ids());
    }
}
