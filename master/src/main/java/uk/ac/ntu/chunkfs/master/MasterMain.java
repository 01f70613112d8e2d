package uk.ac.ntu.chunkfs.master;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.chunkfs.common.config.Env;
import uk.ac.ntu.chunkfs.common.config.FsConfig;
import uk.ac.ntu.chunkfs.common.placement.RotatingPlacement;
import uk.ac.ntu.chunkfs.master.http.MasterHttpServer;
import uk.ac.ntu.chunkfs.master.liveness.LivenessMonitor;

import java.io.IOException;
import java.time.Clock;

public final class MasterMain {
    private static final Logger log = LoggerFactory.getLogger(MasterMain.class);

    private MasterMain() {}

    public static void main(String[] args) throws IOException {
        Env env = Env.system();
        int port = env.readInt("MASTER_PORT", 9000);
        int workers = env.readInt("MASTER_WORKERS", 8);

        Master master = createMaster(env, Clock.systemUTC());
        FsConfig config = master.config();
        LivenessMonitor.startDaemon(master, config.heartbeatInterval().toMillis());

        MasterHttpServer server = new MasterHttpServer(master, port, workers);
        server.start();

        log.info("Config: chunkSize={} replication={} lease={}s heartbeat={}s dead={}s placement={}",
                config.chunkSize(), config.replicationFactor(), config.leaseTimeout().toSeconds(),
                config.heartbeatInterval().toSeconds(), config.deadThreshold().toSeconds(), master.placementName());
    }

    static Master createMaster(Env env, Clock clock) {
        Master master = new Master(FsConfig.from(env), new RotatingPlacement(), clock);
        // no repair policy yet: surface the loss so an operator can act on it
        master.addReplicaLossListener(loss -> {
            if (!loss.underReplicated().isEmpty()) {
                log.warn("Chunks under-replicated after losing {}: {}", loss.chunkserverId(), loss.underReplicated());
            }
        });
        return master;
    }
}
