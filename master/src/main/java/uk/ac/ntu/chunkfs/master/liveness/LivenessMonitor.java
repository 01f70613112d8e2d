package uk.ac.ntu.chunkfs.master.liveness;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.chunkfs.master.Master;

/**
 * Background sweep so that dead chunkservers are reported even when no client call
 * touches the master.
 */
public final class LivenessMonitor implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);

    private final Master master;
    private final long intervalMs;

    public LivenessMonitor(Master master, long intervalMs) {
        if (intervalMs <= 0) throw new IllegalArgumentException("intervalMs must be positive");
        this.master = master;
        this.intervalMs = intervalMs;
    }

    @Override
    public void run() {
        log.debug("Liveness monitor running every {}ms", intervalMs);
        while (!Thread.currentThread().isInterrupted()) {
            master.checkLiveness();

            try {
                Thread.sleep(intervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public static Thread startDaemon(Master master, long intervalMs) {
        Thread t = new Thread(new LivenessMonitor(master, intervalMs), "liveness-monitor");
        t.setDaemon(true);
        t.start();
        return t;
    }
}
