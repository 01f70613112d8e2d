package uk.ac.ntu.chunkfs.chunkserver;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

final class HeartbeatSender implements AutoCloseable {
    private final Chunkserver chunkserver;
    private final long intervalMs;
    private ScheduledExecutorService exec;

    HeartbeatSender(Chunkserver chunkserver, Duration interval) {
        this.chunkserver = chunkserver;
        this.intervalMs = interval.toMillis();
    }

    synchronized void start() {
        if (exec != null) return;
        exec = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-" + chunkserver.id());
            t.setDaemon(true);
            return t;
        });
        exec.scheduleAtFixedRate(chunkserver::heartbeatTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    synchronized boolean running() { return exec != null && !exec.isShutdown(); }

    @Override
    public synchronized void close() {
        if (exec == null) return;
        exec.shutdownNow();
        exec = null;
    }
}
