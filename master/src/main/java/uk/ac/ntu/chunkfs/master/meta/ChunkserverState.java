package uk.ac.ntu.chunkfs.master.meta;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

public final class ChunkserverState {
    private final String id;

    private Instant lastHeartbeat;
    private Set<Long> inventory = Set.of();

    // liveness as last observed; used to spot alive -> dead transitions
    private boolean observedAlive = true;

    ChunkserverState(String id, Instant firstSeen) {
        this.id = Objects.requireNonNull(id);
        this.lastHeartbeat = Objects.requireNonNull(firstSeen);
    }

    public String id() { return id; }
    public Instant lastHeartbeat() { return lastHeartbeat; }
    public Set<Long> inventory() { return inventory; }
    public boolean observedAlive() { return observedAlive; }

    public boolean isAlive(Instant now, Duration deadThreshold) {
        return Duration.between(lastHeartbeat, now).compareTo(deadThreshold) < 0;
    }

    /**
     * Out-of-order heartbeats never move last-seen backwards, so a stale one cannot revive a
     * chunkserver already seen dead. Returns true on a dead -> alive transition.
     */
    public boolean recordHeartbeat(Instant timestamp, Set<Long> reported, Instant now, Duration deadThreshold) {
        if (timestamp.isAfter(lastHeartbeat)) lastHeartbeat = timestamp;
        inventory = Set.copyOf(reported);
        boolean wasAlive = observedAlive;
        observedAlive = isAlive(now, deadThreshold);
        return !wasAlive && observedAlive;
    }

    public void markDead() { observedAlive = false; }
}
