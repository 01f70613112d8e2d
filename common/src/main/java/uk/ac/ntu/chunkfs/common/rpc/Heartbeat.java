package uk.ac.ntu.chunkfs.common.rpc;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

public record Heartbeat(String chunkserverId, Set<Long> chunkHandles, Instant timestamp) {
    public Heartbeat {
        Objects.requireNonNull(chunkserverId);
        Objects.requireNonNull(timestamp);
        chunkHandles = Set.copyOf(chunkHandles);
    }
}
