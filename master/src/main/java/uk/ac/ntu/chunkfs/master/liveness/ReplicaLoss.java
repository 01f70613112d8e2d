package uk.ac.ntu.chunkfs.master.liveness;

import java.time.Instant;
import java.util.List;

public record ReplicaLoss(String chunkserverId, List<Long> underReplicated, Instant detectedAt) {
    public ReplicaLoss {
        underReplicated = List.copyOf(underReplicated);
    }
}
