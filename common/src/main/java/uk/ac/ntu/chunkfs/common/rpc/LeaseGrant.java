package uk.ac.ntu.chunkfs.common.rpc;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A primary lease on one chunk. Secondaries are the other replicas that were alive when the
 * lease was granted, ascending by id.
 */
public record LeaseGrant(long handle, String primary, List<String> secondaries, long version, Instant expiry) {
    public LeaseGrant {
        Objects.requireNonNull(primary);
        Objects.requireNonNull(expiry);
        secondaries = List.copyOf(secondaries);
    }

    /** Primary first, then the secondaries. */
    public List<String> participants() {
        List<String> out = new ArrayList<>(secondaries.size() + 1);
        out.add(primary);
        out.addAll(secondaries);
        return out;
    }
}
