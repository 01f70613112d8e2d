package uk.ac.ntu.chunkfs.master.meta;

import java.time.Instant;
import java.util.List;

/**
 * Replica set and lease state of one chunk. Guarded by the master lock.
 *
 * <p>The primary, when set, is always a replica; the version only ever grows.
 */
public final class ChunkMetadata {
    private final long handle;
    private final List<String> replicas;

    private long version;
    private String primary;
    private List<String> leaseSecondaries = List.of();
    private Instant leaseExpiry;

    ChunkMetadata(long handle, List<String> replicas) {
        this.handle = handle;
        this.replicas = List.copyOf(replicas);
    }

    public long handle() { return handle; }
    public List<String> replicas() { return replicas; }
    public long version() { return version; }

    /** Null when no lease was ever granted or the last one was cleared. */
    public String primary() { return primary; }
    public Instant leaseExpiry() { return leaseExpiry; }
    public List<String> leaseSecondaries() { return leaseSecondaries; }

    public boolean hasValidLease(Instant now) {
        return primary != null && leaseExpiry != null && leaseExpiry.isAfter(now);
    }

    public void grantLease(String newPrimary, List<String> secondaries, Instant expiry) {
        if (!replicas.contains(newPrimary)) {
            throw new IllegalArgumentException(newPrimary + " is not a replica of chunk " + handle);
        }
        this.primary = newPrimary;
        this.leaseSecondaries = List.copyOf(secondaries);
        this.leaseExpiry = expiry;
        this.version++;
    }

    public void clearLease() {
        this.primary = null;
        this.leaseSecondaries = List.of();
        this.leaseExpiry = null;
    }
}
