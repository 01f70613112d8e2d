package uk.ac.ntu.chunkfs.common.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Cluster-wide tunables shared by master, chunkservers and clients.
 *
 * <p>The dead threshold is independent of the heartbeat interval; nothing forces it to be a
 * multiple of it.
 */
public record FsConfig(
        int chunkSize,
        int replicationFactor,
        Duration leaseTimeout,
        Duration heartbeatInterval,
        Duration deadThreshold) {

    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024 * 1024;
    public static final int DEFAULT_REPLICATION = 3;
    public static final long DEFAULT_LEASE_TIMEOUT_S = 60;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_S = 10;
    public static final long DEFAULT_DEAD_THRESHOLD_S = 30;

    public FsConfig {
        Objects.requireNonNull(leaseTimeout, "leaseTimeout");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(deadThreshold, "deadThreshold");
        if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        if (replicationFactor < 1) throw new IllegalArgumentException("replicationFactor must be >= 1: " + replicationFactor);
        requirePositive("leaseTimeout", leaseTimeout);
        requirePositive("heartbeatInterval", heartbeatInterval);
        requirePositive("deadThreshold", deadThreshold);
    }

    public static FsConfig defaults() {
        return new FsConfig(
                DEFAULT_CHUNK_SIZE,
                DEFAULT_REPLICATION,
                Duration.ofSeconds(DEFAULT_LEASE_TIMEOUT_S),
                Duration.ofSeconds(DEFAULT_HEARTBEAT_INTERVAL_S),
                Duration.ofSeconds(DEFAULT_DEAD_THRESHOLD_S));
    }

    public static FsConfig fromEnv() { return from(Env.system()); }

    /**
     * CHUNKFS_CHUNK_SIZE, CHUNKFS_REPLICATION, CHUNKFS_LEASE_TIMEOUT_S,
     * CHUNKFS_HEARTBEAT_INTERVAL_S, CHUNKFS_DEAD_THRESHOLD_S
     */
    public static FsConfig from(Env env) {
        return new FsConfig(
                env.readInt("CHUNKFS_CHUNK_SIZE", DEFAULT_CHUNK_SIZE),
                env.readInt("CHUNKFS_REPLICATION", DEFAULT_REPLICATION),
                Duration.ofSeconds(env.readLong("CHUNKFS_LEASE_TIMEOUT_S", DEFAULT_LEASE_TIMEOUT_S)),
                Duration.ofSeconds(env.readLong("CHUNKFS_HEARTBEAT_INTERVAL_S", DEFAULT_HEARTBEAT_INTERVAL_S)),
                Duration.ofSeconds(env.readLong("CHUNKFS_DEAD_THRESHOLD_S", DEFAULT_DEAD_THRESHOLD_S)));
    }

    public FsConfig withChunkSize(int bytes) {
        return new FsConfig(bytes, replicationFactor, leaseTimeout, heartbeatInterval, deadThreshold);
    }

    public FsConfig withReplicationFactor(int replicas) {
        return new FsConfig(chunkSize, replicas, leaseTimeout, heartbeatInterval, deadThreshold);
    }

    private static void requirePositive(String name, Duration d) {
        if (d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be positive: " + d);
    }
}
