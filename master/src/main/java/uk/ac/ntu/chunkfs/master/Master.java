package uk.ac.ntu.chunkfs.master;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.chunkfs.common.config.FsConfig;
import uk.ac.ntu.chunkfs.common.error.ErrorCode;
import uk.ac.ntu.chunkfs.common.error.FsException;
import uk.ac.ntu.chunkfs.common.placement.PlacementPolicy;
import uk.ac.ntu.chunkfs.common.rpc.ChunkAllocation;
import uk.ac.ntu.chunkfs.common.rpc.ChunkLocations;
import uk.ac.ntu.chunkfs.common.rpc.FileInfo;
import uk.ac.ntu.chunkfs.common.rpc.Heartbeat;
import uk.ac.ntu.chunkfs.common.rpc.LeaseGrant;
import uk.ac.ntu.chunkfs.common.rpc.MasterService;
import uk.ac.ntu.chunkfs.master.liveness.ReplicaLoss;
import uk.ac.ntu.chunkfs.master.liveness.ReplicaLossListener;
import uk.ac.ntu.chunkfs.master.meta.ChunkMetadata;
import uk.ac.ntu.chunkfs.master.meta.ChunkserverState;
import uk.ac.ntu.chunkfs.master.meta.FileMetadata;
import uk.ac.ntu.chunkfs.master.meta.MetadataStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The metadata authority. Every operation runs under one lock over the {@link MetadataStore};
 * none of them spans more than one chunk plus the chunkserver registry.
 *
 * <p>Dead chunkservers are detected lazily at the start of allocate, lease and location calls
 * (and by {@link #checkLiveness()}); each alive -> dead transition is reported to the
 * registered {@link ReplicaLossListener}s after the lock is released.
 */
public final class Master implements MasterService {
    private static final Logger log = LoggerFactory.getLogger(Master.class);

    private final FsConfig config;
    private final PlacementPolicy placement;
    private final Clock clock;
    private final MetadataStore store;

    private final ReentrantLock lock = new ReentrantLock();
    private final CopyOnWriteArrayList<ReplicaLossListener> listeners = new CopyOnWriteArrayList<>();

    public Master(FsConfig config, PlacementPolicy placement, Clock clock, MetadataStore store) {
        this.config = Objects.requireNonNull(config);
        this.placement = Objects.requireNonNull(placement);
        this.clock = Objects.requireNonNull(clock);
        this.store = Objects.requireNonNull(store);
    }

    public Master(FsConfig config, PlacementPolicy placement, Clock clock) {
        this(config, placement, clock, new MetadataStore());
    }

    public void addReplicaLossListener(ReplicaLossListener l) { listeners.add(l); }

    public FsConfig config() { return config; }
    public String placementName() { return placement.name(); }

    // ---------------- files ----------------

    @Override
    public void createFile(String path) throws FsException {
        requirePath(path);
        lock.lock();
        try {
            if (store.file(path) != null) throw new FsException(ErrorCode.ALREADY_EXISTS, "file exists: " + path);
            store.createFile(path);
        } finally {
            lock.unlock();
        }
        log.info("Created file {}", path);
    }

    @Override
    public FileInfo getFileInfo(String path) throws FsException {
        requirePath(path);
        lock.lock();
        try {
            return new FileInfo(path, requireFile(path).chunkHandles());
        } finally {
            lock.unlock();
        }
    }

    // ---------------- chunks ----------------

    @Override
    public ChunkAllocation allocateChunk(String path) throws FsException {
        requirePath(path);
        Instant now = detectDeadChunkservers();
        ChunkAllocation out;
        lock.lock();
        try {
            FileMetadata file = requireFile(path);
            List<String> alive = aliveIds(now);
            int rf = config.replicationFactor();
            if (alive.size() < rf) {
                throw new FsException(ErrorCode.INSUFFICIENT_REPLICAS,
                        "need " + rf + " alive chunkservers, have " + alive.size());
            }
            List<String> chosen = new ArrayList<>(placement.select(alive, rf));
            chosen.sort(null);
            ChunkMetadata c = store.addChunk(file, chosen);
            out = new ChunkAllocation(c.handle(), c.replicas());
        } finally {
            lock.unlock();
        }
        log.info("Allocated chunk {} for {} on {}", out.handle(), path, out.replicas());
        return out;
    }

    @Override
    public LeaseGrant getOrGrantLease(long handle) throws FsException {
        Instant now = detectDeadChunkservers();
        lock.lock();
        try {
            ChunkMetadata c = requireChunk(handle);
            if (c.hasValidLease(now)) return leaseOf(c);

            String primary = null;
            List<String> secondaries = new ArrayList<>();
            for (String id : c.replicas()) {
                if (!isAlive(id, now)) continue;
                if (primary == null) primary = id;
                else secondaries.add(id);
            }
            if (primary == null) {
                c.clearLease();
                throw new FsException(ErrorCode.CHUNK_UNAVAILABLE, "no alive replica for chunk " + handle);
            }

            c.grantLease(primary, secondaries, now.plus(config.leaseTimeout()));
            log.info("Granted lease on chunk {} to {} (version {}, secondaries {})",
                    handle, primary, c.version(), secondaries);
            return leaseOf(c);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void revokeLease(long handle) throws FsException {
        lock.lock();
        try {
            ChunkMetadata c = requireChunk(handle);
            if (c.primary() == null) return;
            log.info("Revoked lease on chunk {} held by {}", handle, c.primary());
            c.clearLease();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ChunkLocations getChunkLocations(long handle) throws FsException {
        Instant now = detectDeadChunkservers();
        lock.lock();
        try {
            ChunkMetadata c = requireChunk(handle);
            List<String> alive = new ArrayList<>();
            for (String id : c.replicas()) {
                if (isAlive(id, now)) alive.add(id);
            }
            String primary = c.hasValidLease(now) ? c.primary() : null;
            return new ChunkLocations(handle, c.version(), c.replicas(), alive, primary);
        } finally {
            lock.unlock();
        }
    }

    // ---------------- chunkservers ----------------

    @Override
    public void heartbeat(Heartbeat hb) {
        Instant now = clock.instant();
        boolean registered = false;
        boolean rejoined;
        lock.lock();
        try {
            ChunkserverState s = store.chunkserver(hb.chunkserverId());
            if (s == null) {
                s = store.registerChunkserver(hb.chunkserverId(), hb.timestamp());
                registered = true;
            }
            rejoined = s.recordHeartbeat(hb.timestamp(), hb.chunkHandles(), now, config.deadThreshold());
        } finally {
            lock.unlock();
        }

        if (registered) log.info("Registered chunkserver {} with {} chunk(s)", hb.chunkserverId(), hb.chunkHandles().size());
        else if (rejoined) log.info("Chunkserver {} is alive again", hb.chunkserverId());
        else log.debug("Heartbeat from {} ({} chunks)", hb.chunkserverId(), hb.chunkHandles().size());
    }

    /** Sweeps the registry for chunkservers that went silent and notifies listeners. */
    public void checkLiveness() {
        detectDeadChunkservers();
    }

    public List<ChunkserverView> chunkservers() {
        Instant now = clock.instant();
        lock.lock();
        try {
            List<ChunkserverView> out = new ArrayList<>();
            for (ChunkserverState s : store.chunkservers()) {
                out.add(new ChunkserverView(s.id(), s.isAlive(now, config.deadThreshold()),
                        s.lastHeartbeat(), s.inventory().size()));
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public record ChunkserverView(String id, boolean alive, Instant lastHeartbeat, int reportedChunks) {}

    /** The master's own time, used to stamp heartbeats that cross process boundaries. */
    public Instant now() { return clock.instant(); }

    public int chunkCount() {
        lock.lock();
        try { return store.chunkCount(); }
        finally { lock.unlock(); }
    }

    // ---------------- internals ----------------

    /** Returns the instant the check was made at. */
    private Instant detectDeadChunkservers() {
        Instant now = clock.instant();
        List<ReplicaLoss> losses = new ArrayList<>();
        lock.lock();
        try {
            for (ChunkserverState s : store.chunkservers()) {
                if (!s.observedAlive() || s.isAlive(now, config.deadThreshold())) continue;
                s.markDead();
                losses.add(new ReplicaLoss(s.id(), underReplicatedOn(s.id(), now), now));
            }
        } finally {
            lock.unlock();
        }

        for (ReplicaLoss loss : losses) {
            log.info("Chunkserver {} is dead, {} chunk(s) under-replicated", loss.chunkserverId(), loss.underReplicated().size());
            for (ReplicaLossListener l : listeners) {
                try {
                    l.onReplicaLoss(loss);
                } catch (RuntimeException e) {
                    log.warn("Replica loss listener failed for {}", loss.chunkserverId(), e);
                }
            }
        }
        return now;
    }

    private List<Long> underReplicatedOn(String deadId, Instant now) {
        List<Long> out = new ArrayList<>();
        for (ChunkMetadata c : store.chunksReplicatedOn(deadId)) {
            int alive = 0;
            for (String id : c.replicas()) {
                if (isAlive(id, now)) alive++;
            }
            if (alive < config.replicationFactor()) out.add(c.handle());
        }
        return out;
    }

    private List<String> aliveIds(Instant now) {
        List<String> out = new ArrayList<>();
        for (ChunkserverState s : store.chunkservers()) {
            if (s.isAlive(now, config.deadThreshold())) out.add(s.id());
        }
        return out;
    }

    private boolean isAlive(String id, Instant now) {
        ChunkserverState s = store.chunkserver(id);
        return s != null && s.isAlive(now, config.deadThreshold());
    }

    private FileMetadata requireFile(String path) throws FsException {
        FileMetadata f = store.file(path);
        if (f == null) throw new FsException(ErrorCode.UNKNOWN_FILE, "no such file: " + path);
        return f;
    }

    private ChunkMetadata requireChunk(long handle) throws FsException {
        ChunkMetadata c = store.chunk(handle);
        if (c == null) throw new FsException(ErrorCode.UNKNOWN_CHUNK, "no such chunk: " + handle);
        return c;
    }

    private static LeaseGrant leaseOf(ChunkMetadata c) {
        return new LeaseGrant(c.handle(), c.primary(), c.leaseSecondaries(), c.version(), c.leaseExpiry());
    }

    private static void requirePath(String path) {
        if (path == null || path.isBlank()) throw new IllegalArgumentException("path must not be blank");
    }
}
