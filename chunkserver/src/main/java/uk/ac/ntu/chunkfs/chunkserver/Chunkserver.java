package uk.ac.ntu.chunkfs.chunkserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.chunkfs.chunkserver.store.ChunkStore;
import uk.ac.ntu.chunkfs.common.config.FsConfig;
import uk.ac.ntu.chunkfs.common.error.ErrorCode;
import uk.ac.ntu.chunkfs.common.error.FsException;
import uk.ac.ntu.chunkfs.common.rpc.AppendResult;
import uk.ac.ntu.chunkfs.common.rpc.AppendRole;
import uk.ac.ntu.chunkfs.common.rpc.ChunkserverDirectory;
import uk.ac.ntu.chunkfs.common.rpc.ChunkserverService;
import uk.ac.ntu.chunkfs.common.rpc.Heartbeat;
import uk.ac.ntu.chunkfs.common.rpc.MasterService;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Stores chunk bytes and runs the write pipeline: as primary it applies an append and then
 * forwards the same bytes to each secondary, holding the chunk's lock throughout so every
 * replica sees appends in the same order.
 *
 * <p>A failed forward fails the whole call with {@code REPLICATION_FAILED} while the primary
 * (and any secondary that did succeed) keeps the bytes. Nothing is rolled back.
 */
public final class Chunkserver implements ChunkserverService, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Chunkserver.class);

    private final String id;
    private final ChunkStore store;
    private final ChunkLocks locks = new ChunkLocks();
    private final ChunkserverDirectory peers;
    private final MasterService master;
    private final Clock clock;
    private final HeartbeatSender heartbeats;
    private final CopyOnWriteArrayList<ForwardingFailureListener> listeners = new CopyOnWriteArrayList<>();

    public Chunkserver(String id, FsConfig config, ChunkserverDirectory peers, MasterService master, Clock clock) {
        this.id = Objects.requireNonNull(id);
        this.store = new ChunkStore(config.chunkSize());
        this.peers = Objects.requireNonNull(peers);
        this.master = Objects.requireNonNull(master);
        this.clock = Objects.requireNonNull(clock);
        this.heartbeats = new HeartbeatSender(this, config.heartbeatInterval());
    }

    public String id() { return id; }

    public void addForwardingFailureListener(ForwardingFailureListener l) { listeners.add(l); }

    /** Registers with the master right away, then heartbeats on the configured interval. */
    public void start() {
        heartbeatTick();
        heartbeats.start();
        log.info("[{}] started", id);
    }

    @Override
    public void close() {
        heartbeats.close();
    }

    // ---------------- data ----------------

    @Override
    public void createChunk(long handle, long version) throws FsException {
        store.create(handle, version);
        log.info("[{}] Created chunk {} (version {})", id, handle, version);
    }

    @Override
    public byte[] readChunk(long handle, int offset, int length) throws FsException {
        return store.read(handle, offset, length);
    }

    @Override
    public AppendResult append(long handle, byte[] data, AppendRole role, List<String> secondaries) throws FsException {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(role, "role");
        return locks.withLock(handle, () -> {
            int offset = store.append(handle, data);
            AppendResult local = new AppendResult(handle, offset, offset + data.length);
            log.debug("[{}] Appended {} bytes to chunk {} at offset {} as {}", id, data.length, handle, offset, role);

            if (role == AppendRole.SECONDARY || secondaries == null || secondaries.isEmpty()) return local;

            List<String> failed = forward(handle, data, secondaries);
            if (failed.isEmpty()) return local;

            ForwardingFailure failure = new ForwardingFailure(handle, id, offset, data.length, failed);
            for (ForwardingFailureListener l : listeners) {
                try {
                    l.onForwardingFailure(failure);
                } catch (RuntimeException e) {
                    log.warn("[{}] Forwarding failure listener threw", id, e);
                }
            }
            throw new FsException(ErrorCode.REPLICATION_FAILED,
                    "chunk " + handle + " applied on " + id + " at offset " + offset + " but not on " + failed);
        });
    }

    private List<String> forward(long handle, byte[] data, List<String> secondaries) {
        List<String> failed = new ArrayList<>();
        for (String secondary : secondaries) {
            if (secondary.equals(id)) continue;
            try {
                peers.resolve(secondary).append(handle, data, AppendRole.SECONDARY, List.of());
            } catch (FsException e) {
                log.warn("[{}] Forward of chunk {} to {} failed: {}", id, handle, secondary, e.getMessage());
                failed.add(secondary);
            }
        }
        return failed;
    }

    // ---------------- heartbeat ----------------

    /** Reports this chunkserver's inventory to the master. Failures wait for the next tick. */
    public void heartbeatTick() {
        Heartbeat hb = new Heartbeat(id, store.handles(), clock.instant());
        try {
            master.heartbeat(hb);
        } catch (FsException e) {
            log.debug("[{}] Heartbeat not delivered ({}), retrying next tick", id, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("[{}] Heartbeat failed unexpectedly, retrying next tick", id, e);
        }
    }
}
