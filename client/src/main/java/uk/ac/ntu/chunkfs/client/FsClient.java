package uk.ac.ntu.chunkfs.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.chunkfs.common.error.ErrorCode;
import uk.ac.ntu.chunkfs.common.error.FsException;
import uk.ac.ntu.chunkfs.common.rpc.AppendResult;
import uk.ac.ntu.chunkfs.common.rpc.AppendRole;
import uk.ac.ntu.chunkfs.common.rpc.ChunkLocations;
import uk.ac.ntu.chunkfs.common.rpc.ChunkserverDirectory;
import uk.ac.ntu.chunkfs.common.rpc.FileInfo;
import uk.ac.ntu.chunkfs.common.rpc.LeaseGrant;
import uk.ac.ntu.chunkfs.common.rpc.MasterService;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives the create, append and read protocols against a master and its chunkservers.
 *
 * <p>Holds no authoritative state. The only thing remembered between calls is which replicas
 * already confirmed a chunk exists, to skip redundant create calls; losing it costs one
 * {@code CHUNK_EXISTS} round trip per replica.
 */
public final class FsClient {
    private static final Logger log = LoggerFactory.getLogger(FsClient.class);

    private final MasterService master;
    private final ChunkserverDirectory chunkservers;
    private final ConcurrentHashMap<Long, Set<String>> confirmed = new ConcurrentHashMap<>();

    public FsClient(MasterService master, ChunkserverDirectory chunkservers) {
        this.master = Objects.requireNonNull(master);
        this.chunkservers = Objects.requireNonNull(chunkservers);
    }

    public void create(String path) throws FsException {
        master.createFile(path);
    }

    /**
     * Appends {@code data} to the file's last chunk, allocating one if the file has none. A
     * full chunk triggers one reallocation and retry; a second {@code CHUNK_FULL} is thrown.
     */
    public AppendResult append(String path, byte[] data) throws FsException {
        Objects.requireNonNull(data, "data");
        FileInfo info = master.getFileInfo(path);
        long handle = info.lastChunk().isPresent()
                ? info.lastChunk().getAsLong()
                : master.allocateChunk(path).handle();

        try {
            return appendToChunk(handle, data);
        } catch (FsException e) {
            if (!e.is(ErrorCode.CHUNK_FULL)) throw e;
            // a full chunk never takes another append
            confirmed.remove(handle);
            long fresh = master.allocateChunk(path).handle();
            log.debug("Chunk {} of {} is full, retrying {} bytes on new chunk {}", handle, path, data.length, fresh);
            return appendToChunk(fresh, data);
        }
    }

    /** Reads the whole file, chunk by chunk in file order. */
    public byte[] read(String path) throws FsException {
        FileInfo info = master.getFileInfo(path);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (long handle : info.chunkHandles()) {
            byte[] part = readChunk(master.getChunkLocations(handle));
            out.write(part, 0, part.length);
        }
        return out.toByteArray();
    }

    public FileInfo stat(String path) throws FsException {
        return master.getFileInfo(path);
    }

    Set<Long> confirmedChunks() {
        return Set.copyOf(confirmed.keySet());
    }

    // ---------------- internals ----------------

    private AppendResult appendToChunk(long handle, byte[] data) throws FsException {
        LeaseGrant lease = master.getOrGrantLease(handle);
        ensureCreated(lease);
        return chunkservers.resolve(lease.primary())
                .append(handle, data, AppendRole.PRIMARY, lease.secondaries());
    }

    private void ensureCreated(LeaseGrant lease) throws FsException {
        Set<String> done = confirmed.computeIfAbsent(lease.handle(), k -> ConcurrentHashMap.newKeySet());
        for (String id : lease.participants()) {
            if (done.contains(id)) continue;
            try {
                chunkservers.resolve(id).createChunk(lease.handle(), lease.version());
            } catch (FsException e) {
                if (!e.is(ErrorCode.CHUNK_EXISTS)) throw e;
            }
            done.add(id);
        }
    }

    private byte[] readChunk(ChunkLocations locs) throws FsException {
        List<String> candidates = locs.readCandidates();
        for (String id : candidates) {
            try {
                return chunkservers.resolve(id).readChunk(locs.handle());
            } catch (FsException e) {
                if (!e.is(ErrorCode.CHUNK_NOT_FOUND) && !e.is(ErrorCode.UNREACHABLE)) throw e;
                log.debug("Chunk {} not readable from {} ({}), trying next replica", locs.handle(), id, e.code());
            }
        }
        throw new FsException(ErrorCode.CHUNK_UNAVAILABLE,
                "chunk " + locs.handle() + " unreadable from all candidates " + candidates);
    }
}
