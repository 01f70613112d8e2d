package uk.ac.ntu.chunkfs.chunkserver.store;

import uk.ac.ntu.chunkfs.common.error.ErrorCode;
import uk.ac.ntu.chunkfs.common.error.FsException;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Chunk bytes held in memory, each chunk an append-only buffer of at most {@code chunkSize}
 * bytes. Callers serialize appends per handle; reads may run alongside them.
 */
public final class ChunkStore {
    private final int chunkSize;
    private final ConcurrentHashMap<Long, Chunk> chunks = new ConcurrentHashMap<>();

    public ChunkStore(int chunkSize) {
        if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be positive");
        this.chunkSize = chunkSize;
    }

    public void create(long handle, long version) throws FsException {
        if (chunks.putIfAbsent(handle, new Chunk(version)) != null) {
            throw new FsException(ErrorCode.CHUNK_EXISTS, "chunk " + handle + " already stored");
        }
    }

    public int size(long handle) throws FsException { return require(handle).size(); }

    public long version(long handle) throws FsException { return require(handle).version; }

    public byte[] read(long handle, int offset, int length) throws FsException {
        if (offset < 0 || length < 0) throw new IllegalArgumentException("negative range: offset=" + offset + " length=" + length);
        byte[] all = require(handle).snapshot();
        if (offset >= all.length) return new byte[0];
        int end = (int) Math.min((long) offset + length, all.length);
        return Arrays.copyOfRange(all, offset, end);
    }

    /** Returns the offset the data was written at. Nothing is written if it would not fit. */
    public int append(long handle, byte[] data) throws FsException {
        Chunk c = require(handle);
        synchronized (c) {
            int size = c.size();
            if ((long) size + data.length > chunkSize) {
                throw new FsException(ErrorCode.CHUNK_FULL,
                        "chunk " + handle + " has " + size + " of " + chunkSize + " bytes, cannot take " + data.length);
            }
            c.bytes.write(data, 0, data.length);
            return size;
        }
    }

    /** Ascending. */
    public Set<Long> handles() { return new TreeSet<>(chunks.keySet()); }

    private Chunk require(long handle) throws FsException {
        Chunk c = chunks.get(handle);
        if (c == null) throw new FsException(ErrorCode.CHUNK_NOT_FOUND, "chunk " + handle + " not stored here");
        return c;
    }

    private static final class Chunk {
        private final long version;
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        Chunk(long version) {
            this.version = version;
        }

        synchronized int size() { return bytes.size(); }

        synchronized byte[] snapshot() { return bytes.toByteArray(); }
    }
}
