package uk.ac.ntu.chunkfs.common.rpc;

import uk.ac.ntu.chunkfs.common.error.FsException;

import java.util.List;

public interface ChunkserverService {

    void createChunk(long handle, long version) throws FsException;

    /**
     * Reads up to {@code length} bytes from {@code offset}. The range is clamped to the
     * current chunk size; an offset past the end yields an empty array.
     */
    byte[] readChunk(long handle, int offset, int length) throws FsException;

    default byte[] readChunk(long handle) throws FsException {
        return readChunk(handle, 0, Integer.MAX_VALUE);
    }

    /**
     * Appends {@code data} as primary (then forwards to {@code secondaries}) or as secondary
     * (local only, {@code secondaries} ignored).
     */
    AppendResult append(long handle, byte[] data, AppendRole role, List<String> secondaries) throws FsException;
}
