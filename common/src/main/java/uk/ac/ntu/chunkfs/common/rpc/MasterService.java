package uk.ac.ntu.chunkfs.common.rpc;

import uk.ac.ntu.chunkfs.common.error.FsException;

/**
 * Metadata operations of the master. Callers must expect {@link FsException} from any method,
 * at least with {@code UNREACHABLE} when the call crosses a network.
 */
public interface MasterService {

    void createFile(String path) throws FsException;

    FileInfo getFileInfo(String path) throws FsException;

    ChunkAllocation allocateChunk(String path) throws FsException;

    /** Returns the unexpired lease if one exists, otherwise grants a new one. */
    LeaseGrant getOrGrantLease(long handle) throws FsException;

    /** Drops the current lease, if any, so that the next request grants a fresh one. */
    void revokeLease(long handle) throws FsException;

    ChunkLocations getChunkLocations(long handle) throws FsException;

    void heartbeat(Heartbeat heartbeat) throws FsException;
}
