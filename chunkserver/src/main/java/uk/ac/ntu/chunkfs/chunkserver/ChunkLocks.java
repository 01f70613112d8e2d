package uk.ac.ntu.chunkfs.chunkserver;

import uk.ac.ntu.chunkfs.common.error.FsException;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

public final class ChunkLocks {
    private final ConcurrentHashMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    private ReentrantLock lock(long handle) {
        return locks.computeIfAbsent(handle, k -> new ReentrantLock());
    }

    public <T> T withLock(long handle, LockedOp<T> op) throws FsException {
        var l = lock(handle);
        l.lock();
        try { return op.run(); }
        finally { l.unlock(); }
    }

    @FunctionalInterface public interface LockedOp<T> { T run() throws FsException; }
}
