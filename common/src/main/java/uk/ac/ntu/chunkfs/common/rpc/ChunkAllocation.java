package uk.ac.ntu.chunkfs.common.rpc;

import java.util.List;

public record ChunkAllocation(long handle, List<String> replicas) {
    public ChunkAllocation {
        replicas = List.copyOf(replicas);
    }
}
