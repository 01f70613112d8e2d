package uk.ac.ntu.chunkfs.common.rpc;

import java.util.ArrayList;
import java.util.List;

public record ChunkLocations(long handle, long version, List<String> replicas, List<String> aliveReplicas, String primary) {
    public ChunkLocations {
        replicas = List.copyOf(replicas);
        aliveReplicas = List.copyOf(aliveReplicas);
    }

    /** Read order: valid primary first, then the other alive replicas as listed (ascending id). */
    public List<String> readCandidates() {
        List<String> out = new ArrayList<>(aliveReplicas.size() + 1);
        if (primary != null) out.add(primary);
        for (String id : aliveReplicas) {
            if (!id.equals(primary)) out.add(id);
        }
        return out;
    }
}
