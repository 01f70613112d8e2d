package uk.ac.ntu.chunkfs.common.placement;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Takes {@code count} consecutive ids (wrapping) from a start position that moves one step per
 * selection, so successive chunks spread over the cluster without any randomness.
 */
public final class RotatingPlacement implements PlacementPolicy {
    private final AtomicInteger idx = new AtomicInteger(0);

    @Override
    public String name() { return "rotation"; }

    @Override
    public List<String> select(List<String> candidates, int count) {
        if (candidates == null || candidates.isEmpty() || count <= 0) return List.of();
        int n = candidates.size();
        int take = Math.min(count, n);
        int start = Math.floorMod(idx.getAndIncrement(), n);

        List<String> out = new ArrayList<>(take);
        for (int i = 0; i < take; i++) {
            out.add(candidates.get((start + i) % n));
        }
        return out;
    }
}
