package uk.ac.ntu.chunkfs.common.placement;

import java.util.List;

public interface PlacementPolicy {
    String name();

    /**
     * Picks {@code count} distinct ids from {@code candidates} (sorted ascending, never fewer
     * than {@code count}). Must be deterministic for a given call sequence.
     */
    List<String> select(List<String> candidates, int count);
}
