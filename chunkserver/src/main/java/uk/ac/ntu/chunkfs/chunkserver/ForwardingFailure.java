package uk.ac.ntu.chunkfs.chunkserver;

import java.util.List;

/**
 * A primary applied an append locally but could not forward it to every secondary. The
 * primary's copy of the chunk is ahead of {@code failedSecondaries} from {@code offset} on.
 */
public record ForwardingFailure(long handle, String primary, int offset, int length, List<String> failedSecondaries) {
    public ForwardingFailure {
        failedSecondaries = List.copyOf(failedSecondaries);
    }
}
