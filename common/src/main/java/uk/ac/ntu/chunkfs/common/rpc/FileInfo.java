package uk.ac.ntu.chunkfs.common.rpc;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

public record FileInfo(String path, List<Long> chunkHandles) {
    public FileInfo {
        Objects.requireNonNull(path);
        chunkHandles = List.copyOf(chunkHandles);
    }

    public OptionalLong lastChunk() {
        if (chunkHandles.isEmpty()) return OptionalLong.empty();
        return OptionalLong.of(chunkHandles.get(chunkHandles.size() - 1));
    }
}
