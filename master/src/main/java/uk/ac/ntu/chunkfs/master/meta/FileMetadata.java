package uk.ac.ntu.chunkfs.master.meta;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class FileMetadata {
    private final String path;
    private final List<Long> chunkHandles = new ArrayList<>();

    FileMetadata(String path) {
        this.path = Objects.requireNonNull(path);
    }

    public String path() { return path; }

    public List<Long> chunkHandles() { return List.copyOf(chunkHandles); }

    void appendChunk(long handle) { chunkHandles.add(handle); }
}
