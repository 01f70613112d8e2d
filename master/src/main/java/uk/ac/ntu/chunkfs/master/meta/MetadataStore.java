package uk.ac.ntu.chunkfs.master.meta;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * File, chunk and chunkserver tables of one master. Not thread-safe: the owning master
 * serializes every access.
 */
public final class MetadataStore {
    private final Map<String, FileMetadata> files = new HashMap<>();
    private final Map<Long, ChunkMetadata> chunks = new HashMap<>();
    // ascending id order is what placement and primary selection iterate in
    private final TreeMap<String, ChunkserverState> chunkservers = new TreeMap<>();

    private long lastHandle = 0;

    // ---------------- files ----------------

    public FileMetadata file(String path) { return files.get(path); }

    public FileMetadata createFile(String path) {
        if (files.containsKey(path)) throw new IllegalStateException("file exists: " + path);
        FileMetadata f = new FileMetadata(path);
        files.put(path, f);
        return f;
    }

    // ---------------- chunks ----------------

    public ChunkMetadata chunk(long handle) { return chunks.get(handle); }

    /** Issues the next handle and appends it to {@code file}. */
    public ChunkMetadata addChunk(FileMetadata file, List<String> replicas) {
        long handle = ++lastHandle;
        ChunkMetadata c = new ChunkMetadata(handle, replicas);
        chunks.put(handle, c);
        file.appendChunk(handle);
        return c;
    }

    public int chunkCount() { return chunks.size(); }

    public List<ChunkMetadata> chunksReplicatedOn(String chunkserverId) {
        List<ChunkMetadata> out = new ArrayList<>();
        for (ChunkMetadata c : chunks.values()) {
            if (c.replicas().contains(chunkserverId)) out.add(c);
        }
        out.sort((a, b) -> Long.compare(a.handle(), b.handle()));
        return out;
    }

    // ---------------- chunkservers ----------------

    public ChunkserverState chunkserver(String id) { return chunkservers.get(id); }

    public ChunkserverState registerChunkserver(String id, Instant firstSeen) {
        return chunkservers.computeIfAbsent(id, k -> new ChunkserverState(k, firstSeen));
    }

    /** Ascending by id. */
    public Collection<ChunkserverState> chunkservers() { return chunkservers.values(); }
}
