package uk.ac.ntu.chunkfs.common.http;

import uk.ac.ntu.chunkfs.common.rpc.ChunkserverDirectory;

import java.util.LinkedHashMap;
import java.util.Map;

public final class PeerConfig {
    private PeerConfig() {}

    /**
     * CHUNKSERVERS format:
     *   cs1=http://localhost:9101,cs2=http://localhost:9102
     * Malformed entries are skipped.
     */
    public static Map<String, String> parse(String raw) {
        Map<String, String> peers = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) return peers;

        for (String part : raw.split(",")) {
            String p = part.trim();
            if (p.isEmpty()) continue;

            String[] kv = p.split("=", 2);
            if (kv.length != 2) continue;

            String id = kv[0].trim();
            String url = kv[1].trim();
            if (id.isEmpty() || url.isEmpty()) continue;

            peers.put(id, url);
        }
        return peers;
    }

    public static ChunkserverDirectory directory(String raw, RpcClient rpc) {
        ChunkserverDirectory dir = new ChunkserverDirectory();
        for (var e : parse(raw).entrySet()) {
            dir.register(e.getKey(), new HttpChunkserverClient(e.getValue(), rpc));
        }
        return dir;
    }
}
