package uk.ac.ntu.chunkfs.common.rpc;

import uk.ac.ntu.chunkfs.common.error.ErrorCode;
import uk.ac.ntu.chunkfs.common.error.FsException;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

public final class ChunkserverDirectory {
    private final ConcurrentHashMap<String, ChunkserverService> routes = new ConcurrentHashMap<>();

    public void register(String chunkserverId, ChunkserverService service) {
        routes.put(chunkserverId, service);
    }

    public void remove(String chunkserverId) { routes.remove(chunkserverId); }

    public ChunkserverService resolve(String chunkserverId) throws FsException {
        ChunkserverService s = routes.get(chunkserverId);
        if (s == null) throw new FsException(ErrorCode.UNREACHABLE, "no route to chunkserver " + chunkserverId);
        return s;
    }

    public List<String> ids() { return List.copyOf(routes.keySet()); }
}
