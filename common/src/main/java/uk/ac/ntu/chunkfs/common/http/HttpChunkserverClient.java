package uk.ac.ntu.chunkfs.common.http;

import uk.ac.ntu.chunkfs.common.error.FsException;
import uk.ac.ntu.chunkfs.common.rpc.AppendResult;
import uk.ac.ntu.chunkfs.common.rpc.AppendRole;
import uk.ac.ntu.chunkfs.common.rpc.ChunkserverService;

import java.util.List;

import static uk.ac.ntu.chunkfs.common.http.Wire.enc;

public final class HttpChunkserverClient implements ChunkserverService {
    private final String baseUrl;
    private final RpcClient rpc;

    public HttpChunkserverClient(String baseUrl, RpcClient rpc) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.rpc = rpc;
    }

    public HttpChunkserverClient(String baseUrl) {
        this(baseUrl, new RpcClient());
    }

    @Override
    public void createChunk(long handle, long version) throws FsException {
        rpc.put(baseUrl + "/chunk?handle=" + handle + "&version=" + version);
    }

    @Override
    public byte[] readChunk(long handle, int offset, int length) throws FsException {
        return rpc.getBytes(baseUrl + "/chunk?handle=" + handle + "&offset=" + offset + "&length=" + length);
    }

    @Override
    public byte[] readChunk(long handle) throws FsException {
        return rpc.getBytes(baseUrl + "/chunk?handle=" + handle);
    }

    @Override
    public AppendResult append(long handle, byte[] data, AppendRole role, List<String> secondaries) throws FsException {
        String url = baseUrl + "/chunk/append?handle=" + handle
                + "&role=" + role.name()
                + "&secondaries=" + enc(Wire.joinIds(secondaries == null ? List.of() : secondaries));
        return Wire.decodeAppend(rpc.post(url, data));
    }

    @Override
    public String toString() { return "HttpChunkserverClient[" + baseUrl + "]"; }
}
