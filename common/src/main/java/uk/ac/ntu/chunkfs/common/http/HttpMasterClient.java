package uk.ac.ntu.chunkfs.common.http;

import uk.ac.ntu.chunkfs.common.error.FsException;
import uk.ac.ntu.chunkfs.common.rpc.ChunkAllocation;
import uk.ac.ntu.chunkfs.common.rpc.ChunkLocations;
import uk.ac.ntu.chunkfs.common.rpc.FileInfo;
import uk.ac.ntu.chunkfs.common.rpc.Heartbeat;
import uk.ac.ntu.chunkfs.common.rpc.LeaseGrant;
import uk.ac.ntu.chunkfs.common.rpc.MasterService;

import static uk.ac.ntu.chunkfs.common.http.Wire.enc;

public final class HttpMasterClient implements MasterService {
    private final String baseUrl;
    private final RpcClient rpc;

    public HttpMasterClient(String baseUrl, RpcClient rpc) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.rpc = rpc;
    }

    public HttpMasterClient(String baseUrl) {
        this(baseUrl, new RpcClient());
    }

    @Override
    public void createFile(String path) throws FsException {
        rpc.post(baseUrl + "/files?path=" + enc(path));
    }

    @Override
    public FileInfo getFileInfo(String path) throws FsException {
        return Wire.decodeFileInfo(rpc.get(baseUrl + "/files?path=" + enc(path)));
    }

    @Override
    public ChunkAllocation allocateChunk(String path) throws FsException {
        return Wire.decodeAllocation(rpc.post(baseUrl + "/chunks/allocate?path=" + enc(path)));
    }

    @Override
    public LeaseGrant getOrGrantLease(long handle) throws FsException {
        return Wire.decodeLease(rpc.post(baseUrl + "/chunks/lease?handle=" + handle));
    }

    @Override
    public void revokeLease(long handle) throws FsException {
        rpc.post(baseUrl + "/chunks/revoke?handle=" + handle);
    }

    @Override
    public ChunkLocations getChunkLocations(long handle) throws FsException {
        return Wire.decodeLocations(rpc.get(baseUrl + "/chunks/locations?handle=" + handle));
    }

    @Override
    public void heartbeat(Heartbeat hb) throws FsException {
        rpc.post(baseUrl + "/heartbeat?id=" + enc(hb.chunkserverId())
                + "&handles=" + Wire.joinHandles(hb.chunkHandles()));
    }

    @Override
    public String toString() { return "HttpMasterClient[" + baseUrl + "]"; }
}
