package uk.ac.ntu.chunkfs.chunkserver.http;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uk.ac.ntu.chunkfs.chunkserver.Chunkserver;
import uk.ac.ntu.chunkfs.common.config.FsConfig;
import uk.ac.ntu.chunkfs.common.error.ErrorCode;
import uk.ac.ntu.chunkfs.common.error.FsException;
import uk.ac.ntu.chunkfs.common.http.HttpChunkserverClient;
import uk.ac.ntu.chunkfs.common.http.RpcClient;
import uk.ac.ntu.chunkfs.common.rpc.AppendResult;
import uk.ac.ntu.chunkfs.common.rpc.AppendRole;
import uk.ac.ntu.chunkfs.common.rpc.ChunkserverDirectory;
import uk.ac.ntu.chunkfs.common.rpc.MasterService;
import uk.ac.ntu.chunkfs.common.testing.ManualClock;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ChunkserverHttpServerTest {

    private final List<ChunkserverHttpServer> servers = new ArrayList<>();
    private final ChunkserverDirectory remote = new ChunkserverDirectory();
    private final RpcClient rpc = new RpcClient(Duration.ofSeconds(5));

    @BeforeEach
    void setUp() throws Exception {
        FsConfig config = FsConfig.defaults().withChunkSize(16);
        MasterService master = mock(MasterService.class);
        for (String id : List.of("cs1", "cs2", "cs3")) {
            // peers are reached over HTTP too
            Chunkserver cs = new Chunkserver(id, config, remote, master, new ManualClock());
            ChunkserverHttpServer server = new ChunkserverHttpServer(cs, 0, 4);
            server.start();
            servers.add(server);
            remote.register(id, new HttpChunkserverClient("http://localhost:" + server.port(), rpc));
        }
    }

    @AfterEach
    void tearDown() {
        servers.forEach(ChunkserverHttpServer::close);
    }

    private static byte[] b(String s) { return s.getBytes(StandardCharsets.UTF_8); }

    @Test
    void writePipelineRunsOverHttp() throws FsException {
        for (String id : List.of("cs1", "cs2", "cs3")) remote.resolve(id).createChunk(1, 1);

        AppendResult r = remote.resolve("cs1").append(1, b("hello "), AppendRole.PRIMARY, List.of("cs2", "cs3"));
        assertEquals(0, r.offset());
        r = remote.resolve("cs1").append(1, b("world"), AppendRole.PRIMARY, List.of("cs2", "cs3"));
        assertEquals(6, r.offset());

        assertEquals("hello world", new String(remote.resolve("cs3").readChunk(1), StandardCharsets.UTF_8));
        assertEquals("wor", new String(remote.resolve("cs2").readChunk(1, 6, 3), StandardCharsets.UTF_8));
    }

    @Test
    void typedErrorsSurviveTheWire() throws FsException {
        var cs1 = remote.resolve("cs1");
        cs1.createChunk(1, 1);
        assertEquals(0, cs1.readChunk(1).length);

        assertEquals(ErrorCode.CHUNK_EXISTS, assertThrows(FsException.class, () -> cs1.createChunk(1, 1)).code());
        assertEquals(ErrorCode.CHUNK_NOT_FOUND, assertThrows(FsException.class, () -> cs1.readChunk(2)).code());
        assertEquals(ErrorCode.CHUNK_FULL, assertThrows(FsException.class,
                () -> cs1.append(1, new byte[17], AppendRole.PRIMARY, List.of())).code());
    }

    @Test
    void deadSecondaryTurnsIntoReplicationFailure() throws FsException {
        for (String id : List.of("cs1", "cs2", "cs3")) remote.resolve(id).createChunk(1, 1);
        servers.get(2).close();

        FsException e = assertThrows(FsException.class,
                () -> remote.resolve("cs1").append(1, b("abc"), AppendRole.PRIMARY, List.of("cs2", "cs3")));
        assertEquals(ErrorCode.REPLICATION_FAILED, e.code());
        assertEquals("abc", new String(remote.resolve("cs1").readChunk(1), StandardCharsets.UTF_8));
        assertEquals(ErrorCode.UNREACHABLE, assertThrows(FsException.class, () -> remote.resolve("cs3").readChunk(1)).code());
    }

    @Test
    void badRequestsAreRejected() {
        String base = "http://localhost:" + servers.get(0).port();
        FsException e = assertThrows(FsException.class, () -> rpc.get(base + "/chunk?handle=abc"));
        assertEquals(ErrorCode.UNREACHABLE, e.code());
        assertTrue(e.getMessage().contains("400"), e.getMessage());
    }
}
