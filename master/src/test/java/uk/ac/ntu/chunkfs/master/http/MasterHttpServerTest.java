package uk.ac.ntu.chunkfs.master.http;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uk.ac.ntu.chunkfs.common.config.FsConfig;
import uk.ac.ntu.chunkfs.common.error.ErrorCode;
import uk.ac.ntu.chunkfs.common.error.FsException;
import uk.ac.ntu.chunkfs.common.http.HttpMasterClient;
import uk.ac.ntu.chunkfs.common.http.RpcClient;
import uk.ac.ntu.chunkfs.common.placement.RotatingPlacement;
import uk.ac.ntu.chunkfs.common.rpc.ChunkAllocation;
import uk.ac.ntu.chunkfs.common.rpc.ChunkLocations;
import uk.ac.ntu.chunkfs.common.rpc.Heartbeat;
import uk.ac.ntu.chunkfs.common.rpc.LeaseGrant;
import uk.ac.ntu.chunkfs.common.testing.ManualClock;
import uk.ac.ntu.chunkfs.master.Master;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MasterHttpServerTest {

    private ManualClock clock;
    private MasterHttpServer server;
    private HttpMasterClient client;
    private RpcClient rpc;
    private String base;

    @BeforeEach
    void setUp() throws Exception {
        clock = new ManualClock();
        Master master = new Master(FsConfig.defaults(), new RotatingPlacement(), clock);
        server = new MasterHttpServer(master, 0, 4);
        server.start();
        base = "http://localhost:" + server.port();
        rpc = new RpcClient(Duration.ofSeconds(5));
        client = new HttpMasterClient(base, rpc);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void metadataCallsWorkOverHttp() throws FsException {
        for (String id : List.of("cs3", "cs1", "cs2")) {
            client.heartbeat(new Heartbeat(id, Set.of(), clock.instant()));
        }
        client.createFile("/dir/a file");

        ChunkAllocation a = client.allocateChunk("/dir/a file");
        assertEquals(List.of("cs1", "cs2", "cs3"), a.replicas());
        assertEquals(List.of(a.handle()), client.getFileInfo("/dir/a file").chunkHandles());

        LeaseGrant g = client.getOrGrantLease(a.handle());
        assertEquals("cs1", g.primary());
        assertEquals(List.of("cs2", "cs3"), g.secondaries());
        assertEquals(clock.instant().plusSeconds(60), g.expiry());

        ChunkLocations l = client.getChunkLocations(a.handle());
        assertEquals("cs1", l.primary());
        assertEquals(1, l.version());

        client.revokeLease(a.handle());
        assertNull(client.getChunkLocations(a.handle()).primary());
    }

    @Test
    void errorsKeepTheirCodeAcrossTheWire() throws FsException {
        client.createFile("/f");
        FsException dup = assertThrows(FsException.class, () -> client.createFile("/f"));
        assertEquals(ErrorCode.ALREADY_EXISTS, dup.code());

        assertEquals(ErrorCode.UNKNOWN_FILE,
                assertThrows(FsException.class, () -> client.getFileInfo("/missing")).code());
        assertEquals(ErrorCode.INSUFFICIENT_REPLICAS,
                assertThrows(FsException.class, () -> client.allocateChunk("/f")).code());
        assertEquals(ErrorCode.UNKNOWN_CHUNK,
                assertThrows(FsException.class, () -> client.getOrGrantLease(42)).code());
    }

    @Test
    void healthAndMetricsEndpoints() throws FsException {
        assertEquals("OK", rpc.get(base + "/health"));
        client.heartbeat(new Heartbeat("cs1", Set.of(7L), clock.instant()));
        String metrics = rpc.get(base + "/metrics");
        assertTrue(metrics.contains("chunkservers=1/1"), metrics);
        assertTrue(metrics.contains("cs1 ALIVE"), metrics);
    }

    @Test
    void heartbeatsAreTimedByTheMasterClock() throws FsException {
        // cs1 runs an hour behind, cs2 an hour ahead
        client.heartbeat(new Heartbeat("cs1", Set.of(), clock.instant().minusSeconds(3600)));
        client.heartbeat(new Heartbeat("cs2", Set.of(), clock.instant().plusSeconds(3600)));
        String metrics = rpc.get(base + "/metrics");
        assertTrue(metrics.contains("cs1 ALIVE"), metrics);
        assertTrue(metrics.contains("cs2 ALIVE"), metrics);

        clock.advanceSeconds(31);
        metrics = rpc.get(base + "/metrics");
        assertTrue(metrics.contains("cs2 DEAD"), metrics);
        assertTrue(metrics.contains("chunkservers=0/2"), metrics);
    }

    @Test
    void unreachableMasterIsATypedFailure() {
        server.close();
        FsException e = assertThrows(FsException.class, () -> client.createFile("/g"));
        assertEquals(ErrorCode.UNREACHABLE, e.code());
    }
}
