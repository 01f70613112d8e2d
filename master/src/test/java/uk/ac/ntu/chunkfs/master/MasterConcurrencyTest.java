package uk.ac.ntu.chunkfs.master;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uk.ac.ntu.chunkfs.common.config.FsConfig;
import uk.ac.ntu.chunkfs.common.placement.RotatingPlacement;
import uk.ac.ntu.chunkfs.common.rpc.Heartbeat;
import uk.ac.ntu.chunkfs.common.rpc.LeaseGrant;
import uk.ac.ntu.chunkfs.common.testing.ManualClock;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MasterConcurrencyTest {

    private static final int THREADS = 16;

    private ManualClock clock;
    private Master master;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        master = new Master(FsConfig.defaults(), new RotatingPlacement(), clock);
        pool = Executors.newFixedThreadPool(THREADS);
        for (String id : List.of("cs1", "cs2", "cs3", "cs4", "cs5")) {
            master.heartbeat(new Heartbeat(id, Set.of(), clock.instant()));
        }
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }

    private <T> List<T> runTogether(int n, Callable<T> task) throws Exception {
        CountDownLatch go = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            futures.add(pool.submit(() -> {
                go.await();
                return task.call();
            }));
        }
        go.countDown();
        List<T> out = new ArrayList<>();
        for (Future<T> f : futures) out.add(f.get(10, TimeUnit.SECONDS));
        return out;
    }

    @Test
    void concurrentAllocationsNeverShareAHandle() throws Exception {
        master.createFile("/f");
        List<Long> handles = runTogether(200, () -> master.allocateChunk("/f").handle());

        assertEquals(200, new HashSet<>(handles).size());
        List<Long> inFile = master.getFileInfo("/f").chunkHandles();
        assertEquals(200, inFile.size());
        for (int i = 1; i < inFile.size(); i++) {
            assertTrue(inFile.get(i) > inFile.get(i - 1), "file order must follow handle order");
        }
    }

    @Test
    void concurrentLeaseRequestsAgreeOnOnePrimary() throws Exception {
        master.createFile("/f");
        long h = master.allocateChunk("/f").handle();

        List<LeaseGrant> grants = runTogether(64, () -> master.getOrGrantLease(h));

        Set<String> primaries = new HashSet<>();
        Set<Long> versions = new HashSet<>();
        for (LeaseGrant g : grants) {
            primaries.add(g.primary());
            versions.add(g.version());
        }
        assertEquals(1, primaries.size());
        assertEquals(Set.of(1L), versions);
    }

    @Test
    void leasesGrantedOverTimeNeverOverlap() throws Exception {
        master.createFile("/f");
        long h = master.allocateChunk("/f").handle();

        // every 7s: a heartbeat round, then concurrent lease requests. cs1 goes silent for a
        // while, so the lease has to move once its current term runs out
        List<LeaseGrant> seen = new ArrayList<>();
        for (int step = 0; step < 60; step++) {
            clock.advanceSeconds(7);
            for (String id : List.of("cs1", "cs2", "cs3", "cs4", "cs5")) {
                if (id.equals("cs1") && step >= 10 && step < 20) continue;
                master.heartbeat(new Heartbeat(id, Set.of(), clock.instant()));
            }
            List<LeaseGrant> now = runTogether(4, () -> master.getOrGrantLease(h));
            assertEquals(1, new HashSet<>(now).size());
            seen.add(now.get(0));
        }
        assertTrue(seen.stream().anyMatch(g -> g.primary().equals("cs2")), "lease should have moved off cs1");

        for (int i = 1; i < seen.size(); i++) {
            LeaseGrant prev = seen.get(i - 1);
            LeaseGrant cur = seen.get(i);
            if (cur.version() == prev.version()) {
                assertEquals(prev, cur);
            } else {
                assertEquals(prev.version() + 1, cur.version());
                // the replacement starts no earlier than the previous expiry
                assertFalse(cur.expiry().minus(master.config().leaseTimeout()).isBefore(prev.expiry()));
            }
        }
    }
}
