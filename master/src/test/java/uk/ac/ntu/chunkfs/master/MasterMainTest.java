package uk.ac.ntu.chunkfs.master;

import org.junit.jupiter.api.Test;
import uk.ac.ntu.chunkfs.common.config.Env;
import uk.ac.ntu.chunkfs.common.error.FsException;
import uk.ac.ntu.chunkfs.common.rpc.Heartbeat;
import uk.ac.ntu.chunkfs.common.testing.ManualClock;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MasterMainTest {

    @Test
    void placementAlwaysRotatesWhateverTheEnvironmentAsks() throws FsException {
        ManualClock clock = new ManualClock();
        Master master = MasterMain.createMaster(new Env(Map.of(
                "MASTER_PLACEMENT", "first_fit",
                "CHUNKFS_REPLICATION", "2")), clock);
        assertEquals("rotation", master.placementName());
        assertEquals(2, master.config().replicationFactor());

        for (String id : List.of("cs1", "cs2", "cs3")) master.heartbeat(new Heartbeat(id, Set.of(), clock.instant()));
        master.createFile("/f");
        assertEquals(List.of("cs1", "cs2"), master.allocateChunk("/f").replicas());
        assertEquals(List.of("cs2", "cs3"), master.allocateChunk("/f").replicas());
        assertEquals(List.of("cs1", "cs3"), master.allocateChunk("/f").replicas());
    }
}
