package uk.ac.ntu.chunkfs.chunkserver;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.ac.ntu.chunkfs.common.config.FsConfig;
import uk.ac.ntu.chunkfs.common.error.ErrorCode;
import uk.ac.ntu.chunkfs.common.error.FsException;
import uk.ac.ntu.chunkfs.common.rpc.ChunkserverDirectory;
import uk.ac.ntu.chunkfs.common.rpc.Heartbeat;
import uk.ac.ntu.chunkfs.common.rpc.MasterService;
import uk.ac.ntu.chunkfs.common.testing.ManualClock;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HeartbeatTest {

    @Mock
    MasterService master;

    @Test
    void tickReportsIdInventoryAndTime() throws FsException {
        ManualClock clock = new ManualClock();
        Chunkserver cs = new Chunkserver("cs7", FsConfig.defaults(), new ChunkserverDirectory(), master, clock);
        cs.createChunk(4, 1);
        cs.createChunk(2, 1);

        cs.heartbeatTick();

        ArgumentCaptor<Heartbeat> sent = ArgumentCaptor.forClass(Heartbeat.class);
        verify(master).heartbeat(sent.capture());
        assertEquals("cs7", sent.getValue().chunkserverId());
        assertEquals(Set.of(2L, 4L), sent.getValue().chunkHandles());
        assertEquals(clock.instant(), sent.getValue().timestamp());
    }

    @Test
    void deliveryFailuresAreSwallowedAndRetriedNextTick() throws FsException {
        doThrow(new FsException(ErrorCode.UNREACHABLE, "master down"))
                .doThrow(new IllegalStateException("transport bug"))
                .doNothing()
                .when(master).heartbeat(any());
        Chunkserver cs = new Chunkserver("cs1", FsConfig.defaults(), new ChunkserverDirectory(), master, new ManualClock());

        assertDoesNotThrow(cs::heartbeatTick);
        assertDoesNotThrow(cs::heartbeatTick);
        assertDoesNotThrow(cs::heartbeatTick);
        verify(master, times(3)).heartbeat(any());
    }

    @Test
    void startRegistersImmediatelyThenKeepsTicking() throws FsException {
        FsConfig fast = new FsConfig(1024, 3, Duration.ofSeconds(60), Duration.ofMillis(20), Duration.ofSeconds(30));
        doThrow(new FsException(ErrorCode.UNREACHABLE, "flaky")).doNothing().when(master).heartbeat(any());

        try (Chunkserver cs = new Chunkserver("cs1", fast, new ChunkserverDirectory(), master, Clock.systemUTC())) {
            cs.start();
            verify(master, timeout(5000).atLeast(4)).heartbeat(any());
        }
    }

    @Test
    void closeStopsTheSchedule() {
        FsConfig fast = new FsConfig(1024, 3, Duration.ofSeconds(60), Duration.ofMillis(20), Duration.ofSeconds(30));
        Chunkserver cs = new Chunkserver("cs1", fast, new ChunkserverDirectory(), master, Clock.systemUTC());
        HeartbeatSender sender = new HeartbeatSender(cs, fast.heartbeatInterval());

        sender.start();
        assertTrue(sender.running());
        sender.close();
        assertFalse(sender.running());
        sender.close();
    }
}
