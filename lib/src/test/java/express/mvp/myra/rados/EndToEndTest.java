package express.mvp.myra.rados;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.myra.rados.memory.ResourceTracker;
import express.mvp.myra.rados.simulated.SimulatedRadosBackend;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Full create, connect, read and tear-down sequence against the simulated backend. */
@DisplayName("End to end")
class EndToEndTest {

    @Test
    @DisplayName("Sync and async reads return the written object")
    void scenario(@TempDir Path dir) throws Exception {
        byte[] payload = new byte[10_000];
        new Random(42).nextBytes(payload);
        Path conf = Files.writeString(dir.resolve("ceph.conf"), "[global]\nmon_host = 127.0.0.1\n");

        SimulatedRadosBackend backend = new SimulatedRadosBackend(2);
        backend.createPool("pool");
        backend.putObject("pool", "obj", null, payload, 1_234_567_890L);
        RadosConfig config =
                RadosConfig.builder()
                        .backendType(RadosConfig.BackendType.SIMULATED)
                        .defaultUserId("admin")
                        .defaultConfigPath(conf.toString())
                        .trackResources(true)
                        .build();

        try (Rados rados = RadosFactory.create(backend, config, new InFlightCompletions())) {
            assertEquals("3.0.0", rados.version().toString());

            Cluster cluster = rados.create().orElseThrow();
            cluster.configure().orElseThrow();
            cluster.connect().orElseThrow();
            IoContext ioctx = cluster.openContext("pool").orElseThrow();

            ObjectStat stat = ioctx.stat("obj", null).orElseThrow();
            assertEquals(payload.length, stat.size());
            assertEquals(1_234_567_890L, stat.mtimeSeconds());

            byte[] sync = ioctx.read("obj", (int) stat.size(), 0).orElseThrow();
            assertArrayEquals(payload, sync);

            try (Completion<byte[]> completion =
                    ioctx.aioRead("obj", (int) stat.size(), 0).orElseThrow()) {
                completion.waitForComplete();
                assertArrayEquals(sync, completion.result().orElseThrow());
            }

            ioctx.close();
            cluster.shutdown();

            ResourceTracker tracker = rados.resourceTracker();
            assertEquals(0, tracker.getActiveCount(), tracker::getSummary);
            assertEquals(0, rados.inFlightCompletions().count());
            assertEquals(0, rados.backendStats().getLiveClusters());
            assertTrue(backend.violations().isEmpty());
        }
    }
}
