package express.mvp.myra.rados.simulated;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.myra.rados.backend.HandleRef;
import express.mvp.myra.rados.error.Errno;
import express.mvp.myra.rados.memory.ReadBuffer;
import express.mvp.myra.rados.memory.ResourceTracker;
import express.mvp.myra.rados.memory.StatSlot;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Unit tests for {@link SimulatedRadosBackend}. */
@DisplayName("SimulatedRadosBackend")
class SimulatedRadosBackendTest {

    private static final byte[] HELLO = "hello world".getBytes(StandardCharsets.UTF_8);

    private SimulatedRadosBackend backend;

    @BeforeEach
    void setUp() {
        backend = new SimulatedRadosBackend(2);
        backend.createPool("data");
        backend.putObject("data", "obj", null, HELLO, 1_700_000_000L);
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    private long connectedCluster() {
        HandleRef cluster = new HandleRef();
        assertEquals(0, backend.createCluster("admin", cluster));
        assertEquals(0, backend.confReadFile(cluster.get(), null));
        assertEquals(0, backend.connect(cluster.get()));
        return cluster.get();
    }

    private long openIoctx(long cluster) {
        HandleRef ioctx = new HandleRef();
        assertEquals(0, backend.createIoContext(cluster, "data", ioctx));
        return ioctx.get();
    }

    @Nested
    @DisplayName("Cluster calls")
    class ClusterTests {

        @Test
        @DisplayName("Connect without configuration fails with ENOENT")
        void connectUnconfigured() {
            HandleRef cluster = new HandleRef();
            backend.createCluster(null, cluster);

            assertEquals(-Errno.ENOENT, backend.connect(cluster.get()));
        }

        @Test
        @DisplayName("Unreadable configuration file fails with ENOENT")
        void missingConfigFile(@TempDir Path dir) {
            HandleRef cluster = new HandleRef();
            backend.createCluster(null, cluster);

            assertEquals(
                    -Errno.ENOENT,
                    backend.confReadFile(cluster.get(), dir.resolve("absent.conf").toString()));
        }

        @Test
        @DisplayName("Readable configuration file is accepted")
        void readableConfigFile(@TempDir Path dir) throws Exception {
            Path conf = Files.writeString(dir.resolve("ceph.conf"), "[global]\n");
            HandleRef cluster = new HandleRef();
            backend.createCluster("admin", cluster);

            assertEquals(0, backend.confReadFile(cluster.get(), conf.toString()));
            assertEquals("admin", backend.userId(cluster.get()));
        }

        @Test
        @DisplayName("Shutdown of a never-connected cluster is a violation")
        void shutdownUnconnected() {
            HandleRef cluster = new HandleRef();
            backend.createCluster(null, cluster);

            backend.shutdown(cluster.get());

            assertEquals(1, backend.violations().size());
        }

        @Test
        @DisplayName("Releasing a cluster twice throws")
        void doubleRelease() {
            HandleRef cluster = new HandleRef();
            backend.createCluster(null, cluster);
            backend.releaseCluster(cluster.get());

            assertFalse(backend.isClusterLive(cluster.get()));
            assertThrows(IllegalStateException.class, () -> backend.releaseCluster(cluster.get()));
        }

        @Test
        @DisplayName("Tearing down a cluster with open contexts is a violation")
        void teardownWithOpenContexts() {
            long cluster = connectedCluster();
            openIoctx(cluster);

            backend.shutdown(cluster);

            assertTrue(backend.violations().get(0).contains("open ioctx"));
        }
    }

    @Nested
    @DisplayName("I/O context calls")
    class IoContextTests {

        @Test
        @DisplayName("Missing pool fails with ENOENT")
        void missingPool() {
            long cluster = connectedCluster();

            assertEquals(-Errno.ENOENT, backend.createIoContext(cluster, "nope", new HandleRef()));
        }

        @Test
        @DisplayName("Context counts against its cluster until destroyed")
        void contextCounted() {
            long cluster = connectedCluster();
            long ioctx = openIoctx(cluster);
            assertEquals(1, backend.openIoContexts(cluster));

            backend.destroyIoContext(ioctx);

            assertEquals(0, backend.openIoContexts(cluster));
            assertThrows(IllegalStateException.class, () -> backend.destroyIoContext(ioctx));
        }

        @Test
        @DisplayName("Stat fills the slot")
        void statFillsSlot() {
            long ioctx = openIoctx(connectedCluster());
            StatSlot slot = new StatSlot();

            assertEquals(0, backend.stat(ioctx, "obj", slot));
            assertEquals(HELLO.length, slot.size());
            assertEquals(1_700_000_000L, slot.mtimeSeconds());
        }

        @Test
        @DisplayName("Read past the end returns zero bytes")
        void readPastEnd() {
            long ioctx = openIoctx(connectedCluster());
            ReadBuffer buffer = ReadBuffer.tryAllocate(4, ResourceTracker.disabled());

            assertEquals(0, backend.read(ioctx, "obj", buffer, 100));
        }

        @Test
        @DisplayName("Locator key selects a different object")
        void locatorKeySelectsObject() {
            backend.putObject("data", "obj", "loc", new byte[3]);
            long ioctx = openIoctx(connectedCluster());
            StatSlot slot = new StatSlot();

            backend.setLocatorKey(ioctx, "loc");
            assertEquals(0, backend.stat(ioctx, "obj", slot));
            assertEquals(3, slot.size());
            assertEquals("loc", backend.currentLocatorKey(ioctx));

            backend.setLocatorKey(ioctx, null);
            assertEquals(0, backend.stat(ioctx, "obj", slot));
            assertEquals(HELLO.length, slot.size());
        }
    }

    @Nested
    @DisplayName("Asynchronous calls")
    class AsyncTests {

        @Test
        @DisplayName("Held completion reports EINPROGRESS until released")
        void heldCompletion() {
            long ioctx = openIoctx(connectedCluster());
            HandleRef completion = new HandleRef();
            backend.aioCreateCompletion(completion);
            backend.holdCompletions();

            assertEquals(0, backend.aioStat(ioctx, "obj", completion.get(), new StatSlot()));
            assertFalse(backend.aioIsComplete(completion.get()));
            assertEquals(-Errno.EINPROGRESS, backend.aioGetReturnValue(completion.get()));

            backend.releaseCompletions();
            assertEquals(0, backend.aioWaitForComplete(completion.get()));
            assertTrue(backend.aioIsComplete(completion.get()));
            assertEquals(0, backend.aioGetReturnValue(completion.get()));
            backend.aioRelease(completion.get());
            assertTrue(backend.violations().isEmpty());
        }

        @Test
        @DisplayName("Async read returns the byte count")
        void asyncRead() {
            long ioctx = openIoctx(connectedCluster());
            HandleRef completion = new HandleRef();
            backend.aioCreateCompletion(completion);
            ReadBuffer buffer = ReadBuffer.tryAllocate(64, ResourceTracker.disabled());

            assertEquals(0, backend.aioRead(ioctx, "obj", completion.get(), buffer, 0));
            backend.aioWaitForComplete(completion.get());

            assertEquals(HELLO.length, backend.aioGetReturnValue(completion.get()));
            assertArrayEquals(HELLO, buffer.toByteArray(HELLO.length));
        }

        @Test
        @DisplayName("Releasing a pending completion is a violation")
        void releasePending() {
            long ioctx = openIoctx(connectedCluster());
            HandleRef completion = new HandleRef();
            backend.aioCreateCompletion(completion);
            backend.holdCompletions();
            backend.aioStat(ioctx, "obj", completion.get(), new StatSlot());

            backend.aioRelease(completion.get());

            assertTrue(backend.violations().get(0).contains("pending"));
            backend.releaseCompletions();
        }

        @Test
        @DisplayName("Releasing the buffer before the token is a violation")
        void bufferBeforeToken() {
            long ioctx = openIoctx(connectedCluster());
            HandleRef completion = new HandleRef();
            backend.aioCreateCompletion(completion);
            ReadBuffer buffer = ReadBuffer.tryAllocate(8, ResourceTracker.disabled());
            backend.aioRead(ioctx, "obj", completion.get(), buffer, 0);
            backend.aioWaitForComplete(completion.get());

            buffer.release();
            backend.aioRelease(completion.get());

            assertTrue(backend.violations().get(0).contains("before token"));
        }
    }

    @Nested
    @DisplayName("Fault injection")
    class FaultTests {

        @Test
        @DisplayName("Injected fault applies to the next call only")
        void oneShot() {
            backend.failNext(SimulatedOperation.CREATE, -Errno.EPERM);

            assertEquals(-Errno.EPERM, backend.createCluster(null, new HandleRef()));
            assertEquals(0, backend.createCluster(null, new HandleRef()));
            assertEquals(1, backend.getStats().getFailedCalls());
        }

        @Test
        @DisplayName("Non-negative injected status is rejected")
        void nonNegativeRejected() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> backend.failNext(SimulatedOperation.READ, 0));
        }
    }

    @Test
    @DisplayName("Reports version 3.0.0 and type simulated")
    void identity() {
        assertEquals("3.0.0", backend.version().toString());
        assertEquals("simulated", backend.getBackendType());
    }
}
