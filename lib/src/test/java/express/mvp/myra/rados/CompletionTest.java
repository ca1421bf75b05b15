package express.mvp.myra.rados;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.myra.rados.error.ErrorKind;
import express.mvp.myra.rados.error.Errno;
import express.mvp.myra.rados.error.RadosException;
import express.mvp.myra.rados.memory.ResourceTracker;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Unit tests for {@link Completion}. */
@DisplayName("Completion")
class CompletionTest {

    private SimulatedClusterFixture fixture;

    private IoContext ioctx;

    @BeforeEach
    void setUp() {
        fixture = new SimulatedClusterFixture();
        ioctx = fixture.openContext();
    }

    @AfterEach
    void tearDown() {
        assertTrue(fixture.backend.violations().isEmpty(), fixture.backend.violations()::toString);
        fixture.close();
    }

    @Nested
    @DisplayName("Stat completion")
    class StatCompletionTests {

        @Test
        @DisplayName("Pending completion reports EINPROGRESS")
        void pending() {
            fixture.backend.holdCompletions();
            Completion<ObjectStat> completion = ioctx.aioStat("obj").orElseThrow();

            assertEquals(CompletionKind.STAT, completion.kind());
            assertFalse(completion.isComplete());
            RadosResult<ObjectStat> early = completion.result();
            assertEquals(-Errno.EINPROGRESS, early.errorCode());

            fixture.backend.releaseCompletions();
            completion.waitForComplete();
            assertTrue(completion.isComplete());
            completion.close();
        }

        @Test
        @DisplayName("Result yields size and modification time")
        void result() {
            try (Completion<ObjectStat> completion = ioctx.aioStat("obj").orElseThrow()) {
                completion.waitForComplete();

                ObjectStat stat = completion.result().orElseThrow();
                assertEquals(SimulatedClusterFixture.HELLO.length, stat.size());
                assertEquals(SimulatedClusterFixture.MTIME, stat.mtimeSeconds());
            }
        }

        @Test
        @DisplayName("Harvesting twice returns the same fields")
        void doubleHarvest() {
            try (Completion<ObjectStat> completion = ioctx.aioStat("obj", "loc").orElseThrow()) {
                completion.waitForComplete();

                ObjectStat first = completion.result().orElseThrow();
                ObjectStat second = completion.result().orElseThrow();
                assertEquals(first, second);
                assertEquals(SimulatedClusterFixture.LOCATED.length, second.size());
                assertEquals(SimulatedClusterFixture.MTIME + 60, second.mtimeSeconds());
            }
        }

        @Test
        @DisplayName("Missing object fails at harvest")
        void missingObject() {
            try (Completion<ObjectStat> completion = ioctx.aioStat("absent").orElseThrow()) {
                completion.waitForComplete();

                RadosResult<ObjectStat> result = completion.result();
                assertEquals(-Errno.ENOENT, result.errorCode());
                assertEquals(ErrorKind.BACKEND_ERROR, result.errorKind());
            }
        }
    }

    @Nested
    @DisplayName("Read completion")
    class ReadCompletionTests {

        @Test
        @DisplayName("Result is truncated to the bytes read")
        void truncated() {
            try (Completion<byte[]> completion = ioctx.aioRead("obj", 4096, 0).orElseThrow()) {
                assertEquals(CompletionKind.READ, completion.kind());
                completion.waitForComplete();

                assertArrayEquals(SimulatedClusterFixture.HELLO, completion.result().orElseThrow());
            }
        }

        @Test
        @DisplayName("Harvesting twice returns the same bytes")
        void doubleHarvest() {
            try (Completion<byte[]> completion = ioctx.aioRead("obj", 64, 0).orElseThrow()) {
                completion.waitForComplete();

                byte[] first = completion.result().orElseThrow();
                byte[] second = completion.result().orElseThrow();
                assertArrayEquals(first, second);
                assertNotSame(first, second);
            }
        }

        @Test
        @DisplayName("Locator key selects the object read")
        void locatorKey() {
            try (Completion<byte[]> completion =
                    ioctx.aioRead("obj", 64, 0, "loc").orElseThrow()) {
                completion.waitForComplete();

                assertArrayEquals(
                        SimulatedClusterFixture.LOCATED, completion.result().orElseThrow());
            }
            assertNull(fixture.backend.currentLocatorKey(ioctx.handle().token()));
        }

        @Test
        @DisplayName("Zero-length read yields an empty array")
        void zeroLength() {
            try (Completion<byte[]> completion = ioctx.aioRead("obj", 0, 0).orElseThrow()) {
                completion.waitForComplete();

                assertEquals(0, completion.result().orElseThrow().length);
            }
        }

        @Test
        @DisplayName("Completion stays valid after its context is closed")
        void outlivesContext() {
            Completion<byte[]> completion = ioctx.aioRead("obj", 5, 6).orElseThrow();
            ioctx.close();

            completion.waitForComplete();
            assertEquals("world", new String(completion.result().orElseThrow()));
            completion.close();
        }
    }

    @Nested
    @DisplayName("Release")
    class ReleaseTests {

        @Test
        @DisplayName("In-flight counter follows creation and release")
        void inFlightCounter() {
            Completion<ObjectStat> a = ioctx.aioStat("obj").orElseThrow();
            Completion<byte[]> b = ioctx.aioRead("obj", 8, 0).orElseThrow();
            assertEquals(2, fixture.inFlight.count());

            a.close();
            b.close();
            assertEquals(0, fixture.inFlight.count());
            assertEquals(0, fixture.rados.backendStats().getLiveCompletions());
        }

        @Test
        @DisplayName("close is idempotent")
        void idempotentClose() {
            Completion<ObjectStat> completion = ioctx.aioStat("obj").orElseThrow();

            completion.close();
            completion.close();

            assertTrue(completion.isReleased());
            assertEquals(1, fixture.rados.backendStats().getCompletionsReleased());
        }

        @Test
        @DisplayName("Use after release fails with INVALID_STATE")
        void useAfterRelease() {
            Completion<byte[]> completion = ioctx.aioRead("obj", 8, 0).orElseThrow();
            completion.close();

            RadosException e = assertThrows(RadosException.class, completion::result);
            assertEquals(ErrorKind.INVALID_STATE, e.kind());
            assertTrue(e.getMessage().contains("cannot reuse released completion handle"));
            assertThrows(RadosException.class, completion::isComplete);
            assertThrows(RadosException.class, completion::waitForComplete);
        }

        @Test
        @DisplayName("Releasing a pending read waits and frees the buffer after the token")
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        void releasePendingRead() throws InterruptedException {
            fixture.backend.holdCompletions();
            Completion<byte[]> completion = ioctx.aioRead("obj", 64, 0).orElseThrow();
            assertEquals(1, fixture.rados.tracker().getActiveCount(ResourceTracker.READ_BUFFER));

            Thread releaser =
                    new Thread(
                            () -> {
                                try {
                                    Thread.sleep(100);
                                } catch (InterruptedException e) {
                                    Thread.currentThread().interrupt();
                                }
                                fixture.backend.releaseCompletions();
                            });
            releaser.start();

            completion.close();
            releaser.join();

            assertTrue(completion.isReleased());
            assertEquals(0, fixture.rados.tracker().getActiveCount(ResourceTracker.READ_BUFFER));
            assertEquals(0, fixture.inFlight.count());
        }

        @Test
        @DisplayName("Closing the instance cancels unfinished operations")
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        void closeCancelsPending() {
            fixture.backend.holdCompletions();
            List<Completion<ObjectStat>> pending = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                pending.add(ioctx.aioStat("obj").orElseThrow());
            }

            fixture.rados.close();

            for (Completion<ObjectStat> completion : pending) {
                assertTrue(completion.isComplete());
                assertEquals(-Errno.ECANCELED, completion.result().errorCode());
                completion.close();
                assertTrue(completion.isReleased());
            }
            assertEquals(0, fixture.inFlight.count());
        }
    }
}
