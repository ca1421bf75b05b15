package express.mvp.myra.rados;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.myra.rados.backend.BackendStats;
import java.lang.ref.WeakReference;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Release of handles that the host drops without closing them. */
@DisplayName("Handle lifetime")
class HandleLifetimeTest {

    private SimulatedClusterFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new SimulatedClusterFixture();
    }

    @AfterEach
    void tearDown() {
        assertTrue(fixture.backend.violations().isEmpty(), fixture.backend.violations()::toString);
        fixture.close();
    }

    private static boolean awaitGc(BooleanSupplier condition) throws InterruptedException {
        for (int i = 0; i < 100; i++) {
            if (condition.getAsBoolean()) {
                return true;
            }
            System.gc();
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }

    private BackendStats stats() {
        return fixture.rados.backendStats();
    }

    @Test
    @DisplayName("Dropped never-connected cluster is freed without shutdown")
    void droppedNeverConnected() throws InterruptedException {
        createAndDrop();

        assertTrue(awaitGc(() -> stats().getClustersReleasedUnconnected() == 1));
        assertEquals(0, stats().getClusterShutdowns());
    }

    private void createAndDrop() {
        Cluster cluster = fixture.rados.create().orElseThrow();
        cluster.configure().orElseThrow();
    }

    @Test
    @DisplayName("Reachable context keeps its dropped cluster alive")
    void contextKeepsClusterAlive() throws InterruptedException {
        ContextAndCluster pair = openAndDropCluster();

        for (int i = 0; i < 10; i++) {
            System.gc();
            Thread.sleep(20);
        }

        assertNotNull(pair.cluster.get());
        assertEquals(0, stats().getClusterShutdowns());
        assertTrue(pair.ioctx.stat("obj").isSuccess());
        assertSame(pair.cluster.get(), pair.ioctx.cluster());

        pair.ioctx.close();
    }

    @Test
    @DisplayName("Dropping the last context releases context and cluster in order")
    void droppedContextAndCluster() throws InterruptedException {
        WeakReference<Cluster> cluster = openAndDropBoth();

        assertTrue(awaitGc(() -> stats().getClusterShutdowns() == 1));
        assertEquals(1, stats().getIoContextsDestroyed());
        assertNull(cluster.get(), "stale registry entry must not keep the cluster alive");
    }

    @Test
    @DisplayName("Dropped completion is released after its operation")
    void droppedCompletion() throws InterruptedException {
        IoContext ioctx = fixture.openContext();
        startAndDropRead(ioctx);

        assertTrue(awaitGc(() -> fixture.inFlight.count() == 0));
        assertEquals(0, stats().getLiveCompletions());
        ioctx.close();
    }

    @Test
    @DisplayName("Chained calls on unreferenced handles finish before their cleanup")
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void chainedCallsUnderGcPressure() throws InterruptedException {
        AtomicBoolean running = new AtomicBoolean(true);
        Thread collector =
                new Thread(
                        () -> {
                            while (running.get()) {
                                System.gc();
                                Thread.onSpinWait();
                            }
                        },
                        "gc-pressure");
        collector.setDaemon(true);
        collector.start();
        try {
            for (int i = 0; i < 200; i++) {
                byte[] data =
                        fixture.connectedCluster()
                                .openContext(SimulatedClusterFixture.POOL)
                                .orElseThrow()
                                .read("obj", 64, 0, "loc")
                                .orElseThrow();
                assertArrayEquals(SimulatedClusterFixture.LOCATED, data);

                Completion<ObjectStat> completion =
                        fixture.openContext().aioStat("obj").orElseThrow();
                completion.waitForComplete();
                assertEquals(
                        SimulatedClusterFixture.HELLO.length,
                        completion.result().orElseThrow().size());
                completion.close();
            }
        } finally {
            running.set(false);
            collector.join();
        }

        assertTrue(awaitGc(() -> stats().getLiveClusters() == 0));
        assertEquals(0, stats().getLiveIoContexts());
    }

    private ContextAndCluster openAndDropCluster() {
        Cluster cluster = fixture.connectedCluster();
        IoContext ioctx = cluster.openContext(SimulatedClusterFixture.POOL).orElseThrow();
        return new ContextAndCluster(ioctx, new WeakReference<>(cluster));
    }

    private WeakReference<Cluster> openAndDropBoth() {
        Cluster cluster = fixture.connectedCluster();
        IoContext ioctx = cluster.openContext(SimulatedClusterFixture.POOL).orElseThrow();
        ioctx.stat("obj").orElseThrow();
        return new WeakReference<>(cluster);
    }

    private void startAndDropRead(IoContext ioctx) {
        ioctx.aioRead("obj", 64, 0).orElseThrow();
    }

    private static final class ContextAndCluster {
        final IoContext ioctx;
        final WeakReference<Cluster> cluster;

        ContextAndCluster(IoContext ioctx, WeakReference<Cluster> cluster) {
            this.ioctx = ioctx;
            this.cluster = cluster;
        }
    }
}
