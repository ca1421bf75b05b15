package express.mvp.myra.rados.lifecycle;

import static org.junit.jupiter.api.Assertions.*;

import java.lang.ref.WeakReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ClusterReferenceRegistry}. */
@DisplayName("ClusterReferenceRegistry")
class ClusterReferenceRegistryTest {

    private ClusterReferenceRegistry<Object, Object> registry;

    @BeforeEach
    void setUp() {
        registry = new ClusterReferenceRegistry<>();
    }

    @Test
    @DisplayName("Context resolves to its cluster")
    void resolvesCluster() {
        Object cluster = new Object();
        Object context = new Object();
        registry.register(context, cluster);

        assertSame(cluster, registry.clusterFor(context));
        assertTrue(registry.isReferenced(cluster));
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("Keys are compared by identity")
    void identityKeys() {
        Object cluster = new Object();
        registry.register(new String("ctx"), cluster);

        assertNull(registry.clusterFor(new String("ctx")));
    }

    @Test
    @DisplayName("Reachable context keeps its cluster reachable")
    void reachableContext_keepsCluster() throws InterruptedException {
        Object context = new Object();
        WeakReference<Object> cluster = registerCluster(context);

        for (int i = 0; i < 5; i++) {
            System.gc();
            Thread.sleep(20);
        }

        assertNotNull(cluster.get());
        assertSame(cluster.get(), registry.clusterFor(context));
    }

    @Test
    @DisplayName("Unreachable context lets its cluster be collected")
    void unreachableContext_releasesCluster() throws InterruptedException {
        WeakReference<Object> cluster = registerCluster(new Object());

        for (int i = 0; i < 50 && cluster.get() != null; i++) {
            System.gc();
            Thread.sleep(20);
            registry.size();
        }

        assertNull(cluster.get(), "stale entry must not keep the cluster alive");
        assertEquals(0, registry.size());
    }

    private WeakReference<Object> registerCluster(Object context) {
        Object cluster = new Object();
        registry.register(context, cluster);
        return new WeakReference<>(cluster);
    }
}
