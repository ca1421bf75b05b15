package express.mvp.myra.rados;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RadosConfig")
class RadosConfigTest {

    @Test
    @DisplayName("Defaults target librados without fallback")
    void defaults() {
        RadosConfig config = RadosConfig.defaults();

        assertEquals(RadosConfig.BackendType.LIBRADOS, config.backendType());
        assertFalse(config.allowSimulatedFallback());
        assertNull(config.defaultUserId());
        assertNull(config.defaultConfigPath());
        assertFalse(config.trackResources());
        assertEquals(4, config.aioThreads());
    }

    @Test
    @DisplayName("Builder sets every option")
    void builder() {
        RadosConfig config =
                RadosConfig.builder()
                        .backendType(RadosConfig.BackendType.SIMULATED)
                        .allowSimulatedFallback(true)
                        .defaultUserId("admin")
                        .defaultConfigPath("/etc/ceph/ceph.conf")
                        .trackResources(true)
                        .aioThreads(8)
                        .build();

        assertEquals(RadosConfig.BackendType.SIMULATED, config.backendType());
        assertTrue(config.allowSimulatedFallback());
        assertEquals("admin", config.defaultUserId());
        assertEquals("/etc/ceph/ceph.conf", config.defaultConfigPath());
        assertTrue(config.trackResources());
        assertEquals(8, config.aioThreads());
        assertTrue(config.toString().contains("SIMULATED"));
    }

    @Test
    @DisplayName("Builder rejects invalid values")
    void rejectsInvalid() {
        assertThrows(NullPointerException.class, () -> RadosConfig.builder().backendType(null));
        assertThrows(IllegalArgumentException.class, () -> RadosConfig.builder().aioThreads(0));
    }
}
