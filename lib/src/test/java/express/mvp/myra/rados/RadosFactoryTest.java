package express.mvp.myra.rados;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

import express.mvp.myra.rados.backend.RadosBackend;
import express.mvp.myra.rados.error.ErrorKind;
import express.mvp.myra.rados.error.RadosException;
import express.mvp.myra.rados.librados.LibRados;
import express.mvp.myra.rados.simulated.SimulatedRadosBackend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RadosFactory")
class RadosFactoryTest {

    @Test
    @DisplayName("Creates the simulated backend on request")
    void simulated() {
        RadosConfig config =
                RadosConfig.builder().backendType(RadosConfig.BackendType.SIMULATED).build();

        try (RadosBackend backend = RadosFactory.createBackend(config)) {
            assertTrue(backend instanceof SimulatedRadosBackend);
            assertEquals("simulated", backend.getBackendType());
        }
    }

    @Test
    @DisplayName("Falls back to simulated when librados is missing and fallback is allowed")
    void fallback() {
        assumeFalse(LibRados.isAvailable(), "librados is installed");
        RadosConfig config = RadosConfig.builder().allowSimulatedFallback(true).build();

        try (Rados rados = RadosFactory.create(config, new InFlightCompletions())) {
            assertEquals("simulated", rados.backendType());
        }
    }

    @Test
    @DisplayName("Raises when librados is missing and fallback is disabled")
    void noFallback() {
        assumeFalse(LibRados.isAvailable(), "librados is installed");

        RadosException e =
                assertThrows(
                        RadosException.class, () -> RadosFactory.create(RadosConfig.defaults()));
        assertEquals(ErrorKind.BACKEND_ERROR, e.kind());
    }

    @Test
    @DisplayName("Instances share the process-wide counter by default")
    void sharedCounter() {
        RadosConfig config =
                RadosConfig.builder().backendType(RadosConfig.BackendType.SIMULATED).build();

        try (Rados first = RadosFactory.create(config);
                Rados second = RadosFactory.create(config)) {
            assertSame(InFlightCompletions.shared(), first.inFlightCompletions());
            assertSame(first.inFlightCompletions(), second.inFlightCompletions());
        }
    }
}
