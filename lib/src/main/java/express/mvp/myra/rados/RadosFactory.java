package express.mvp.myra.rados;

import express.mvp.myra.rados.backend.RadosBackend;
import express.mvp.myra.rados.error.ErrorKind;
import express.mvp.myra.rados.error.RadosException;
import express.mvp.myra.rados.librados.LibRados;
import express.mvp.myra.rados.librados.LibRadosBackend;
import express.mvp.myra.rados.simulated.SimulatedRadosBackend;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Factory for {@link Rados} instances.
 *
 * <h2>Backend Selection</h2>
 *
 * <ul>
 *   <li><b>LIBRADOS:</b> Binds the system librados. If it cannot be loaded, creation fails, or
 *       falls back to the simulated backend when {@link RadosConfig#allowSimulatedFallback()} is
 *       set.
 *   <li><b>SIMULATED:</b> Always available.
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RadosConfig config = RadosConfig.builder()
 *     .backendType(BackendType.LIBRADOS)
 *     .allowSimulatedFallback(true)
 *     .build();
 *
 * try (Rados rados = RadosFactory.create(config)) {
 *     Cluster cluster = rados.create().orElseThrow();
 *     // ...
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This factory is thread-safe.
 *
 * @see RadosConfig
 */
public final class RadosFactory {

    private static final Logger LOGGER = Logger.getLogger(RadosFactory.class.getName());

    private RadosFactory() {
        // Utility class
    }

    /**
     * Creates an instance sharing the process-wide in-flight counter.
     *
     * @param config the configuration
     * @return a new instance
     * @throws RadosException if librados is required but unavailable
     */
    public static Rados create(RadosConfig config) {
        return create(config, InFlightCompletions.shared());
    }

    /**
     * Creates an instance with its own in-flight counter.
     *
     * @param config the configuration
     * @param inFlight the counter its completions report to
     * @return a new instance
     * @throws RadosException if librados is required but unavailable
     */
    public static Rados create(RadosConfig config, InFlightCompletions inFlight) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(inFlight, "inFlight");
        return new Rados(createBackend(config), config, inFlight);
    }

    /**
     * Creates an instance over an existing backend.
     *
     * @param backend the backend, closed with the instance
     * @param config the configuration
     * @param inFlight the counter its completions report to
     * @return a new instance
     */
    public static Rados create(
            RadosBackend backend, RadosConfig config, InFlightCompletions inFlight) {
        return new Rados(
                Objects.requireNonNull(backend, "backend"),
                Objects.requireNonNull(config, "config"),
                Objects.requireNonNull(inFlight, "inFlight"));
    }

    /**
     * Creates the backend named by the configuration.
     *
     * @param config the configuration
     * @return a new backend
     * @throws RadosException if librados is required but unavailable
     */
    public static RadosBackend createBackend(RadosConfig config) {
        switch (config.backendType()) {
            case SIMULATED:
                LOGGER.log(Level.FINE, "using simulated backend");
                return new SimulatedRadosBackend(config.aioThreads());

            case LIBRADOS:
                if (LibRados.isAvailable()) {
                    LOGGER.log(Level.FINE, "using librados backend");
                    return new LibRadosBackend();
                }
                if (config.allowSimulatedFallback()) {
                    LOGGER.log(Level.WARNING, "librados not available, falling back to simulated");
                    return new SimulatedRadosBackend(config.aioThreads());
                }
                throw new RadosException(
                        ErrorKind.BACKEND_ERROR,
                        "librados is not available and simulated fallback is disabled");

            default:
                throw new IllegalArgumentException("Unknown backend type: " + config.backendType());
        }
    }
}
