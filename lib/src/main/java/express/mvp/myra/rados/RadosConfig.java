package express.mvp.myra.rados;

import java.util.Objects;

/**
 * Configuration for a {@link Rados} instance.
 *
 * <p>Immutable; use {@link #builder()} to create instances.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Rados configuration options</caption>
 *   <tr><th>Option</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>backendType</td><td>LIBRADOS</td><td>Storage client implementation</td></tr>
 *   <tr><td>allowSimulatedFallback</td><td>false</td><td>Use the simulated backend when
 *       librados cannot be loaded</td></tr>
 *   <tr><td>defaultUserId</td><td>null</td><td>User for {@link Rados#create()}</td></tr>
 *   <tr><td>defaultConfigPath</td><td>null</td><td>Path for {@link Cluster#configure()}; null
 *       searches the standard locations</td></tr>
 *   <tr><td>trackResources</td><td>false</td><td>Record native handles for leak detection</td></tr>
 *   <tr><td>aioThreads</td><td>4</td><td>Worker threads of the simulated backend</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RadosConfig config = RadosConfig.builder()
 *     .backendType(BackendType.LIBRADOS)
 *     .defaultUserId("admin")
 *     .defaultConfigPath("/etc/ceph/ceph.conf")
 *     .build();
 * }</pre>
 *
 * @see RadosFactory
 */
public final class RadosConfig {

    private final BackendType backendType;

    private final boolean allowSimulatedFallback;

    private final String defaultUserId;

    private final String defaultConfigPath;

    private final boolean trackResources;

    private final int aioThreads;

    private RadosConfig(Builder builder) {
        this.backendType = builder.backendType;
        this.allowSimulatedFallback = builder.allowSimulatedFallback;
        this.defaultUserId = builder.defaultUserId;
        this.defaultConfigPath = builder.defaultConfigPath;
        this.trackResources = builder.trackResources;
        this.aioThreads = builder.aioThreads;
    }

    /**
     * Creates a new builder.
     *
     * @return a builder with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the configuration with every option at its default.
     *
     * @return the default configuration
     */
    public static RadosConfig defaults() {
        return new Builder().build();
    }

    /**
     * Returns the backend type.
     *
     * @return the backend type
     */
    public BackendType backendType() {
        return backendType;
    }

    /**
     * Checks if the simulated backend may replace an unavailable librados.
     *
     * @return true if fallback is allowed
     */
    public boolean allowSimulatedFallback() {
        return allowSimulatedFallback;
    }

    /**
     * Returns the user id used when a cluster is created without one.
     *
     * @return the user id, or null for the library default
     */
    public String defaultUserId() {
        return defaultUserId;
    }

    /**
     * Returns the configuration file read by {@link Cluster#configure()}.
     *
     * @return the path, or null to search the default locations
     */
    public String defaultConfigPath() {
        return defaultConfigPath;
    }

    /**
     * Checks if native handles are recorded for leak detection.
     *
     * @return true if tracking is on
     */
    public boolean trackResources() {
        return trackResources;
    }

    /**
     * Returns the number of worker threads of the simulated backend.
     *
     * @return the thread count
     */
    public int aioThreads() {
        return aioThreads;
    }

    @Override
    public String toString() {
        return "RadosConfig[backend="
                + backendType
                + ", fallback="
                + allowSimulatedFallback
                + ", user="
                + defaultUserId
                + ", conf="
                + defaultConfigPath
                + ", track="
                + trackResources
                + ", aioThreads="
                + aioThreads
                + "]";
    }

    /** Storage client implementations. */
    public enum BackendType {
        /**
         * The system librados, bound through JNA.
         *
         * <p>Requires {@code librados.so.2} on the library path.
         */
        LIBRADOS,

        /**
         * In-process object store.
         *
         * <p>Works everywhere. Pools and objects are seeded through the backend's fixture methods.
         */
        SIMULATED
    }

    /** Builder for {@link RadosConfig} instances. */
    public static final class Builder {
        private BackendType backendType = BackendType.LIBRADOS;
        private boolean allowSimulatedFallback = false;
        private String defaultUserId;
        private String defaultConfigPath;
        private boolean trackResources = false;
        private int aioThreads = 4;

        private Builder() {}

        /**
         * Sets the backend type.
         *
         * @param backendType the backend to use
         * @return this builder for chaining
         * @throws NullPointerException if backendType is null
         */
        public Builder backendType(BackendType backendType) {
            this.backendType = Objects.requireNonNull(backendType);
            return this;
        }

        /**
         * Allows falling back to the simulated backend when librados is unavailable.
         *
         * @param allow true to allow fallback
         * @return this builder for chaining
         */
        public Builder allowSimulatedFallback(boolean allow) {
            this.allowSimulatedFallback = allow;
            return this;
        }

        /**
         * Sets the user id for {@link Rados#create()}.
         *
         * @param userId the user id, or null for the library default
         * @return this builder for chaining
         */
        public Builder defaultUserId(String userId) {
            this.defaultUserId = userId;
            return this;
        }

        /**
         * Sets the configuration file for {@link Cluster#configure()}.
         *
         * @param path the path, or null to search the default locations
         * @return this builder for chaining
         */
        public Builder defaultConfigPath(String path) {
            this.defaultConfigPath = path;
            return this;
        }

        /**
         * Enables resource tracking.
         *
         * @param enabled true to record native handles
         * @return this builder for chaining
         */
        public Builder trackResources(boolean enabled) {
            this.trackResources = enabled;
            return this;
        }

        /**
         * Sets the worker thread count of the simulated backend.
         *
         * @param threads the thread count
         * @return this builder for chaining
         * @throws IllegalArgumentException if threads is not positive
         */
        public Builder aioThreads(int threads) {
            if (threads <= 0) {
                throw new IllegalArgumentException("aioThreads must be positive: " + threads);
            }
            this.aioThreads = threads;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return a new immutable RadosConfig
         */
        public RadosConfig build() {
            return new RadosConfig(this);
        }
    }
}
