package express.mvp.myra.rados;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.myra.rados.backend.BackendStats;
import express.mvp.myra.rados.backend.HandleRef;
import express.mvp.myra.rados.backend.RadosBackend;
import express.mvp.myra.rados.backend.RadosVersion;
import express.mvp.myra.rados.lifecycle.ClusterReferenceRegistry;
import express.mvp.myra.rados.memory.ResourceTracker;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the access layer: library version and cluster creation.
 *
 * <p>A {@code Rados} binds one {@link RadosBackend} to the process-wide pieces every handle shares:
 * the in-flight completion counter, the resource tracker and the cluster reference registry.
 * Instances come from {@link RadosFactory}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (Rados rados = RadosFactory.create(config);
 *         Cluster cluster = rados.create("admin").orElseThrow()) {
 *     cluster.configure().orElseThrow();
 *     cluster.connect().orElseThrow();
 *     try (IoContext ioctx = cluster.openContext("data").orElseThrow()) {
 *         RadosResult<ObjectStat> stat = ioctx.stat("obj");
 *     }
 *     cluster.shutdown();
 * }
 * }</pre>
 *
 * @see Cluster
 */
public final class Rados implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(Rados.class.getName());

    private final RadosBackend backend;

    private final RadosConfig config;

    private final InFlightCompletions inFlight;

    private final ResourceTracker tracker;

    private final ClusterReferenceRegistry<IoContext, Cluster> registry =
            new ClusterReferenceRegistry<>();

    private final AtomicLong clusterSequence = new AtomicLong();

    Rados(RadosBackend backend, RadosConfig config, InFlightCompletions inFlight) {
        this.backend = backend;
        this.config = config;
        this.inFlight = inFlight;
        this.tracker = new ResourceTracker(config.trackResources());
    }

    /**
     * Returns the version of the storage client library.
     *
     * @return the version
     */
    public RadosVersion version() {
        return backend.version();
    }

    /**
     * Creates a cluster handle for the configured default user.
     *
     * @return the cluster in {@code CONFIGURING} state, or the backend failure
     */
    public RadosResult<Cluster> create() {
        return create(config.defaultUserId());
    }

    /**
     * Creates a cluster handle.
     *
     * @param userId the user to connect as, or null for the library default
     * @return the cluster in {@code CONFIGURING} state, or the backend failure
     * @throws express.mvp.myra.rados.error.RadosException if userId contains a NUL character
     */
    public RadosResult<Cluster> create(String userId) {
        if (userId != null) {
            Arguments.checkNoNul(userId, "user id");
        }
        HandleRef ref = new HandleRef();
        int status = backend.createCluster(userId, ref);
        if (status < 0) {
            if (ref.isSet()) {
                backend.releaseCluster(ref.get());
            }
            LOGGER.log(Level.FINE, "rados_create failed: {0}", status);
            return RadosResult.failure(status);
        }

        String clusterId = "cluster-" + clusterSequence.incrementAndGet();
        ClusterHandle handle = new ClusterHandle(backend, ref.get(), tracker);
        return RadosResult.success(new Cluster(this, clusterId, handle));
    }

    /**
     * Returns the in-flight completion counter shared by every handle of this instance.
     *
     * @return the counter
     */
    public InFlightCompletions inFlightCompletions() {
        return inFlight;
    }

    /**
     * Returns the tracker recording native handles and read buffers.
     *
     * @return the tracker, recording only if enabled in the configuration
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "tracker is a live introspection view")
    public ResourceTracker resourceTracker() {
        return tracker;
    }

    /**
     * Returns a snapshot of the backend call counters.
     *
     * @return the statistics
     */
    public BackendStats backendStats() {
        return backend.getStats();
    }

    /**
     * Returns the name of the active backend.
     *
     * @return "librados" or "simulated"
     */
    public String backendType() {
        return backend.getBackendType();
    }

    /**
     * Returns the configuration this instance was built with.
     *
     * @return the configuration
     */
    public RadosConfig config() {
        return config;
    }

    RadosBackend backend() {
        return backend;
    }

    ResourceTracker tracker() {
        return tracker;
    }

    ClusterReferenceRegistry<IoContext, Cluster> registry() {
        return registry;
    }

    /**
     * Closes the backend. Operations not yet finished complete with {@code -ECANCELED}, so their
     * completions can still be closed. Other handles still open must not be used afterwards.
     */
    @Override
    public void close() {
        if (inFlight.count() > 0) {
            LOGGER.log(
                    Level.FINE,
                    "closing {0} backend with {1} completion(s) in flight",
                    new Object[] {backend.getBackendType(), inFlight.count()});
        }
        backend.close();
    }

    @Override
    public String toString() {
        return "Rados[" + backend.getBackendType() + ", " + backend.version() + "]";
    }
}
