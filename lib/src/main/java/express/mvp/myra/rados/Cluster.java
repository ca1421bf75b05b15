package express.mvp.myra.rados;

import express.mvp.myra.rados.backend.HandleRef;
import express.mvp.myra.rados.backend.RadosBackend;
import express.mvp.myra.rados.error.RadosException;
import express.mvp.myra.rados.lifecycle.ClusterState;
import express.mvp.myra.rados.lifecycle.ClusterStateListener;
import express.mvp.myra.rados.lifecycle.ClusterStateMachine;
import express.mvp.myra.rados.memory.HandleCleaner;
import java.lang.ref.Reference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One configured, possibly connected session to the storage cluster.
 *
 * <h2>State Machine</h2>
 *
 * <pre>
 *              connect()             shutdown()
 * CONFIGURING ───────────► CONNECTED ──────────► SHUTDOWN
 *      │                                            ▲
 *      └──────────────────── close() ───────────────┘
 * </pre>
 *
 * <ul>
 *   <li>{@link #configure(String)} is allowed in every state but {@code SHUTDOWN}
 *   <li>{@link #connect()} succeeds at most once
 *   <li>{@link #shutdown()} requires {@code CONNECTED} and is rejected when repeated
 *   <li>{@link #close()} moves any state to {@code SHUTDOWN} and may be repeated
 * </ul>
 *
 * <h2>Native Lifetime</h2>
 *
 * <p>Every {@link IoContext} opened from this cluster holds a reference on the native cluster
 * handle. Shutting the cluster down while contexts are open makes it unusable at once but defers
 * the native teardown until the last context is closed or collected. A handle that never connected
 * is freed without the connection teardown call.
 */
public final class Cluster implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(Cluster.class.getName());

    private final Rados rados;

    private final RadosBackend backend;

    private final String clusterId;

    private final ClusterHandle handle;

    private final ClusterStateMachine stateMachine;

    private final HandleCleaner.Registration registration;

    Cluster(Rados rados, String clusterId, ClusterHandle handle) {
        this.rados = rados;
        this.backend = rados.backend();
        this.clusterId = clusterId;
        this.handle = handle;
        this.stateMachine = new ClusterStateMachine(clusterId);
        this.registration = HandleCleaner.register(this, clusterId, handle::release);
    }

    /**
     * Reads the configured default configuration file.
     *
     * @return success, or the backend failure
     * @throws RadosException if the cluster was shut down
     * @see RadosConfig#defaultConfigPath()
     */
    public RadosResult<Void> configure() {
        return configure(rados.config().defaultConfigPath());
    }

    /**
     * Reads a configuration file into the handle.
     *
     * @param path the file, or null to search the default locations
     * @return success, or the backend failure
     * @throws RadosException if the cluster was shut down or the path is malformed
     */
    public RadosResult<Void> configure(String path) {
        ensureNotShutdown();
        if (path != null) {
            Arguments.checkNoNul(path, "config path");
        }
        int status;
        try {
            status = backend.confReadFile(handle.token(), path);
        } finally {
            Reference.reachabilityFence(this);
        }
        if (status < 0) {
            return RadosResult.failure(status);
        }
        return RadosResult.success(null);
    }

    /**
     * Connects to the cluster.
     *
     * <p>On failure the state stays {@code CONFIGURING} and the call may be retried.
     *
     * @return success, or the backend failure
     * @throws RadosException if already connected or shut down
     */
    public RadosResult<Void> connect() {
        ClusterState state = stateMachine.getState();
        if (state == ClusterState.SHUTDOWN) {
            throw RadosException.invalidState(this, "cannot reuse shutdown rados handle");
        }
        if (state == ClusterState.CONNECTED) {
            throw RadosException.invalidState(this, "already connected to cluster");
        }

        try {
            int status = backend.connect(handle.token());
            if (status < 0) {
                LOGGER.log(
                        Level.FINE,
                        "{0}: connect failed with {1}",
                        new Object[] {clusterId, status});
                return RadosResult.failure(status);
            }
            // marked before the cleaner may run, so teardown takes the shutdown path
            handle.markConnected();
        } finally {
            Reference.reachabilityFence(this);
        }
        stateMachine.transitionTo(ClusterState.CONNECTED);
        return RadosResult.success(null);
    }

    /**
     * Shuts the connection down.
     *
     * <p>Open contexts keep working; the native handle is released after the last of them.
     *
     * @throws RadosException if not connected or already shut down
     */
    public void shutdown() {
        ClusterState state = stateMachine.getState();
        if (state == ClusterState.SHUTDOWN) {
            throw RadosException.invalidState(this, "cannot reuse shutdown rados handle");
        }
        if (state != ClusterState.CONNECTED) {
            throw RadosException.invalidState(this, "not connected to cluster");
        }
        stateMachine.transitionTo(ClusterState.SHUTDOWN);
        registration.clean();
    }

    /**
     * Opens an I/O context on a pool.
     *
     * @param poolName the pool
     * @return the context, or the backend failure (for example {@code -ENOENT} for a missing pool)
     * @throws RadosException if not connected, or if poolName is null or malformed
     */
    public RadosResult<IoContext> openContext(String poolName) {
        ClusterState state = stateMachine.getState();
        if (state == ClusterState.SHUTDOWN) {
            throw RadosException.invalidState(this, "cannot reuse shutdown rados handle");
        }
        if (state != ClusterState.CONNECTED) {
            throw RadosException.invalidState(this, "not connected to cluster");
        }
        Arguments.requireName(poolName, "pool name");

        HandleRef ref = new HandleRef();
        try {
            int status = backend.createIoContext(handle.token(), poolName, ref);
            if (status < 0) {
                return RadosResult.failure(status);
            }
            if (!handle.retain()) {
                backend.destroyIoContext(ref.get());
                throw RadosException.invalidState(this, "cannot reuse shutdown rados handle");
            }
        } finally {
            Reference.reachabilityFence(this);
        }

        IoContextHandle ioHandle = new IoContextHandle(backend, ref.get(), handle, rados.tracker());
        IoContext context = new IoContext(rados, poolName, ioHandle);
        rados.registry().register(context, this);
        LOGGER.log(Level.FINE, "{0}: opened ioctx on pool {1}", new Object[] {clusterId, poolName});
        return RadosResult.success(context);
    }

    /**
     * Returns the current lifecycle state.
     *
     * @return the state
     */
    public ClusterState state() {
        return stateMachine.getState();
    }

    /**
     * Checks if the cluster is connected.
     *
     * @return true in {@code CONNECTED} state
     */
    public boolean isConnected() {
        return stateMachine.getState().isConnected();
    }

    /**
     * Registers a listener for state transitions.
     *
     * @param listener the listener
     */
    public void addStateListener(ClusterStateListener listener) {
        stateMachine.addListener(listener);
    }

    /**
     * Removes a state listener.
     *
     * @param listener the listener
     * @return true if it was registered
     */
    public boolean removeStateListener(ClusterStateListener listener) {
        return stateMachine.removeListener(listener);
    }

    /**
     * Returns the identifier used in log messages.
     *
     * @return the identifier
     */
    public String id() {
        return clusterId;
    }

    /**
     * Releases this cluster's hold on the native handle from any state. Repeated calls have no
     * effect.
     */
    @Override
    public void close() {
        stateMachine.transitionTo(ClusterState.SHUTDOWN);
        registration.clean();
    }

    ClusterHandle handle() {
        return handle;
    }

    private void ensureNotShutdown() {
        if (stateMachine.getState() == ClusterState.SHUTDOWN) {
            throw RadosException.invalidState(this, "cannot reuse shutdown rados handle");
        }
    }

    @Override
    public String toString() {
        return "Cluster[" + clusterId + ", " + stateMachine.getState().displayName() + "]";
    }
}
