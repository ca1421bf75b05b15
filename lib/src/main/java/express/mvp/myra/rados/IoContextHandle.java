package express.mvp.myra.rados;

import express.mvp.myra.rados.backend.RadosBackend;
import express.mvp.myra.rados.memory.ResourceTracker;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owner of a native I/O context token and of one reference on its cluster token.
 *
 * <p>Destruction order is fixed: the context token first, then the cluster reference. The cleaner
 * state of an {@link IoContext}; never references it.
 */
final class IoContextHandle {

    private final RadosBackend backend;

    private final long token;

    private final ClusterHandle cluster;

    private final ResourceTracker tracker;

    private final long trackingId;

    private final AtomicBoolean destroyed = new AtomicBoolean(false);

    IoContextHandle(
            RadosBackend backend, long token, ClusterHandle cluster, ResourceTracker tracker) {
        this.backend = backend;
        this.token = token;
        this.cluster = cluster;
        this.tracker = tracker;
        this.trackingId = tracker.trackAcquire(ResourceTracker.IOCTX, 0);
    }

    long token() {
        return token;
    }

    /** Destroys the context token and drops the cluster reference. Only the first call acts. */
    void destroy() {
        if (!destroyed.compareAndSet(false, true)) {
            return;
        }
        try {
            backend.destroyIoContext(token);
            tracker.trackRelease(trackingId);
        } finally {
            cluster.release();
        }
    }

    boolean isDestroyed() {
        return destroyed.get();
    }
}
