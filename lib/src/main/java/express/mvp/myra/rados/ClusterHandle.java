package express.mvp.myra.rados;

import express.mvp.myra.rados.backend.RadosBackend;
import express.mvp.myra.rados.memory.ResourceTracker;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reference-counted owner of a native cluster token.
 *
 * <p>The {@link Cluster} holds one reference and every open {@link IoContext} one more, so the
 * token outlives every context derived from it regardless of the order in which the host drops or
 * closes them. When the last reference goes, the token is torn down through {@code shutdown} if it
 * ever connected, and freed through the allocator path otherwise.
 *
 * <p>Never references the {@link Cluster} object: it is the cleaner state of that object.
 */
final class ClusterHandle {

    private static final Logger LOGGER = Logger.getLogger(ClusterHandle.class.getName());

    private final RadosBackend backend;

    private final long token;

    private final ResourceTracker tracker;

    private final long trackingId;

    private final AtomicInteger references = new AtomicInteger(1);

    private volatile boolean connected;

    ClusterHandle(RadosBackend backend, long token, ResourceTracker tracker) {
        this.backend = backend;
        this.token = token;
        this.tracker = tracker;
        this.trackingId = tracker.trackAcquire(ResourceTracker.CLUSTER, 0);
    }

    long token() {
        return token;
    }

    /** Records that the token completed {@code rados_connect}; teardown then uses shutdown. */
    void markConnected() {
        connected = true;
    }

    boolean isConnected() {
        return connected;
    }

    /**
     * Adds a reference for a derived I/O context.
     *
     * @return false if the token has already been released
     */
    boolean retain() {
        while (true) {
            int current = references.get();
            if (current <= 0) {
                return false;
            }
            if (references.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /** Drops a reference, releasing the token when it was the last one. */
    void release() {
        int remaining = references.decrementAndGet();
        if (remaining > 0) {
            LOGGER.log(
                    Level.FINE,
                    "cluster 0x{0}: teardown deferred, {1} context(s) still open",
                    new Object[] {Long.toHexString(token), remaining});
            return;
        }
        if (remaining < 0) {
            throw new IllegalStateException("cluster handle released more often than retained");
        }

        if (connected) {
            backend.shutdown(token);
        } else {
            backend.releaseCluster(token);
        }
        tracker.trackRelease(trackingId);
        LOGGER.log(
                Level.FINE,
                "cluster 0x{0}: native handle released ({1})",
                new Object[] {Long.toHexString(token), connected ? "shutdown" : "never connected"});
    }

    int referenceCount() {
        return references.get();
    }
}
