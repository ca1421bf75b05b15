package express.mvp.myra.rados.lifecycle;

import java.util.Map;
import java.util.Objects;
import java.util.WeakHashMap;

/**
 * Keeps a cluster reachable for as long as any I/O context derived from it is reachable.
 *
 * <p>Entries are keyed by the I/O context with weak reachability and hold the cluster strongly.
 * While the context is reachable, so is its cluster, so the cluster's finalization cannot run
 * first. Once the context becomes unreachable its entry goes stale; stale entries are dropped on
 * the next access or by {@link #expungeStaleEntries()}, after which the cluster is collectable on
 * its own reachability again.
 *
 * <p>Keys are compared by identity: the context types do not override {@code equals}.
 *
 * @param <K> the I/O context type
 * @param <V> the cluster type
 */
public final class ClusterReferenceRegistry<K, V> {

    private final Map<K, V> references = new WeakHashMap<>();

    /**
     * Records that {@code context} depends on {@code cluster}.
     *
     * @param context the derived I/O context (held weakly)
     * @param cluster the originating cluster (held strongly while the context is reachable)
     */
    public synchronized void register(K context, V cluster) {
        references.put(
                Objects.requireNonNull(context, "context"),
                Objects.requireNonNull(cluster, "cluster"));
    }

    /**
     * Returns the cluster a context was derived from.
     *
     * @param context the I/O context
     * @return the cluster, or null if the context was never registered
     */
    public synchronized V clusterFor(K context) {
        return references.get(context);
    }

    /**
     * Drops the entries of contexts that have been collected.
     *
     * <p>Called from the cleanup action of a context, which runs after the context's weak key has
     * been cleared.
     */
    public synchronized void expungeStaleEntries() {
        // WeakHashMap expunges on every access
        references.size();
    }

    /**
     * Returns the number of contexts still reachable.
     *
     * @return live entry count, after expunging collected keys
     */
    public synchronized int size() {
        return references.size();
    }

    /**
     * Checks if a cluster is kept reachable by at least one context.
     *
     * @param cluster the cluster
     * @return true if some live entry refers to it
     */
    public synchronized boolean isReferenced(V cluster) {
        for (V value : references.values()) {
            if (value == cluster) {
                return true;
            }
        }
        return false;
    }
}
