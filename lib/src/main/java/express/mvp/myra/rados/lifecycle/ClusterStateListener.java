package express.mvp.myra.rados.lifecycle;

/**
 * Listener for cluster state transitions.
 *
 * <p>Called synchronously on the thread that performed the transition, after the new state is
 * visible. Exceptions thrown by a listener are logged and do not affect the transition or other
 * listeners.
 *
 * <pre>{@code
 * cluster.addStateListener((previous, current) ->
 *     LOGGER.info("cluster " + previous + " -> " + current));
 * }</pre>
 *
 * @see ClusterStateMachine
 */
@FunctionalInterface
public interface ClusterStateListener {

    /**
     * Called after a successful transition.
     *
     * @param previous the state before the transition
     * @param current the state after the transition
     */
    void onStateChanged(ClusterState previous, ClusterState current);
}
