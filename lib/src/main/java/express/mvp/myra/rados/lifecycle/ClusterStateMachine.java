package express.mvp.myra.rados.lifecycle;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * State machine enforcing the cluster handle lifecycle.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * CONFIGURING → CONNECTED, SHUTDOWN
 * CONNECTED   → SHUTDOWN
 * SHUTDOWN    → (terminal, no transitions)
 * </pre>
 *
 * <p>The machine only records state. Whether an operation is permitted in a state, and which error
 * it raises otherwise, is decided by the cluster.
 *
 * @see ClusterState
 * @see ClusterStateListener
 */
public final class ClusterStateMachine {

    private static final Logger LOGGER = Logger.getLogger(ClusterStateMachine.class.getName());

    private static final Set<ClusterState> FROM_CONFIGURING =
            EnumSet.of(ClusterState.CONNECTED, ClusterState.SHUTDOWN);

    private static final Set<ClusterState> FROM_CONNECTED = EnumSet.of(ClusterState.SHUTDOWN);

    private final AtomicReference<ClusterState> state =
            new AtomicReference<>(ClusterState.CONFIGURING);

    private final List<ClusterStateListener> listeners = new CopyOnWriteArrayList<>();

    private final String clusterId;

    /**
     * Creates a state machine in {@link ClusterState#CONFIGURING}.
     *
     * @param clusterId identifier used in log messages
     */
    public ClusterStateMachine(String clusterId) {
        this.clusterId = clusterId;
    }

    /**
     * Returns the current state.
     *
     * @return the state
     */
    public ClusterState getState() {
        return state.get();
    }

    /**
     * Registers a listener for state changes.
     *
     * @param listener the listener
     */
    public void addListener(ClusterStateListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a listener.
     *
     * @param listener the listener
     * @return true if it was registered
     */
    public boolean removeListener(ClusterStateListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Attempts a transition from the current state.
     *
     * @param newState the desired state
     * @return true if the transition happened
     */
    public boolean transitionTo(ClusterState newState) {
        while (true) {
            ClusterState current = state.get();
            if (!isValidTransition(current, newState)) {
                return false;
            }
            if (state.compareAndSet(current, newState)) {
                notifyListeners(current, newState);
                return true;
            }
        }
    }

    /**
     * Attempts a transition only if the current state is {@code expected}.
     *
     * @param expected the expected current state
     * @param newState the desired state
     * @return true if the transition happened
     */
    public boolean transitionFrom(ClusterState expected, ClusterState newState) {
        if (!isValidTransition(expected, newState)) {
            return false;
        }
        if (state.compareAndSet(expected, newState)) {
            notifyListeners(expected, newState);
            return true;
        }
        return false;
    }

    /**
     * Checks if a transition is allowed.
     *
     * @param from the source state
     * @param to the target state
     * @return true if allowed
     */
    public static boolean isValidTransition(ClusterState from, ClusterState to) {
        if (from == to) {
            return false;
        }

        return switch (from) {
            case CONFIGURING -> FROM_CONFIGURING.contains(to);
            case CONNECTED -> FROM_CONNECTED.contains(to);
            case SHUTDOWN -> false;
        };
    }

    private void notifyListeners(ClusterState previous, ClusterState current) {
        LOGGER.log(
                Level.FINE,
                "cluster {0}: {1} -> {2}",
                new Object[] {clusterId, previous, current});

        for (ClusterStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, current);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "Cluster state listener failed", e);
            }
        }
    }

    @Override
    public String toString() {
        return "ClusterStateMachine[" + clusterId + ":" + state.get() + "]";
    }
}
