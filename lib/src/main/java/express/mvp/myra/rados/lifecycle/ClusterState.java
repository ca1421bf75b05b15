package express.mvp.myra.rados.lifecycle;

/**
 * Lifecycle states of a cluster handle.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 * ┌─────────────┐  connect() ok  ┌───────────┐  shutdown()  ┌──────────┐
 * │ CONFIGURING │───────────────▶│ CONNECTED │─────────────▶│ SHUTDOWN │
 * └─────────────┘                └───────────┘              └──────────┘
 *        │                                                        ▲
 *        └──────────────────────── close() ───────────────────────┘
 * </pre>
 *
 * <p>A failed {@code connect()} leaves the handle in {@link #CONFIGURING}. {@link #SHUTDOWN} is
 * terminal: the handle cannot be reconfigured or reconnected.
 *
 * @see ClusterStateMachine
 */
public enum ClusterState {

    /**
     * Created, possibly configured, not connected.
     *
     * <p>Configuration and connection attempts are allowed. A handle released in this state is
     * freed through the allocator path, never through the connection teardown.
     */
    CONFIGURING("Configuring", false, false),

    /** Connected to the cluster; I/O contexts may be opened. */
    CONNECTED("Connected", true, false),

    /** Terminal state - the handle cannot be reused. */
    SHUTDOWN("Shutdown", false, true);

    private final String displayName;
    private final boolean connected;
    private final boolean terminal;

    ClusterState(String displayName, boolean connected, boolean terminal) {
        this.displayName = displayName;
        this.connected = connected;
        this.terminal = terminal;
    }

    /**
     * Returns a human-readable name for this state.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks if I/O contexts may be opened.
     *
     * @return true only in {@link #CONNECTED}
     */
    public boolean isConnected() {
        return connected;
    }

    /**
     * Checks if this is the terminal state.
     *
     * @return true only in {@link #SHUTDOWN}
     */
    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Checks if a connect attempt is allowed.
     *
     * @return true only in {@link #CONFIGURING}
     */
    public boolean canConnect() {
        return this == CONFIGURING;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
