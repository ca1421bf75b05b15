package express.mvp.myra.rados.error;

/**
 * Categories of backend failures for retry and recovery decisions made by the caller.
 *
 * <p>The access layer never retries on its own. Categories only help the embedding host choose a
 * policy:
 *
 * <ul>
 *   <li><b>TRANSIENT:</b> Retry after a short delay
 *   <li><b>NETWORK:</b> Reconnect the cluster, then retry
 *   <li><b>NOT_FOUND:</b> Treat as absent, do not retry
 *   <li><b>PERMISSION:</b> Fix credentials, do not retry
 *   <li><b>RESOURCE:</b> Back off or shrink the request
 *   <li><b>INVALID_REQUEST:</b> Fix the request, do not retry
 * </ul>
 *
 * @see ErrorClassifier
 */
public enum ErrorCategory {

    /** Temporary condition such as EAGAIN, EBUSY or a completion not yet finished. */
    TRANSIENT(true, "Transient error - may succeed on retry"),

    /** Connectivity to the cluster lost or never established. */
    NETWORK(true, "Network error - reconnection required"),

    /** The object or pool does not exist. */
    NOT_FOUND(false, "Not found - object or pool does not exist"),

    /** The client lacks the capabilities for the operation. */
    PERMISSION(false, "Permission denied - check credentials"),

    /** Memory, space or quota exhausted. */
    RESOURCE(true, "Resource exhaustion - wait for availability"),

    /** The request itself was rejected (invalid argument, name too long, unsupported). */
    INVALID_REQUEST(false, "Invalid request - fix before retrying"),

    /** Unclassified status. Conservative handling treats these as potentially transient. */
    UNKNOWN(true, "Unknown error - conservative retry");

    private final boolean retryable;
    private final String description;

    ErrorCategory(boolean retryable, String description) {
        this.retryable = retryable;
        this.description = description;
    }

    /**
     * Checks if errors in this category are generally retryable.
     *
     * @return true if retry is generally appropriate
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Returns a human-readable description of this category.
     *
     * @return the description
     */
    public String description() {
        return description;
    }

    /**
     * Checks if this error requires the cluster connection to be re-established.
     *
     * @return true only for NETWORK
     */
    public boolean requiresReconnect() {
        return this == NETWORK;
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}
