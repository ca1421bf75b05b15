package express.mvp.myra.rados.lifecycle;

/**
 * Lifecycle states of an I/O context: {@code OPEN → CLOSED}.
 *
 * <p>{@link #CLOSED} is terminal; a second {@code close()} is rejected like any other use of a
 * closed context.
 */
public enum IoContextState {

    /** Usable for I/O. */
    OPEN,

    /** Native context destroyed. */
    CLOSED
}
