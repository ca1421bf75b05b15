package express.mvp.myra.rados.error;

import java.util.Objects;

/**
 * Unchecked exception raised for programmer errors against the RADOS access layer.
 *
 * <p>Argument and lifecycle violations (null object ids, reuse of a shut down cluster, a second
 * {@code connect()}, a closed I/O context) are raised as this exception with {@link
 * ErrorKind#INVALID_ARGUMENT} or {@link ErrorKind#INVALID_STATE}. Backend failures are normally
 * returned as {@link express.mvp.myra.rados.RadosResult} values; they only surface as this
 * exception when the caller explicitly asks for it through {@link
 * express.mvp.myra.rados.RadosResult#orElseThrow()}.
 *
 * @see ErrorKind
 * @see Errno#fromStatus(int, String)
 */
public class RadosException extends RuntimeException {

    private final ErrorKind kind;

    private final int status;

    /**
     * Constructs an exception without a backend status.
     *
     * @param kind the error kind
     * @param message the detail message
     */
    public RadosException(ErrorKind kind, String message) {
        this(kind, message, 0);
    }

    /**
     * Constructs an exception carrying a backend status.
     *
     * @param kind the error kind
     * @param message the detail message
     * @param status the negative backend status, or 0 when not applicable
     */
    public RadosException(ErrorKind kind, String message, int status) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.status = status;
    }

    /**
     * Constructs an exception with an underlying cause.
     *
     * @param kind the error kind
     * @param message the detail message
     * @param cause the underlying cause
     */
    public RadosException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.status = 0;
    }

    /**
     * Creates an {@link ErrorKind#INVALID_ARGUMENT} exception.
     *
     * @param message the detail message
     * @return the exception
     */
    public static RadosException invalidArgument(String message) {
        return new RadosException(ErrorKind.INVALID_ARGUMENT, message);
    }

    /**
     * Creates an {@link ErrorKind#INVALID_STATE} exception naming the offending handle.
     *
     * @param handle the handle the operation was attempted on
     * @param message the lifecycle violation
     * @return the exception
     */
    public static RadosException invalidState(Object handle, String message) {
        return new RadosException(
                ErrorKind.INVALID_STATE, "bad handle " + handle + " (" + message + ")");
    }

    /**
     * Returns the error kind.
     *
     * @return the kind
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * Returns the backend status carried by this exception.
     *
     * @return the negative status, or 0 for argument and state errors
     */
    public int status() {
        return status;
    }
}
