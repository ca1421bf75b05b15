package express.mvp.myra.rados.error;

/**
 * The four shapes a failed operation can take.
 *
 * <p>{@link #INVALID_ARGUMENT} and {@link #INVALID_STATE} are programmer errors and are raised
 * immediately as {@link RadosException}. {@link #BACKEND_ERROR} and {@link #ALLOCATION_FAILURE} are
 * operational outcomes and are reported through {@link express.mvp.myra.rados.RadosResult}.
 *
 * @see RadosException
 */
public enum ErrorKind {

    /** Malformed or missing input, such as a null object id or a negative read length. */
    INVALID_ARGUMENT(false),

    /** Operation attempted on a handle in an incompatible lifecycle state. */
    INVALID_STATE(false),

    /** The storage backend returned a negative status. */
    BACKEND_ERROR(true),

    /** A read buffer could not be allocated; reported with status {@code -ENOMEM}. */
    ALLOCATION_FAILURE(true);

    private final boolean operational;

    ErrorKind(boolean operational) {
        this.operational = operational;
    }

    /**
     * Checks if this kind is reported as a result value rather than raised.
     *
     * @return true for {@link #BACKEND_ERROR} and {@link #ALLOCATION_FAILURE}
     */
    public boolean isOperational() {
        return operational;
    }
}
