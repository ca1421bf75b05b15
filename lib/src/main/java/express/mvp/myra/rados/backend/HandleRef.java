package express.mvp.myra.rados.backend;

/**
 * Out-parameter receiving an opaque native token, the Java counterpart of the {@code rados_t *},
 * {@code rados_ioctx_t *} and {@code rados_completion_t *} arguments of librados.
 *
 * <p>A backend writes the token only when the call succeeds. A value of 0 means "no handle".
 */
public final class HandleRef {

    private long value;

    /**
     * Returns the token written by the backend.
     *
     * @return the token, or 0 if none was written
     */
    public long get() {
        return value;
    }

    /**
     * Stores a token.
     *
     * @param value the native token
     */
    public void set(long value) {
        this.value = value;
    }

    /**
     * Checks if a token was written.
     *
     * @return true if the value is non-zero
     */
    public boolean isSet() {
        return value != 0;
    }

    @Override
    public String toString() {
        return "HandleRef[0x" + Long.toHexString(value) + "]";
    }
}
