package express.mvp.myra.rados.simulated;

/** Backend calls of {@link SimulatedRadosBackend} that accept an injected failure. */
public enum SimulatedOperation {
    /** {@code rados_create}. */
    CREATE,

    /** {@code rados_conf_read_file}. */
    CONF_READ_FILE,

    /** {@code rados_connect}. */
    CONNECT,

    /** {@code rados_ioctx_create}. */
    IOCTX_CREATE,

    /** {@code rados_stat}. */
    STAT,

    /** {@code rados_read}. */
    READ,

    /** {@code rados_aio_create_completion}. */
    AIO_CREATE_COMPLETION,

    /** {@code rados_aio_stat} submission. */
    AIO_STAT,

    /** {@code rados_aio_read} submission. */
    AIO_READ
}
