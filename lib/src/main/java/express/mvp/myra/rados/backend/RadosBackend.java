package express.mvp.myra.rados.backend;

import express.mvp.myra.rados.memory.ReadBuffer;
import express.mvp.myra.rados.memory.StatSlot;

/**
 * Calls made into the storage client library.
 *
 * <p>This interface mirrors the subset of the librados C API the access layer depends on. All
 * handles are opaque {@code long} tokens. Every fallible call returns a signed status: zero or
 * positive for success, a negated errno for failure. Implementations never throw for backend
 * failures.
 *
 * <h2>Backend Types</h2>
 *
 * <table border="1">
 *   <caption>Available backends</caption>
 *   <tr><th>Backend</th><th>Platform</th><th>Use</th></tr>
 *   <tr><td>librados</td><td>Linux with librados.so.2</td><td>Real clusters</td></tr>
 *   <tr><td>simulated</td><td>Any</td><td>Tests and embedding without a cluster</td></tr>
 * </table>
 *
 * <h2>Asynchronous Operations</h2>
 *
 * <pre>
 * 1. aioCreateCompletion()          token allocated, nothing in flight
 * 2. aioStat() / aioRead()          operation submitted, writes into the slot/buffer later
 * 3. aioIsComplete() / aioWaitForComplete()
 * 4. aioGetReturnValue()            status of the finished operation
 * 5. aioRelease()                   token released; only now may the buffer be freed
 * </pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Callers issue calls sequentially. Asynchronous operations run on threads owned by the
 * backend; their only shared state with the caller is the completion token and its result
 * storage.
 *
 * @see express.mvp.myra.rados.librados.LibRadosBackend
 * @see express.mvp.myra.rados.simulated.SimulatedRadosBackend
 */
public interface RadosBackend extends AutoCloseable {

    /**
     * Returns the client library version.
     *
     * @return the version
     */
    RadosVersion version();

    /**
     * Allocates a cluster handle ({@code rados_create}).
     *
     * @param userId the user to connect as, or null for the default
     * @param cluster receives the cluster token on success
     * @return status
     */
    int createCluster(String userId, HandleRef cluster);

    /**
     * Reads configuration into a cluster handle ({@code rados_conf_read_file}).
     *
     * @param cluster the cluster token
     * @param path the configuration file, or null for the default search path
     * @return status
     */
    int confReadFile(long cluster, String path);

    /**
     * Connects a configured cluster handle ({@code rados_connect}).
     *
     * @param cluster the cluster token
     * @return status
     */
    int connect(long cluster);

    /**
     * Tears down a connected cluster handle and frees it ({@code rados_shutdown}).
     *
     * @param cluster the cluster token
     */
    void shutdown(long cluster);

    /**
     * Frees a cluster handle that never connected.
     *
     * <p>Callers never pass such a handle to {@link #shutdown(long)}. librados has no separate
     * destructor for an unconnected handle, so its implementation frees it through {@code
     * rados_shutdown}, which skips the connection teardown for a client that never connected.
     *
     * @param cluster the cluster token
     */
    void releaseCluster(long cluster);

    /**
     * Opens an I/O context on a pool ({@code rados_ioctx_create}).
     *
     * @param cluster the connected cluster token
     * @param poolName the pool name
     * @param ioctx receives the context token on success
     * @return status; {@code -ENOENT} for a pool that does not exist
     */
    int createIoContext(long cluster, String poolName, HandleRef ioctx);

    /**
     * Destroys an I/O context ({@code rados_ioctx_destroy}).
     *
     * @param ioctx the context token
     */
    void destroyIoContext(long ioctx);

    /**
     * Sets or clears the locator key used by subsequent calls on a context ({@code
     * rados_ioctx_locator_set_key}).
     *
     * @param ioctx the context token
     * @param locatorKey the key, or null to clear it
     */
    void setLocatorKey(long ioctx, String locatorKey);

    /**
     * Reads the size and modification time of an object ({@code rados_stat}).
     *
     * @param ioctx the context token
     * @param oid the object id
     * @param slot receives the result on success
     * @return status
     */
    int stat(long ioctx, String oid, StatSlot slot);

    /**
     * Reads object data ({@code rados_read}).
     *
     * @param ioctx the context token
     * @param oid the object id
     * @param buffer receives the data; its {@link ReadBuffer#length()} is the requested length
     * @param offset the offset in the object
     * @return number of bytes read, or a negative status
     */
    int read(long ioctx, String oid, ReadBuffer buffer, long offset);

    /**
     * Allocates a completion token ({@code rados_aio_create_completion}).
     *
     * @param completion receives the completion token on success
     * @return status
     */
    int aioCreateCompletion(HandleRef completion);

    /**
     * Submits an asynchronous stat ({@code rados_aio_stat}).
     *
     * @param ioctx the context token
     * @param oid the object id
     * @param completion the completion token
     * @param slot receives the result when the operation completes successfully
     * @return submission status
     */
    int aioStat(long ioctx, String oid, long completion, StatSlot slot);

    /**
     * Submits an asynchronous read ({@code rados_aio_read}).
     *
     * @param ioctx the context token
     * @param oid the object id
     * @param completion the completion token
     * @param buffer receives the data while the operation runs
     * @param offset the offset in the object
     * @return submission status
     */
    int aioRead(long ioctx, String oid, long completion, ReadBuffer buffer, long offset);

    /**
     * Polls a completion without blocking ({@code rados_aio_is_complete}).
     *
     * @param completion the completion token
     * @return true if the operation finished
     */
    boolean aioIsComplete(long completion);

    /**
     * Blocks until a completion finishes ({@code rados_aio_wait_for_complete}).
     *
     * @param completion the completion token
     * @return status of the wait itself
     */
    int aioWaitForComplete(long completion);

    /**
     * Returns the status of a finished operation ({@code rados_aio_get_return_value}).
     *
     * @param completion the completion token
     * @return status; bytes read for reads
     */
    int aioGetReturnValue(long completion);

    /**
     * Releases a completion token ({@code rados_aio_release}).
     *
     * @param completion the completion token
     */
    void aioRelease(long completion);

    /**
     * Returns the backend type identifier.
     *
     * @return "librados" or "simulated"
     */
    String getBackendType();

    /**
     * Returns call statistics.
     *
     * @return a snapshot of backend counters
     */
    BackendStats getStats();

    /** Releases resources owned by the backend itself (worker threads, loaded state). */
    @Override
    void close();
}
