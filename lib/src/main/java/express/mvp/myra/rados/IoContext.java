package express.mvp.myra.rados;

import express.mvp.myra.rados.backend.HandleRef;
import express.mvp.myra.rados.backend.RadosBackend;
import express.mvp.myra.rados.error.RadosException;
import express.mvp.myra.rados.lifecycle.ClusterReferenceRegistry;
import express.mvp.myra.rados.lifecycle.IoContextState;
import express.mvp.myra.rados.memory.HandleCleaner;
import express.mvp.myra.rados.memory.ReadBuffer;
import express.mvp.myra.rados.memory.StatSlot;
import java.lang.ref.Reference;
import java.util.function.IntSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A session on one pool, opened from a connected {@link Cluster}.
 *
 * <p>All operations take an optional locator key. A key applies to the single call that names it:
 * it is set on the native context immediately before the backend call and cleared immediately
 * after, so it never carries over to the next call. For asynchronous operations the key is scoped
 * around submission only.
 *
 * <p>Expected failures (missing object, allocation failure) come back as failed {@link
 * RadosResult}s. Malformed arguments and use after {@link #close()} raise {@link RadosException}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RadosResult<ObjectStat> stat = ioctx.stat("obj", "locator");
 * RadosResult<byte[]> head = ioctx.read("obj", 512, 0);
 *
 * try (Completion<byte[]> pending = ioctx.aioRead("obj", 4096, 0).orElseThrow()) {
 *     while (!pending.isComplete()) {
 *         doOtherWork();
 *     }
 *     byte[] data = pending.result().orElseThrow();
 * }
 * }</pre>
 */
public final class IoContext implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(IoContext.class.getName());

    private final Rados rados;

    private final RadosBackend backend;

    private final String poolName;

    private final IoContextHandle handle;

    private final HandleCleaner.Registration registration;

    private volatile IoContextState state = IoContextState.OPEN;

    IoContext(Rados rados, String poolName, IoContextHandle handle) {
        this.rados = rados;
        this.backend = rados.backend();
        this.poolName = poolName;
        this.handle = handle;
        ClusterReferenceRegistry<IoContext, Cluster> registry = rados.registry();
        this.registration =
                HandleCleaner.register(
                        this,
                        "ioctx " + poolName,
                        () -> {
                            handle.destroy();
                            registry.expungeStaleEntries();
                        });
    }

    /**
     * Returns the size and modification time of an object.
     *
     * @param oid the object id
     * @return the stat, or the backend failure
     */
    public RadosResult<ObjectStat> stat(String oid) {
        return stat(oid, null);
    }

    /**
     * Returns the size and modification time of an object.
     *
     * @param oid the object id
     * @param locatorKey the locator key for this call, or null
     * @return the stat, or the backend failure
     * @throws RadosException if the context is closed or an argument is malformed
     */
    public RadosResult<ObjectStat> stat(String oid, String locatorKey) {
        ensureOpen();
        ObjectLocation location = ObjectLocation.of(oid, locatorKey);
        StatSlot slot = new StatSlot();

        int status =
                withLocator(location, () -> backend.stat(handle.token(), location.oid(), slot));
        if (status < 0) {
            return RadosResult.failure(status);
        }
        return RadosResult.success(new ObjectStat(slot.size(), slot.mtimeSeconds()));
    }

    /**
     * Reads object data.
     *
     * @param oid the object id
     * @param length the maximum number of bytes
     * @param offset the offset in the object
     * @return the bytes read, or the backend failure
     */
    public RadosResult<byte[]> read(String oid, int length, long offset) {
        return read(oid, length, offset, null);
    }

    /**
     * Reads object data.
     *
     * <p>The result holds the bytes the backend reports as read, which is fewer than {@code
     * length} at the end of the object. A zero length yields an empty array.
     *
     * @param oid the object id
     * @param length the maximum number of bytes
     * @param offset the offset in the object
     * @param locatorKey the locator key for this call, or null
     * @return the bytes read, the backend failure, or an allocation failure
     * @throws RadosException if the context is closed or an argument is malformed
     */
    public RadosResult<byte[]> read(String oid, int length, long offset, String locatorKey) {
        ensureOpen();
        ObjectLocation location = ObjectLocation.of(oid, locatorKey);
        ReadRange range = ReadRange.of(length, offset);

        ReadBuffer buffer = ReadBuffer.tryAllocate(range.length(), rados.tracker());
        if (buffer == null) {
            return RadosResult.allocationFailure();
        }
        try {
            int status =
                    withLocator(
                            location,
                            () ->
                                    backend.read(
                                            handle.token(),
                                            location.oid(),
                                            buffer,
                                            range.offset()));
            if (status < 0) {
                return RadosResult.failure(status);
            }
            return RadosResult.success(buffer.toByteArray(status));
        } finally {
            buffer.release();
        }
    }

    /**
     * Starts an asynchronous stat.
     *
     * @param oid the object id
     * @return the completion, or the submission failure
     */
    public RadosResult<Completion<ObjectStat>> aioStat(String oid) {
        return aioStat(oid, null);
    }

    /**
     * Starts an asynchronous stat.
     *
     * <p>If submission fails the completion is released at once and the failure returned.
     *
     * @param oid the object id
     * @param locatorKey the locator key for submission, or null
     * @return the completion, or the submission failure
     * @throws RadosException if the context is closed or an argument is malformed
     */
    public RadosResult<Completion<ObjectStat>> aioStat(String oid, String locatorKey) {
        ensureOpen();
        ObjectLocation location = ObjectLocation.of(oid, locatorKey);

        HandleRef ref = new HandleRef();
        int status = backend.aioCreateCompletion(ref);
        if (status < 0) {
            return RadosResult.failure(status);
        }
        StatSlot slot = new StatSlot();
        CompletionHandle completionHandle =
                new CompletionHandle(
                        backend,
                        ref.get(),
                        slot,
                        null,
                        rados.inFlightCompletions(),
                        rados.tracker());
        StatCompletion completion = new StatCompletion(backend, completionHandle);

        return submit(
                completion,
                withLocator(
                        location,
                        () -> backend.aioStat(handle.token(), location.oid(), ref.get(), slot)));
    }

    /**
     * Starts an asynchronous read.
     *
     * @param oid the object id
     * @param length the maximum number of bytes
     * @param offset the offset in the object
     * @return the completion, or the submission failure
     */
    public RadosResult<Completion<byte[]>> aioRead(String oid, int length, long offset) {
        return aioRead(oid, length, offset, null);
    }

    /**
     * Starts an asynchronous read.
     *
     * <p>The result buffer is allocated before submission and belongs to the returned completion.
     * If submission fails the completion is released at once and the failure returned.
     *
     * @param oid the object id
     * @param length the maximum number of bytes
     * @param offset the offset in the object
     * @param locatorKey the locator key for submission, or null
     * @return the completion, the submission failure, or an allocation failure
     * @throws RadosException if the context is closed or an argument is malformed
     */
    public RadosResult<Completion<byte[]>> aioRead(
            String oid, int length, long offset, String locatorKey) {
        ensureOpen();
        ObjectLocation location = ObjectLocation.of(oid, locatorKey);
        ReadRange range = ReadRange.of(length, offset);

        ReadBuffer buffer = ReadBuffer.tryAllocate(range.length(), rados.tracker());
        if (buffer == null) {
            return RadosResult.allocationFailure();
        }
        HandleRef ref = new HandleRef();
        int status = backend.aioCreateCompletion(ref);
        if (status < 0) {
            buffer.release();
            return RadosResult.failure(status);
        }
        CompletionHandle completionHandle =
                new CompletionHandle(
                        backend,
                        ref.get(),
                        null,
                        buffer,
                        rados.inFlightCompletions(),
                        rados.tracker());
        ReadCompletion completion = new ReadCompletion(backend, completionHandle);

        return submit(
                completion,
                withLocator(
                        location,
                        () ->
                                backend.aioRead(
                                        handle.token(),
                                        location.oid(),
                                        ref.get(),
                                        buffer,
                                        range.offset())));
    }

    /**
     * Returns the cluster this context was opened from.
     *
     * @return the cluster
     */
    public Cluster cluster() {
        return rados.registry().clusterFor(this);
    }

    /**
     * Returns the pool name.
     *
     * @return the pool
     */
    public String poolName() {
        return poolName;
    }

    /**
     * Returns the lifecycle state.
     *
     * @return the state
     */
    public IoContextState state() {
        return state;
    }

    /**
     * Destroys the native context and drops its hold on the cluster handle.
     *
     * <p>Completions issued from this context stay valid.
     *
     * @throws RadosException if the context was already closed
     */
    @Override
    public void close() {
        ensureOpen();
        state = IoContextState.CLOSED;
        registration.clean();
        LOGGER.log(Level.FINE, "closed ioctx on pool {0}", poolName);
    }

    IoContextHandle handle() {
        return handle;
    }

    private <T> RadosResult<Completion<T>> submit(Completion<T> completion, int status) {
        if (status < 0) {
            completion.close();
            return RadosResult.failure(status);
        }
        completion.markSubmitted();
        return RadosResult.success(completion);
    }

    /**
     * Runs a backend call on this context's token with the locator key set around it. The context
     * stays reachable until the call returns, so its cleaner cannot destroy the token mid-call.
     */
    private int withLocator(ObjectLocation location, IntSupplier call) {
        try {
            if (!location.hasLocatorKey()) {
                return call.getAsInt();
            }
            long token = handle.token();
            backend.setLocatorKey(token, location.locatorKey());
            try {
                return call.getAsInt();
            } finally {
                backend.setLocatorKey(token, null);
            }
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    private void ensureOpen() {
        if (state == IoContextState.CLOSED) {
            throw RadosException.invalidState(this, "cannot reuse closed ioctx handle");
        }
    }

    @Override
    public String toString() {
        return "IoContext[" + poolName + ", " + state + "]";
    }
}
