package express.mvp.myra.rados;

import express.mvp.myra.rados.backend.RadosBackend;
import express.mvp.myra.rados.error.Errno;
import express.mvp.myra.rados.error.RadosException;
import express.mvp.myra.rados.memory.HandleCleaner;
import java.lang.ref.Reference;

/**
 * Handle to one asynchronous stat or read and its eventual result.
 *
 * <p>Completion state lives in the backend and is only inspected: {@link #isComplete()} polls,
 * {@link #waitForComplete()} blocks, {@link #result()} harvests. A completion stays valid after the
 * {@link IoContext} that issued it is closed.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (Completion<byte[]> completion = ioctx.aioRead("obj", 4096, 0).orElseThrow()) {
 *     completion.waitForComplete();
 *     RadosResult<byte[]> data = completion.result();
 * }
 * }</pre>
 *
 * <h2>Release</h2>
 *
 * <p>{@link #close()} releases the native token and then the read buffer. If the operation is still
 * in flight, release waits for it first, so the buffer is never freed under a pending write. A
 * completion that is simply dropped is released the same way by {@link HandleCleaner}.
 *
 * @param <T> {@link ObjectStat} for stat completions, {@code byte[]} for read completions
 */
public abstract class Completion<T> implements AutoCloseable {

    private final RadosBackend backend;

    private final CompletionHandle handle;

    private final HandleCleaner.Registration registration;

    Completion(RadosBackend backend, CompletionHandle handle) {
        this.backend = backend;
        this.handle = handle;
        this.registration = HandleCleaner.register(this, "completion", handle::release);
    }

    /**
     * Returns the operation this completion was issued for.
     *
     * @return the kind
     */
    public abstract CompletionKind kind();

    /**
     * Polls the backend without blocking.
     *
     * @return true once the operation has finished
     * @throws RadosException if the completion was released
     */
    public boolean isComplete() {
        ensureNotReleased();
        try {
            return backend.aioIsComplete(handle.token());
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Blocks until the backend reports the operation finished. There is no timeout.
     *
     * @throws RadosException if the completion was released
     */
    public void waitForComplete() {
        ensureNotReleased();
        try {
            backend.aioWaitForComplete(handle.token());
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Harvests the outcome.
     *
     * <p>Before completion the result is a failure with status {@code -EINPROGRESS}. A negative
     * operation status is returned as a failure for both kinds. Harvesting again returns the same
     * values.
     *
     * @return the stat fields or the bytes read, truncated to the reported length
     * @throws RadosException if the completion was released
     */
    public final RadosResult<T> result() {
        ensureNotReleased();
        long token = handle.token();
        try {
            if (!backend.aioIsComplete(token)) {
                return RadosResult.failure(-Errno.EINPROGRESS);
            }
            int status = backend.aioGetReturnValue(token);
            if (status < 0) {
                return RadosResult.failure(status);
            }
            return RadosResult.success(harvest(status));
        } finally {
            // the token and its storage are released by this object's cleaner
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Shapes the result of a finished operation.
     *
     * @param status the non-negative return value of the operation
     * @return the value
     */
    abstract T harvest(int status);

    /**
     * Checks if the completion was released.
     *
     * @return true after {@link #close()} or cleaner release
     */
    public boolean isReleased() {
        return handle.isReleased();
    }

    /** Releases the native token and the result storage. Repeated calls have no effect. */
    @Override
    public void close() {
        registration.clean();
    }

    CompletionHandle handle() {
        return handle;
    }

    void markSubmitted() {
        handle.markSubmitted();
    }

    private void ensureNotReleased() {
        if (handle.isReleased()) {
            throw RadosException.invalidState(this, "cannot reuse released completion handle");
        }
    }

    @Override
    public String toString() {
        return "Completion[" + kind() + ", 0x" + Long.toHexString(handle.token()) + "]";
    }
}
