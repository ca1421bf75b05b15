package express.mvp.myra.rados;

import express.mvp.myra.rados.backend.RadosBackend;
import express.mvp.myra.rados.memory.ReadBuffer;
import express.mvp.myra.rados.memory.ResourceTracker;
import express.mvp.myra.rados.memory.StatSlot;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owner of a native completion token and of the storage its operation writes into.
 *
 * <p>Release order: if the operation was submitted and is still pending, wait for it; release the
 * token; release the read buffer; decrement the in-flight counter. The buffer is never released
 * while the token shows outstanding work. A token whose submission failed has nothing in flight
 * and is released without waiting.
 *
 * <p>Exactly one of the stat slot and the read buffer is present. Both are referenced from here so
 * the memory the backend writes into stays reachable for as long as the token does.
 *
 * <p>The cleaner state of a {@link Completion}; never references it.
 */
final class CompletionHandle {

    private final RadosBackend backend;

    private final long token;

    private final StatSlot statSlot;

    private final ReadBuffer buffer;

    private final InFlightCompletions inFlight;

    private final ResourceTracker tracker;

    private final long trackingId;

    private final AtomicBoolean released = new AtomicBoolean(false);

    private volatile boolean submitted;

    CompletionHandle(
            RadosBackend backend,
            long token,
            StatSlot statSlot,
            ReadBuffer buffer,
            InFlightCompletions inFlight,
            ResourceTracker tracker) {
        this.backend = backend;
        this.token = token;
        this.statSlot = statSlot;
        this.buffer = buffer;
        this.inFlight = inFlight;
        this.tracker = tracker;
        this.trackingId = tracker.trackAcquire(ResourceTracker.COMPLETION, 0);
        inFlight.increment();
    }

    long token() {
        return token;
    }

    /** Records that an operation was submitted against the token. */
    void markSubmitted() {
        submitted = true;
    }

    boolean isSubmitted() {
        return submitted;
    }

    /** Releases the token and then the buffer. Only the first call acts. */
    void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        try {
            if (submitted && !backend.aioIsComplete(token)) {
                backend.aioWaitForComplete(token);
            }
            backend.aioRelease(token);
            tracker.trackRelease(trackingId);
        } finally {
            if (buffer != null) {
                buffer.release();
            }
            inFlight.decrement();
        }
    }

    StatSlot statSlot() {
        return statSlot;
    }

    ReadBuffer buffer() {
        return buffer;
    }

    boolean isReleased() {
        return released.get();
    }
}
