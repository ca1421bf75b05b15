package express.mvp.myra.rados.memory;

import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scratch region that receives the bytes of a single read.
 *
 * <p>The buffer is direct so a native backend can write into it while an asynchronous read is in
 * flight. Its capacity is {@code max(1, length)}: a zero-length read still gets a one-byte region
 * and reports an empty result.
 *
 * <p>Ownership: a synchronous read owns its buffer for the duration of the call; an asynchronous
 * read hands it to the completion, which releases it after the completion token. The buffer is
 * released at most once; any access after release fails.
 */
public final class ReadBuffer {

    private final int length;

    private final ResourceTracker tracker;

    private final long trackingId;

    private final AtomicBoolean released = new AtomicBoolean(false);

    private volatile ByteBuffer buffer;

    private ReadBuffer(ByteBuffer buffer, int length, ResourceTracker tracker) {
        this.buffer = buffer;
        this.length = length;
        this.tracker = tracker;
        this.trackingId = tracker.trackAcquire(ResourceTracker.READ_BUFFER, buffer.capacity());
    }

    /**
     * Allocates a buffer for a read of {@code length} bytes.
     *
     * @param length the requested read length (must not be negative)
     * @param tracker the tracker recording the allocation
     * @return the buffer, or {@code null} if the memory could not be allocated
     * @throws IllegalArgumentException if length is negative
     */
    public static ReadBuffer tryAllocate(int length, ResourceTracker tracker) {
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative: " + length);
        }

        ByteBuffer region;
        try {
            region = ByteBuffer.allocateDirect(Math.max(1, length));
        } catch (OutOfMemoryError e) {
            return null;
        }
        return new ReadBuffer(region, length, tracker);
    }

    /**
     * Returns the requested read length.
     *
     * @return the length, possibly 0
     */
    public int length() {
        return length;
    }

    /**
     * Returns the allocated capacity.
     *
     * @return {@code max(1, length())}
     */
    public int capacity() {
        return requireLive().capacity();
    }

    /**
     * Returns the backing region for the backend to fill.
     *
     * @return the direct buffer
     * @throws IllegalStateException if the buffer was released
     */
    public ByteBuffer buffer() {
        return requireLive();
    }

    /**
     * Copies out the bytes the backend reported as read.
     *
     * @param count the number of bytes read; clamped to {@code [0, length()]}
     * @return a new array of at most {@code length()} bytes
     * @throws IllegalStateException if the buffer was released
     */
    public byte[] toByteArray(int count) {
        ByteBuffer region = requireLive();
        int n = Math.max(0, Math.min(count, length));
        byte[] bytes = new byte[n];
        ByteBuffer view = region.duplicate();
        view.position(0);
        view.get(bytes, 0, n);
        return bytes;
    }

    /**
     * Checks if the buffer has been released.
     *
     * @return true after {@link #release()}
     */
    public boolean isReleased() {
        return released.get();
    }

    /**
     * Releases the region. Only the first call has an effect.
     *
     * @return true if this call released the buffer
     */
    public boolean release() {
        if (!released.compareAndSet(false, true)) {
            return false;
        }
        buffer = null;
        tracker.trackRelease(trackingId);
        return true;
    }

    private ByteBuffer requireLive() {
        ByteBuffer region = buffer;
        if (region == null) {
            throw new IllegalStateException("read buffer already released");
        }
        return region;
    }

    @Override
    public String toString() {
        return "ReadBuffer[length=" + length + ", released=" + released.get() + "]";
    }
}
