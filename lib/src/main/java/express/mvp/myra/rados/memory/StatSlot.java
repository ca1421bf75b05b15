package express.mvp.myra.rados.memory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Native-ordered result storage for a stat call: {@code uint64_t size} at offset 0 and {@code
 * time_t mtime} at offset 8.
 *
 * <p>Direct so that an asynchronous stat can write into it from a backend thread. A stat
 * completion owns its slot for as long as it owns its completion token.
 */
public final class StatSlot {

    /** Size of the slot in bytes. */
    public static final int BYTES = 16;

    /** Offset of the object size. */
    public static final int SIZE_OFFSET = 0;

    /** Offset of the modification time in seconds since the epoch. */
    public static final int MTIME_OFFSET = 8;

    private final ByteBuffer buffer;

    /** Creates a zeroed slot. */
    public StatSlot() {
        this.buffer = ByteBuffer.allocateDirect(BYTES).order(ByteOrder.nativeOrder());
    }

    /**
     * Returns the backing region.
     *
     * @return the direct buffer
     */
    public ByteBuffer buffer() {
        return buffer;
    }

    /**
     * Stores a stat result.
     *
     * @param size the object size in bytes
     * @param mtimeSeconds the modification time in seconds since the epoch
     */
    public void store(long size, long mtimeSeconds) {
        buffer.putLong(SIZE_OFFSET, size);
        buffer.putLong(MTIME_OFFSET, mtimeSeconds);
    }

    /**
     * Returns the stored object size.
     *
     * @return size in bytes
     */
    public long size() {
        return buffer.getLong(SIZE_OFFSET);
    }

    /**
     * Returns the stored modification time.
     *
     * @return seconds since the epoch
     */
    public long mtimeSeconds() {
        return buffer.getLong(MTIME_OFFSET);
    }
}
