package express.mvp.myra.rados.memory;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ReadBuffer}. */
@DisplayName("ReadBuffer")
class ReadBufferTest {

    private ResourceTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new ResourceTracker(true);
    }

    @Nested
    @DisplayName("Allocation")
    class AllocationTests {

        @Test
        @DisplayName("Zero-length read allocates one byte")
        void zeroLength_allocatesOneByte() {
            ReadBuffer buffer = ReadBuffer.tryAllocate(0, tracker);

            assertNotNull(buffer);
            assertEquals(0, buffer.length());
            assertEquals(1, buffer.capacity());
            assertTrue(buffer.buffer().isDirect());
        }

        @Test
        @DisplayName("Capacity matches the requested length")
        void capacityMatchesLength() {
            ReadBuffer buffer = ReadBuffer.tryAllocate(4096, tracker);

            assertEquals(4096, buffer.length());
            assertEquals(4096, buffer.capacity());
        }

        @Test
        @DisplayName("Negative length is rejected")
        void negativeLength_rejected() {
            assertThrows(IllegalArgumentException.class, () -> ReadBuffer.tryAllocate(-1, tracker));
        }

        @Test
        @DisplayName("Allocation is tracked as a read buffer")
        void allocationTracked() {
            ReadBuffer buffer = ReadBuffer.tryAllocate(128, tracker);

            assertEquals(1, tracker.getActiveCount(ResourceTracker.READ_BUFFER));
            assertEquals(128, tracker.getBytesAcquired());

            buffer.release();
            assertEquals(0, tracker.getActiveCount(ResourceTracker.READ_BUFFER));
        }
    }

    @Nested
    @DisplayName("Copying out")
    class CopyTests {

        @Test
        @DisplayName("toByteArray truncates to the reported count")
        void truncatesToCount() {
            ReadBuffer buffer = ReadBuffer.tryAllocate(8, tracker);
            ByteBuffer region = buffer.buffer().duplicate();
            region.put(new byte[] {1, 2, 3, 4, 5, 6, 7, 8});

            assertArrayEquals(new byte[] {1, 2, 3}, buffer.toByteArray(3));
        }

        @Test
        @DisplayName("Count larger than the length is clamped")
        void clampsToLength() {
            ReadBuffer buffer = ReadBuffer.tryAllocate(2, tracker);

            assertEquals(2, buffer.toByteArray(100).length);
        }

        @Test
        @DisplayName("Zero-length buffer yields an empty array")
        void zeroLength_yieldsEmpty() {
            ReadBuffer buffer = ReadBuffer.tryAllocate(0, tracker);

            assertEquals(0, buffer.toByteArray(1).length);
        }
    }

    @Nested
    @DisplayName("Release")
    class ReleaseTests {

        @Test
        @DisplayName("Release happens exactly once")
        void releaseOnce() {
            ReadBuffer buffer = ReadBuffer.tryAllocate(16, tracker);

            assertTrue(buffer.release());
            assertFalse(buffer.release());
            assertTrue(buffer.isReleased());
            assertEquals(1, tracker.getReleaseCount());
        }

        @Test
        @DisplayName("Released buffer cannot be read")
        void releasedBuffer_throws() {
            ReadBuffer buffer = ReadBuffer.tryAllocate(16, tracker);
            buffer.release();

            assertThrows(IllegalStateException.class, buffer::buffer);
            assertThrows(IllegalStateException.class, () -> buffer.toByteArray(1));
        }
    }
}
