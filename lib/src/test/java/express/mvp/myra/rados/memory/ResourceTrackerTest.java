package express.mvp.myra.rados.memory;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ResourceTracker}. */
@DisplayName("ResourceTracker")
class ResourceTrackerTest {

    private ResourceTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new ResourceTracker(true);
    }

    @Nested
    @DisplayName("Enable/disable")
    class EnableDisableTests {

        @Test
        @DisplayName("Disabled tracker returns ID 0")
        void disabled_returnsZero() {
            ResourceTracker disabled = ResourceTracker.disabled();

            assertEquals(0, disabled.trackAcquire(ResourceTracker.CLUSTER, 0));
            assertEquals(0, disabled.getActiveCount());
            assertFalse(disabled.trackRelease(0));
        }

        @Test
        @DisplayName("setEnabled toggles tracking")
        void setEnabled_toggles() {
            tracker.setEnabled(false);
            assertFalse(tracker.isEnabled());
            assertEquals(0, tracker.trackAcquire(ResourceTracker.IOCTX, 0));
        }
    }

    @Nested
    @DisplayName("Tracking")
    class TrackingTests {

        @Test
        @DisplayName("Acquire and release are counted per source")
        void perSourceCounts() {
            long cluster = tracker.trackAcquire(ResourceTracker.CLUSTER, 0);
            long ioctx = tracker.trackAcquire(ResourceTracker.IOCTX, 0);
            tracker.trackAcquire(ResourceTracker.READ_BUFFER, 64);

            assertNotEquals(0, cluster);
            assertEquals(3, tracker.getActiveCount());
            assertEquals(1, tracker.getActiveCount(ResourceTracker.IOCTX));
            assertEquals(64, tracker.getBytesAcquired());

            assertTrue(tracker.trackRelease(ioctx));
            assertFalse(tracker.trackRelease(ioctx));
            assertEquals(0, tracker.getActiveCount(ResourceTracker.IOCTX));
            assertEquals(3, tracker.getAcquireCount());
            assertEquals(1, tracker.getReleaseCount());
        }

        @Test
        @DisplayName("Active resources carry their source")
        void activeResources() {
            tracker.trackAcquire(ResourceTracker.COMPLETION, 0);

            ResourceTracker.TrackedResource resource =
                    tracker.getActiveResources().iterator().next();
            assertEquals(ResourceTracker.COMPLETION, resource.source());
            assertTrue(resource.ageMillis() >= 0);
        }

        @Test
        @DisplayName("clear resets everything")
        void clear_resets() {
            tracker.trackAcquire(ResourceTracker.CLUSTER, 0);
            tracker.clear();

            assertEquals(0, tracker.getActiveCount());
            assertEquals(0, tracker.getAcquireCount());
            assertTrue(tracker.getSummary().contains("active=0"));
        }
    }
}
