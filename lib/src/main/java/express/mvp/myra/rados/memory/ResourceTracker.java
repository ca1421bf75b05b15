package express.mvp.myra.rados.memory;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks native handles and read buffers for leak detection.
 *
 * <p>Every cluster, I/O context, completion and read buffer reports its acquisition and release
 * here when tracking is enabled ({@code RadosConfig.Builder#trackResources(boolean)}). Whatever is
 * still listed by {@link #getActiveResources()} when the host is done has leaked.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ResourceTracker tracker = rados.resourceTracker();
 * // ... run the workload, close everything ...
 * for (TrackedResource leak : tracker.getActiveResources()) {
 *     LOGGER.warning("Leaked " + leak);
 * }
 * }</pre>
 *
 * <p>When disabled every method is a cheap no-op and {@link #trackAcquire} returns 0.
 *
 * @see HandleCleaner
 */
public final class ResourceTracker {

    /** Source name for cluster handles. */
    public static final String CLUSTER = "cluster";

    /** Source name for I/O context handles. */
    public static final String IOCTX = "ioctx";

    /** Source name for completion handles. */
    public static final String COMPLETION = "completion";

    /** Source name for read buffers. */
    public static final String READ_BUFFER = "read-buffer";

    private final Map<Long, TrackedResource> active = new ConcurrentHashMap<>();

    private final AtomicLong idGenerator = new AtomicLong(1);

    private final AtomicLong acquireCount = new AtomicLong(0);

    private final AtomicLong releaseCount = new AtomicLong(0);

    private final AtomicLong bytesAcquired = new AtomicLong(0);

    private volatile boolean enabled;

    /**
     * Creates a tracker.
     *
     * @param enabled whether tracking starts enabled
     */
    public ResourceTracker(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Returns a tracker that never records anything.
     *
     * @return a disabled tracker
     */
    public static ResourceTracker disabled() {
        return new ResourceTracker(false);
    }

    /**
     * Enables or disables tracking. Resources acquired while disabled are never reported.
     *
     * @param enabled true to enable tracking
     */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Checks if tracking is enabled.
     *
     * @return true if tracking is enabled
     */
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Records the acquisition of a resource.
     *
     * @param source one of the source constants of this class
     * @param sizeBytes the size in bytes, 0 for handles
     * @return tracking ID for {@link #trackRelease(long)}, or 0 when disabled
     */
    public long trackAcquire(String source, long sizeBytes) {
        if (!enabled) {
            return 0;
        }

        long id = idGenerator.getAndIncrement();
        active.put(id, new TrackedResource(id, source, sizeBytes, Instant.now()));
        acquireCount.incrementAndGet();
        bytesAcquired.addAndGet(sizeBytes);
        return id;
    }

    /**
     * Records the release of a resource.
     *
     * @param trackingId the ID returned by {@link #trackAcquire}
     * @return true if the resource was being tracked
     */
    public boolean trackRelease(long trackingId) {
        if (trackingId == 0) {
            return false;
        }

        TrackedResource resource = active.remove(trackingId);
        if (resource == null) {
            return false;
        }
        releaseCount.incrementAndGet();
        return true;
    }

    /**
     * Returns the resources acquired and not yet released.
     *
     * @return unmodifiable view of active resources
     */
    public Collection<TrackedResource> getActiveResources() {
        return Collections.unmodifiableCollection(active.values());
    }

    /**
     * Returns the number of active resources of one source.
     *
     * @param source the source name
     * @return active count for that source
     */
    public long getActiveCount(String source) {
        return active.values().stream().filter(r -> r.source().equals(source)).count();
    }

    /**
     * Returns the number of active resources.
     *
     * @return active count
     */
    public int getActiveCount() {
        return active.size();
    }

    /**
     * Returns the total number of acquisitions recorded.
     *
     * @return acquisition count
     */
    public long getAcquireCount() {
        return acquireCount.get();
    }

    /**
     * Returns the total number of releases recorded.
     *
     * @return release count
     */
    public long getReleaseCount() {
        return releaseCount.get();
    }

    /**
     * Returns the cumulative bytes of tracked buffers.
     *
     * @return bytes acquired
     */
    public long getBytesAcquired() {
        return bytesAcquired.get();
    }

    /** Clears all tracking data. */
    public void clear() {
        active.clear();
        acquireCount.set(0);
        releaseCount.set(0);
        bytesAcquired.set(0);
        idGenerator.set(1);
    }

    /**
     * Returns a summary of tracking statistics.
     *
     * @return formatted statistics string
     */
    public String getSummary() {
        return String.format(
                "ResourceTracker[enabled=%s, active=%d, acquired=%d, released=%d]",
                enabled, active.size(), acquireCount.get(), releaseCount.get());
    }

    /**
     * A resource acquired and not yet released.
     *
     * @param id the tracking ID
     * @param source the source name
     * @param size the size in bytes, 0 for handles
     * @param acquiredAt when it was acquired
     */
    public record TrackedResource(long id, String source, long size, Instant acquiredAt) {

        /**
         * Returns how long the resource has been held.
         *
         * @return age in milliseconds
         */
        public long ageMillis() {
            return Instant.now().toEpochMilli() - acquiredAt.toEpochMilli();
        }
    }
}
