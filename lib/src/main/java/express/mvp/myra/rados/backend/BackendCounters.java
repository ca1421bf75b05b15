package express.mvp.myra.rados.backend;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable call counters shared by backend implementations.
 *
 * <p>Counters are atomic because asynchronous operations finish on backend threads.
 */
public final class BackendCounters {

    /** Number of cluster handles allocated. */
    public final AtomicLong clustersCreated = new AtomicLong();

    /** Number of connected cluster handles torn down. */
    public final AtomicLong clusterShutdowns = new AtomicLong();

    /** Number of never-connected cluster handles freed. */
    public final AtomicLong clustersReleasedUnconnected = new AtomicLong();

    /** Number of I/O contexts opened. */
    public final AtomicLong ioContextsCreated = new AtomicLong();

    /** Number of I/O contexts destroyed. */
    public final AtomicLong ioContextsDestroyed = new AtomicLong();

    /** Number of completion tokens allocated. */
    public final AtomicLong completionsCreated = new AtomicLong();

    /** Number of completion tokens released. */
    public final AtomicLong completionsReleased = new AtomicLong();

    /** Number of synchronous stat calls. */
    public final AtomicLong syncStats = new AtomicLong();

    /** Number of synchronous read calls. */
    public final AtomicLong syncReads = new AtomicLong();

    /** Number of asynchronous stat submissions. */
    public final AtomicLong aioStats = new AtomicLong();

    /** Number of asynchronous read submissions. */
    public final AtomicLong aioReads = new AtomicLong();

    /** Number of bytes returned by successful reads. */
    public final AtomicLong bytesRead = new AtomicLong();

    /** Number of calls that returned a negative status. */
    public final AtomicLong failedCalls = new AtomicLong();

    /**
     * Records a call status, counting it as failed when negative.
     *
     * @param status the status returned by the call
     * @return the status, unchanged
     */
    public int record(int status) {
        if (status < 0) {
            failedCalls.incrementAndGet();
        }
        return status;
    }

    /**
     * Takes a snapshot of all counters.
     *
     * @return the stats
     */
    public BackendStats snapshot() {
        return BackendStats.builder()
                .clustersCreated(clustersCreated.get())
                .clusterShutdowns(clusterShutdowns.get())
                .clustersReleasedUnconnected(clustersReleasedUnconnected.get())
                .ioContextsCreated(ioContextsCreated.get())
                .ioContextsDestroyed(ioContextsDestroyed.get())
                .completionsCreated(completionsCreated.get())
                .completionsReleased(completionsReleased.get())
                .syncStats(syncStats.get())
                .syncReads(syncReads.get())
                .aioStats(aioStats.get())
                .aioReads(aioReads.get())
                .bytesRead(bytesRead.get())
                .failedCalls(failedCalls.get())
                .build();
    }
}
