package express.mvp.myra.rados.backend;

/**
 * Statistics for backend calls.
 *
 * <p>This immutable class is a snapshot of the counters a backend keeps. Comparing handle
 * creations with their releases is the quickest way to spot a leak in an embedding host:
 *
 * <table border="1">
 *   <caption>Balanced counters</caption>
 *   <tr><th>Created</th><th>Released</th></tr>
 *   <tr><td>clustersCreated</td><td>clusterShutdowns + clustersReleasedUnconnected</td></tr>
 *   <tr><td>ioContextsCreated</td><td>ioContextsDestroyed</td></tr>
 *   <tr><td>completionsCreated</td><td>completionsReleased</td></tr>
 * </table>
 *
 * @see RadosBackend#getStats()
 * @see BackendCounters
 */
public final class BackendStats {
    private final long clustersCreated;
    private final long clusterShutdowns;
    private final long clustersReleasedUnconnected;
    private final long ioContextsCreated;
    private final long ioContextsDestroyed;
    private final long completionsCreated;
    private final long completionsReleased;
    private final long syncStats;
    private final long syncReads;
    private final long aioStats;
    private final long aioReads;
    private final long bytesRead;
    private final long failedCalls;

    private BackendStats(Builder builder) {
        this.clustersCreated = builder.clustersCreated;
        this.clusterShutdowns = builder.clusterShutdowns;
        this.clustersReleasedUnconnected = builder.clustersReleasedUnconnected;
        this.ioContextsCreated = builder.ioContextsCreated;
        this.ioContextsDestroyed = builder.ioContextsDestroyed;
        this.completionsCreated = builder.completionsCreated;
        this.completionsReleased = builder.completionsReleased;
        this.syncStats = builder.syncStats;
        this.syncReads = builder.syncReads;
        this.aioStats = builder.aioStats;
        this.aioReads = builder.aioReads;
        this.bytesRead = builder.bytesRead;
        this.failedCalls = builder.failedCalls;
    }

    /**
     * Creates a new builder for constructing stats.
     *
     * @return a new builder with zero values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the number of cluster handles allocated.
     *
     * @return the count
     */
    public long getClustersCreated() {
        return clustersCreated;
    }

    /**
     * Returns the number of connected cluster handles torn down.
     *
     * @return the count
     */
    public long getClusterShutdowns() {
        return clusterShutdowns;
    }

    /**
     * Returns the number of never-connected cluster handles freed.
     *
     * @return the count
     */
    public long getClustersReleasedUnconnected() {
        return clustersReleasedUnconnected;
    }

    /**
     * Returns the number of I/O contexts opened.
     *
     * @return the count
     */
    public long getIoContextsCreated() {
        return ioContextsCreated;
    }

    /**
     * Returns the number of I/O contexts destroyed.
     *
     * @return the count
     */
    public long getIoContextsDestroyed() {
        return ioContextsDestroyed;
    }

    /**
     * Returns the number of completion tokens allocated.
     *
     * @return the count
     */
    public long getCompletionsCreated() {
        return completionsCreated;
    }

    /**
     * Returns the number of completion tokens released.
     *
     * @return the count
     */
    public long getCompletionsReleased() {
        return completionsReleased;
    }

    /**
     * Returns the number of synchronous stat calls.
     *
     * @return the count
     */
    public long getSyncStats() {
        return syncStats;
    }

    /**
     * Returns the number of synchronous read calls.
     *
     * @return the count
     */
    public long getSyncReads() {
        return syncReads;
    }

    /**
     * Returns the number of asynchronous stat submissions.
     *
     * @return the count
     */
    public long getAioStats() {
        return aioStats;
    }

    /**
     * Returns the number of asynchronous read submissions.
     *
     * @return the count
     */
    public long getAioReads() {
        return aioReads;
    }

    /**
     * Returns the number of bytes returned by successful reads.
     *
     * @return the count
     */
    public long getBytesRead() {
        return bytesRead;
    }

    /**
     * Returns the number of calls that returned a negative status.
     *
     * @return the count
     */
    public long getFailedCalls() {
        return failedCalls;
    }

    /**
     * Returns the number of cluster handles not yet torn down or freed.
     *
     * @return live cluster handles
     */
    public long getLiveClusters() {
        return clustersCreated - clusterShutdowns - clustersReleasedUnconnected;
    }

    /**
     * Returns the number of I/O contexts not yet destroyed.
     *
     * @return live I/O contexts
     */
    public long getLiveIoContexts() {
        return ioContextsCreated - ioContextsDestroyed;
    }

    /**
     * Returns the number of completion tokens not yet released.
     *
     * @return live completions
     */
    public long getLiveCompletions() {
        return completionsCreated - completionsReleased;
    }

    @Override
    public String toString() {
        return "BackendStats["
                + "clusters=" + getLiveClusters()
                + ", ioctxs=" + getLiveIoContexts()
                + ", completions=" + getLiveCompletions()
                + ", reads=" + (syncReads + aioReads)
                + ", stats=" + (syncStats + aioStats)
                + ", bytesRead=" + bytesRead
                + ", failed=" + failedCalls
                + "]";
    }

    /** Builder for constructing {@link BackendStats} instances. */
    public static final class Builder {
        private long clustersCreated;
        private long clusterShutdowns;
        private long clustersReleasedUnconnected;
        private long ioContextsCreated;
        private long ioContextsDestroyed;
        private long completionsCreated;
        private long completionsReleased;
        private long syncStats;
        private long syncReads;
        private long aioStats;
        private long aioReads;
        private long bytesRead;
        private long failedCalls;

        private Builder() {}

        /**
         * Sets the number of cluster handles allocated.
         *
         * @param count the count
         * @return this builder for chaining
         */
        public Builder clustersCreated(long count) {
            this.clustersCreated = count;
            return this;
        }

        /**
         * Sets the number of connected cluster handles torn down.
         *
         * @param count the count
         * @return this builder for chaining
         */
        public Builder clusterShutdowns(long count) {
            this.clusterShutdowns = count;
            return this;
        }

        /**
         * Sets the number of never-connected cluster handles freed.
         *
         * @param count the count
         * @return this builder for chaining
         */
        public Builder clustersReleasedUnconnected(long count) {
            this.clustersReleasedUnconnected = count;
            return this;
        }

        /**
         * Sets the number of I/O contexts opened.
         *
         * @param count the count
         * @return this builder for chaining
         */
        public Builder ioContextsCreated(long count) {
            this.ioContextsCreated = count;
            return this;
        }

        /**
         * Sets the number of I/O contexts destroyed.
         *
         * @param count the count
         * @return this builder for chaining
         */
        public Builder ioContextsDestroyed(long count) {
            this.ioContextsDestroyed = count;
            return this;
        }

        /**
         * Sets the number of completion tokens allocated.
         *
         * @param count the count
         * @return this builder for chaining
         */
        public Builder completionsCreated(long count) {
            this.completionsCreated = count;
            return this;
        }

        /**
         * Sets the number of completion tokens released.
         *
         * @param count the count
         * @return this builder for chaining
         */
        public Builder completionsReleased(long count) {
            this.completionsReleased = count;
            return this;
        }

        /**
         * Sets the number of synchronous stat calls.
         *
         * @param count the count
         * @return this builder for chaining
         */
        public Builder syncStats(long count) {
            this.syncStats = count;
            return this;
        }

        /**
         * Sets the number of synchronous read calls.
         *
         * @param count the count
         * @return this builder for chaining
         */
        public Builder syncReads(long count) {
            this.syncReads = count;
            return this;
        }

        /**
         * Sets the number of asynchronous stat submissions.
         *
         * @param count the count
         * @return this builder for chaining
         */
        public Builder aioStats(long count) {
            this.aioStats = count;
            return this;
        }

        /**
         * Sets the number of asynchronous read submissions.
         *
         * @param count the count
         * @return this builder for chaining
         */
        public Builder aioReads(long count) {
            this.aioReads = count;
            return this;
        }

        /**
         * Sets the number of bytes returned by successful reads.
         *
         * @param count the count
         * @return this builder for chaining
         */
        public Builder bytesRead(long count) {
            this.bytesRead = count;
            return this;
        }

        /**
         * Sets the number of calls that returned a negative status.
         *
         * @param count the count
         * @return this builder for chaining
         */
        public Builder failedCalls(long count) {
            this.failedCalls = count;
            return this;
        }

        /**
         * Builds the stats snapshot.
         *
         * @return a new immutable BackendStats
         */
        public BackendStats build() {
            return new BackendStats(this);
        }
    }
}
