package express.mvp.myra.rados.simulated;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed pool of platform threads that executes simulated asynchronous operations.
 *
 * <pre>
 * caller ── aioRead() ──► work queue ──► aio-worker-1..N ──► completion token
 * </pre>
 *
 * <p>Operations may block on the completion gate of {@link SimulatedRadosBackend}, so each pending
 * operation occupies one worker. Tasks submitted after shutdown are rejected and counted.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Tasks can be submitted from any thread. Submission happens-before task execution.
 */
public final class AioWorkerPool implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(AioWorkerPool.class.getName());

    private final ExecutorService executor;

    private final AioThreadFactory threadFactory;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private final AtomicLong submittedTasks = new AtomicLong(0);

    private final AtomicLong completedTasks = new AtomicLong(0);

    private final AtomicLong failedTasks = new AtomicLong(0);

    private final AtomicLong rejectedTasks = new AtomicLong(0);

    private AioWorkerPool(AioThreadFactory threadFactory, int threads) {
        this.threadFactory = threadFactory;
        this.executor = Executors.newFixedThreadPool(threads, threadFactory);
    }

    /**
     * Creates a new builder.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Submits an operation.
     *
     * @param task the operation
     * @return a future for the task, or null if the pool is shut down
     * @throws NullPointerException if task is null
     */
    public Future<?> submit(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");

        if (shutdown.get()) {
            rejectedTasks.incrementAndGet();
            return null;
        }

        submittedTasks.incrementAndGet();

        return executor.submit(
                () -> {
                    try {
                        task.run();
                        completedTasks.incrementAndGet();
                    } catch (RuntimeException e) {
                        failedTasks.incrementAndGet();
                        LOGGER.log(Level.WARNING, "Simulated aio task failed", e);
                        throw e;
                    }
                });
    }

    /**
     * Stops accepting tasks and waits for the queued ones.
     *
     * @param timeout maximum time to wait
     * @return true if all tasks finished in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean shutdown(Duration timeout) throws InterruptedException {
        if (!shutdown.compareAndSet(false, true)) {
            return true;
        }

        executor.shutdown();
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Waits for running tasks to finish after a shutdown.
     *
     * @param timeout maximum time to wait
     * @return true if the pool terminated in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Stops accepting tasks and interrupts running ones. Queued tasks are dropped. */
    public void shutdownNow() {
        shutdown.set(true);
        executor.shutdownNow();
    }

    /**
     * Returns whether the pool was shut down.
     *
     * @return true after shutdown
     */
    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Returns the number of submitted tasks.
     *
     * @return the count
     */
    public long getSubmittedTasks() {
        return submittedTasks.get();
    }

    /**
     * Returns the number of tasks that finished normally.
     *
     * @return the count
     */
    public long getCompletedTasks() {
        return completedTasks.get();
    }

    /**
     * Returns the number of tasks that threw.
     *
     * @return the count
     */
    public long getFailedTasks() {
        return failedTasks.get();
    }

    /**
     * Returns the number of tasks rejected after shutdown.
     *
     * @return the count
     */
    public long getRejectedTasks() {
        return rejectedTasks.get();
    }

    /**
     * Returns the approximate number of queued or running tasks.
     *
     * @return the count
     */
    public long getActiveTasks() {
        return submittedTasks.get() - completedTasks.get() - failedTasks.get();
    }

    /**
     * Returns the number of threads created.
     *
     * @return the count
     */
    public long getThreadCount() {
        return threadFactory.getThreadCount();
    }

    @Override
    public void close() {
        shutdownNow();
    }

    @Override
    public String toString() {
        return "AioWorkerPool["
                + "submitted="
                + submittedTasks.get()
                + ", completed="
                + completedTasks.get()
                + ", failed="
                + failedTasks.get()
                + ", pending="
                + getActiveTasks()
                + ", threads="
                + threadFactory.getThreadCount()
                + ", shutdown="
                + shutdown.get()
                + "]";
    }

    /** Builder for {@link AioWorkerPool} instances. */
    public static final class Builder {

        private String namePrefix = "rados-aio";
        private int threads = 4;

        private Builder() {}

        /**
         * Sets the thread name prefix.
         *
         * @param namePrefix the prefix
         * @return this builder
         */
        public Builder namePrefix(String namePrefix) {
            this.namePrefix = Objects.requireNonNull(namePrefix);
            return this;
        }

        /**
         * Sets the number of worker threads.
         *
         * @param threads the thread count
         * @return this builder
         * @throws IllegalArgumentException if threads is not positive
         */
        public Builder threads(int threads) {
            if (threads <= 0) {
                throw new IllegalArgumentException("threads must be positive: " + threads);
            }
            this.threads = threads;
            return this;
        }

        /**
         * Builds the pool.
         *
         * @return a new pool
         */
        public AioWorkerPool build() {
            return new AioWorkerPool(new AioThreadFactory(namePrefix), threads);
        }
    }
}
