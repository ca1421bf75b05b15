package express.mvp.myra.rados.simulated;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory for the simulated backend's asynchronous workers.
 *
 * <p>Threads are named "{prefix}-{counter}" and are daemon threads by default, so an embedding
 * host that never closes its backend still exits.
 *
 * @see AioWorkerPool
 */
public final class AioThreadFactory implements ThreadFactory {

    private static final Logger LOGGER = Logger.getLogger(AioThreadFactory.class.getName());

    private final AtomicLong threadCount = new AtomicLong(0);

    private final String namePrefix;

    private final boolean daemon;

    /**
     * Creates a factory for daemon threads.
     *
     * @param namePrefix the prefix for thread names
     */
    public AioThreadFactory(String namePrefix) {
        this(namePrefix, true);
    }

    /**
     * Creates a factory.
     *
     * @param namePrefix the prefix for thread names
     * @param daemon whether created threads are daemon threads
     */
    public AioThreadFactory(String namePrefix, boolean daemon) {
        this.namePrefix = namePrefix;
        this.daemon = daemon;
    }

    /**
     * Creates an unstarted worker thread. Uncaught failures are logged instead of printed.
     *
     * @param runnable the task to execute
     * @return a new thread
     */
    @Override
    public Thread newThread(Runnable runnable) {
        long count = threadCount.incrementAndGet();
        Thread thread = new Thread(runnable, namePrefix + "-" + count);
        thread.setDaemon(daemon);
        thread.setUncaughtExceptionHandler(
                (t, e) -> LOGGER.log(Level.WARNING, "aio worker " + t.getName() + " died", e));
        return thread;
    }

    /**
     * Returns the number of threads created.
     *
     * @return the count
     */
    public long getThreadCount() {
        return threadCount.get();
    }

    /**
     * Returns whether this factory creates daemon threads.
     *
     * @return true for daemon threads
     */
    public boolean isDaemon() {
        return daemon;
    }

    @Override
    public String toString() {
        return "AioThreadFactory[prefix=" + namePrefix + ", created=" + threadCount.get() + "]";
    }
}
