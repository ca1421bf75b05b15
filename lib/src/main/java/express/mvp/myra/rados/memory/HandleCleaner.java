package express.mvp.myra.rados.memory;

import java.lang.ref.Cleaner;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Releases native RADOS handles when their Java owners become unreachable.
 *
 * <p>Clusters, I/O contexts and completions all own native tokens. Explicit release ({@code
 * shutdown()}, {@code close()}) is the primary path; this cleaner is the finalization path the
 * embedding host relies on when it simply drops a handle. Both paths run the same release action,
 * and the action runs at most once.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * final class IoContext {
 *     private final IoContextHandle handle;
 *     private final HandleCleaner.Registration registration;
 *
 *     IoContext(IoContextHandle handle) {
 *         this.handle = handle;
 *         // The action must not capture 'this'
 *         this.registration = HandleCleaner.register(this, "ioctx", handle::destroy);
 *     }
 *
 *     public void close() {
 *         registration.clean(); // explicit release, the cleaner will not run it again
 *     }
 * }
 * }</pre>
 *
 * <h2>Important Constraints</h2>
 *
 * <ul>
 *   <li>Release actions <b>must not</b> reference the registered owner (prevents GC)
 *   <li>Release actions run on the cleaner thread when triggered by GC
 *   <li>A release triggered by GC is logged at WARNING as a leak hint
 * </ul>
 *
 * @see java.lang.ref.Cleaner
 */
public final class HandleCleaner {

    private static final Logger LOGGER = Logger.getLogger(HandleCleaner.class.getName());

    /** Shared cleaner for all handle owners. */
    private static final Cleaner CLEANER = Cleaner.create();

    private static final AtomicLong registrations = new AtomicLong(0);

    private static final AtomicLong explicitReleases = new AtomicLong(0);

    private static final AtomicLong cleanerReleases = new AtomicLong(0);

    private HandleCleaner() {
        // Utility class
    }

    /**
     * Registers an owner whose release action runs when it becomes phantom reachable.
     *
     * @param owner the object to monitor
     * @param description short label for log messages (must not be derived lazily from owner)
     * @param releaseAction the action that releases the native resource (must not reference owner)
     * @return a registration used for explicit release
     */
    public static Registration register(Object owner, String description, Runnable releaseAction) {
        ReleaseAction action = new ReleaseAction(description, releaseAction);
        Cleaner.Cleanable cleanable = CLEANER.register(owner, action);
        registrations.incrementAndGet();
        return new Registration(cleanable, action);
    }

    /**
     * Returns the total number of registrations.
     *
     * @return registration count
     */
    public static long getRegistrationCount() {
        return registrations.get();
    }

    /**
     * Returns the number of explicit releases.
     *
     * @return explicit release count
     */
    public static long getExplicitReleaseCount() {
        return explicitReleases.get();
    }

    /**
     * Returns the number of releases triggered by garbage collection.
     *
     * @return cleaner release count
     */
    public static long getCleanerReleaseCount() {
        return cleanerReleases.get();
    }

    /**
     * Returns the number of registrations not yet released.
     *
     * @return active registration count
     */
    public static long getActiveCount() {
        return registrations.get() - explicitReleases.get() - cleanerReleases.get();
    }

    /** Resets all statistics (for testing). */
    public static void resetStatistics() {
        registrations.set(0);
        explicitReleases.set(0);
        cleanerReleases.set(0);
    }

    /** Runs the release action once and records how it was triggered. */
    private static final class ReleaseAction implements Runnable {
        private final String description;
        private final Runnable delegate;
        private final AtomicBoolean done = new AtomicBoolean(false);
        private volatile boolean explicit = false;

        ReleaseAction(String description, Runnable delegate) {
            this.description = description;
            this.delegate = delegate;
        }

        void markExplicit() {
            this.explicit = true;
        }

        @Override
        public void run() {
            if (!done.compareAndSet(false, true)) {
                return;
            }

            if (explicit) {
                explicitReleases.incrementAndGet();
            } else {
                cleanerReleases.incrementAndGet();
                LOGGER.log(
                        Level.WARNING,
                        "{0} released by cleaner; close it explicitly to release it promptly",
                        description);
            }

            try {
                delegate.run();
            } catch (RuntimeException e) {
                if (explicit) {
                    throw e;
                }
                LOGGER.log(Level.WARNING, "Cleaner release of " + description + " failed", e);
            }
        }
    }

    /** Handle for explicit release of a registered owner. */
    public static final class Registration {
        private final Cleaner.Cleanable cleanable;
        private final ReleaseAction action;

        Registration(Cleaner.Cleanable cleanable, ReleaseAction action) {
            this.cleanable = cleanable;
            this.action = action;
        }

        /** Runs the release action now, unless it already ran. */
        public void clean() {
            action.markExplicit();
            cleanable.clean();
        }

        /**
         * Checks if the release action has run.
         *
         * @return true once released, explicitly or by the cleaner
         */
        public boolean isReleased() {
            return action.done.get();
        }
    }
}
