package express.mvp.myra.rados;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Count of completions created and not yet released.
 *
 * <p>Purely observational. One shared instance is created on first use for the process; tests and
 * hosts that want isolation inject their own through {@link RadosFactory}.
 */
public final class InFlightCompletions {

    private final AtomicLong count = new AtomicLong();

    /** Creates an isolated counter. */
    public InFlightCompletions() {}

    /**
     * Returns the process-wide counter, creating it on first use.
     *
     * @return the shared counter
     */
    public static InFlightCompletions shared() {
        return Holder.SHARED;
    }

    /**
     * Returns the number of completions in flight.
     *
     * @return the count
     */
    public long count() {
        return count.get();
    }

    void increment() {
        count.incrementAndGet();
    }

    void decrement() {
        count.decrementAndGet();
    }

    @Override
    public String toString() {
        return "InFlightCompletions[" + count.get() + "]";
    }

    private static final class Holder {
        static final InFlightCompletions SHARED = new InFlightCompletions();
    }
}
