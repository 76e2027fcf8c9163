package anyrun.core.util;

/**
 * Monotonic time source used for token refill and cache expiry.
 *
 * <p>Production code uses {@link #system()}; tests substitute a manually advanced clock so that
 * refill and expiry can be asserted without sleeping.
 */
@FunctionalInterface
public interface Clock {

    /**
     * Return the current monotonic time in nanoseconds.
     *
     * <p>Only differences between two readings are meaningful.
     *
     * @return the current reading
     */
    long nanoTime();

    /**
     * Return the clock backed by {@link System#nanoTime()}.
     *
     * @return the system clock
     */
    static Clock system() {
        return System::nanoTime;
    }
}
