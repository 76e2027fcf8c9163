package anyrun.core.model.retry;

import java.time.Duration;

/**
 * Retry and backoff settings.
 *
 * @param enabled       when false every call is attempted exactly once
 * @param strategy      how the delay grows
 * @param maxAttempts   total attempts including the first, at least 1
 * @param initialDelay  delay before the second attempt
 * @param maxDelay      upper bound of the computed delay, applied before jitter
 * @param backoffFactor growth factor for {@link RetryStrategy#EXPONENTIAL}
 * @param jitter        whether the delay is multiplied by a random factor in [0.5, 1.5]
 */
public record RetryPolicy(
        boolean enabled,
        RetryStrategy strategy,
        int maxAttempts,
        Duration initialDelay,
        Duration maxDelay,
        double backoffFactor,
        boolean jitter) {

    public RetryPolicy {
        if (strategy == null) {
            strategy = RetryStrategy.EXPONENTIAL;
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be non-negative");
        }
        if (maxDelay == null || maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must be non-negative");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be at least 1");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(
                true, RetryStrategy.EXPONENTIAL, 3, Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, true);
    }

    public static RetryPolicy disabled() {
        return new RetryPolicy(false, RetryStrategy.EXPONENTIAL, 1, Duration.ZERO, Duration.ZERO, 1.0, false);
    }

    /**
     * Number of attempts a call gets under this policy.
     */
    public int effectiveMaxAttempts() {
        return enabled ? maxAttempts : 1;
    }

    /**
     * Delay after the given failed attempt, before jitter.
     *
     * @param attempt the 1-based number of the attempt that just failed
     * @return the capped delay
     */
    public Duration backoffDelay(int attempt) {
        final var initialNanos = (double) initialDelay.toNanos();
        final var raw = strategy == RetryStrategy.EXPONENTIAL
                ? initialNanos * Math.pow(backoffFactor, attempt - 1)
                : initialNanos * attempt;
        final var capped = Math.min(raw, (double) maxDelay.toNanos());
        return Duration.ofNanos((long) capped);
    }

    public RetryPolicy withJitter(boolean jitter) {
        return new RetryPolicy(enabled, strategy, maxAttempts, initialDelay, maxDelay, backoffFactor, jitter);
    }
}
