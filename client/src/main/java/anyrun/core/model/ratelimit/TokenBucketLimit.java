package anyrun.core.model.ratelimit;

import java.time.Duration;

/**
 * Refill rate and capacity of a token bucket.
 *
 * <p>A non-positive rate or burst means the bucket is unlimited: every request is allowed and no
 * token is consumed.
 *
 * @param rate  tokens added per second
 * @param burst maximum number of tokens the bucket can hold
 */
public record TokenBucketLimit(double rate, double burst) {

    private static final TokenBucketLimit UNLIMITED = new TokenBucketLimit(0, 0);

    /**
     * Return a limit that never rejects.
     *
     * @return the unlimited limit
     */
    public static TokenBucketLimit unlimited() {
        return UNLIMITED;
    }

    /**
     * Derive a limit from a rate and the window over which a burst may be spent.
     *
     * <p>The burst is {@code rate * window} tokens, with a floor of one token so that a positive
     * rate with a very short window still admits requests.
     *
     * @param rate   tokens per second
     * @param window burst window
     * @return the limit
     */
    public static TokenBucketLimit fromRateAndWindow(double rate, Duration window) {
        if (rate <= 0) {
            return UNLIMITED;
        }
        final var windowSeconds = window.toNanos() / 1_000_000_000.0;
        return new TokenBucketLimit(rate, Math.max(1.0, rate * windowSeconds));
    }

    /**
     * Check whether this limit disables rate limiting.
     *
     * @return true if no request is ever rejected
     */
    public boolean isUnlimited() {
        return rate <= 0 || burst <= 0;
    }

    /**
     * Time needed to accumulate a single token when {@code tokens} are available.
     *
     * @param tokens the current token count
     * @return the wait, zero when a token is already available
     */
    public Duration timeUntilToken(double tokens) {
        if (isUnlimited() || tokens >= 1.0 - BucketState.EPSILON) {
            return Duration.ZERO;
        }
        final var seconds = (1.0 - tokens) / rate;
        return Duration.ofNanos((long) Math.ceil(seconds * 1_000_000_000.0));
    }
}
