package anyrun.core.model.ratelimit;

/**
 * Token bucket state.
 *
 * <p>Tokens are fractional so that a bucket refilled at a slow rate accumulates partial credit
 * between requests. Refill is lazy: it is applied when the state is next read.
 *
 * @param tokens          the current number of tokens, between zero and the burst capacity
 * @param lastRefillNanos the monotonic timestamp of the last refill
 */
public record BucketState(double tokens, long lastRefillNanos) {

    /**
     * Shortfall below one token still counted as a whole token.
     *
     * <p>A wait computed to land on the one-token boundary can refill to a hair under it.
     */
    public static final double EPSILON = 1e-9;

    public BucketState {
        if (tokens < 0) {
            throw new IllegalArgumentException("tokens must be non-negative");
        }
    }

    /**
     * Creates a full bucket.
     *
     * @param limit     the bucket limit
     * @param nowNanos  the current monotonic time
     * @return the initial state
     */
    public static BucketState full(TokenBucketLimit limit, long nowNanos) {
        return new BucketState(limit.burst(), nowNanos);
    }

    /**
     * Returns the state after adding the tokens accrued since the last refill.
     *
     * <p>The result is clamped to the limit's burst, so a burst lowered on a live bucket takes
     * effect here.
     *
     * @param limit    the bucket limit
     * @param nowNanos the current monotonic time
     * @return the refilled state
     */
    public BucketState refill(TokenBucketLimit limit, long nowNanos) {
        final var elapsedNanos = Math.max(0L, nowNanos - lastRefillNanos);
        final var accrued = (elapsedNanos / 1_000_000_000.0) * limit.rate();
        return new BucketState(Math.min(limit.burst(), tokens + accrued), nowNanos);
    }

    /**
     * Returns a new state after consuming one token.
     *
     * @return the new state with one fewer token
     * @throws IllegalStateException if less than one token is available
     */
    public BucketState consume() {
        if (!hasToken()) {
            throw new IllegalStateException("No tokens available to consume");
        }
        return new BucketState(Math.max(0.0, tokens - 1.0), lastRefillNanos);
    }

    /**
     * Check whether a whole token is available.
     *
     * @return true if {@link #consume()} would succeed
     */
    public boolean hasToken() {
        return tokens >= 1.0 - EPSILON;
    }
}
