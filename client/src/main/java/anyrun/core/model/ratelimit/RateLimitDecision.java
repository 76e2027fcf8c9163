package anyrun.core.model.ratelimit;

import java.time.Duration;

/**
 * Result of a token bucket check.
 *
 * @param allowed   whether a token was consumed
 * @param remaining tokens left after the decision ({@code Double.POSITIVE_INFINITY} when unlimited)
 * @param retryAfter time until the next token becomes available (zero when allowed)
 */
public record RateLimitDecision(boolean allowed, double remaining, Duration retryAfter) {

    private static final RateLimitDecision UNLIMITED =
            new RateLimitDecision(true, Double.POSITIVE_INFINITY, Duration.ZERO);

    /**
     * Create an "allowed" decision for an unlimited or disabled bucket.
     *
     * @return an allowed decision
     */
    public static RateLimitDecision allow() {
        return UNLIMITED;
    }

    /**
     * Create an "allowed" decision.
     *
     * @param remaining tokens left in the bucket
     * @return an allowed decision
     */
    public static RateLimitDecision allow(double remaining) {
        return new RateLimitDecision(true, remaining, Duration.ZERO);
    }

    /**
     * Create a "rejected" decision.
     *
     * @param remaining  the fractional tokens currently in the bucket
     * @param retryAfter time until one whole token is available
     * @return a rejected decision
     */
    public static RateLimitDecision rejected(double remaining, Duration retryAfter) {
        return new RateLimitDecision(false, remaining, retryAfter);
    }

    /**
     * Describe a bucket state without consuming from it.
     *
     * @param state the refilled state
     * @param limit the limit the state was refilled under
     * @return allowed when a whole token is available, otherwise rejected with the wait for one
     */
    public static RateLimitDecision of(BucketState state, TokenBucketLimit limit) {
        if (state.hasToken()) {
            return allow(state.tokens());
        }
        return rejected(state.tokens(), limit.timeUntilToken(state.tokens()));
    }
}
