package anyrun.core.port.out;

import io.smallrye.mutiny.Uni;

import anyrun.core.model.ratelimit.RateLimitDecision;
import anyrun.core.model.ratelimit.RateLimitKey;
import anyrun.core.model.ratelimit.TokenBucketLimit;

/**
 * Port interface for token bucket storage.
 *
 * <p>Implementations keep one bucket per {@link RateLimitKey}, in process memory or in a shared
 * store. Waiting for a token is not the limiter's concern; callers that need to wait re-check
 * after the decision's {@code retryAfter}.
 */
public interface RateLimiter {

    /**
     * Refill the bucket, then consume one token if a whole token is available.
     *
     * <p>The refill and the consumption happen atomically with respect to other callers of the
     * same key. A limit whose rate or burst changed since the last call applies from this
     * refill on, without resetting the accumulated tokens.
     *
     * @param key   the bucket
     * @param limit rate and capacity to apply
     * @return the decision
     */
    Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, TokenBucketLimit limit);

    /**
     * Read the bucket without consuming a token.
     *
     * <p>The decision reports whether a call made now would be allowed, the tokens the bucket
     * holds after refilling, and the wait until the next whole token.
     *
     * @param key   the bucket
     * @param limit rate and capacity to apply
     * @return the current status
     */
    Uni<RateLimitDecision> getStatus(RateLimitKey key, TokenBucketLimit limit);

    /**
     * Refill the bucket to its burst capacity.
     *
     * @param key   the bucket
     * @param limit rate and capacity to apply
     * @return completion signal
     */
    Uni<Void> reset(RateLimitKey key, TokenBucketLimit limit);

    /**
     * Check if rate limiting is enabled.
     *
     * @return true if rate limiting is active
     */
    boolean isEnabled();
}
