package anyrun.adapter.out.ratelimit.memory;

import java.util.concurrent.locks.ReentrantLock;

import anyrun.core.model.ratelimit.BucketState;
import anyrun.core.model.ratelimit.RateLimitDecision;
import anyrun.core.model.ratelimit.TokenBucketLimit;

/**
 * A single in-memory token bucket.
 *
 * <p>State is only read or replaced while holding this bucket's own lock, so callers of
 * different buckets never contend. The limit is supplied on every call and may change between
 * calls.
 */
public final class TokenBucket {

    private final ReentrantLock lock = new ReentrantLock();
    private BucketState state;

    TokenBucket(TokenBucketLimit limit, long nowNanos) {
        this.state = BucketState.full(limit, nowNanos);
    }

    /**
     * Refill, then take one token if available.
     *
     * @param limit    rate and capacity to apply
     * @param nowNanos the current monotonic time
     * @return the decision
     */
    public RateLimitDecision tryConsume(TokenBucketLimit limit, long nowNanos) {
        if (limit.isUnlimited()) {
            return RateLimitDecision.allow();
        }
        lock.lock();
        try {
            final var refilled = state.refill(limit, nowNanos);
            if (refilled.hasToken()) {
                state = refilled.consume();
                return RateLimitDecision.allow(state.tokens());
            }
            state = refilled;
            return RateLimitDecision.of(refilled, limit);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refill to the burst capacity and restart the refill clock.
     */
    public void reset(TokenBucketLimit limit, long nowNanos) {
        lock.lock();
        try {
            state = BucketState.full(limit, nowNanos);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Report the refilled state without taking a token or moving the refill clock.
     *
     * @param limit    rate and capacity to apply
     * @param nowNanos the current monotonic time
     * @return an allowed decision when a whole token is available, otherwise a rejected one with
     *     the wait until the next token
     */
    public RateLimitDecision status(TokenBucketLimit limit, long nowNanos) {
        if (limit.isUnlimited()) {
            return RateLimitDecision.allow();
        }
        lock.lock();
        try {
            return RateLimitDecision.of(state.refill(limit, nowNanos), limit);
        } finally {
            lock.unlock();
        }
    }
}
