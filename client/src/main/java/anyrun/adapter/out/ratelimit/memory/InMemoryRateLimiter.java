package anyrun.adapter.out.ratelimit.memory;

import io.smallrye.mutiny.Uni;

import anyrun.core.model.ratelimit.RateLimitDecision;
import anyrun.core.model.ratelimit.RateLimitKey;
import anyrun.core.model.ratelimit.TokenBucketLimit;
import anyrun.core.port.out.RateLimiter;
import anyrun.core.util.Clock;

/**
 * In-memory rate limiter implementation.
 *
 * <p>Buckets live in a {@link TokenBucketRegistry}, by default the process-wide one. State is
 * not shared across processes and is lost on restart; use the Redis limiter when several
 * processes share an API key.
 */
public final class InMemoryRateLimiter implements RateLimiter {

    static final String KEY_PREFIX = "anyrun:ratelimit:";

    private final TokenBucketRegistry registry;
    private final Clock clock;
    private final boolean enabled;

    /**
     * Creates a new in-memory rate limiter.
     *
     * @param registry the bucket registry
     * @param clock    the monotonic time source
     * @param enabled  whether rate limiting is enabled
     */
    public InMemoryRateLimiter(TokenBucketRegistry registry, Clock clock, boolean enabled) {
        this.registry = registry;
        this.clock = clock;
        this.enabled = enabled;
    }

    @Override
    public Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, TokenBucketLimit limit) {
        if (!enabled || limit.isUnlimited()) {
            return Uni.createFrom().item(RateLimitDecision.allow());
        }
        return Uni.createFrom().item(() -> {
            final var now = clock.nanoTime();
            return registry.bucket(key.toStorageKey(KEY_PREFIX), limit, now).tryConsume(limit, now);
        });
    }

    @Override
    public Uni<RateLimitDecision> getStatus(RateLimitKey key, TokenBucketLimit limit) {
        if (!enabled || limit.isUnlimited()) {
            return Uni.createFrom().item(RateLimitDecision.allow());
        }
        return Uni.createFrom().item(() -> {
            final var now = clock.nanoTime();
            return registry.bucket(key.toStorageKey(KEY_PREFIX), limit, now).status(limit, now);
        });
    }

    @Override
    public Uni<Void> reset(RateLimitKey key, TokenBucketLimit limit) {
        return Uni.createFrom().voidItem().invoke(() -> {
            final var now = clock.nanoTime();
            registry.bucket(key.toStorageKey(KEY_PREFIX), limit, now).reset(limit, now);
        });
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

}
