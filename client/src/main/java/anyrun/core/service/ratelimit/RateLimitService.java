package anyrun.core.service.ratelimit;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import anyrun.core.model.error.RateLimitExceededException;
import anyrun.core.model.ratelimit.RateLimitDecision;
import anyrun.core.model.ratelimit.RateLimitKey;
import anyrun.core.port.out.Metrics;
import anyrun.core.port.out.RateLimiter;

/**
 * Gates calls on token buckets.
 *
 * <p>{@link #acquire} waits on a timer, never on a parked thread, and consumes nothing until a
 * token is actually taken, so cancelling a waiting acquisition leaves the bucket untouched. A
 * failing limiter backend lets the call through.
 */
public class RateLimitService {

    private static final Logger LOG = Logger.getLogger(RateLimitService.class);

    private static final Duration MIN_WAIT = Duration.ofMillis(1);

    private final RateLimiter rateLimiter;
    private final RateLimitResolver resolver;
    private final Metrics metrics;

    public RateLimitService(RateLimiter rateLimiter, RateLimitResolver resolver, Metrics metrics) {
        this.rateLimiter = rateLimiter;
        this.resolver = resolver;
        this.metrics = metrics;
    }

    public boolean isEnabled() {
        return rateLimiter.isEnabled();
    }

    /**
     * Take a token if one is available, without waiting.
     *
     * @param key the bucket
     * @return true if a token was taken
     */
    public Uni<Boolean> check(RateLimitKey key) {
        return decide(key).map(RateLimitDecision::allowed);
    }

    /**
     * Wait until a token is available, then take it.
     *
     * @param key the bucket
     * @return completion once the token is taken
     */
    public Uni<Void> acquire(RateLimitKey key) {
        return decide(key).chain(decision -> {
            if (decision.allowed()) {
                return Uni.createFrom().voidItem();
            }
            final var wait = max(decision.retryAfter(), MIN_WAIT);
            LOG.debugv("Rate limit bucket {0} empty, waiting {1}", key.bucket(), wait);
            metrics.recordRateLimitWait(key.bucket());
            return Uni.createFrom()
                    .voidItem()
                    .onItem()
                    .delayIt()
                    .by(wait)
                    .chain(() -> acquire(key));
        });
    }

    /**
     * Take a token or fail immediately.
     *
     * @param key the bucket
     * @return completion, or a failure with {@link RateLimitExceededException} carrying the wait
     */
    public Uni<Void> tryAcquire(RateLimitKey key) {
        return decide(key).chain(decision -> decision.allowed()
                ? Uni.createFrom().voidItem()
                : Uni.createFrom().failure(new RateLimitExceededException(key.bucket(), decision.retryAfter())));
    }

    /**
     * Read a bucket without taking a token.
     *
     * @param key the bucket
     * @return whether a call made now would be allowed, the tokens held and the wait for the next
     *     one; an open bucket when the limiter backend fails
     */
    public Uni<RateLimitDecision> status(RateLimitKey key) {
        if (!rateLimiter.isEnabled()) {
            return Uni.createFrom().item(RateLimitDecision.allow());
        }
        return Uni.createFrom()
                .deferred(() -> rateLimiter.getStatus(key, resolver.resolveLimit(key)))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(error, "Rate limit status failed for bucket {0}", key.bucket());
                    metrics.recordBackendFailure("ratelimit", "getStatus");
                    return RateLimitDecision.allow();
                });
    }

    /**
     * Refill a bucket to its capacity.
     *
     * @param key the bucket
     * @return completion signal
     */
    public Uni<Void> reset(RateLimitKey key) {
        return rateLimiter.reset(key, resolver.resolveLimit(key));
    }

    public RateLimitResolver resolver() {
        return resolver;
    }

    private Uni<RateLimitDecision> decide(RateLimitKey key) {
        if (!rateLimiter.isEnabled()) {
            return Uni.createFrom().item(RateLimitDecision.allow());
        }
        return Uni.createFrom()
                .deferred(() -> rateLimiter.checkAndConsume(key, resolver.resolveLimit(key)))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(error, "Rate limit check failed for bucket {0}, allowing request", key.bucket());
                    metrics.recordBackendFailure("ratelimit", "checkAndConsume");
                    return RateLimitDecision.allow();
                });
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
