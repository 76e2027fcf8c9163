package anyrun.adapter.out.ratelimit;

import java.util.Comparator;
import java.util.List;

import org.jboss.logging.Logger;

import anyrun.adapter.out.ratelimit.memory.InMemoryRateLimiterProvider;
import anyrun.adapter.out.ratelimit.memory.TokenBucketRegistry;
import anyrun.adapter.out.ratelimit.redis.RedisRateLimiterProvider;
import anyrun.adapter.out.redis.RedisClients;
import anyrun.adapter.out.redis.RedisTimeoutHelper;
import anyrun.config.SandboxConfig;
import anyrun.core.model.ratelimit.RateLimitBackendType;
import anyrun.core.port.out.Metrics;
import anyrun.core.port.out.RateLimiter;
import anyrun.core.util.Clock;
import anyrun.spi.RateLimiterProvider;

/**
 * Selects the rate limiter implementation.
 *
 * <p>When rate limiting is disabled, returns a no-op implementation. Otherwise the provider
 * named by {@code anyrun.rate-limit.backend} is used if available, falling back to the
 * in-memory provider.
 */
public final class RateLimiterProviderLoader {

    private static final Logger LOG = Logger.getLogger(RateLimiterProviderLoader.class);

    private final SandboxConfig config;
    private final TokenBucketRegistry registry;
    private final Clock clock;
    private final RedisClients redisClients;
    private final Metrics metrics;

    /**
     * @param config       the client configuration
     * @param registry     bucket registry of the in-memory backend
     * @param clock        monotonic time source of the in-memory backend
     * @param redisClients the Redis connection, null when Redis is not in use
     * @param metrics      the metrics sink
     */
    public RateLimiterProviderLoader(
            SandboxConfig config,
            TokenBucketRegistry registry,
            Clock clock,
            RedisClients redisClients,
            Metrics metrics) {
        this.config = config;
        this.registry = registry;
        this.clock = clock;
        this.redisClients = redisClients;
        this.metrics = metrics;
    }

    /**
     * Create the configured rate limiter.
     *
     * @return the rate limiter
     */
    public RateLimiter load() {
        final var rateLimit = config.rateLimit();
        if (!rateLimit.enabled()) {
            LOG.info("Rate limiting is disabled, using NoOpRateLimiter");
            return NoOpRateLimiter.getInstance();
        }

        final var provider = select(rateLimit.backend());
        LOG.infov(
                "Rate limiting enabled with provider={0}, defaultRate={1}/s, window={2}",
                provider.name(), rateLimit.rate(), rateLimit.window());
        return provider.createRateLimiter();
    }

    private RateLimiterProvider select(RateLimitBackendType backend) {
        final var memory = new InMemoryRateLimiterProvider(registry, clock, true);
        if (backend != RateLimitBackendType.REDIS) {
            return memory;
        }

        final var redis = new RedisRateLimiterProvider(
                redisClients, new RedisTimeoutHelper(config.redis().timeout(), metrics, "ratelimit"), true);
        return List.<RateLimiterProvider>of(redis, memory).stream()
                .filter(RateLimiterProvider::isAvailable)
                .max(Comparator.comparingInt(RateLimiterProvider::priority))
                .orElse(memory);
    }
}
