package anyrun.adapter.out.ratelimit.redis;

import anyrun.adapter.out.redis.RedisClients;
import anyrun.adapter.out.redis.RedisTimeoutHelper;
import anyrun.core.port.out.RateLimiter;
import anyrun.spi.RateLimiterProvider;

/**
 * Redis-based rate limiter provider.
 *
 * <p>Available when a Redis URL is configured; otherwise the loader falls back to in-memory
 * rate limiting.
 */
public final class RedisRateLimiterProvider implements RateLimiterProvider {

    private static final int PRIORITY = 10;
    private static final String NAME = "redis";

    private final RedisClients redisClients;
    private final RedisTimeoutHelper timeoutHelper;
    private final boolean enabled;

    /**
     * Creates a new Redis provider with configuration.
     *
     * @param redisClients  the shared Redis connection, null when Redis is not configured
     * @param timeoutHelper timeout and degradation policy
     * @param enabled       whether rate limiting is enabled
     */
    public RedisRateLimiterProvider(RedisClients redisClients, RedisTimeoutHelper timeoutHelper, boolean enabled) {
        this.redisClients = redisClients;
        this.timeoutHelper = timeoutHelper;
        this.enabled = enabled;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return redisClients != null;
    }

    @Override
    public RateLimiter createRateLimiter() {
        if (redisClients == null) {
            throw new IllegalStateException("Redis is not configured");
        }
        return new RedisRateLimiter(redisClients.api(), timeoutHelper, System::currentTimeMillis, enabled);
    }
}
