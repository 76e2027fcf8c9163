package anyrun.adapter.out.cache.redis;

import anyrun.adapter.out.redis.RedisClients;
import anyrun.adapter.out.redis.RedisTimeoutHelper;
import anyrun.core.port.out.CacheBackend;
import anyrun.spi.CacheBackendProvider;

/**
 * Redis cache provider, available when a Redis connection is configured.
 */
public final class RedisCacheBackendProvider implements CacheBackendProvider {

    private static final int PRIORITY = 10;
    private static final String NAME = "redis";

    private final RedisClients redisClients;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisCacheBackendProvider(RedisClients redisClients, RedisTimeoutHelper timeoutHelper) {
        this.redisClients = redisClients;
        this.timeoutHelper = timeoutHelper;
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
    public CacheBackend createBackend() {
        if (redisClients == null) {
            throw new IllegalStateException("Redis is not configured");
        }
        return new RedisCacheBackend(redisClients.api(), timeoutHelper);
    }
}
