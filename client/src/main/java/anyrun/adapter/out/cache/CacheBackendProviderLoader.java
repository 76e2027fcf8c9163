package anyrun.adapter.out.cache;

import java.util.Comparator;
import java.util.List;

import org.jboss.logging.Logger;

import anyrun.adapter.out.cache.memory.CaffeineCacheBackendProvider;
import anyrun.adapter.out.cache.redis.RedisCacheBackendProvider;
import anyrun.adapter.out.redis.RedisClients;
import anyrun.adapter.out.redis.RedisTimeoutHelper;
import anyrun.config.SandboxConfig;
import anyrun.core.model.cache.CacheBackendType;
import anyrun.core.port.out.CacheBackend;
import anyrun.core.port.out.Metrics;
import anyrun.core.util.Clock;
import anyrun.spi.CacheBackendProvider;

/**
 * Selects the response cache backend.
 *
 * <p>When caching is disabled, returns a no-op backend. Otherwise the provider named by
 * {@code anyrun.cache.backend} is used if available, falling back to Caffeine.
 */
public final class CacheBackendProviderLoader {

    private static final Logger LOG = Logger.getLogger(CacheBackendProviderLoader.class);

    private final SandboxConfig config;
    private final Clock clock;
    private final RedisClients redisClients;
    private final Metrics metrics;

    public CacheBackendProviderLoader(SandboxConfig config, Clock clock, RedisClients redisClients, Metrics metrics) {
        this.config = config;
        this.clock = clock;
        this.redisClients = redisClients;
        this.metrics = metrics;
    }

    /**
     * Create the configured backend.
     *
     * @return the cache backend
     */
    public CacheBackend load() {
        final var cache = config.cache();
        if (!cache.enabled()) {
            LOG.info("Response caching is disabled, using NoOpCacheBackend");
            return NoOpCacheBackend.getInstance();
        }

        final var provider = select(cache.backend());
        LOG.infov("Response caching enabled with provider={0}, ttl={1}", provider.name(), cache.ttl());
        return provider.createBackend();
    }

    private CacheBackendProvider select(CacheBackendType backend) {
        final var memory = new CaffeineCacheBackendProvider(config.cache().maxEntries(), clock);
        if (backend != CacheBackendType.REDIS) {
            return memory;
        }

        final var redis = new RedisCacheBackendProvider(
                redisClients, new RedisTimeoutHelper(config.redis().timeout(), metrics, "cache"));
        return List.<CacheBackendProvider>of(redis, memory).stream()
                .filter(CacheBackendProvider::isAvailable)
                .max(Comparator.comparingInt(CacheBackendProvider::priority))
                .orElse(memory);
    }
}
