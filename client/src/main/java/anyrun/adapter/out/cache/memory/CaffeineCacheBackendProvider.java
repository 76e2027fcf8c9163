package anyrun.adapter.out.cache.memory;

import anyrun.core.port.out.CacheBackend;
import anyrun.core.util.Clock;
import anyrun.spi.CacheBackendProvider;

/**
 * In-memory cache provider. Always available.
 */
public final class CaffeineCacheBackendProvider implements CacheBackendProvider {

    private static final int PRIORITY = 0;
    private static final String NAME = "memory";

    private final long maxEntries;
    private final Clock clock;

    public CaffeineCacheBackendProvider(long maxEntries, Clock clock) {
        this.maxEntries = maxEntries;
        this.clock = clock;
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
        return true;
    }

    @Override
    public CacheBackend createBackend() {
        return new CaffeineCacheBackend(maxEntries, clock);
    }
}
