package anyrun.adapter.out.cache;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import anyrun.core.port.out.CacheBackend;

/**
 * A cache backend that stores nothing.
 *
 * <p>Used when caching is disabled.
 */
public final class NoOpCacheBackend implements CacheBackend {

    private static final NoOpCacheBackend INSTANCE = new NoOpCacheBackend();

    private NoOpCacheBackend() {}

    public static NoOpCacheBackend getInstance() {
        return INSTANCE;
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return Uni.createFrom().item(Optional.empty());
    }

    @Override
    public Uni<Void> set(String key, String value, Optional<Duration> ttl) {
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(false);
    }
}
