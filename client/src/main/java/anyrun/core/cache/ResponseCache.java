package anyrun.core.cache;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import anyrun.core.port.out.CacheBackend;
import anyrun.core.port.out.Metrics;

/**
 * Response cache used by the request executor.
 *
 * <p>Prefixes keys, applies the default TTL and turns every backend failure into a miss or a
 * no-op, so that a broken cache never fails an API call. A disabled cache is permanently empty
 * and never touches its backend.
 */
public class ResponseCache {

    private static final Logger LOG = Logger.getLogger(ResponseCache.class);

    private final CacheBackend backend;
    private final boolean enabled;
    private final String prefix;
    private final Optional<Duration> defaultTtl;
    private final Metrics metrics;

    /**
     * Create a new response cache.
     *
     * @param backend    the storage backend
     * @param enabled    whether caching is enabled
     * @param prefix     prefix prepended to every key
     * @param defaultTtl TTL of {@link #set(String, String)}; zero means entries never expire
     * @param metrics    the metrics sink
     */
    public ResponseCache(CacheBackend backend, boolean enabled, String prefix, Duration defaultTtl, Metrics metrics) {
        this.backend = backend;
        this.enabled = enabled;
        this.prefix = prefix == null ? "" : prefix;
        this.defaultTtl = defaultTtl == null || defaultTtl.isZero() ? Optional.empty() : Optional.of(defaultTtl);
        this.metrics = metrics;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Uni<Optional<String>> get(String key) {
        if (!enabled) {
            return Uni.createFrom().item(Optional.empty());
        }
        return Uni.createFrom()
                .deferred(() -> backend.get(prefix + key))
                .onFailure()
                .recoverWithItem(error -> {
                    degraded("get", key, error);
                    return Optional.empty();
                });
    }

    /**
     * Store a value with the default TTL.
     */
    public Uni<Void> set(String key, String value) {
        return set(key, value, defaultTtl);
    }

    /**
     * Store a value.
     *
     * @param ttl time to live; empty means the entry never expires
     */
    public Uni<Void> set(String key, String value, Optional<Duration> ttl) {
        if (!enabled) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom()
                .deferred(() -> backend.set(prefix + key, value, ttl))
                .onFailure()
                .recoverWithUni(error -> {
                    degraded("set", key, error);
                    return Uni.createFrom().voidItem();
                });
    }

    public Uni<Void> delete(String key) {
        if (!enabled) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom()
                .deferred(() -> backend.delete(prefix + key))
                .onFailure()
                .recoverWithUni(error -> {
                    degraded("delete", key, error);
                    return Uni.createFrom().voidItem();
                });
    }

    public Uni<Boolean> exists(String key) {
        if (!enabled) {
            return Uni.createFrom().item(false);
        }
        return Uni.createFrom()
                .deferred(() -> backend.exists(prefix + key))
                .onFailure()
                .recoverWithItem(error -> {
                    degraded("exists", key, error);
                    return false;
                });
    }

    public void close() {
        backend.close();
    }

    private void degraded(String operation, String key, Throwable error) {
        LOG.warnv(error, "Cache {0} failed for key {1}, continuing without cache", operation, key);
        metrics.recordBackendFailure("cache", operation);
    }
}
