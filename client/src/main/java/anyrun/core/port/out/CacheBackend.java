package anyrun.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port interface for response cache storage.
 *
 * <p>Keys arrive fully prefixed. Each operation is atomic for its key; there are no
 * transactions across keys. Entries read after their expiry behave as absent.
 */
public interface CacheBackend {

    /**
     * Look up a live entry.
     *
     * @param key the cache key
     * @return the cached value, or empty if absent or expired
     */
    Uni<Optional<String>> get(String key);

    /**
     * Store a value, replacing any existing entry.
     *
     * @param key   the cache key
     * @param value the value
     * @param ttl   time to live; empty means the entry never expires
     * @return completion signal
     */
    Uni<Void> set(String key, String value, Optional<Duration> ttl);

    /**
     * Remove an entry. Removing an absent key is not an error.
     *
     * @param key the cache key
     * @return completion signal
     */
    Uni<Void> delete(String key);

    /**
     * Check whether a live entry exists.
     *
     * @param key the cache key
     * @return true if present and not expired
     */
    Uni<Boolean> exists(String key);

    /**
     * Release resources held by the backend.
     */
    default void close() {}
}
