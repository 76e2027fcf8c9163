package anyrun.adapter.out.cache.memory;

import java.time.Duration;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import io.smallrye.mutiny.Uni;

import anyrun.core.port.out.CacheBackend;
import anyrun.core.util.Clock;

/**
 * Caffeine-backed cache backend with a TTL per entry.
 *
 * <p>Each entry carries its own TTL, so entries written with and without expiry coexist.
 * Expiry is checked against the supplied clock on every read, and maintenance runs on the
 * calling thread.
 */
public class CaffeineCacheBackend implements CacheBackend {

    private static final long NEVER = Long.MAX_VALUE;

    private final Cache<String, Entry> cache;

    /**
     * Create a new Caffeine-backed cache.
     *
     * @param maxSize the maximum number of entries
     * @param clock   the monotonic time source used for expiry
     */
    public CaffeineCacheBackend(long maxSize, Clock clock) {
        this.cache = Caffeine.newBuilder()
                .expireAfter(new EntryExpiry())
                .maximumSize(maxSize)
                .ticker(clock::nanoTime)
                .executor(Runnable::run)
                .build();
    }

    private record Entry(String value, long ttlNanos) {}

    /**
     * Expiry policy that honors the TTL stored in each entry.
     */
    private static final class EntryExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return Uni.createFrom().item(() -> Optional.ofNullable(cache.getIfPresent(key)).map(Entry::value));
    }

    @Override
    public Uni<Void> set(String key, String value, Optional<Duration> ttl) {
        return Uni.createFrom().voidItem().invoke(() -> cache.put(key, new Entry(value, toNanos(ttl))));
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().voidItem().invoke(() -> cache.invalidate(key));
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> cache.getIfPresent(key) != null);
    }

    @Override
    public void close() {
        cache.invalidateAll();
    }

    private static long toNanos(Optional<Duration> ttl) {
        return ttl.map(d -> d.isNegative() ? 0L : saturatedNanos(d)).orElse(NEVER);
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return NEVER;
        }
    }
}
