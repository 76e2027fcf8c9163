package anyrun.adapter.out.ratelimit.memory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import anyrun.core.model.ratelimit.TokenBucketLimit;

/**
 * Buckets keyed by name.
 *
 * <p>{@link #shared()} is the process-wide registry used by default, so that every client in
 * the process draws from the same buckets. Tests create private registries.
 */
public final class TokenBucketRegistry {

    private static final TokenBucketRegistry SHARED = new TokenBucketRegistry();

    private final ConcurrentMap<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    /**
     * Return the process-wide registry.
     *
     * @return the shared registry
     */
    public static TokenBucketRegistry shared() {
        return SHARED;
    }

    /**
     * Return the bucket for a key, creating a full one on first use.
     *
     * @param key      the storage key
     * @param limit    limit used to size a new bucket
     * @param nowNanos the current monotonic time
     * @return the bucket
     */
    public TokenBucket bucket(String key, TokenBucketLimit limit, long nowNanos) {
        return buckets.computeIfAbsent(key, k -> new TokenBucket(limit, nowNanos));
    }

    /**
     * Returns the current number of tracked buckets.
     *
     * @return the number of buckets
     */
    public int size() {
        return buckets.size();
    }
}
