package anyrun.core.model.cache;

/**
 * Storage backend for cached responses.
 */
public enum CacheBackendType {
    /** Caffeine-backed in-memory cache. */
    MEMORY,
    /** Redis string values with native expiry. */
    REDIS
}
