package anyrun.core.model.ratelimit;

/**
 * Storage backend for token buckets.
 */
public enum RateLimitBackendType {
    /** Process-wide in-memory registry. */
    MEMORY,
    /** Buckets kept in Redis and updated by a Lua script. */
    REDIS
}
