package anyrun.core.model.ratelimit;

/**
 * Logical name of a token bucket.
 *
 * <p>Operations of the same class share a bucket, so that for example every status poll draws
 * from {@link #STATUS} regardless of which task it targets. Custom keys may be created with
 * {@link #of(String)}.
 *
 * @param bucket the bucket name
 */
public record RateLimitKey(String bucket) {

    public static final RateLimitKey ANALYZE = new RateLimitKey("analyze");
    public static final RateLimitKey LIST = new RateLimitKey("list");
    public static final RateLimitKey STATUS = new RateLimitKey("status");
    public static final RateLimitKey DOWNLOAD = new RateLimitKey("download");
    public static final RateLimitKey ENVIRONMENT = new RateLimitKey("environment");
    public static final RateLimitKey USER = new RateLimitKey("user");

    public RateLimitKey {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("bucket is required");
        }
    }

    /**
     * Create a key for a custom bucket.
     *
     * @param bucket the bucket name
     * @return the key
     */
    public static RateLimitKey of(String bucket) {
        return new RateLimitKey(bucket);
    }

    /**
     * Return the storage key for this bucket under the given prefix.
     *
     * @param prefix namespace prefix, for example {@code anyrun:ratelimit:}
     * @return the prefixed key
     */
    public String toStorageKey(String prefix) {
        return prefix + bucket;
    }
}
