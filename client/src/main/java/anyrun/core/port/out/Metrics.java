package anyrun.core.port.out;

/**
 * Port interface for recording client metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record the outcome of one logical API call.
     *
     * @param operation the operation identifier
     * @param outcome   {@code success} or the lower-case error kind
     * @param latencyMs time from execute to completion, including retries and waits
     */
    void recordRequest(String operation, String outcome, long latencyMs);

    /**
     * Record a cache lookup.
     *
     * @param operation the operation identifier
     * @param hit       whether the lookup returned a value
     */
    void recordCacheLookup(String operation, boolean hit);

    /**
     * Record a retry scheduled after a transient failure.
     *
     * @param operation the operation identifier
     * @param errorKind the lower-case kind of the failure being retried
     */
    void recordRetry(String operation, String errorKind);

    /**
     * Record a rate limit wait.
     *
     * @param bucket the bucket name
     */
    void recordRateLimitWait(String bucket);

    /**
     * Record a failure of a cache or rate limit backend that was degraded.
     *
     * @param backend   {@code cache} or {@code ratelimit}
     * @param operation the backend operation that failed
     */
    void recordBackendFailure(String backend, String operation);
}
