package anyrun.adapter.out.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import anyrun.core.port.out.Metrics;

/**
 * Applies timeouts and failure handling to Redis operations with graceful degradation.
 *
 * <ul>
 *   <li>{@link #withTimeoutGraceful} - returns empty on timeout or any failure. Used for cache
 *       reads, where a failure is a miss.</li>
 *   <li>{@link #withTimeoutFallback} - returns a fallback on timeout or any failure. Used for
 *       rate limiting, which fails open.</li>
 *   <li>{@link #withTimeoutSilent} - logs and ignores timeout or any failure. Used for cache
 *       writes and deletes.</li>
 * </ul>
 *
 * <p>Every degraded call is recorded as a backend failure.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final Metrics metrics;
    private final String backendName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout     the timeout for each Redis operation
     * @param metrics     the metrics sink
     * @param backendName {@code cache} or {@code ratelimit}, used for logs and metrics
     */
    public RedisTimeoutHelper(Duration timeout, Metrics metrics, String backendName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.backendName = backendName;
    }

    /**
     * Apply timeout with graceful degradation to an empty Optional.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging and metrics
     * @param <T>           the result type
     * @return a Uni that returns empty Optional on timeout or failure
     */
    public <T> Uni<Optional<T>> withTimeoutGraceful(Uni<T> operation, String operationName) {
        return operation
                .map(Optional::ofNullable)
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv("Redis {0} timeout (graceful): {1} after {2}", backendName, operationName, timeout);
                    recordFailure(operationName);
                    return Optional.empty();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Redis {0} failure (graceful): {1}: {2}", backendName, operationName, error.getMessage());
                    recordFailure(operationName);
                    return Optional.empty();
                });
    }

    /**
     * Apply timeout with graceful degradation to a custom fallback.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging and metrics
     * @param fallback      supplier for the fallback value
     * @param <T>           the result type
     * @return a Uni that returns the fallback on timeout or failure
     */
    public <T> Uni<T> withTimeoutFallback(Uni<T> operation, String operationName, Supplier<T> fallback) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv("Redis {0} timeout (fallback): {1} after {2}", backendName, operationName, timeout);
                    recordFailure(operationName);
                    return fallback.get();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Redis {0} failure (fallback): {1}: {2}", backendName, operationName, error.getMessage());
                    recordFailure(operationName);
                    return fallback.get();
                });
    }

    /**
     * Apply timeout with silent failure.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging and metrics
     * @return a Uni that completes with void on timeout or failure
     */
    public Uni<Void> withTimeoutSilent(Uni<Void> operation, String operationName) {
        return withTimeoutFallback(operation, operationName, () -> null);
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordBackendFailure(backendName, operationName);
        }
    }
}
