package anyrun.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import anyrun.core.port.out.Metrics;

/**
 * Records client metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe to call them without
 * checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code anyrun.requests.total} - Logical API calls by operation and outcome</li>
 *   <li>{@code anyrun.request.latency} - Call latency including retries and waits</li>
 *   <li>{@code anyrun.cache.hits} / {@code anyrun.cache.misses} - Cache lookups by operation</li>
 *   <li>{@code anyrun.retries.total} - Retries by operation and error kind</li>
 *   <li>{@code anyrun.ratelimit.waits.total} - Rate limit waits by bucket</li>
 *   <li>{@code anyrun.backend.failures.total} - Degraded cache and rate limit backend calls</li>
 * </ul>
 */
public class MicrometerMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    public MicrometerMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled && registry != null;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordRequest(String operation, String outcome, long latencyMs) {
        if (!enabled) {
            return;
        }

        Counter.builder("anyrun.requests.total")
                .description("Total number of API calls")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        Timer.builder("anyrun.request.latency")
                .description("Time to complete an API call, including retries and rate limit waits")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordCacheLookup(String operation, boolean hit) {
        if (!enabled) {
            return;
        }

        Counter.builder(hit ? "anyrun.cache.hits" : "anyrun.cache.misses")
                .description(hit ? "Responses served from the cache" : "Cache lookups that found nothing")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordRetry(String operation, String errorKind) {
        if (!enabled) {
            return;
        }

        Counter.builder("anyrun.retries.total")
                .description("Attempts retried after a transient failure")
                .tag("operation", operation)
                .tag("kind", errorKind)
                .register(registry)
                .increment();
    }

    @Override
    public void recordRateLimitWait(String bucket) {
        if (!enabled) {
            return;
        }

        Counter.builder("anyrun.ratelimit.waits.total")
                .description("Calls that waited for a rate limit token")
                .tag("bucket", bucket)
                .register(registry)
                .increment();
    }

    @Override
    public void recordBackendFailure(String backend, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("anyrun.backend.failures.total")
                .description("Cache and rate limit backend calls that failed and were degraded")
                .tag("backend", backend)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
