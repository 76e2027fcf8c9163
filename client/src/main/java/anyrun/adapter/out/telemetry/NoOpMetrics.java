package anyrun.adapter.out.telemetry;

import anyrun.core.port.out.Metrics;

/**
 * Metrics sink used when no registry is supplied or metrics are disabled.
 */
public final class NoOpMetrics implements Metrics {

    private static final NoOpMetrics INSTANCE = new NoOpMetrics();

    private NoOpMetrics() {}

    public static NoOpMetrics getInstance() {
        return INSTANCE;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public void recordRequest(String operation, String outcome, long latencyMs) {}

    @Override
    public void recordCacheLookup(String operation, boolean hit) {}

    @Override
    public void recordRetry(String operation, String errorKind) {}

    @Override
    public void recordRateLimitWait(String bucket) {}

    @Override
    public void recordBackendFailure(String backend, String operation) {}
}
