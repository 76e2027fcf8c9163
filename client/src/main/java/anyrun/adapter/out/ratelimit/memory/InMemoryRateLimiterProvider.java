package anyrun.adapter.out.ratelimit.memory;

import anyrun.core.port.out.RateLimiter;
import anyrun.core.util.Clock;
import anyrun.spi.RateLimiterProvider;

/**
 * In-memory rate limiter provider.
 *
 * <p>This provider is always available and is the fallback when Redis is not configured.
 */
public final class InMemoryRateLimiterProvider implements RateLimiterProvider {

    private static final int PRIORITY = 0;
    private static final String NAME = "memory";

    private final TokenBucketRegistry registry;
    private final Clock clock;
    private final boolean enabled;

    /**
     * Create a new in-memory provider with configuration.
     *
     * @param registry the bucket registry
     * @param clock    the monotonic time source
     * @param enabled  whether rate limiting is enabled
     */
    public InMemoryRateLimiterProvider(TokenBucketRegistry registry, Clock clock, boolean enabled) {
        this.registry = registry;
        this.clock = clock;
        this.enabled = enabled;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public RateLimiter createRateLimiter() {
        return new InMemoryRateLimiter(registry, clock, enabled);
    }
}
