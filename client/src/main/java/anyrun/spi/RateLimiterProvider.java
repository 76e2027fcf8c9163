package anyrun.spi;

import anyrun.core.port.out.RateLimiter;

/**
 * Provider of a rate limiter implementation.
 *
 * <p>The loader picks the provider named by the configured backend and falls back to the
 * in-memory provider when the chosen one is not available.
 *
 * <p>Standard priorities:
 * <ul>
 *   <li>0 - In-memory (fallback)</li>
 *   <li>10 - Redis</li>
 * </ul>
 *
 * @see anyrun.core.port.out.RateLimiter
 */
public interface RateLimiterProvider {

    /**
     * Return the priority of this provider. Higher values are preferred.
     *
     * @return the provider priority
     */
    int priority();

    /**
     * Return the name of this provider for logging and configuration.
     *
     * @return the provider name (e.g., "memory", "redis")
     */
    String name();

    /**
     * Check if this provider can be used with the current configuration.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create a rate limiter instance. The returned instance must be thread-safe.
     *
     * @return the rate limiter instance
     */
    RateLimiter createRateLimiter();
}
