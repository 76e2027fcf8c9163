package anyrun.spi;

import anyrun.core.port.out.CacheBackend;

/**
 * Provider of a response cache backend.
 *
 * <p>Standard priorities:
 * <ul>
 *   <li>0 - In-memory Caffeine cache (fallback)</li>
 *   <li>10 - Redis</li>
 * </ul>
 *
 * @see anyrun.core.port.out.CacheBackend
 */
public interface CacheBackendProvider {

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
     * Create a cache backend instance. The returned instance must be thread-safe.
     *
     * @return the backend
     */
    CacheBackend createBackend();
}
