package anyrun.config;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import anyrun.core.model.cache.CacheBackendType;
import anyrun.core.model.ratelimit.RateLimitBackendType;
import anyrun.core.model.retry.RetryStrategy;

/**
 * Configuration mapping for the sandbox client.
 *
 * <p>Configuration prefix: {@code anyrun}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code ANYRUN_API_KEY} - API key sent in the {@code Authorization} header</li>
 *   <li>{@code ANYRUN_BASE_URL} - Service base URL</li>
 *   <li>{@code ANYRUN_CACHE_BACKEND} - MEMORY or REDIS</li>
 *   <li>{@code ANYRUN_RATE_LIMIT_RATE} - Default tokens per second</li>
 *   <li>{@code ANYRUN_RETRY_MAX_ATTEMPTS} - Attempts per call including the first</li>
 * </ul>
 */
@ConfigMapping(prefix = "anyrun")
public interface SandboxConfig {

    /**
     * API key. Never logged.
     */
    String apiKey();

    @WithDefault("https://api.any.run")
    String baseUrl();

    /**
     * Version segment prepended to every path.
     *
     * @return the version (default: v1)
     */
    @WithDefault("v1")
    String apiVersion();

    /**
     * Timeout of a single HTTP attempt.
     *
     * @return the timeout (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration timeout();

    /**
     * Verify the server certificate and host name.
     *
     * @return true to verify (default: true)
     */
    @WithDefault("true")
    boolean verifyTls();

    /**
     * Proxy URLs keyed by scheme ({@code http} or {@code https}).
     */
    Map<String, String> proxies();

    /**
     * Extra headers sent with every request.
     */
    Map<String, String> headers();

    @WithDefault("anyrun-java-client")
    String userAgent();

    /**
     * How long close waits for in-flight calls.
     *
     * @return the grace period (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration shutdownGracePeriod();

    CacheConfig cache();

    RateLimitConfig rateLimit();

    RetryConfig retry();

    RedisConfig redis();

    MetricsConfig metrics();

    /**
     * Response cache configuration.
     */
    interface CacheConfig {

        @WithDefault("true")
        boolean enabled();

        /**
         * Cache backend.
         *
         * @return the backend (default: MEMORY)
         */
        @WithDefault("MEMORY")
        CacheBackendType backend();

        /**
         * TTL of cached responses.
         *
         * @return the TTL (default: 5 minutes)
         */
        @WithDefault("PT5M")
        Duration ttl();

        /**
         * Prefix of every cache key, allowing several clients to share a Redis instance.
         *
         * @return the prefix (default: "anyrun:")
         */
        @WithDefault("anyrun:")
        String prefix();

        /**
         * Maximum number of entries of the in-memory backend.
         *
         * @return maximum entries (default: 10000)
         */
        @WithDefault("10000")
        long maxEntries();
    }

    /**
     * Token bucket configuration.
     */
    interface RateLimitConfig {

        @WithDefault("true")
        boolean enabled();

        @WithDefault("MEMORY")
        RateLimitBackendType backend();

        /**
         * Default tokens per second for every bucket.
         *
         * @return the rate (default: 10)
         */
        @WithDefault("10")
        double rate();

        /**
         * Window over which a full burst may be spent; burst is {@code rate * window}.
         *
         * @return the window (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration window();

        /**
         * Per-bucket overrides keyed by bucket name (analyze, list, status, ...).
         */
        Map<String, BucketConfig> buckets();

        /**
         * Override of a single bucket. Unset values fall back to the defaults.
         */
        interface BucketConfig {

            Optional<Double> rate();

            Optional<Double> burst();
        }
    }

    /**
     * Retry configuration.
     */
    interface RetryConfig {

        @WithDefault("true")
        boolean enabled();

        @WithDefault("EXPONENTIAL")
        RetryStrategy strategy();

        /**
         * Attempts per call including the first.
         *
         * @return maximum attempts (default: 3)
         */
        @WithDefault("3")
        int maxAttempts();

        @WithDefault("PT1S")
        Duration initialDelay();

        @WithDefault("PT60S")
        Duration maxDelay();

        @WithDefault("2.0")
        double backoffFactor();

        @WithDefault("true")
        boolean jitter();
    }

    /**
     * Redis connection used by the Redis cache and rate limit backends.
     */
    interface RedisConfig {

        @WithDefault("redis://localhost:6379")
        String url();

        /**
         * Timeout of a single Redis command before the backend degrades.
         *
         * @return the timeout (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration timeout();
    }

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {

        @WithDefault("true")
        boolean enabled();
    }
}
