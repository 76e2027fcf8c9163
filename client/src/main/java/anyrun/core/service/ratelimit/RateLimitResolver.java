package anyrun.core.service.ratelimit;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import anyrun.config.SandboxConfig;
import anyrun.core.model.ratelimit.RateLimitKey;
import anyrun.core.model.ratelimit.TokenBucketLimit;

/**
 * Resolves the effective token bucket limit of a bucket.
 *
 * <p>Resolution priority (highest to lowest):
 * <ol>
 * <li>Limits set at runtime with {@link #setLimit}</li>
 * <li>Configured bucket overrides ({@code anyrun.rate-limit.buckets.<name>.*})</li>
 * <li>The default rate and window</li>
 * </ol>
 *
 * <p>Limits are resolved on every acquisition, so a changed limit applies on the bucket's next
 * refill without resetting its tokens.
 */
public class RateLimitResolver {

    private final SandboxConfig.RateLimitConfig config;
    private final ConcurrentMap<RateLimitKey, TokenBucketLimit> runtimeLimits = new ConcurrentHashMap<>();

    public RateLimitResolver(SandboxConfig.RateLimitConfig config) {
        this.config = config;
    }

    /**
     * Resolves the effective limit of a bucket.
     *
     * @param key the bucket
     * @return the limit
     */
    public TokenBucketLimit resolveLimit(RateLimitKey key) {
        final var runtime = runtimeLimits.get(key);
        if (runtime != null) {
            return runtime;
        }

        final var defaults = TokenBucketLimit.fromRateAndWindow(config.rate(), config.window());
        final var override = config.buckets().get(key.bucket());
        if (override == null) {
            return defaults;
        }

        final var rate = override.rate().orElse(config.rate());
        if (rate <= 0) {
            return TokenBucketLimit.unlimited();
        }
        final var burst = override.burst()
                .orElseGet(() -> TokenBucketLimit.fromRateAndWindow(rate, config.window()).burst());
        return new TokenBucketLimit(rate, burst);
    }

    /**
     * Replace the limit of a bucket for the lifetime of this resolver.
     *
     * @param key   the bucket
     * @param limit the new limit
     */
    public void setLimit(RateLimitKey key, TokenBucketLimit limit) {
        runtimeLimits.put(key, limit);
    }
}
