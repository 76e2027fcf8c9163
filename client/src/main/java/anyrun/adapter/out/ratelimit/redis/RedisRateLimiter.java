package anyrun.adapter.out.ratelimit.redis;

import java.time.Duration;
import java.util.List;
import java.util.function.LongSupplier;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.RedisAPI;
import io.vertx.mutiny.redis.client.Response;

import anyrun.adapter.out.redis.RedisTimeoutHelper;
import anyrun.core.model.ratelimit.RateLimitDecision;
import anyrun.core.model.ratelimit.RateLimitKey;
import anyrun.core.model.ratelimit.TokenBucketLimit;
import anyrun.core.port.out.RateLimiter;

/**
 * Redis-based rate limiter for processes that share an API key.
 *
 * <p>The token bucket runs atomically in a Lua script. Tokens are stored as strings so that
 * fractional credit survives between calls; timestamps are wall-clock milliseconds because
 * several hosts update the same key. Redis failures and timeouts allow the request.
 *
 * <p>Key format: {@code anyrun:ratelimit:{bucket}}
 */
public final class RedisRateLimiter implements RateLimiter {

    static final String KEY_PREFIX = "anyrun:ratelimit:";

    /**
     * Lua script for atomic token bucket rate limiting.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the bucket key</li>
     *   <li>ARGV[1] - refill rate (tokens per second)</li>
     *   <li>ARGV[2] - burst capacity</li>
     *   <li>ARGV[3] - current timestamp in milliseconds</li>
     *   <li>ARGV[4] - key TTL in seconds</li>
     * </ol>
     *
     * <p>Returns array: [allowed (0/1), tokens as string, wait in milliseconds]
     */
    static final String TOKEN_BUCKET_SCRIPT =
            """
            local key = KEYS[1]
            local rate = tonumber(ARGV[1])
            local burst = tonumber(ARGV[2])
            local now_ms = tonumber(ARGV[3])
            local ttl_seconds = tonumber(ARGV[4])

            local data = redis.call('HMGET', key, 'tokens', 'last_refill_ms')
            local tokens = tonumber(data[1])
            local last_refill_ms = tonumber(data[2])

            if tokens == nil then
                tokens = burst
                last_refill_ms = now_ms
            end

            local elapsed_ms = math.max(0, now_ms - last_refill_ms)
            tokens = math.min(burst, tokens + (elapsed_ms / 1000.0) * rate)

            local allowed = 0
            local wait_ms = 0
            if tokens >= 1 - 1e-9 then
                tokens = math.max(0, tokens - 1)
                allowed = 1
            else
                wait_ms = math.ceil(((1 - tokens) / rate) * 1000)
            end

            redis.call('HSET', key, 'tokens', tostring(tokens), 'last_refill_ms', tostring(now_ms))
            redis.call('EXPIRE', key, ttl_seconds)

            return {allowed, tostring(tokens), wait_ms}
            """;

    /**
     * Lua script reading a bucket without consuming or writing.
     *
     * <p>Arguments are the first three of {@link #TOKEN_BUCKET_SCRIPT}. Returns the same array,
     * where allowed tells whether a call made now would get a token. A missing key reports a full
     * bucket.
     */
    static final String STATUS_SCRIPT =
            """
            local key = KEYS[1]
            local rate = tonumber(ARGV[1])
            local burst = tonumber(ARGV[2])
            local now_ms = tonumber(ARGV[3])

            local data = redis.call('HMGET', key, 'tokens', 'last_refill_ms')
            local tokens = tonumber(data[1])
            local last_refill_ms = tonumber(data[2])

            if tokens == nil then
                return {1, tostring(burst), 0}
            end

            local elapsed_ms = math.max(0, now_ms - last_refill_ms)
            tokens = math.min(burst, tokens + (elapsed_ms / 1000.0) * rate)

            if tokens >= 1 - 1e-9 then
                return {1, tostring(tokens), 0}
            end
            return {0, tostring(tokens), math.ceil(((1 - tokens) / rate) * 1000)}
            """;

    private final RedisAPI redis;
    private final RedisTimeoutHelper timeoutHelper;
    private final LongSupplier wallClockMillis;
    private final boolean enabled;

    public RedisRateLimiter(
            RedisAPI redis, RedisTimeoutHelper timeoutHelper, LongSupplier wallClockMillis, boolean enabled) {
        this.redis = redis;
        this.timeoutHelper = timeoutHelper;
        this.wallClockMillis = wallClockMillis;
        this.enabled = enabled;
    }

    @Override
    public Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, TokenBucketLimit limit) {
        if (!enabled || limit.isUnlimited()) {
            return Uni.createFrom().item(RateLimitDecision.allow());
        }

        final var args = List.of(
                TOKEN_BUCKET_SCRIPT,
                "1",
                key.toStorageKey(KEY_PREFIX),
                String.valueOf(limit.rate()),
                String.valueOf(limit.burst()),
                String.valueOf(wallClockMillis.getAsLong()),
                String.valueOf(ttlSeconds(limit)));

        final var operation = Uni.createFrom().deferred(() -> redis.eval(args)).map(this::parseDecision);
        return timeoutHelper.withTimeoutFallback(operation, "checkAndConsume", RateLimitDecision::allow);
    }

    @Override
    public Uni<RateLimitDecision> getStatus(RateLimitKey key, TokenBucketLimit limit) {
        if (!enabled || limit.isUnlimited()) {
            return Uni.createFrom().item(RateLimitDecision.allow());
        }

        final var args = List.of(
                STATUS_SCRIPT,
                "1",
                key.toStorageKey(KEY_PREFIX),
                String.valueOf(limit.rate()),
                String.valueOf(limit.burst()),
                String.valueOf(wallClockMillis.getAsLong()));

        final var operation = Uni.createFrom().deferred(() -> redis.eval(args)).map(this::parseDecision);
        return timeoutHelper.withTimeoutFallback(operation, "getStatus", RateLimitDecision::allow);
    }

    @Override
    public Uni<Void> reset(RateLimitKey key, TokenBucketLimit limit) {
        final var operation = Uni.createFrom()
                .deferred(() -> redis.del(List.of(key.toStorageKey(KEY_PREFIX))))
                .replaceWithVoid();
        return timeoutHelper.withTimeoutSilent(operation, "reset");
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    private RateLimitDecision parseDecision(Response response) {
        if (response == null || response.size() < 3) {
            throw new IllegalStateException("Unexpected response from rate limit script");
        }
        final var allowed = response.get(0).toInteger() == 1;
        final var tokens = Double.parseDouble(response.get(1).toString());
        if (allowed) {
            return RateLimitDecision.allow(tokens);
        }
        return RateLimitDecision.rejected(tokens, Duration.ofMillis(Math.max(1L, response.get(2).toLong())));
    }

    // Idle keys expire once a full bucket would have been refilled twice over.
    private static long ttlSeconds(TokenBucketLimit limit) {
        return Math.max(1L, (long) Math.ceil(limit.burst() / limit.rate()) * 2);
    }
}
