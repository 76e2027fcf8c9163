package anyrun.adapter.out.cache.redis;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.RedisAPI;
import io.vertx.mutiny.redis.client.Response;

import anyrun.adapter.out.redis.RedisTimeoutHelper;
import anyrun.core.port.out.CacheBackend;

/**
 * Redis implementation of the cache backend.
 *
 * <p>Values are stored as plain strings with a millisecond TTL ({@code SET key value PX ttl}).
 * Reads degrade to a miss and writes to a no-op when Redis fails or times out.
 */
public class RedisCacheBackend implements CacheBackend {

    private final RedisAPI redis;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisCacheBackend(RedisAPI redis, RedisTimeoutHelper timeoutHelper) {
        this.redis = redis;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        final var operation = Uni.createFrom().deferred(() -> redis.get(key)).map(RedisCacheBackend::asString);
        return timeoutHelper.withTimeoutGraceful(operation, "get");
    }

    @Override
    public Uni<Void> set(String key, String value, Optional<Duration> ttl) {
        if (ttl.isPresent() && ttl.get().toMillis() <= 0) {
            // An entry that expires immediately is never observable.
            return delete(key);
        }
        final var args = ttl.map(d -> List.of(key, value, "PX", String.valueOf(d.toMillis())))
                .orElseGet(() -> List.of(key, value));
        final var operation = Uni.createFrom().deferred(() -> redis.set(args)).replaceWithVoid();
        return timeoutHelper.withTimeoutSilent(operation, "set");
    }

    @Override
    public Uni<Void> delete(String key) {
        final var operation = Uni.createFrom().deferred(() -> redis.del(List.of(key))).replaceWithVoid();
        return timeoutHelper.withTimeoutSilent(operation, "delete");
    }

    @Override
    public Uni<Boolean> exists(String key) {
        final var operation = Uni.createFrom()
                .deferred(() -> redis.exists(List.of(key)))
                .map(response -> response != null && response.toInteger() > 0);
        return timeoutHelper.withTimeoutFallback(operation, "exists", () -> false);
    }

    private static String asString(Response response) {
        return response == null ? null : response.toString();
    }
}
