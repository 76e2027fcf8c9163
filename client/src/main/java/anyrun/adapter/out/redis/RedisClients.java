package anyrun.adapter.out.redis;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.mutiny.redis.client.RedisAPI;
import io.vertx.redis.client.RedisOptions;
import org.jboss.logging.Logger;

/**
 * Lazily created Redis connection shared by the Redis cache and rate limiter of one client.
 *
 * <p>No connection is opened until a Redis backend issues its first command.
 */
public final class RedisClients implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(RedisClients.class);

    private final Vertx vertx;
    private final String url;
    private volatile Redis redis;
    private volatile RedisAPI api;

    public RedisClients(Vertx vertx, String url) {
        this.vertx = vertx;
        this.url = url;
    }

    /**
     * Return the command API, creating the client on first use.
     *
     * @return the Redis API
     */
    public RedisAPI api() {
        var current = api;
        if (current == null) {
            synchronized (this) {
                current = api;
                if (current == null) {
                    LOG.infov("Creating Redis client for {0}", redactedUrl());
                    redis = Redis.createClient(vertx, new RedisOptions().setConnectionString(url));
                    current = RedisAPI.api(redis);
                    api = current;
                }
            }
        }
        return current;
    }

    @Override
    public synchronized void close() {
        if (api != null) {
            api.close();
            api = null;
        }
        if (redis != null) {
            redis.close();
            redis = null;
        }
    }

    private String redactedUrl() {
        final var at = url.lastIndexOf('@');
        if (at < 0) {
            return url;
        }
        final var scheme = url.indexOf("://");
        return url.substring(0, scheme + 3) + "***" + url.substring(at);
    }
}
