package anyrun.core.model.request;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import anyrun.core.cache.CacheKeys;
import anyrun.core.model.ratelimit.RateLimitKey;

/**
 * Everything the request executor needs to perform one logical API call.
 *
 * @param operation     operation identifier, used for cache keys, logs and metrics
 * @param method        HTTP method
 * @param path          path relative to the base URL, for example {@code /v1/analysis}
 * @param queryParams   query parameters in insertion order
 * @param body          request body
 * @param cacheable     whether a successful response may be served from and stored in the cache
 * @param cacheKeyArgs  ordered argument values identifying the request for caching
 * @param rateLimitKey  the token bucket the call draws from
 */
public record RequestDescriptor(
        String operation,
        RequestMethod method,
        String path,
        Map<String, String> queryParams,
        RequestBody body,
        boolean cacheable,
        List<Object> cacheKeyArgs,
        RateLimitKey rateLimitKey) {

    public RequestDescriptor {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation is required");
        }
        if (method == null) {
            throw new IllegalArgumentException("method is required");
        }
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/'");
        }
        if (cacheable && !method.isRead()) {
            throw new IllegalArgumentException("only GET requests can be cached: " + operation);
        }
        queryParams = queryParams == null ? Map.of() : new LinkedHashMap<>(queryParams);
        if (body == null) {
            body = RequestBody.none();
        }
        cacheKeyArgs = cacheKeyArgs == null ? List.of() : new ArrayList<>(cacheKeyArgs);
        if (rateLimitKey == null) {
            rateLimitKey = RateLimitKey.of(operation);
        }
    }

    /**
     * Return the cache key of this request, without the configured prefix.
     *
     * @return the key derived from the operation and its arguments
     */
    public String cacheKey() {
        return CacheKeys.of(operation, cacheKeyArgs);
    }

    public static Builder builder(String operation, RequestMethod method, String path) {
        return new Builder(operation, method, path);
    }

    public static class Builder {
        private final String operation;
        private final RequestMethod method;
        private final String path;
        private final Map<String, String> queryParams = new LinkedHashMap<>();
        private RequestBody body = RequestBody.none();
        private boolean cacheable;
        private List<Object> cacheKeyArgs = List.of();
        private RateLimitKey rateLimitKey;

        private Builder(String operation, RequestMethod method, String path) {
            this.operation = operation;
            this.method = method;
            this.path = path;
        }

        public Builder queryParam(String name, Object value) {
            if (value != null) {
                this.queryParams.put(name, String.valueOf(value));
            }
            return this;
        }

        public Builder body(RequestBody body) {
            this.body = body;
            return this;
        }

        /**
         * Mark the request cacheable under the given argument values.
         */
        public Builder cacheable(Object... args) {
            this.cacheable = true;
            this.cacheKeyArgs = List.of(args);
            return this;
        }

        public Builder rateLimitKey(RateLimitKey rateLimitKey) {
            this.rateLimitKey = rateLimitKey;
            return this;
        }

        public RequestDescriptor build() {
            return new RequestDescriptor(
                    operation, method, path, queryParams, body, cacheable, cacheKeyArgs, rateLimitKey);
        }
    }
}
