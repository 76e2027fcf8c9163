package anyrun.core.model.error;

import java.time.Duration;
import java.util.Optional;

/**
 * Structured failure of a sandbox API call.
 *
 * <p>Every variant carries the HTTP status code (zero when the failure was detected locally, or
 * when no response was received) and a human-readable message.
 */
public sealed interface ClassifiedError {

    /** Wait reported by {@link RateLimit#retryAfterOrDefault()} when the server sent no hint. */
    Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(60);

    int statusCode();

    String message();

    ErrorKind kind();

    default boolean isTransient() {
        return kind().isTransient();
    }

    /**
     * The API key was rejected (401).
     */
    record Authentication(int statusCode, String message) implements ClassifiedError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.AUTHENTICATION;
        }
    }

    /**
     * The task or resource does not exist (404).
     */
    record NotFound(int statusCode, String message) implements ClassifiedError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.NOT_FOUND;
        }
    }

    /**
     * The service throttled the request (429).
     *
     * @param retryAfter the wait requested by the {@code Retry-After} header, if one was sent
     */
    record RateLimit(int statusCode, String message, Optional<Duration> retryAfter) implements ClassifiedError {

        public RateLimit {
            if (retryAfter == null) {
                retryAfter = Optional.empty();
            }
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.RATE_LIMIT;
        }

        /**
         * Return the server hint, or {@link ClassifiedError#DEFAULT_RETRY_AFTER} without one.
         *
         * @return how long callers should wait before trying again
         */
        public Duration retryAfterOrDefault() {
            return retryAfter.orElse(DEFAULT_RETRY_AFTER);
        }
    }

    /**
     * The service failed to handle the request (5xx).
     */
    record Server(int statusCode, String message) implements ClassifiedError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.SERVER;
        }
    }

    /**
     * The request was rejected before it was sent.
     */
    record Validation(String message) implements ClassifiedError {
        @Override
        public int statusCode() {
            return 0;
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.VALIDATION;
        }
    }

    /**
     * The response body is not the JSON envelope the client understands.
     */
    record MalformedResponse(int statusCode, String message) implements ClassifiedError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.MALFORMED_RESPONSE;
        }
    }

    /**
     * Any other failure, including transport errors where no response arrived (status 0).
     */
    record Generic(int statusCode, String message) implements ClassifiedError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.GENERIC;
        }
    }

    static ClassifiedError validation(String message) {
        return new Validation(message);
    }

    static ClassifiedError malformed(int statusCode, String message) {
        return new MalformedResponse(statusCode, message);
    }
}
