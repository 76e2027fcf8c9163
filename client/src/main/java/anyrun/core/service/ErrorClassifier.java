package anyrun.core.service;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import anyrun.core.model.analysis.ApiResponse;
import anyrun.core.model.error.ClassifiedError;
import anyrun.core.model.request.RawResponse;

/**
 * Turns a raw HTTP response into either the parsed envelope or exactly one
 * {@link ClassifiedError}.
 *
 * <p>Mapping: 401 authentication, 404 not found, 429 rate limit, 5xx server, any other non-2xx
 * generic. A body that is present but not a JSON object is a malformed response whatever the
 * status. A 2xx envelope with {@code "error": true} is a generic error carrying the envelope's
 * message.
 */
public class ErrorClassifier {

    static final String RETRY_AFTER_HEADER = "Retry-After";

    private final ObjectMapper objectMapper;
    private final Clock wallClock;

    public ErrorClassifier(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    /**
     * @param objectMapper the JSON mapper
     * @param wallClock    clock used to turn an HTTP-date {@code Retry-After} into a wait
     */
    public ErrorClassifier(ObjectMapper objectMapper, Clock wallClock) {
        this.objectMapper = objectMapper;
        this.wallClock = wallClock;
    }

    /**
     * Outcome of classifying a response.
     */
    public sealed interface Outcome {

        /**
         * @param response the parsed envelope
         * @param body     the raw body, stored verbatim by the cache
         */
        record Success(ApiResponse response, String body) implements Outcome {}

        record Failure(ClassifiedError error) implements Outcome {}
    }

    /**
     * Classify a response.
     *
     * @param response the raw response
     * @return the outcome
     */
    public Outcome classify(RawResponse response) {
        final var status = response.statusCode();
        final var body = response.body();

        if (body.isBlank()) {
            if (response.isSuccess()) {
                return new Outcome.Success(ApiResponse.empty(), "");
            }
            return new Outcome.Failure(byStatus(response, "HTTP " + status));
        }

        final JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return new Outcome.Failure(ClassifiedError.malformed(status, "Invalid JSON response: " + abbreviate(body)));
        }
        if (json == null || !json.isObject()) {
            return new Outcome.Failure(
                    ClassifiedError.malformed(status, "Response is not a JSON object: " + abbreviate(body)));
        }

        if (!response.isSuccess()) {
            return new Outcome.Failure(byStatus(response, messageOf(json, "HTTP " + status)));
        }

        final ApiResponse envelope;
        try {
            envelope = objectMapper.treeToValue(json, ApiResponse.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return new Outcome.Failure(ClassifiedError.malformed(status, "Unexpected response envelope: " + e.getMessage()));
        }
        if (envelope.error()) {
            return new Outcome.Failure(new ClassifiedError.Generic(status, messageOf(json, "Unknown error")));
        }
        return new Outcome.Success(envelope, body);
    }

    /**
     * Classify a response that is known to be an error by its status alone.
     *
     * @param response the raw response
     * @return the classified error
     */
    public ClassifiedError classifyFailure(RawResponse response) {
        final var outcome = classify(response);
        if (outcome instanceof Outcome.Failure failure) {
            return failure.error();
        }
        return new ClassifiedError.Generic(response.statusCode(), "HTTP " + response.statusCode());
    }

    private ClassifiedError byStatus(RawResponse response, String message) {
        final var status = response.statusCode();
        if (status == 401) {
            return new ClassifiedError.Authentication(status, message);
        }
        if (status == 404) {
            return new ClassifiedError.NotFound(status, message);
        }
        if (status == 429) {
            return new ClassifiedError.RateLimit(
                    status, message, response.header(RETRY_AFTER_HEADER).flatMap(this::parseRetryAfter));
        }
        if (status >= 500 && status <= 599) {
            return new ClassifiedError.Server(status, message);
        }
        return new ClassifiedError.Generic(status, message);
    }

    /**
     * Parse a {@code Retry-After} value given in seconds (fractions allowed) or as an HTTP-date.
     *
     * @param value the header value
     * @return the wait, never negative, or empty when the value cannot be parsed
     */
    Optional<Duration> parseRetryAfter(String value) {
        final var trimmed = value.trim();
        try {
            final var seconds = Double.parseDouble(trimmed);
            if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
                return Optional.empty();
            }
            return Optional.of(Duration.ofNanos((long) (Math.max(0.0, seconds) * 1_000_000_000L)));
        } catch (NumberFormatException e) {
            return parseHttpDate(trimmed);
        }
    }

    private Optional<Duration> parseHttpDate(String value) {
        try {
            final var at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            final var wait = Duration.between(wallClock.instant(), at);
            return Optional.of(wait.isNegative() ? Duration.ZERO : wait);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static String messageOf(JsonNode json, String fallback) {
        final var message = json.path("message");
        if (message.isTextual() && !message.asText().isBlank()) {
            return message.asText();
        }
        return fallback;
    }

    private static String abbreviate(String body) {
        final var trimmed = body.strip();
        return trimmed.length() <= 200 ? trimmed : trimmed.substring(0, 200) + "...";
    }
}
