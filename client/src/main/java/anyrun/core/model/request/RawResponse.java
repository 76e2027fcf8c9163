package anyrun.core.model.request;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Unclassified HTTP response as returned by the transport.
 *
 * @param statusCode the HTTP status
 * @param headers    response headers; lookups through {@link #header(String)} ignore case
 * @param body       the body decoded as UTF-8, empty when the response had none
 */
public record RawResponse(int statusCode, Map<String, List<String>> headers, String body) {

    public RawResponse {
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = "";
        }
    }

    /**
     * Return the first value of a header.
     *
     * @param name header name, matched case-insensitively
     * @return the value, if present
     */
    public Optional<String> header(String name) {
        for (var entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return Optional.of(entry.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
