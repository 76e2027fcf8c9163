package anyrun.core.model.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * JSON envelope returned by every sandbox endpoint.
 *
 * @param error   whether the service reported a failure
 * @param data    the payload, an empty object when absent
 * @param message optional human-readable message
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiResponse(
        @JsonProperty("error") boolean error,
        @JsonProperty("data") JsonNode data,
        @JsonProperty("message") String message) {

    @JsonCreator
    public ApiResponse {
        if (data == null || data.isNull() || data.isMissingNode()) {
            data = JsonNodeFactory.instance.objectNode();
        }
    }

    /**
     * Envelope used for a successful response with an empty body.
     */
    public static ApiResponse empty() {
        return new ApiResponse(false, null, null);
    }
}
