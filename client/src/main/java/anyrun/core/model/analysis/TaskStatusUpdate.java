package anyrun.core.model.analysis;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One event of the task monitor stream.
 *
 * @param task      progress of the task
 * @param completed whether the task has finished
 * @param error     whether the task finished with an error
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskStatusUpdate(
        @JsonProperty("task") Task task,
        @JsonProperty("completed") boolean completed,
        @JsonProperty("error") boolean error) {

    /**
     * Check whether no further update will follow.
     */
    public boolean isTerminal() {
        return completed || error;
    }

    /**
     * @param uuid      the task id
     * @param status    completion percentage
     * @param remaining seconds until completion
     * @param userTags  tags attached by the submitter
     * @param threats   threats detected so far
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Task(
            @JsonProperty("uuid") String uuid,
            @JsonProperty("status") int status,
            @JsonProperty("remaining") int remaining,
            @JsonProperty("usersTags") List<String> userTags,
            @JsonProperty("threats") List<String> threats) {

        @JsonCreator
        public Task {
            userTags = userTags == null ? List.of() : List.copyOf(userTags);
            threats = threats == null ? List.of() : List.copyOf(threats);
        }
    }
}
