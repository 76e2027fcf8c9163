package anyrun.core.model.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identifier of a newly submitted analysis task.
 *
 * @param taskId the task id, read from the {@code taskid} field
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmissionResult(@JsonProperty("taskid") String taskId) {

    @JsonCreator
    public SubmissionResult {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskid is missing from the submission response");
        }
    }
}
