package anyrun.core.model.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of a task's progress.
 *
 * @param taskId     the task id
 * @param status     the lifecycle state
 * @param completion completion percentage, 0 when unknown
 * @param remaining  seconds until the task finishes, 0 when unknown
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskStatus(
        @JsonProperty("taskid") String taskId,
        @JsonProperty("status") AnalysisStatus status,
        @JsonProperty("completion") int completion,
        @JsonProperty("remaining") int remaining) {

    @JsonCreator
    public TaskStatus {
        if (status == null) {
            throw new IllegalArgumentException("status is missing from the status response");
        }
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
