package anyrun.core.model.analysis;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of an analysis task.
 */
public enum AnalysisStatus {
    QUEUED,
    STARTING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /**
     * Check whether the task can no longer change state.
     *
     * @return true for completed, failed and cancelled tasks
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AnalysisStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
