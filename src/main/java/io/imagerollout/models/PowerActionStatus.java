package io.imagerollout.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.imagerollout.enums.PowerActionOutcome;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Snapshot of an asynchronous power action as reported by the broker.
 * While {@code completed} is false the outcome and completion time are not meaningful.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PowerActionStatus {

    @JsonProperty("task_id")
    private String taskId;

    @JsonProperty("completed")
    private boolean completed;

    @JsonProperty("outcome")
    private PowerActionOutcome outcome;

    @JsonProperty("completion_time")
    private OffsetDateTime completionTime;

    @JsonProperty("message")
    private String message;

    public static PowerActionStatus pending(String taskId) {
        return new PowerActionStatus(taskId, false, null, null, null);
    }

    public static PowerActionStatus completed(String taskId, PowerActionOutcome outcome, OffsetDateTime completionTime) {
        return new PowerActionStatus(taskId, true, outcome, completionTime, null);
    }
}
