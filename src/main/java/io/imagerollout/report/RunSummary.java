package io.imagerollout.report;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Final summary of a rollout run, logged at the end of the run and optionally written as JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunSummary {

    private String rolloutId;
    private OffsetDateTime startedAt;
    private long elapsedSeconds;
    private boolean simulate;

    /** Site identity to the endpoint bound to it for the run. */
    private Map<String, String> sites;
    /** Sites whose session pass was skipped because machine restarts were outstanding. */
    private List<String> deferredSites;

    private int machinesAnalysed;
    private int sessionsAnalysed;
    private Map<String, Long> byUpdateStatus;
    private Map<String, Long> byProposedAction;
    private Map<String, Long> byDiskImage;

    private int nagsSent;
    private int nagsFailed;
    private int nagsSimulated;
    private int restartsRequested;
    private int restartsFailed;
    private int restartsSimulated;
    private int restartsSkippedStale;
    private int restartsSkippedBudget;
    private int restartsDowngraded;
    private int restartsSucceeded;
    private int restartsCompletedWithFailure;
    private int restartsPending;

    private boolean monitored;
    private boolean monitorTimedOut;
    private List<String> pendingTasks;
}
