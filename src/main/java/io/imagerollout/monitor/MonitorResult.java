package io.imagerollout.monitor;

import io.imagerollout.models.PendingTask;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of monitoring the power actions of one run.
 * Tasks in {@code stillPending} are excluded from the success and failure tallies.
 */
@Getter
@ToString
@AllArgsConstructor
public class MonitorResult {

    private final boolean monitored;
    private final int succeeded;
    private final int failed;
    private final List<PendingTask> stillPending;
    private final boolean timedOut;
    private final Duration elapsed;

    /**
     * Result for a run that submitted its power actions without waiting for them.
     */
    public static MonitorResult notMonitored(List<PendingTask> submitted) {
        return new MonitorResult(false, 0, 0, List.copyOf(submitted), false, Duration.ZERO);
    }
}
