package io.imagerollout.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.imagerollout.enums.EntityKind;
import io.imagerollout.execution.RunCounters;
import io.imagerollout.models.ActionRecord;
import io.imagerollout.models.PendingTask;
import io.imagerollout.monitor.MonitorResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.imagerollout.config.Constants.UNRESOLVED_DISK_IMAGE;

/**
 * Builds the end-of-run summary from the combined machine and session records and the run counters.
 */
@Slf4j
public class ReportAggregator {

    private final ObjectMapper objectMapper;

    public ReportAggregator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RunSummary aggregate(String rolloutId, boolean simulate, Map<String, String> sites, List<String> deferredSites,
                                List<ActionRecord> records, RunCounters counters, MonitorResult monitorResult,
                                Duration elapsed) {
        int restartsPending = monitorResult.isMonitored()
                ? monitorResult.getStillPending().size()
                : counters.getRestartsRequested();
        List<String> pendingTasks = new ArrayList<>();
        for (PendingTask task : monitorResult.getStillPending()) {
            pendingTasks.add(task.getSiteId() + "/" + task.getMachineName() + " (task " + task.getTaskId() + ")");
        }

        return RunSummary.builder()
                .rolloutId(rolloutId)
                .startedAt(counters.getStartedAt())
                .elapsedSeconds(elapsed.toSeconds())
                .simulate(simulate)
                .sites(new TreeMap<>(sites))
                .deferredSites(List.copyOf(deferredSites))
                .machinesAnalysed(countKind(records, EntityKind.MACHINE))
                .sessionsAnalysed(countKind(records, EntityKind.SESSION))
                .byUpdateStatus(groupBy(records, r -> r.getUpdateStatus().getValue()))
                .byProposedAction(groupBy(records, r -> r.getProposedAction().getValue()))
                .byDiskImage(groupBy(records, r -> r.getEntity().getDiskImage() != null
                        ? r.getEntity().getDiskImage() : UNRESOLVED_DISK_IMAGE))
                .nagsSent(counters.getNagsSent())
                .nagsFailed(counters.getNagsFailed())
                .nagsSimulated(counters.getNagsSimulated())
                .restartsRequested(counters.getRestartsRequested())
                .restartsFailed(counters.getRestartsFailed())
                .restartsSimulated(counters.getRestartsSimulated())
                .restartsSkippedStale(counters.getRestartsSkippedStale())
                .restartsSkippedBudget(counters.getRestartsSkippedBudget())
                .restartsDowngraded(counters.getRestartsDowngraded())
                .restartsSucceeded(counters.getRestartsCompleted())
                .restartsCompletedWithFailure(counters.getRestartsCompletedWithFailure())
                .restartsPending(restartsPending)
                .monitored(monitorResult.isMonitored())
                .monitorTimedOut(monitorResult.isTimedOut())
                .pendingTasks(pendingTasks)
                .build();
    }

    /**
     * Log the summary.
     */
    public void report(RunSummary summary) {
        log.info("===== Rollout '{}' summary{} =====", summary.getRolloutId(), summary.isSimulate() ? " (simulate)" : "");
        log.info("Sites: {}", summary.getSites().keySet());
        if (!summary.getDeferredSites().isEmpty()) {
            log.info("Session pass deferred for sites with outstanding machine restarts: {}", summary.getDeferredSites());
        }
        log.info("Analysed {} machine(s) and {} session(s)", summary.getMachinesAnalysed(), summary.getSessionsAnalysed());
        log.info("By update status: {}", summary.getByUpdateStatus());
        log.info("By proposed action: {}", summary.getByProposedAction());
        log.info("By disk image: {}", summary.getByDiskImage());
        log.info("Nags: {} sent, {} failed, {} simulated",
                summary.getNagsSent(), summary.getNagsFailed(), summary.getNagsSimulated());
        log.info("Restarts: {} requested, {} failed, {} simulated, {} skipped (stale), {} skipped (budget), {} downgraded to nag",
                summary.getRestartsRequested(), summary.getRestartsFailed(), summary.getRestartsSimulated(),
                summary.getRestartsSkippedStale(), summary.getRestartsSkippedBudget(), summary.getRestartsDowngraded());
        if (summary.isMonitored()) {
            log.info("Restart completion: {} succeeded, {} failed, {} pending",
                    summary.getRestartsSucceeded(), summary.getRestartsCompletedWithFailure(), summary.getRestartsPending());
        } else {
            log.info("Restart completion not monitored: {} restart(s) left running", summary.getRestartsPending());
        }
        if (summary.isMonitorTimedOut()) {
            log.warn("Still pending at monitor timeout: {}", summary.getPendingTasks());
        }
        log.info("Total elapsed: {}s", summary.getElapsedSeconds());
    }

    /**
     * Write the summary as JSON, creating parent directories as needed.
     */
    public void writeJson(RunSummary summary, Path outputFile) throws IOException {
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(outputFile.toFile(), summary);
        log.info("Run summary written to {}", outputFile);
    }

    private static int countKind(List<ActionRecord> records, EntityKind kind) {
        return (int) records.stream().filter(r -> r.getEntity().getKind() == kind).count();
    }

    private static Map<String, Long> groupBy(List<ActionRecord> records, Function<ActionRecord, String> key) {
        return records.stream().collect(Collectors.groupingBy(key, TreeMap::new, Collectors.counting()));
    }
}
