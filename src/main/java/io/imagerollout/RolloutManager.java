package io.imagerollout;

import io.imagerollout.config.RolloutConfig;
import io.imagerollout.enums.EntityKind;
import io.imagerollout.enums.SearchScope;
import io.imagerollout.execution.ActionExecutor;
import io.imagerollout.execution.RunCounters;
import io.imagerollout.health.EndpointHealthSelector;
import io.imagerollout.health.NoHealthyEndpointException;
import io.imagerollout.inventory.InventoryCollector;
import io.imagerollout.metrics.MetricsProvider;
import io.imagerollout.models.ActionRecord;
import io.imagerollout.models.PendingTask;
import io.imagerollout.monitor.MonitorResult;
import io.imagerollout.monitor.PowerActionMonitor;
import io.imagerollout.planning.ActionPlanner;
import io.imagerollout.report.ReportAggregator;
import io.imagerollout.report.RunSummary;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.imagerollout.metrics.MetricsConstants.INVENTORY_PASS_DURATION_METRIC_NAME;
import static io.imagerollout.metrics.MetricsUtils.buildSiteTags;

/**
 * Runs one rollout from start to finish.
 *
 * <ol>
 *   <li>Bind one healthy endpoint per site.</li>
 *   <li>Machine pass: collect and plan the available machines of every site, then execute.</li>
 *   <li>Session pass: collect and plan the sessions of every site whose machine pass left no
 *       restart outstanding, then execute. Other sites are deferred to a later run.</li>
 *   <li>Wait for submitted restarts unless running asynchronously.</li>
 *   <li>Report.</li>
 * </ol>
 *
 * Only the absence of any healthy endpoint aborts a run; every other failure is logged, counted and
 * the run carries on to its summary.
 */
@Slf4j
public class RolloutManager {

    private final RolloutConfig config;
    private final EndpointHealthSelector healthSelector;
    private final InventoryCollector inventoryCollector;
    private final ActionPlanner actionPlanner;
    private final ActionExecutor actionExecutor;
    private final PowerActionMonitor powerActionMonitor;
    private final ReportAggregator reportAggregator;
    private final MetricsProvider metricsProvider;
    private final Clock clock;

    public RolloutManager(RolloutConfig config, EndpointHealthSelector healthSelector,
                          InventoryCollector inventoryCollector, ActionPlanner actionPlanner,
                          ActionExecutor actionExecutor, PowerActionMonitor powerActionMonitor,
                          ReportAggregator reportAggregator, MetricsProvider metricsProvider, Clock clock) {
        this.config = config;
        this.healthSelector = healthSelector;
        this.inventoryCollector = inventoryCollector;
        this.actionPlanner = actionPlanner;
        this.actionExecutor = actionExecutor;
        this.powerActionMonitor = powerActionMonitor;
        this.reportAggregator = reportAggregator;
        this.metricsProvider = metricsProvider;
        this.clock = clock;
    }

    public RunSummary run() throws NoHealthyEndpointException {
        OffsetDateTime startedAt = OffsetDateTime.now(clock);
        RunCounters counters = new RunCounters(startedAt);
        SearchScope scope = config.getSearchScope();
        log.info("Starting rollout '{}' (scope: {}, simulate: {})", config.getRolloutId(), scope.getValue(), config.isSimulate());

        Map<String, String> sites = healthSelector.select(config.getEndpoints());
        log.info("Selected {} site(s): {}", sites.size(), sites);

        List<ActionRecord> allRecords = new ArrayList<>();
        List<PendingTask> submitted = new ArrayList<>();
        Map<String, List<ActionRecord>> machineRecordsBySite = new LinkedHashMap<>();

        if (scope.includesAvailableMachines()) {
            List<ActionRecord> machineRecords = new ArrayList<>();
            sites.forEach((siteId, endpoint) -> {
                List<ActionRecord> records = metricsProvider
                        .timer(INVENTORY_PASS_DURATION_METRIC_NAME, buildSiteTags(siteId, EntityKind.MACHINE))
                        .record(() -> actionPlanner.planMachines(inventoryCollector.collectAvailableMachines(siteId, endpoint)));
                machineRecordsBySite.put(siteId, records);
                machineRecords.addAll(records);
            });
            allRecords.addAll(machineRecords);
            submitted.addAll(actionExecutor.execute(machineRecords, counters));
        }

        List<String> deferredSites = new ArrayList<>();
        if (scope.includesSessions()) {
            List<ActionRecord> sessionRecords = new ArrayList<>();
            sites.forEach((siteId, endpoint) -> {
                if (ActionPlanner.hasOutstandingRestart(machineRecordsBySite.getOrDefault(siteId, List.of()))) {
                    log.info("[Site: {}] Machine restarts are outstanding - deferring session pass to a later run", siteId);
                    deferredSites.add(siteId);
                    return;
                }
                List<ActionRecord> records = metricsProvider
                        .timer(INVENTORY_PASS_DURATION_METRIC_NAME, buildSiteTags(siteId, EntityKind.SESSION))
                        .record(() -> actionPlanner.planSessions(inventoryCollector.collectSessions(siteId, endpoint)));
                sessionRecords.addAll(records);
            });
            allRecords.addAll(sessionRecords);
            submitted.addAll(actionExecutor.execute(sessionRecords, counters));
        }

        MonitorResult monitorResult;
        if (config.isAsynchronous()) {
            log.info("Asynchronous run - not waiting for {} submitted restart(s)", submitted.size());
            monitorResult = MonitorResult.notMonitored(submitted);
        } else {
            monitorResult = powerActionMonitor.await(submitted, counters);
        }

        Duration elapsed = Duration.between(startedAt, OffsetDateTime.now(clock));
        RunSummary summary = reportAggregator.aggregate(config.getRolloutId(), config.isSimulate(), sites, deferredSites,
                allRecords, counters, monitorResult, elapsed);
        reportAggregator.report(summary);

        if (config.getReportOutputFile() != null) {
            try {
                reportAggregator.writeJson(summary, Path.of(config.getReportOutputFile()));
            } catch (IOException e) {
                log.error("Failed to write run summary to {}: {}", config.getReportOutputFile(), e.getMessage(), e);
            }
        }
        return summary;
    }
}
