package io.imagerollout.execution;

import io.imagerollout.broker.BrokerClient;
import io.imagerollout.broker.BrokerException;
import io.imagerollout.metrics.MetricsProvider;
import io.imagerollout.models.ActionRecord;
import io.imagerollout.models.Machine;
import io.imagerollout.models.PendingTask;
import io.imagerollout.models.Session;
import io.imagerollout.planning.ActionPlanner;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static io.imagerollout.metrics.MetricsConstants.NAGS_FAILED_METRIC_NAME;
import static io.imagerollout.metrics.MetricsConstants.NAGS_SENT_METRIC_NAME;
import static io.imagerollout.metrics.MetricsConstants.RESTARTS_FAILED_METRIC_NAME;
import static io.imagerollout.metrics.MetricsConstants.RESTARTS_REQUESTED_METRIC_NAME;
import static io.imagerollout.metrics.MetricsConstants.RESTARTS_SIMULATED_METRIC_NAME;
import static io.imagerollout.metrics.MetricsUtils.buildSiteTags;

/**
 * Carries out planned actions against live broker state.
 *
 * <p>Records from all sites are shuffled together so that no site can use up the restart budget
 * before the others get a turn. Each restart re-reads the entity first and only proceeds if it is
 * still eligible: a machine must still be available, a session must still be inactive and idle.
 * A session that became active is nagged instead. Failures are logged and counted, never thrown.
 */
@Slf4j
public class ActionExecutor {

    private final BrokerClient brokerClient;
    private final ActionPlanner actionPlanner;
    private final MetricsProvider metricsProvider;
    private final int maxRestartActions;
    private final boolean simulate;
    private final String notificationTitle;
    private final String notificationText;
    private final Random random;
    private final Clock clock;

    public ActionExecutor(BrokerClient brokerClient, ActionPlanner actionPlanner, MetricsProvider metricsProvider,
                          int maxRestartActions, boolean simulate, String notificationTitle, String notificationText,
                          Random random, Clock clock) {
        this.brokerClient = brokerClient;
        this.actionPlanner = actionPlanner;
        this.metricsProvider = metricsProvider;
        this.maxRestartActions = maxRestartActions;
        this.simulate = simulate;
        this.notificationTitle = notificationTitle;
        this.notificationText = notificationText;
        this.random = random;
        this.clock = clock;
    }

    /**
     * Execute every record that plans a restart or a nag.
     *
     * @param records planned records, possibly from several sites
     * @param counters counters of the current run
     * @return power actions submitted by this call, to be handed to the monitor
     */
    public List<PendingTask> execute(List<ActionRecord> records, RunCounters counters) {
        List<ActionRecord> actionable = new ArrayList<>();
        for (ActionRecord record : records) {
            switch (record.getProposedAction()) {
                case RESTART, NAG -> actionable.add(record);
                case NONE -> { }
            }
        }
        List<PendingTask> submitted = new ArrayList<>();
        if (actionable.isEmpty()) {
            log.info("No actions to execute");
            return submitted;
        }

        Collections.shuffle(actionable, random);
        log.info("Executing {} action(s){}", actionable.size(), simulate ? " in simulate mode" : "");

        for (ActionRecord record : actionable) {
            try {
                switch (record.getProposedAction()) {
                    case RESTART -> executeRestart(record, counters, submitted);
                    case NAG -> executeNag(record, counters);
                    default -> { }
                }
            } catch (RuntimeException e) {
                log.error("[Site: {}] Unexpected failure executing {} for {}: {}", record.getSiteId(),
                        record.getProposedAction().getValue(), record.getEntity().getMachineName(), e.getMessage(), e);
            }
        }

        log.info("Execution finished: {} restart(s) requested, {} simulated, {} nag(s) sent so far",
                counters.getRestartsRequested(), counters.getRestartsSimulated(), counters.getNagsSent());
        return submitted;
    }

    private void executeRestart(ActionRecord record, RunCounters counters, List<PendingTask> submitted) {
        if (counters.isRestartBudgetExhausted(maxRestartActions)) {
            log.info("[Site: {}] Restart budget of {} reached - skipping {}", record.getSiteId(), maxRestartActions,
                    record.getEntity().getMachineName());
            counters.recordRestartSkippedBudget();
            return;
        }
        if (record.getEntity() instanceof Machine machine) {
            restartMachine(record, machine, counters, submitted);
        } else if (record.getEntity() instanceof Session session) {
            restartSession(record, session, counters, submitted);
        }
    }

    private void restartMachine(ActionRecord record, Machine planned, RunCounters counters, List<PendingTask> submitted) {
        String siteId = record.getSiteId();
        Optional<Machine> live;
        try {
            live = brokerClient.refreshMachine(record.getEndpoint(), planned.getId());
        } catch (BrokerException e) {
            log.warn("[Site: {}] Could not re-read machine {} before restart: {}", siteId, planned.getMachineName(), e.getMessage());
            counters.recordRestartFailed();
            metricsProvider.counter(RESTARTS_FAILED_METRIC_NAME, buildSiteTags(siteId)).increment();
            return;
        }
        if (live.isEmpty() || !live.get().isAvailable()) {
            log.info("[Site: {}] Machine {} is no longer available ({}) - skipping restart", siteId, planned.getMachineName(),
                    live.map(m -> String.valueOf(m.getAvailabilityState())).orElse("gone"));
            counters.recordRestartSkippedStale();
            return;
        }
        submitRestart(siteId, record.getEndpoint(), planned.getId(), planned.getMachineName(), counters, submitted);
    }

    private void restartSession(ActionRecord record, Session planned, RunCounters counters, List<PendingTask> submitted) {
        String siteId = record.getSiteId();
        Optional<Session> live;
        try {
            live = brokerClient.refreshSession(record.getEndpoint(), planned.getId());
        } catch (BrokerException e) {
            log.warn("[Site: {}] Could not re-read session on {} before restart: {}", siteId, planned.getMachineName(), e.getMessage());
            counters.recordRestartFailed();
            metricsProvider.counter(RESTARTS_FAILED_METRIC_NAME, buildSiteTags(siteId)).increment();
            return;
        }
        if (live.isEmpty()) {
            log.info("[Site: {}] Session on {} has ended - skipping restart", siteId, planned.getMachineName());
            counters.recordRestartSkippedStale();
            return;
        }
        Session session = live.get();
        if (!actionPlanner.isRestartEligible(session)) {
            log.info("[Site: {}] Session on {} is {} - sending a notification instead of restarting", siteId,
                    planned.getMachineName(), session.isInactive() ? "no longer idle long enough" : "no longer inactive");
            counters.recordRestartDowngraded();
            sendNag(siteId, record.getEndpoint(), session, counters);
            return;
        }
        String machineId = session.getMachineId() != null ? session.getMachineId() : planned.getMachineId();
        submitRestart(siteId, record.getEndpoint(), machineId, planned.getMachineName(), counters, submitted);
    }

    private void submitRestart(String siteId, String endpoint, String machineId, String machineName,
                               RunCounters counters, List<PendingTask> submitted) {
        if (!counters.tryReserveRestart(maxRestartActions)) {
            log.info("[Site: {}] Restart budget of {} reached - skipping {}", siteId, maxRestartActions, machineName);
            counters.recordRestartSkippedBudget();
            return;
        }
        if (simulate) {
            log.info("[Site: {}] [SIMULATE] Would restart {}", siteId, machineName);
            counters.recordRestartSimulated();
            metricsProvider.counter(RESTARTS_SIMULATED_METRIC_NAME, buildSiteTags(siteId)).increment();
            return;
        }
        try {
            String taskId = brokerClient.submitRestart(endpoint, machineId);
            submitted.add(new PendingTask(taskId, endpoint, siteId, machineName, OffsetDateTime.now(clock)));
            counters.recordRestartRequested();
            metricsProvider.counter(RESTARTS_REQUESTED_METRIC_NAME, buildSiteTags(siteId)).increment();
            log.info("[Site: {}] Restart of {} requested (task {})", siteId, machineName, taskId);
        } catch (BrokerException e) {
            counters.recordRestartFailed();
            metricsProvider.counter(RESTARTS_FAILED_METRIC_NAME, buildSiteTags(siteId)).increment();
            log.warn("[Site: {}] Failed to request restart of {}: {}", siteId, machineName, e.getMessage());
        }
    }

    private void executeNag(ActionRecord record, RunCounters counters) {
        String siteId = record.getSiteId();
        String sessionId = record.getEntity().getId();
        Optional<Session> live;
        try {
            live = brokerClient.refreshSession(record.getEndpoint(), sessionId);
        } catch (BrokerException e) {
            log.warn("[Site: {}] Could not look up session on {}: {}", siteId, record.getEntity().getMachineName(), e.getMessage());
            counters.recordNagFailed();
            metricsProvider.counter(NAGS_FAILED_METRIC_NAME, buildSiteTags(siteId)).increment();
            return;
        }
        if (live.isEmpty()) {
            log.info("[Site: {}] Session on {} has ended - no notification needed", siteId, record.getEntity().getMachineName());
            return;
        }
        sendNag(siteId, record.getEndpoint(), live.get(), counters);
    }

    private void sendNag(String siteId, String endpoint, Session session, RunCounters counters) {
        if (simulate) {
            log.info("[Site: {}] [SIMULATE] Would notify {} on {}", siteId, session.getUserName(), session.getMachineName());
            counters.recordNagSimulated();
            return;
        }
        try {
            if (brokerClient.submitNotification(endpoint, session.getId(), notificationTitle, notificationText)) {
                counters.recordNagSent();
                metricsProvider.counter(NAGS_SENT_METRIC_NAME, buildSiteTags(siteId)).increment();
                log.info("[Site: {}] Notified {} on {}", siteId, session.getUserName(), session.getMachineName());
                return;
            }
            log.warn("[Site: {}] Broker rejected notification for {} on {}", siteId, session.getUserName(), session.getMachineName());
        } catch (BrokerException e) {
            log.warn("[Site: {}] Failed to notify {} on {}: {}", siteId, session.getUserName(), session.getMachineName(), e.getMessage());
        }
        counters.recordNagFailed();
        metricsProvider.counter(NAGS_FAILED_METRIC_NAME, buildSiteTags(siteId)).increment();
    }
}
