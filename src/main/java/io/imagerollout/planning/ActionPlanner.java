package io.imagerollout.planning;

import io.imagerollout.classification.PatternClassifier;
import io.imagerollout.enums.ProposedAction;
import io.imagerollout.enums.UpdateStatus;
import io.imagerollout.models.ActionRecord;
import io.imagerollout.models.Machine;
import io.imagerollout.models.Session;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Turns classified desktops into action records.
 *
 * <ul>
 *   <li>Available machine needing the new image: restart it.</li>
 *   <li>Session needing the new image: restart only if inactive for at least the idle threshold,
 *       otherwise ask the user to log off.</li>
 *   <li>Everything else: no action.</li>
 * </ul>
 */
@Slf4j
public class ActionPlanner {

    private final PatternClassifier classifier;
    private final Duration idleThreshold;
    private final Clock clock;

    public ActionPlanner(PatternClassifier classifier, Duration idleThreshold, Clock clock) {
        this.classifier = classifier;
        this.idleThreshold = idleThreshold;
        this.clock = clock;
    }

    public ActionRecord planMachine(Machine machine) {
        UpdateStatus status = classifier.classify(machine.getDiskImage());
        ProposedAction action = status == UpdateStatus.RESTART_REQUIRED ? ProposedAction.RESTART : ProposedAction.NONE;
        return new ActionRecord(machine, status, action);
    }

    public ActionRecord planSession(Session session) {
        UpdateStatus status = classifier.classify(session.getDiskImage());
        if (status != UpdateStatus.RESTART_REQUIRED) {
            return new ActionRecord(session, status, ProposedAction.NONE);
        }
        ProposedAction action = isRestartEligible(session) ? ProposedAction.RESTART : ProposedAction.NAG;
        return new ActionRecord(session, status, action);
    }

    public List<ActionRecord> planMachines(Collection<Machine> machines) {
        List<ActionRecord> records = machines.stream().map(this::planMachine).toList();
        logPlan("machine", records);
        return records;
    }

    public List<ActionRecord> planSessions(Collection<Session> sessions) {
        List<ActionRecord> records = sessions.stream().map(this::planSession).toList();
        logPlan("session", records);
        return records;
    }

    /**
     * Whether a session may be restarted rather than nagged: it must be inactive and idle for at
     * least the configured threshold. Also used to re-check live sessions right before acting.
     */
    public boolean isRestartEligible(Session session) {
        if (!session.isInactive()) {
            return false;
        }
        Duration idle = session.idleDuration(OffsetDateTime.now(clock));
        return idle.compareTo(idleThreshold) >= 0;
    }

    public Duration getIdleThreshold() {
        return idleThreshold;
    }

    /**
     * True if any of the records still plans a restart. The orchestrator uses this on a site's
     * machine records to hold back that site's session pass.
     */
    public static boolean hasOutstandingRestart(Collection<ActionRecord> records) {
        return records.stream().anyMatch(r -> r.getProposedAction() == ProposedAction.RESTART);
    }

    private void logPlan(String kind, List<ActionRecord> records) {
        long restarts = records.stream().filter(r -> r.getProposedAction() == ProposedAction.RESTART).count();
        long nags = records.stream().filter(r -> r.getProposedAction() == ProposedAction.NAG).count();
        log.info("Planned {} {} record(s): {} restart(s), {} nag(s)", records.size(), kind, restarts, nags);
    }
}
