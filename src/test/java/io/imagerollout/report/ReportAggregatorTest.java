package io.imagerollout.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.imagerollout.enums.AvailabilityState;
import io.imagerollout.enums.ProposedAction;
import io.imagerollout.enums.SessionState;
import io.imagerollout.enums.UpdateStatus;
import io.imagerollout.execution.RunCounters;
import io.imagerollout.models.ActionRecord;
import io.imagerollout.models.Machine;
import io.imagerollout.models.PendingTask;
import io.imagerollout.models.Session;
import io.imagerollout.monitor.MonitorResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReportAggregatorTest {

    private static final OffsetDateTime STARTED = OffsetDateTime.parse("2026-03-01T12:00:00Z");

    private ObjectMapper objectMapper;
    private ReportAggregator aggregator;
    private List<ActionRecord> records;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        aggregator = new ReportAggregator(objectMapper);

        Machine outdated = machine("m1", "XDP07SLHS-230301.vhd");
        Machine current = machine("m2", "XDP07SLHS-230401.vhd");
        Machine unknown = machine("m3", null);
        Session session = new Session("s1", "m4", "DOM\\m4", "m4.example.com", "Pool-A", SessionState.ACTIVE, STARTED);
        session.setDiskImage("XDP07SLHS-230301.vhd");
        records = List.of(
                new ActionRecord(outdated, UpdateStatus.RESTART_REQUIRED, ProposedAction.RESTART),
                new ActionRecord(current, UpdateStatus.UPDATE_COMPLETED, ProposedAction.NONE),
                new ActionRecord(unknown, UpdateStatus.UNKNOWN, ProposedAction.NONE),
                new ActionRecord(session, UpdateStatus.RESTART_REQUIRED, ProposedAction.NAG));
    }

    @Test
    void testAggregate_GroupsCombinedRecords() {
        RunCounters counters = new RunCounters(STARTED);
        counters.recordRestartRequested();
        counters.recordNagSent();
        counters.recordRestartCompleted();

        RunSummary summary = aggregator.aggregate("r1", false, Map.of("site-1", "http://a"), List.of(), records,
                counters, new MonitorResult(true, 1, 0, List.of(), false, Duration.ofSeconds(3)), Duration.ofSeconds(42));

        assertThat(summary.getMachinesAnalysed()).isEqualTo(3);
        assertThat(summary.getSessionsAnalysed()).isEqualTo(1);
        assertThat(summary.getByUpdateStatus()).containsOnly(
                Map.entry("RestartRequired", 2L), Map.entry("UpdateCompleted", 1L), Map.entry("Unknown", 1L));
        assertThat(summary.getByProposedAction()).containsOnly(
                Map.entry("Restart", 1L), Map.entry("None", 2L), Map.entry("Nag", 1L));
        assertThat(summary.getByDiskImage()).containsOnly(
                Map.entry("XDP07SLHS-230301.vhd", 2L), Map.entry("XDP07SLHS-230401.vhd", 1L), Map.entry("(unresolved)", 1L));
        assertThat(summary.getRestartsRequested()).isEqualTo(1);
        assertThat(summary.getRestartsSucceeded()).isEqualTo(1);
        assertThat(summary.getRestartsPending()).isZero();
        assertThat(summary.getNagsSent()).isEqualTo(1);
        assertThat(summary.getElapsedSeconds()).isEqualTo(42);
        assertThat(summary.getStartedAt()).isEqualTo(STARTED);
    }

    @Test
    void testAggregate_ReportsTasksStillPendingAfterTimeout() {
        RunCounters counters = new RunCounters(STARTED);
        counters.recordRestartRequested();
        PendingTask stuck = new PendingTask("t9", "http://a", "site-1", "DOM\\m1", STARTED);

        RunSummary summary = aggregator.aggregate("r1", false, Map.of("site-1", "http://a"), List.of("site-1"), records,
                counters, new MonitorResult(true, 0, 0, List.of(stuck), true, Duration.ofMinutes(30)), Duration.ofMinutes(31));

        assertThat(summary.isMonitorTimedOut()).isTrue();
        assertThat(summary.getRestartsPending()).isEqualTo(1);
        assertThat(summary.getPendingTasks()).singleElement().asString().contains("t9").contains("site-1");
        assertThat(summary.getDeferredSites()).containsExactly("site-1");
    }

    @Test
    void testAggregate_UnmonitoredRunCountsRequestedRestartsAsPending() {
        RunCounters counters = new RunCounters(STARTED);
        counters.recordRestartRequested();
        counters.recordRestartRequested();

        RunSummary summary = aggregator.aggregate("r1", false, Map.of("site-1", "http://a"), List.of(), records,
                counters, MonitorResult.notMonitored(List.of()), Duration.ofSeconds(5));

        assertThat(summary.isMonitored()).isFalse();
        assertThat(summary.getRestartsPending()).isEqualTo(2);
    }

    @Test
    void testWriteJson_UsesSnakeCaseFields(@TempDir Path tempDir) throws Exception {
        RunSummary summary = aggregator.aggregate("r1", true, Map.of("site-1", "http://a"), List.of(), records,
                new RunCounters(STARTED), MonitorResult.notMonitored(List.of()), Duration.ofSeconds(1));
        aggregator.report(summary);
        Path output = tempDir.resolve("reports/summary.json");

        aggregator.writeJson(summary, output);

        JsonNode json = objectMapper.readTree(output.toFile());
        assertThat(json.path("rollout_id").asText()).isEqualTo("r1");
        assertThat(json.path("simulate").asBoolean()).isTrue();
        assertThat(json.path("by_update_status").path("RestartRequired").asLong()).isEqualTo(2);
        assertThat(json.path("machines_analysed").asInt()).isEqualTo(3);
    }

    private static Machine machine(String id, String diskImage) {
        Machine machine = new Machine(id, "DOM\\" + id, id + ".example.com", "Pool-A", AvailabilityState.AVAILABLE);
        machine.setDiskImage(diskImage);
        return machine;
    }
}
