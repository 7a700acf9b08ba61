package io.imagerollout;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.imagerollout.broker.BrokerClient;
import io.imagerollout.classification.PatternClassifier;
import io.imagerollout.config.RolloutConfig;
import io.imagerollout.enums.AvailabilityState;
import io.imagerollout.enums.PowerActionOutcome;
import io.imagerollout.enums.ServiceStatus;
import io.imagerollout.enums.SessionState;
import io.imagerollout.execution.ActionExecutor;
import io.imagerollout.health.EndpointHealthSelector;
import io.imagerollout.health.NoHealthyEndpointException;
import io.imagerollout.inventory.DiskImageResolver;
import io.imagerollout.inventory.InventoryCollector;
import io.imagerollout.metrics.MetricsProvider;
import io.imagerollout.models.EndpointHealth;
import io.imagerollout.models.Machine;
import io.imagerollout.models.PowerActionStatus;
import io.imagerollout.models.Session;
import io.imagerollout.monitor.PowerActionMonitor;
import io.imagerollout.planning.ActionPlanner;
import io.imagerollout.report.ReportAggregator;
import io.imagerollout.report.RunSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static io.imagerollout.metrics.MetricsConstants.INVENTORY_PASS_DURATION_METRIC_NAME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RolloutManagerTest {

    private static final String SITE_1 = "http://broker-1:8090";
    private static final String SITE_2 = "http://broker-2:8090";
    private static final String OUTDATED = "XDP07SLHS-230301.vhd";
    private static final String CURRENT = "XDP07SLHS-230401.vhd";
    private static final EndpointHealth HEALTHY = new EndpointHealth(ServiceStatus.OK, ServiceStatus.OK);

    @Mock
    private BrokerClient brokerClient;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    private final Map<String, String> diskImages = Map.of(
            "m1.example.com", OUTDATED,
            "m2.example.com", CURRENT,
            "m3.example.com", OUTDATED);
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
    }

    @Test
    void testRun_MachineRestartDefersSessionPassOfThatSiteOnly() throws Exception {
        // Given: site-1 has one outdated available machine and no sessions,
        // site-2 has an up-to-date machine and one active outdated session
        stubTwoHealthySites();
        when(brokerClient.listAvailableMachines(SITE_1, "*", 1000)).thenReturn(List.of(machine("m1")));
        when(brokerClient.listAvailableMachines(SITE_2, "*", 1000)).thenReturn(List.of(machine("m2")));
        when(brokerClient.listSessions(SITE_2, "*", 1000)).thenReturn(List.of(activeSession("s3", "m3")));
        when(brokerClient.refreshMachine(SITE_1, "m1")).thenReturn(Optional.of(machine("m1")));
        when(brokerClient.submitRestart(SITE_1, "m1")).thenReturn("task-1");
        when(brokerClient.refreshSession(SITE_2, "s3")).thenReturn(Optional.of(activeSession("s3", "m3")));
        when(brokerClient.submitNotification(eq(SITE_2), eq("s3"), anyString(), anyString())).thenReturn(true);
        when(brokerClient.pollTask(SITE_1, "task-1")).thenReturn(
                PowerActionStatus.completed("task-1", PowerActionOutcome.SUCCEEDED, OffsetDateTime.now(clock)));

        RunSummary summary = manager(config("Both", false, null)).run();

        assertThat(summary.getSites()).containsOnlyKeys("site-1", "site-2");
        assertThat(summary.getDeferredSites()).containsExactly("site-1");
        assertThat(summary.getRestartsRequested()).isEqualTo(1);
        assertThat(summary.getRestartsSucceeded()).isEqualTo(1);
        assertThat(summary.getRestartsPending()).isZero();
        assertThat(summary.getNagsSent()).isEqualTo(1);
        assertThat(summary.getMachinesAnalysed()).isEqualTo(2);
        assertThat(summary.getSessionsAnalysed()).isEqualTo(1);
        verify(brokerClient, never()).listSessions(eq(SITE_1), anyString(), anyInt());
        assertThat(registry.find(INVENTORY_PASS_DURATION_METRIC_NAME).timers()).hasSize(3);
    }

    @Test
    void testRun_AvailableMachinesScopeSkipsSessions() throws Exception {
        stubTwoHealthySites();
        when(brokerClient.listAvailableMachines(anyString(), anyString(), anyInt())).thenReturn(List.of());

        RunSummary summary = manager(config("AvailableMachines", false, null)).run();

        assertThat(summary.getMachinesAnalysed()).isZero();
        verify(brokerClient, never()).listSessions(anyString(), anyString(), anyInt());
    }

    @Test
    void testRun_SessionsScopeSkipsMachinePassAndGate() throws Exception {
        stubTwoHealthySites();
        when(brokerClient.listSessions(anyString(), anyString(), anyInt())).thenReturn(List.of());

        RunSummary summary = manager(config("MachinesWithSessions", false, null)).run();

        assertThat(summary.getDeferredSites()).isEmpty();
        verify(brokerClient, never()).listAvailableMachines(anyString(), anyString(), anyInt());
    }

    @Test
    void testRun_AsynchronousRunDoesNotPoll(@TempDir Path tempDir) throws Exception {
        stubTwoHealthySites();
        when(brokerClient.listAvailableMachines(SITE_1, "*", 1000)).thenReturn(List.of(machine("m1")));
        when(brokerClient.listAvailableMachines(SITE_2, "*", 1000)).thenReturn(List.of());
        when(brokerClient.listSessions(SITE_2, "*", 1000)).thenReturn(List.of());
        when(brokerClient.refreshMachine(SITE_1, "m1")).thenReturn(Optional.of(machine("m1")));
        when(brokerClient.submitRestart(SITE_1, "m1")).thenReturn("task-1");
        Path output = tempDir.resolve("summary.json");

        RunSummary summary = manager(config("Both", true, output.toString())).run();

        assertThat(summary.isMonitored()).isFalse();
        assertThat(summary.getRestartsPending()).isEqualTo(1);
        assertThat(Files.exists(output)).isTrue();
        verify(brokerClient, never()).pollTask(anyString(), anyString());
    }

    @Test
    void testRun_NoHealthyEndpointAbortsBeforeAnalysis() throws Exception {
        when(brokerClient.probe(anyString())).thenReturn(EndpointHealth.offline());

        assertThatThrownBy(() -> manager(config("Both", false, null)).run())
                .isInstanceOf(NoHealthyEndpointException.class);
        verify(brokerClient, never()).listAvailableMachines(anyString(), anyString(), anyInt());
    }

    private void stubTwoHealthySites() throws Exception {
        when(brokerClient.probe(SITE_1)).thenReturn(HEALTHY);
        when(brokerClient.probe(SITE_2)).thenReturn(HEALTHY);
        lenient().when(brokerClient.siteOf(SITE_1)).thenReturn(Optional.of("site-1"));
        lenient().when(brokerClient.siteOf(SITE_2)).thenReturn(Optional.of("site-2"));
    }

    private RolloutManager manager(RolloutConfig config) {
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        MetricsProvider metricsProvider = new MetricsProvider(registry, config.getRolloutId());
        DiskImageResolver resolver = new DiskImageResolver(
                (host, timeout) -> Optional.ofNullable(diskImages.get(host)), 4, Duration.ofSeconds(5));
        InventoryCollector collector = new InventoryCollector(brokerClient, resolver, config.getDesktopGroup(),
                config.getMaxRecords());
        ActionPlanner planner = new ActionPlanner(
                new PatternClassifier(config.getAllVersionsPattern(), config.getTargetVersionPattern()),
                config.getSessionIdleThreshold(), clock);
        ActionExecutor executor = new ActionExecutor(brokerClient, planner, metricsProvider,
                config.getMaxRestartActions(), config.isSimulate(), config.getNotificationTitle(),
                config.getNotificationText(), new Random(7), clock);
        PowerActionMonitor monitor = new PowerActionMonitor(brokerClient, metricsProvider,
                Duration.ofSeconds(10), Duration.ofMillis(20));
        return new RolloutManager(config, new EndpointHealthSelector(brokerClient), collector, planner, executor,
                monitor, new ReportAggregator(objectMapper), metricsProvider, clock);
    }

    private static RolloutConfig config(String scope, boolean asynchronous, String outputFile) {
        RolloutConfig.ConfigModel model = new RolloutConfig.ConfigModel();
        RolloutConfig.Rollout rollout = new RolloutConfig.Rollout();
        rollout.setId("test-rollout");
        rollout.setEndpoints(List.of(SITE_1, SITE_2));
        rollout.setSearchScope(scope);
        rollout.setMaxRecords(1000);
        rollout.setMaxRestartActions(10);
        model.setRollout(rollout);
        RolloutConfig.Patterns patterns = new RolloutConfig.Patterns();
        patterns.setAllVersions("XDP07SLHS-\\d{6}\\.vhd");
        patterns.setTargetVersion("XDP07SLHS-230401\\.vhd");
        model.setPatterns(patterns);
        RolloutConfig.Monitor monitor = new RolloutConfig.Monitor();
        monitor.setAsynchronous(asynchronous);
        model.setMonitor(monitor);
        RolloutConfig.Report report = new RolloutConfig.Report();
        report.setOutputFile(outputFile);
        model.setReport(report);
        RolloutConfig config = new RolloutConfig(model);
        config.validate();
        return config;
    }

    private static Machine machine(String id) {
        return new Machine(id, "DOM\\" + id, id + ".example.com", "Pool-A", AvailabilityState.AVAILABLE);
    }

    private Session activeSession(String id, String machineId) {
        Session session = new Session(id, machineId, "DOM\\" + machineId, machineId + ".example.com", "Pool-A",
                SessionState.ACTIVE, OffsetDateTime.now(clock).minusHours(8));
        session.setUserName("alice");
        return session;
    }
}
