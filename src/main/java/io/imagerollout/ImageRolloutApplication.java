package io.imagerollout;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.imagerollout.broker.BrokerClient;
import io.imagerollout.broker.HttpBrokerClient;
import io.imagerollout.classification.PatternClassifier;
import io.imagerollout.config.RolloutConfig;
import io.imagerollout.execution.ActionExecutor;
import io.imagerollout.health.EndpointHealthSelector;
import io.imagerollout.inventory.DiskImageQuery;
import io.imagerollout.inventory.DiskImageResolver;
import io.imagerollout.inventory.HttpDiskImageQuery;
import io.imagerollout.inventory.InventoryCollector;
import io.imagerollout.metrics.MetricsProvider;
import io.imagerollout.monitor.PowerActionMonitor;
import io.imagerollout.planning.ActionPlanner;
import io.imagerollout.report.ReportAggregator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

/**
 * Main Spring Boot application for the image rollout.
 *
 * The application runs a single rollout and exits. Components are plain classes wired here so each
 * one can be constructed directly in tests.
 */
@Slf4j
@SpringBootApplication
public class ImageRolloutApplication {

    public static void main(String[] args) {
        log.info("Starting image rollout");
        int exitCode;
        try {
            ConfigurableApplicationContext context = SpringApplication.run(ImageRolloutApplication.class, args);
            exitCode = SpringApplication.exit(context);
        } catch (Exception e) {
            log.error("Image rollout failed to start: {}", e.getMessage(), e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    @Bean
    public RolloutConfig rolloutConfig() {
        RolloutConfig config = new RolloutConfig();
        config.validate();
        log.info("Loaded configuration for rollout '{}'", config.getRolloutId());
        return config;
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public MetricsProvider metricsProvider(MeterRegistry meterRegistry, RolloutConfig config) {
        return new MetricsProvider(meterRegistry, config.getRolloutId());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BrokerClient brokerClient(ObjectMapper objectMapper, RolloutConfig config) {
        return new HttpBrokerClient(objectMapper, config.getBrokerRequestTimeout());
    }

    @Bean
    public DiskImageQuery diskImageQuery(ObjectMapper objectMapper, RolloutConfig config) {
        return new HttpDiskImageQuery(objectMapper, config.getDiskImageAgentPort(), config.getDiskImageAgentPath(),
                config.getQueryTimeout());
    }

    @Bean
    public DiskImageResolver diskImageResolver(DiskImageQuery diskImageQuery, RolloutConfig config) {
        return new DiskImageResolver(diskImageQuery, config.getQueryConcurrency(), config.getQueryTimeout());
    }

    @Bean
    public InventoryCollector inventoryCollector(BrokerClient brokerClient, DiskImageResolver diskImageResolver,
                                                 RolloutConfig config) {
        return new InventoryCollector(brokerClient, diskImageResolver, config.getDesktopGroup(), config.getMaxRecords());
    }

    @Bean
    public PatternClassifier patternClassifier(RolloutConfig config) {
        return new PatternClassifier(config.getAllVersionsPattern(), config.getTargetVersionPattern());
    }

    @Bean
    public ActionPlanner actionPlanner(PatternClassifier classifier, RolloutConfig config, Clock clock) {
        return new ActionPlanner(classifier, config.getSessionIdleThreshold(), clock);
    }

    @Bean
    public EndpointHealthSelector endpointHealthSelector(BrokerClient brokerClient) {
        return new EndpointHealthSelector(brokerClient);
    }

    @Bean
    public ActionExecutor actionExecutor(BrokerClient brokerClient, ActionPlanner actionPlanner,
                                         MetricsProvider metricsProvider, RolloutConfig config, Clock clock) {
        Random random = new SecureRandom();
        return new ActionExecutor(brokerClient, actionPlanner, metricsProvider, config.getMaxRestartActions(),
                config.isSimulate(), config.getNotificationTitle(), config.getNotificationText(), random, clock);
    }

    @Bean
    public PowerActionMonitor powerActionMonitor(BrokerClient brokerClient, MetricsProvider metricsProvider,
                                                 RolloutConfig config) {
        return new PowerActionMonitor(brokerClient, metricsProvider, config.getMonitorTimeout(),
                config.getMonitorPollInterval());
    }

    @Bean
    public ReportAggregator reportAggregator(ObjectMapper objectMapper) {
        return new ReportAggregator(objectMapper);
    }

    @Bean
    public RolloutManager rolloutManager(RolloutConfig config, EndpointHealthSelector healthSelector,
                                         InventoryCollector inventoryCollector, ActionPlanner actionPlanner,
                                         ActionExecutor actionExecutor, PowerActionMonitor powerActionMonitor,
                                         ReportAggregator reportAggregator, MetricsProvider metricsProvider,
                                         Clock clock) {
        return new RolloutManager(config, healthSelector, inventoryCollector, actionPlanner, actionExecutor,
                powerActionMonitor, reportAggregator, metricsProvider, clock);
    }

    @Bean
    public RolloutRunner rolloutRunner(RolloutManager rolloutManager) {
        return new RolloutRunner(rolloutManager);
    }
}
