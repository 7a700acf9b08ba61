package io.imagerollout.config;

import io.imagerollout.enums.SearchScope;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static io.imagerollout.config.Constants.*;

/**
 * Run-scoped configuration for an image rollout.
 * Loads configuration from application.yml with fallbacks to constants. Every value is resolved once
 * at startup and stays fixed for the duration of the run.
 */
@Slf4j
@Getter
public class RolloutConfig {

    private final String rolloutId;
    private final List<String> endpoints;
    // null when the configured scope could not be parsed; validate() rejects that
    private final SearchScope searchScope;
    @Getter(AccessLevel.NONE)
    private final String searchScopeSetting;
    private final String desktopGroup;
    private final String notificationTitle;
    private final String notificationText;
    private final String allVersionsPattern;
    private final String targetVersionPattern;
    private final int maxRecords;
    private final int maxRestartActions;
    private final int queryConcurrency;
    private final Duration queryTimeout;
    private final Duration sessionIdleThreshold;
    private final boolean asynchronous;
    private final Duration monitorTimeout;
    private final Duration monitorPollInterval;
    private final boolean simulate;
    private final Duration brokerRequestTimeout;
    private final int diskImageAgentPort;
    private final String diskImageAgentPath;
    private final String reportOutputFile;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "ROLLOUT_CONFIG_FILE";

    public RolloutConfig() {
        this(loadYamlConfig());
    }

    public RolloutConfig(ConfigModel config) {
        ConfigModel model = config != null ? config : new ConfigModel();
        Rollout rollout = model.getRollout() != null ? model.getRollout() : new Rollout();

        this.rolloutId = textOrDefault(rollout.getId(), DEFAULT_ROLLOUT_ID);
        this.endpoints = parseEndpoints(rollout);
        this.searchScopeSetting = rollout.getSearchScope();
        this.searchScope = parseSearchScope(searchScopeSetting);
        this.desktopGroup = textOrDefault(rollout.getDesktopGroup(), DEFAULT_DESKTOP_GROUP);
        this.maxRecords = positiveOrDefault(rollout.getMaxRecords(), DEFAULT_MAX_RECORDS, "rollout.maxRecords");
        this.maxRestartActions = nonNegativeOrDefault(rollout.getMaxRestartActions(), DEFAULT_MAX_RESTART_ACTIONS);
        this.simulate = Boolean.TRUE.equals(rollout.getSimulate());

        Patterns patterns = model.getPatterns() != null ? model.getPatterns() : new Patterns();
        this.allVersionsPattern = patterns.getAllVersions();
        this.targetVersionPattern = patterns.getTargetVersion();

        Notification notification = model.getNotification() != null ? model.getNotification() : new Notification();
        this.notificationTitle = textOrDefault(notification.getTitle(), DEFAULT_NOTIFICATION_TITLE);
        this.notificationText = textOrDefault(notification.getText(), DEFAULT_NOTIFICATION_TEXT);

        Query query = model.getQuery() != null ? model.getQuery() : new Query();
        this.queryConcurrency = positiveOrDefault(query.getConcurrency(), DEFAULT_QUERY_CONCURRENCY, "query.concurrency");
        this.queryTimeout = Duration.ofSeconds(
                positiveOrDefault(query.getTimeoutSeconds(), DEFAULT_QUERY_TIMEOUT_SECONDS, "query.timeoutSeconds"));

        SessionSettings session = model.getSession() != null ? model.getSession() : new SessionSettings();
        this.sessionIdleThreshold = parseIdleThreshold(session);

        Monitor monitor = model.getMonitor() != null ? model.getMonitor() : new Monitor();
        this.asynchronous = Boolean.TRUE.equals(monitor.getAsynchronous());
        this.monitorTimeout = Duration.ofMinutes(
                positiveOrDefault(monitor.getTimeoutMinutes(), DEFAULT_MONITOR_TIMEOUT_MINUTES, "monitor.timeoutMinutes"));
        this.monitorPollInterval = Duration.ofSeconds(
                positiveOrDefault(monitor.getPollIntervalSeconds(), DEFAULT_MONITOR_POLL_INTERVAL_SECONDS, "monitor.pollIntervalSeconds"));

        Broker broker = model.getBroker() != null ? model.getBroker() : new Broker();
        this.brokerRequestTimeout = Duration.ofSeconds(
                positiveOrDefault(broker.getRequestTimeoutSeconds(), DEFAULT_BROKER_REQUEST_TIMEOUT_SECONDS, "broker.requestTimeoutSeconds"));

        DiskImageAgent agent = model.getDiskImageAgent() != null ? model.getDiskImageAgent() : new DiskImageAgent();
        this.diskImageAgentPort = positiveOrDefault(agent.getPort(), DEFAULT_DISK_IMAGE_AGENT_PORT, "diskImageAgent.port");
        this.diskImageAgentPath = textOrDefault(agent.getPath(), DEFAULT_DISK_IMAGE_AGENT_PATH);

        Report report = model.getReport() != null ? model.getReport() : new Report();
        this.reportOutputFile = report.getOutputFile() != null && !report.getOutputFile().isBlank()
                ? report.getOutputFile().trim() : null;

        log.info("Loaded rollout config - endpoints: {}, scope: {}, desktop group: '{}', max restarts: {}, simulate: {}",
                String.join(", ", endpoints), searchScope != null ? searchScope.getValue() : searchScopeSetting, desktopGroup, maxRestartActions, simulate);
    }

    /**
     * Fail fast on settings without which no run can be meaningful.
     *
     * @throws IllegalStateException if the endpoint list is empty, the search scope is not recognised,
     *                               or an image pattern is missing or invalid
     */
    public void validate() {
        if (endpoints.isEmpty()) {
            throw new IllegalStateException("At least one broker endpoint must be configured");
        }
        if (searchScope == null) {
            throw new IllegalStateException("Invalid rollout.searchScope '" + searchScopeSetting
                    + "', expected one of AvailableMachines, MachinesWithSessions, Both");
        }
        requirePattern("patterns.allVersions", allVersionsPattern);
        requirePattern("patterns.targetVersion", targetVersionPattern);
    }

    private static void requirePattern(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required setting: " + key);
        }
        try {
            Pattern.compile(value);
        } catch (PatternSyntaxException e) {
            throw new IllegalStateException("Invalid regular expression for " + key + ": " + e.getMessage(), e);
        }
    }

    private static ConfigModel loadYamlConfig() {
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(EXTERNAL_CONFIG_ENV_VAR);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", DEFAULT_CONFIG_FILE_CLASSPATH);
            inputStream = RolloutConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try (InputStream in = inputStream) {
            ConfigModel config = parse(in);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config;
        } catch (IOException e) {
            log.error("Error closing config file input stream: {}", e.getMessage());
            return new ConfigModel();
        }
    }

    /**
     * Parse a YAML document into the configuration model. Parse errors yield an empty model.
     */
    public static ConfigModel parse(InputStream inputStream) {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        try {
            ConfigModel config = yaml.load(inputStream);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration: {}. Using defaults.", e.getMessage());
            return new ConfigModel();
        }
    }

    private static List<String> parseEndpoints(Rollout rollout) {
        if (rollout.getEndpoints() != null) {
            List<String> endpoints = rollout.getEndpoints().stream()
                    .filter(e -> e != null && !e.isBlank())
                    .map(String::trim)
                    .distinct()
                    .toList();
            if (!endpoints.isEmpty()) {
                return endpoints;
            }
        }
        return List.of(DEFAULT_BROKER_ENDPOINT);
    }

    private static SearchScope parseSearchScope(String value) {
        if (value == null || value.isBlank()) {
            return SearchScope.BOTH;
        }
        try {
            return SearchScope.fromString(value);
        } catch (IllegalArgumentException e) {
            log.error("Failed to parse search scope '{}': {}", value, e.getMessage());
            return null;
        }
    }

    private static Duration parseIdleThreshold(SessionSettings session) {
        double hours = DEFAULT_SESSION_IDLE_HOURS;
        if (session.getIdleHours() != null) {
            if (session.getIdleHours() >= 0) {
                hours = session.getIdleHours();
            } else {
                log.warn("Ignoring negative session.idleHours {}, using default {}", session.getIdleHours(), hours);
            }
        }
        return Duration.ofSeconds(Math.round(hours * 3600));
    }

    private static String textOrDefault(String value, String defaultValue) {
        return value != null && !value.isBlank() ? value : defaultValue;
    }

    private static int positiveOrDefault(Integer value, int defaultValue, String key) {
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            log.warn("Ignoring non-positive {} {}, using default {}", key, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private static long positiveOrDefault(Long value, long defaultValue, String key) {
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            log.warn("Ignoring non-positive {} {}, using default {}", key, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private static int nonNegativeOrDefault(Integer value, int defaultValue) {
        if (value == null || value < 0) {
            return defaultValue;
        }
        return value;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Rollout rollout;
        private Patterns patterns;
        private Notification notification;
        private Query query;
        private SessionSettings session;
        private Monitor monitor;
        private Broker broker;
        private DiskImageAgent diskImageAgent;
        private Report report;
        private Map<String, Object> logging; // Consumed by Spring Boot
    }

    @Data
    public static class Rollout {
        private String id;
        private List<String> endpoints;
        private String searchScope;
        private String desktopGroup;
        private Integer maxRecords;
        private Integer maxRestartActions;
        private Boolean simulate;
    }

    @Data
    public static class Patterns {
        private String allVersions;
        private String targetVersion;
    }

    @Data
    public static class Notification {
        private String title;
        private String text;
    }

    @Data
    public static class Query {
        private Integer concurrency;
        private Long timeoutSeconds;
    }

    @Data
    public static class SessionSettings {
        private Double idleHours;
    }

    @Data
    public static class Monitor {
        private Boolean asynchronous;
        private Long timeoutMinutes;
        private Long pollIntervalSeconds;
    }

    @Data
    public static class Broker {
        private Long requestTimeoutSeconds;
    }

    @Data
    public static class DiskImageAgent {
        private Integer port;
        private String path;
    }

    @Data
    public static class Report {
        private String outputFile;
    }
}
