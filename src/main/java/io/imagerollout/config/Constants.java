package io.imagerollout.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_ROLLOUT_ID = "image-rollout";
    public static final String DEFAULT_BROKER_ENDPOINT = "http://localhost:8090";
    public static final String DEFAULT_DESKTOP_GROUP = "*";
    public static final String DEFAULT_NOTIFICATION_TITLE = "Restart required";
    public static final String DEFAULT_NOTIFICATION_TEXT =
            "A new desktop image is available. Please save your work, log off and log on again.";
    public static final int DEFAULT_MAX_RECORDS = 10000;
    public static final int DEFAULT_MAX_RESTART_ACTIONS = 50;
    public static final int DEFAULT_QUERY_CONCURRENCY = 32;
    public static final long DEFAULT_QUERY_TIMEOUT_SECONDS = 60L;
    public static final double DEFAULT_SESSION_IDLE_HOURS = 4.0;
    public static final long DEFAULT_MONITOR_TIMEOUT_MINUTES = 30L;
    public static final long DEFAULT_MONITOR_POLL_INTERVAL_SECONDS = 5L;
    public static final long DEFAULT_BROKER_REQUEST_TIMEOUT_SECONDS = 30L;
    public static final int DEFAULT_DISK_IMAGE_AGENT_PORT = 8085;
    public static final String DEFAULT_DISK_IMAGE_AGENT_PATH = "/disk-image";

    // Broker REST paths
    public static final String PATH_HEALTH = "/api/health";
    public static final String PATH_SITE = "/api/site";
    public static final String PATH_MACHINES = "/api/machines";
    public static final String PATH_SESSIONS = "/api/sessions";
    public static final String PATH_POWER_ACTIONS = "/api/power-actions";
    public static final String SUFFIX_POWER_ACTIONS = "power-actions";
    public static final String SUFFIX_MESSAGES = "messages";

    // Power action names
    public static final String POWER_ACTION_RESTART = "Restart";

    // Placeholder used when grouping desktops without a resolved disk image
    public static final String UNRESOLVED_DISK_IMAGE = "(unresolved)";
}
