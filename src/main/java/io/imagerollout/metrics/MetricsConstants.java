package io.imagerollout.metrics;

/**
 * Constants for metric names and tags published by a rollout run.
 */
public class MetricsConstants {
    public final static String NAGS_SENT_METRIC_NAME = "rollout_nags_sent";
    public final static String NAGS_FAILED_METRIC_NAME = "rollout_nags_failed";
    public final static String RESTARTS_REQUESTED_METRIC_NAME = "rollout_restarts_requested";
    public final static String RESTARTS_FAILED_METRIC_NAME = "rollout_restarts_failed";
    public final static String RESTARTS_SIMULATED_METRIC_NAME = "rollout_restarts_simulated";
    public final static String RESTARTS_COMPLETED_METRIC_NAME = "rollout_restarts_completed";
    public final static String PENDING_POWER_ACTIONS_METRIC_NAME = "rollout_pending_power_actions";
    public final static String MONITOR_ELAPSED_SECONDS_METRIC_NAME = "rollout_monitor_elapsed_seconds";
    public final static String INVENTORY_PASS_DURATION_METRIC_NAME = "rollout_inventory_pass_duration";
    public final static String ROLLOUT_ID_TAG = "rollout";
    public final static String SITE_TAG = "site";
    public final static String ENTITY_KIND_TAG = "entityKind";
    public final static String OUTCOME_TAG = "outcome";

    private MetricsConstants() {}
}
