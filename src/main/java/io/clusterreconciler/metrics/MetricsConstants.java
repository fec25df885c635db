package io.clusterreconciler.metrics;

/**
 * Constants for metrics names and tags used by the reconciler.
 */
public class MetricsConstants {
    public final static String ARTIFACTS_CREATED_METRIC_NAME = "artifacts_created";
    public final static String ARTIFACTS_UPDATED_METRIC_NAME = "artifacts_updated";
    public final static String ARTIFACTS_DELETED_METRIC_NAME = "artifacts_deleted";
    public final static String STALE_MEMBERS_METRIC_NAME = "stale_members";
    public final static String DECOMMISSION_TRANSITIONS_METRIC_NAME = "decommission_stage_transitions";
    public final static String DECOMMISSION_WARNINGS_METRIC_NAME = "decommission_warnings";
    public final static String PHASE_DURATION_METRIC_NAME = "pipeline_phase_duration";
    public final static String VERIFICATION_FAILURES_METRIC_NAME = "verification_failures";
    public final static String CLUSTER_TAG = "cluster";
    public final static String STAGE_TAG = "stage";
    public final static String PHASE_TAG = "phase";

    private MetricsConstants() {}
}
