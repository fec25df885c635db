package io.clusterreconciler.enums;

/**
 * States of one deployment pipeline run.
 */
public enum PipelineState {
    LOADING,
    RECONCILING_ARTIFACTS,
    DECOMMISSIONING,
    EVALUATING,
    AWAITING_CONFIRMATION,
    DEPLOYING,
    VERIFYING,
    COMPLETED,
    CANCELLED,
    FAILED
}
