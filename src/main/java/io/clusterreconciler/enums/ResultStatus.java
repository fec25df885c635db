package io.clusterreconciler.enums;

/**
 * Outcome of one phase for one node, as shown in the status table.
 */
public enum ResultStatus {
    SUCCESS,
    WARNING,
    ERROR,
    SKIPPED
}
