package io.clusterreconciler.clients;

/**
 * Result of draining one member.
 */
public enum DrainOutcome {
    COMPLETED,
    // evictions did not finish in time and the remaining pods were deleted without grace
    TIMED_OUT_FORCED
}
