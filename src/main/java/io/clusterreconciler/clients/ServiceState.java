package io.clusterreconciler.clients;

/**
 * Observed state of the k3s units on a host.
 */
public enum ServiceState {
    ACTIVE,
    INACTIVE,
    UNREACHABLE
}
