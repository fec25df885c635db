package io.clusterreconciler.clients;

public enum RemoteOutcome {
    SUCCESS,
    UNREACHABLE
}
