package io.clusterreconciler.enums;

/**
 * Failure taxonomy. VALIDATION, BUILD, DEPLOY, ARTIFACT_WRITE and PRECONDITION abort the pipeline;
 * the others are surfaced per node.
 */
public enum ErrorKind {
    VALIDATION,
    CONNECTIVITY,
    DRAIN_TIMEOUT_WARNING,
    BUILD,
    DEPLOY,
    VERIFICATION_WARNING,
    ARTIFACT_WRITE,
    PRECONDITION,
    REMOTE_COMMAND
}
