package io.clusterreconciler.artifacts;

import io.clusterreconciler.ReconcilerException;
import io.clusterreconciler.enums.ErrorKind;

/**
 * Thrown when an artifact batch could not be rendered or committed.
 * The previously committed artifact tree is left in place.
 */
public class ArtifactWriteException extends ReconcilerException {
    
    public ArtifactWriteException(String message) {
        super(ErrorKind.ARTIFACT_WRITE, message);
    }
    
    public ArtifactWriteException(String message, Throwable cause) {
        super(ErrorKind.ARTIFACT_WRITE, message, cause);
    }
}
