package io.clusterreconciler.decommission;

import io.clusterreconciler.ReconcilerException;
import io.clusterreconciler.enums.ErrorKind;

/**
 * Thrown before any mutating call when a decommission run would violate a safety precondition.
 */
public class DecommissionPreconditionException extends ReconcilerException {
    
    public DecommissionPreconditionException(String message) {
        super(ErrorKind.PRECONDITION, message);
    }
}
