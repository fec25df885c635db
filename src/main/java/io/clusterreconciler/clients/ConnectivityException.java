package io.clusterreconciler.clients;

import io.clusterreconciler.ReconcilerException;
import io.clusterreconciler.enums.ErrorKind;

/**
 * Thrown when the control plane or a remote node cannot be reached.
 * Never to be read as "nothing there".
 */
public class ConnectivityException extends ReconcilerException {
    
    public ConnectivityException(String message) {
        super(ErrorKind.CONNECTIVITY, message);
    }
    
    public ConnectivityException(String message, Throwable cause) {
        super(ErrorKind.CONNECTIVITY, message, cause);
    }
}
