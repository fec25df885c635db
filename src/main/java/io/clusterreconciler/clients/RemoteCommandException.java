package io.clusterreconciler.clients;

import io.clusterreconciler.ReconcilerException;
import io.clusterreconciler.enums.ErrorKind;
import lombok.Getter;

/**
 * Thrown when a remote command ran but failed.
 */
@Getter
public class RemoteCommandException extends ReconcilerException {
    
    private final int exitCode;
    
    public RemoteCommandException(String message, int exitCode) {
        super(ErrorKind.REMOTE_COMMAND, message);
        this.exitCode = exitCode;
    }
}
