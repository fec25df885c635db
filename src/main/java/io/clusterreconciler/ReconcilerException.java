package io.clusterreconciler;

import io.clusterreconciler.enums.ErrorKind;
import lombok.Getter;

/**
 * Base class for failures that carry a place in the error taxonomy.
 */
@Getter
public class ReconcilerException extends RuntimeException {
    
    private final ErrorKind kind;
    
    public ReconcilerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
    
    public ReconcilerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
