package io.clusterreconciler.cli;

/**
 * Thrown for command lines that cannot be understood.
 */
public class UsageException extends RuntimeException {
    
    public UsageException(String message) {
        super(message);
    }
}
