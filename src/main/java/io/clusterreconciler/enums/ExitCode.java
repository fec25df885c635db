package io.clusterreconciler.enums;

/**
 * Process exit codes of the command line runner.
 */
public enum ExitCode {
    SUCCESS(0),
    FAILURE(1),
    USAGE(2),
    DEGRADED(3),
    CANCELLED(4);
    
    private final int code;
    
    ExitCode(int code) {
        this.code = code;
    }
    
    public int getCode() {
        return code;
    }
}
