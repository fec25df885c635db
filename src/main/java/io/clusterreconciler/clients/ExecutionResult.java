package io.clusterreconciler.clients;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Success signal of one external evaluation or deployment.
 */
@Getter
@ToString
@AllArgsConstructor
public class ExecutionResult {
    
    private final String target;
    
    private final boolean success;
    
    // last output line on failure
    private final String detail;
}
