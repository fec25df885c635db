package io.clusterreconciler.pipeline;

import io.clusterreconciler.ReconcilerException;
import io.clusterreconciler.clients.ExecutionResult;
import io.clusterreconciler.enums.ErrorKind;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more targets failed evaluation. Blocks deployment.
 */
@Getter
public class BuildException extends ReconcilerException {
    
    private final List<ExecutionResult> failures;
    
    public BuildException(List<ExecutionResult> failures) {
        super(ErrorKind.BUILD, "Evaluation failed for " + failures.stream()
                .map(ExecutionResult::getTarget)
                .collect(Collectors.joining(", ")));
        this.failures = List.copyOf(failures);
    }
}
