package io.clusterreconciler.pipeline;

import io.clusterreconciler.ReconcilerException;
import io.clusterreconciler.clients.ExecutionResult;
import io.clusterreconciler.enums.ErrorKind;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The deployment executor failed for some nodes. The cluster may run mixed configurations.
 */
@Getter
public class DeployException extends ReconcilerException {
    
    private final List<ExecutionResult> failures;
    
    public DeployException(List<ExecutionResult> failures) {
        super(ErrorKind.DEPLOY, "Deployment failed for " + failures.stream()
                .map(ExecutionResult::getTarget)
                .collect(Collectors.joining(", ")) + "; the cluster may be running mixed configurations");
        this.failures = List.copyOf(failures);
    }
}
