package io.clusterreconciler.models;

import io.clusterreconciler.enums.ErrorKind;
import io.clusterreconciler.enums.PipelinePhase;
import io.clusterreconciler.enums.ResultStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one pipeline phase for one node; one row of the status table.
 */
@Data
@Builder
@AllArgsConstructor
public class NodeResult {
    
    private String node;
    
    private PipelinePhase phase;
    
    private ResultStatus status;
    
    // null on success
    private ErrorKind kind;
    
    private String message;
    
    public static NodeResult success(String node, PipelinePhase phase, String message) {
        return new NodeResult(node, phase, ResultStatus.SUCCESS, null, message);
    }
    
    public static NodeResult warning(String node, PipelinePhase phase, ErrorKind kind, String message) {
        return new NodeResult(node, phase, ResultStatus.WARNING, kind, message);
    }
    
    public static NodeResult error(String node, PipelinePhase phase, ErrorKind kind, String message) {
        return new NodeResult(node, phase, ResultStatus.ERROR, kind, message);
    }
    
    public static NodeResult skipped(String node, PipelinePhase phase, String message) {
        return new NodeResult(node, phase, ResultStatus.SKIPPED, null, message);
    }
    
    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }
}
