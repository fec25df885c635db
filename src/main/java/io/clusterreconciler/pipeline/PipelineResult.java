package io.clusterreconciler.pipeline;

import io.clusterreconciler.enums.ExitCode;
import io.clusterreconciler.enums.PipelineState;
import io.clusterreconciler.models.NodeResult;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class PipelineResult {
    
    private final PipelineState state;
    
    private final ExitCode exitCode;
    
    private final List<NodeResult> results;
}
