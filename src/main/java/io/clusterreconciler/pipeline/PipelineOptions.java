package io.clusterreconciler.pipeline;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * Operator choices for one pipeline run.
 */
@Getter
@Builder
@ToString
public class PipelineOptions {
    
    private final Path topologyFile;
    
    // no mutating call at all, artifacts included
    private final boolean dryRun;
    
    // run the decommission phase
    private final boolean cleanup;
    
    private final boolean skipDeploy;
    
    private final boolean assumeYes;
    
    private final boolean allowServerRemoval;
    
    private final boolean validateOnly;
}
