package io.clusterreconciler.pipeline;

import io.clusterreconciler.artifacts.ArtifactStore;
import io.clusterreconciler.enums.PipelineState;
import io.clusterreconciler.models.ClusterSpec;
import io.clusterreconciler.models.NodeResult;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * State threaded through one pipeline run: the loaded spec, the artifact store and the per-node
 * results accumulated by every phase.
 */
@Slf4j
@Getter
public class ReconciliationContext {
    
    private final PipelineOptions options;
    private final ArtifactStore artifactStore;
    private final List<NodeResult> results = new ArrayList<>();
    
    @Setter
    private ClusterSpec spec;
    
    private PipelineState state;
    
    public ReconciliationContext(PipelineOptions options, ArtifactStore artifactStore) {
        this.options = options;
        this.artifactStore = artifactStore;
    }
    
    public void transition(PipelineState next) {
        log.info("Pipeline - {} -> {}", state, next);
        this.state = next;
    }
    
    public synchronized void addResult(NodeResult result) {
        results.add(result);
    }
    
    public synchronized void addResults(Collection<NodeResult> phaseResults) {
        results.addAll(phaseResults);
    }
    
    public synchronized List<NodeResult> getResults() {
        return List.copyOf(results);
    }
}
