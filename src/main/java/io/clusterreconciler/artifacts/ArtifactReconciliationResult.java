package io.clusterreconciler.artifacts;

import io.clusterreconciler.models.ArtifactPlan;
import io.clusterreconciler.models.NodeResult;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * What one artifact reconciliation computed and whether it was written.
 */
@Getter
@AllArgsConstructor
public class ArtifactReconciliationResult {
    
    private final ArtifactPlan plan;
    
    // false when there was nothing to change or in dry-run
    private final boolean applied;
    
    private final List<NodeResult> nodeResults;
}
