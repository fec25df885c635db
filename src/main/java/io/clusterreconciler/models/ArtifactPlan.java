package io.clusterreconciler.models;

import io.clusterreconciler.enums.ArtifactAction;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Full set of artifact changes computed for one reconciliation, applied as a single batch.
 */
@Data
@AllArgsConstructor
public class ArtifactPlan {
    
    // per-node artifacts, sorted by key
    private List<ArtifactChange> artifacts;
    
    private ArtifactChange descriptor;
    
    public boolean hasChanges() {
        return descriptor.getAction().isChange()
                || artifacts.stream().anyMatch(change -> change.getAction().isChange());
    }
    
    public List<String> keysWith(ArtifactAction action) {
        return artifacts.stream()
                .filter(change -> change.getAction() == action)
                .map(ArtifactChange::getKey)
                .collect(Collectors.toList());
    }
}
