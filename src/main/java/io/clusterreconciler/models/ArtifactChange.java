package io.clusterreconciler.models;

import io.clusterreconciler.enums.ArtifactAction;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One entry of an artifact plan. Content is null for deletions.
 */
@Data
@AllArgsConstructor
public class ArtifactChange {
    
    private String key;
    
    private ArtifactAction action;
    
    private String content;
}
