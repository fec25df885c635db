package io.clusterreconciler.enums;

/**
 * What the artifact reconciler does with one artifact.
 */
public enum ArtifactAction {
    CREATE,
    UPDATE,
    UNCHANGED,
    DELETE;
    
    public boolean isChange() {
        return this != UNCHANGED;
    }
}
