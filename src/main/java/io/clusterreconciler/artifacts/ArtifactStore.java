package io.clusterreconciler.artifacts;

import io.clusterreconciler.models.ArtifactPlan;

import java.io.IOException;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Storage of generated artifacts keyed by node name, plus the aggregate descriptor.
 */
public interface ArtifactStore {
    
    /**
     * Keys of every artifact currently materialized.
     */
    SortedSet<String> listArtifactKeys() throws IOException;
    
    Optional<String> readArtifact(String key) throws IOException;
    
    Optional<String> readDescriptor() throws IOException;
    
    /**
     * Apply every change of the plan, or none of them.
     *
     * @throws ArtifactWriteException if the batch could not be committed; the previous state is kept
     */
    void apply(ArtifactPlan plan);
    
    /**
     * Human readable location, for logs and plans.
     */
    String describe();
}
