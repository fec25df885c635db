package io.clusterreconciler.artifacts;

import io.clusterreconciler.models.ClusterSpec;
import io.clusterreconciler.models.GeneratedArtifact;
import io.clusterreconciler.models.NodeSpec;

/**
 * Renders the per-node artifact. Implementations must be pure: identical input, identical bytes.
 */
public interface ArtifactRenderer {
    
    /**
     * Render the artifact for one node of a validated spec.
     *
     * @param node the node to render
     * @param spec the whole spec, for role config and the server address
     * @return artifact keyed by node name
     */
    GeneratedArtifact render(NodeSpec node, ClusterSpec spec);
}
