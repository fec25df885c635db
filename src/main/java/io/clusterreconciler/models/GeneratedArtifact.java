package io.clusterreconciler.models;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.charset.StandardCharsets;

/**
 * Rendered per-node artifact, keyed by node name.
 */
@Data
@AllArgsConstructor
public class GeneratedArtifact {
    
    private String key;
    
    private String content;
    
    public byte[] getBytes() {
        return content.getBytes(StandardCharsets.UTF_8);
    }
}
