package io.clusterreconciler.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A node as observed in the live control plane. Read-only from the reconciler's point of view.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterMember {
    
    private String name;
    
    private boolean ready;
    
    private boolean schedulable;
    
    // carries the control-plane role label
    private boolean server;
    
    // InternalIP reported by the kubelet, may be null
    private String address;
}
