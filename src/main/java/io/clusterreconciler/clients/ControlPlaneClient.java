package io.clusterreconciler.clients;

import io.clusterreconciler.models.ClusterMember;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Narrow view of the orchestration control plane.
 * Every method throws {@link ConnectivityException} when the API cannot be reached.
 */
public interface ControlPlaneClient {
    
    List<ClusterMember> listMembers();
    
    Optional<ClusterMember> getMember(String name);
    
    /**
     * Pods a drain would evict: everything except DaemonSet-managed and mirror pods.
     */
    int countEvictablePods(String name);
    
    void cordon(String name);
    
    DrainOutcome drain(String name, Duration timeout);
    
    /**
     * @return true if the member existed; already absent is not an error
     */
    boolean deleteMember(String name);
}
