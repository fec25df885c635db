package io.clusterreconciler.models;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Live membership compared against the desired node set.
 */
@Getter
@AllArgsConstructor
public class MembershipSnapshot {
    
    private final List<ClusterMember> liveMembers;
    
    // registered but no longer declared, sorted by name
    private final List<ClusterMember> staleMembers;
    
    // declared but not (yet) registered
    private final List<String> missingMembers;
}
