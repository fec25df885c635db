package io.clusterreconciler.membership;

import io.clusterreconciler.clients.ControlPlaneClient;
import io.clusterreconciler.metrics.MetricsProvider;
import io.clusterreconciler.metrics.MetricsUtils;
import io.clusterreconciler.models.ClusterMember;
import io.clusterreconciler.models.ClusterSpec;
import io.clusterreconciler.models.MembershipSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.stream.Collectors;

import static io.clusterreconciler.metrics.MetricsConstants.STALE_MEMBERS_METRIC_NAME;

/**
 * Read-only comparison of live control-plane membership with the desired node set.
 * Stale members are the sole input of decommissioning; declared nodes that never joined are
 * reported as missing and never touched.
 */
@Slf4j
public class ClusterMembershipInspector {
    
    private final ControlPlaneClient controlPlane;
    private final MetricsProvider metricsProvider;
    private final String clusterName;
    
    public ClusterMembershipInspector(ControlPlaneClient controlPlane, MetricsProvider metricsProvider,
                                      String clusterName) {
        this.controlPlane = controlPlane;
        this.metricsProvider = metricsProvider;
        this.clusterName = clusterName;
    }
    
    /**
     * @throws io.clusterreconciler.clients.ConnectivityException if the control plane cannot be queried
     */
    public MembershipSnapshot inspect(ClusterSpec spec) {
        log.info("Inspecting live membership of cluster {}", clusterName);
        List<ClusterMember> live = controlPlane.listMembers().stream()
                .sorted(Comparator.comparing(ClusterMember::getName))
                .collect(Collectors.toList());
        
        SortedSet<String> target = spec.getNodeNames();
        Set<String> liveNames = live.stream().map(ClusterMember::getName).collect(Collectors.toSet());
        
        List<ClusterMember> stale = live.stream()
                .filter(member -> !target.contains(member.getName()))
                .collect(Collectors.toList());
        List<String> missing = target.stream()
                .filter(name -> !liveNames.contains(name))
                .collect(Collectors.toList());
        
        log.info("Membership - live: {}, stale: {}, not yet joined: {}",
                liveNames.size(), stale.stream().map(ClusterMember::getName).collect(Collectors.toList()), missing);
        metricsProvider.gauge(STALE_MEMBERS_METRIC_NAME, MetricsUtils.buildClusterTags(clusterName)).set(stale.size());
        
        return new MembershipSnapshot(live, stale, missing);
    }
}
