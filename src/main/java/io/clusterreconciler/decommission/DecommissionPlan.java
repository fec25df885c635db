package io.clusterreconciler.decommission;

import io.clusterreconciler.models.DecommissionRecord;
import lombok.Getter;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Stale nodes with the stage each was observed at. Computed without any mutating call.
 */
@Getter
public class DecommissionPlan {
    
    // sorted by node name
    private final List<DecommissionRecord> records;
    
    // declared nodes that still carry a resumption marker from an earlier removal
    private final SortedSet<String> obsoleteMarkers;
    
    public DecommissionPlan(List<DecommissionRecord> records) {
        this(records, new TreeSet<>());
    }
    
    public DecommissionPlan(List<DecommissionRecord> records, SortedSet<String> obsoleteMarkers) {
        this.records = records;
        this.obsoleteMarkers = obsoleteMarkers;
    }
    
    public boolean isEmpty() {
        return records.isEmpty();
    }
    
    public List<String> nodeNames() {
        return records.stream().map(DecommissionRecord::getNodeName).collect(Collectors.toList());
    }
}
