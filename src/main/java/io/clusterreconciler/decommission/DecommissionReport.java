package io.clusterreconciler.decommission;

import io.clusterreconciler.enums.ResultStatus;
import io.clusterreconciler.models.DecommissionRecord;
import io.clusterreconciler.models.NodeResult;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class DecommissionReport {
    
    private final List<DecommissionRecord> records;
    
    private final List<NodeResult> nodeResults;
    
    public boolean hasErrors() {
        return nodeResults.stream().anyMatch(result -> result.getStatus() == ResultStatus.ERROR);
    }
}
