package io.clusterreconciler.models;

import io.clusterreconciler.enums.DecommissionStage;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Progress of one stale node through decommissioning.
 * Derived from observed state on every run, never persisted on its own.
 */
@Data
@NoArgsConstructor
public class DecommissionRecord {
    
    private String nodeName;
    
    private String address;
    
    // stage observed before this run acted
    private DecommissionStage observedStage;
    
    private DecommissionStage stage;
    
    // actions performed, or planned in dry-run
    private List<String> actions = new ArrayList<>();
    
    private List<String> warnings = new ArrayList<>();
    
    public DecommissionRecord(String nodeName, String address, DecommissionStage observedStage) {
        this.nodeName = nodeName;
        this.address = address;
        this.observedStage = observedStage;
        this.stage = observedStage;
    }
}
