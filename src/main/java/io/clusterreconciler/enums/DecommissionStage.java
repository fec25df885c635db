package io.clusterreconciler.enums;

/**
 * Stages a stale node passes through while being decommissioned, in order.
 * 
 * <ul>
 *   <li><strong>PENDING</strong> - registered and possibly still running workloads</li>
 *   <li><strong>DRAINING</strong> - cordoned and drained of evictable workloads</li>
 *   <li><strong>DELETED_FROM_CLUSTER</strong> - member object removed from the control plane</li>
 *   <li><strong>SERVICE_STOPPED</strong> - local k3s services stopped on the host</li>
 *   <li><strong>TOKEN_PURGED</strong> - cached join credentials removed; terminal</li>
 * </ul>
 */
public enum DecommissionStage {
    PENDING("pending"),
    DRAINING("draining"),
    DELETED_FROM_CLUSTER("deleted-from-cluster"),
    SERVICE_STOPPED("service-stopped"),
    TOKEN_PURGED("token-purged");
    
    private final String value;
    
    DecommissionStage(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
    
    public boolean isTerminal() {
        return this == TOKEN_PURGED;
    }
    
    /**
     * @return the stage reached by the next transition, or this stage if terminal
     */
    public DecommissionStage next() {
        return isTerminal() ? this : values()[ordinal() + 1];
    }
}
