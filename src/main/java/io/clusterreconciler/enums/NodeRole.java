package io.clusterreconciler.enums;

/**
 * Roles a node can hold in the desired topology.
 * 
 * SERVER: control plane and cluster-init target, AGENT: joins the server by address
 */
public enum NodeRole {
    SERVER("server"),
    AGENT("agent");
    
    private final String value;
    
    NodeRole(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
    
    public static NodeRole fromString(String value) {
        if (value == null) return null;
        
        String trimmed = value.trim();
        for (NodeRole role : NodeRole.values()) {
            if (role.value.equalsIgnoreCase(trimmed)) {
                return role;
            }
        }
        
        return null; // Return null for unknown roles instead of throwing exception
    }
}
