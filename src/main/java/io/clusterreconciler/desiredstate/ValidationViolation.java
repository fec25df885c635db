package io.clusterreconciler.desiredstate;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A single problem found in the desired state document.
 */
@Data
@AllArgsConstructor
public class ValidationViolation {
    
    // offending node, null for document-level problems
    private String node;
    
    private Type type;
    
    private String message;
    
    public enum Type {
        UNREADABLE_DOCUMENT,
        MISSING_FIELD,
        INVALID_NAME,
        INVALID_DOMAIN,
        DUPLICATE_NAME,
        INVALID_IP,
        DUPLICATE_IP,
        IP_OUTSIDE_SUBNET,
        INVALID_SUBNET,
        INVALID_ROLE,
        NO_SERVER,
        MULTIPLE_SERVERS,
        MISSING_CONFIG_SECTION,
        INVALID_CONFIG_VALUE
    }
    
    @Override
    public String toString() {
        return node == null ? type + ": " + message : type + " [" + node + "]: " + message;
    }
}
