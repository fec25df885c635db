package io.clusterreconciler.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterreconciler.enums.NodeRole;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A node declared in the desired topology.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NodeSpec {
    
    @JsonProperty("name")
    private String name;
    
    @JsonProperty("hostname")
    private String hostname;
    
    @JsonProperty("ip")
    private String ip;
    
    @JsonProperty("role")
    private String role; // "server" or "agent", checked by the validator
    
    @JsonProperty("description")
    private String description;
    
    @JsonIgnore
    public NodeRole getNodeRole() {
        return NodeRole.fromString(role);
    }
    
    @JsonIgnore
    public boolean isServer() {
        return getNodeRole() == NodeRole.SERVER;
    }
    
    /**
     * Hostname defaults to the node name when not declared.
     */
    @JsonIgnore
    public String getEffectiveHostname() {
        return hostname == null || hostname.isBlank() ? name : hostname;
    }
}
