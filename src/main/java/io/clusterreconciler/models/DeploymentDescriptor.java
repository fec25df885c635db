package io.clusterreconciler.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate descriptor consumed by the deployment executor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"domain", "nodes"})
public class DeploymentDescriptor {
    
    @JsonProperty("domain")
    private String domain;
    
    @JsonProperty("nodes")
    private List<Node> nodes = new ArrayList<>();
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonPropertyOrder({"name", "hostname", "address", "role", "ssh_user", "credential_ref"})
    public static class Node {
        
        @JsonProperty("name")
        private String name;
        
        @JsonProperty("hostname")
        private String hostname;
        
        @JsonProperty("address")
        private String address;
        
        @JsonProperty("role")
        private String role;
        
        @JsonProperty("ssh_user")
        private String sshUser;
        
        // path of the join credential on the node, never the credential itself
        @JsonProperty("credential_ref")
        private String credentialRef;
    }
}
