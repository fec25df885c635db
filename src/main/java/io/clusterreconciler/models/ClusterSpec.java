package io.clusterreconciler.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterreconciler.enums.NodeRole;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Desired cluster topology as declared in the topology document.
 */
@Data
public class ClusterSpec {
    
    @JsonProperty("domain")
    private String domain;
    
    @JsonProperty("subnet")
    private String subnet;
    
    @JsonProperty("nodes")
    private List<NodeSpec> nodes = new ArrayList<>();
    
    @JsonProperty("server_config")
    private Map<String, Object> serverConfig;
    
    @JsonProperty("agent_config")
    private Map<String, Object> agentConfig;
    
    /**
     * Names of every declared node, sorted.
     */
    @JsonIgnore
    public SortedSet<String> getNodeNames() {
        SortedSet<String> names = new TreeSet<>();
        for (NodeSpec node : nodes) {
            names.add(node.getName());
        }
        return names;
    }
    
    @JsonIgnore
    public Optional<NodeSpec> findNode(String name) {
        return nodes.stream().filter(node -> node.getName().equals(name)).findFirst();
    }
    
    /**
     * The cluster-init node. Only meaningful on a validated spec.
     */
    @JsonIgnore
    public NodeSpec getServer() {
        return nodes.stream()
                .filter(NodeSpec::isServer)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Cluster spec has no server node"));
    }
    
    /**
     * Role settings with keys in sorted order, so that rendering never depends on document order.
     */
    @JsonIgnore
    public Map<String, Object> getRoleConfig(NodeRole role) {
        Map<String, Object> config = role == NodeRole.SERVER ? serverConfig : agentConfig;
        return config == null ? new TreeMap<>() : new TreeMap<>(config);
    }
}
