package io.clusterreconciler.artifacts;

import io.clusterreconciler.enums.NodeRole;
import io.clusterreconciler.models.ClusterSpec;
import io.clusterreconciler.models.GeneratedArtifact;
import io.clusterreconciler.models.NodeSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static io.clusterreconciler.config.Constants.*;

/**
 * Renders a NixOS host module running k3s for each node.
 * <p>
 * The server is rendered as the cluster-init node advertising its own address; agents point
 * at the server's address and reference the join token by path only.
 */
@Slf4j
public class NixHostArtifactRenderer implements ArtifactRenderer {
    
    private static final String INDENT = "  ";
    private static final Pattern NIX_PATH = Pattern.compile("[A-Za-z0-9._+\\-/]+");
    
    @Override
    public GeneratedArtifact render(NodeSpec node, ClusterSpec spec) {
        NodeRole role = node.getNodeRole();
        Map<String, Object> roleConfig = spec.getRoleConfig(role);
        String hostname = node.getEffectiveHostname();
        String ip = node.getIp().trim();
        
        StringBuilder out = new StringBuilder();
        out.append("# Generated by cluster-reconciler from the desired state of ").append(singleLine(spec.getDomain()))
                .append(". Do not edit.\n");
        if (node.getDescription() != null && !node.getDescription().isBlank()) {
            out.append("# ").append(node.getName()).append(": ").append(singleLine(node.getDescription())).append('\n');
        }
        out.append("{ config, pkgs, ... }:\n\n{\n");
        
        List<String> imports = stringList(roleConfig.get(CONFIG_IMPORTS));
        if (!imports.isEmpty()) {
            out.append(INDENT).append("imports = [\n");
            for (String path : imports) {
                out.append(INDENT).append(INDENT).append(nixPath(path.replace("{name}", node.getName()))).append('\n');
            }
            out.append(INDENT).append("];\n\n");
        }
        
        out.append(INDENT).append("networking.hostName = ").append(nixString(hostname)).append(";\n");
        out.append(INDENT).append("networking.domain = ").append(nixString(spec.getDomain())).append(";\n\n");
        
        List<String> flags = new ArrayList<>();
        flags.add("--node-ip=" + ip);
        
        out.append(INDENT).append("services.k3s = {\n");
        out.append(INDENT).append(INDENT).append("enable = true;\n");
        out.append(INDENT).append(INDENT).append("role = ").append(nixString(role.getValue())).append(";\n");
        if (role == NodeRole.SERVER) {
            out.append(INDENT).append(INDENT).append("clusterInit = true;\n");
            flags.add("--advertise-address=" + ip);
            flags.add("--tls-san=" + hostname + "." + spec.getDomain());
        } else {
            out.append(INDENT).append(INDENT).append("serverAddr = ").append(nixString(serverAddress(spec))).append(";\n");
            out.append(INDENT).append(INDENT).append("tokenFile = ")
                    .append(nixString(agentTokenFile(spec))).append(";\n");
        }
        flags.addAll(stringList(roleConfig.get(CONFIG_EXTRA_FLAGS)));
        out.append(INDENT).append(INDENT).append("extraFlags = toString [\n");
        for (String flag : flags) {
            out.append(INDENT).append(INDENT).append(INDENT).append(nixString(flag)).append('\n');
        }
        out.append(INDENT).append(INDENT).append("];\n");
        out.append(INDENT).append("};\n");
        
        List<String> tcpPorts = portList(roleConfig.get(CONFIG_FIREWALL_TCP_PORTS));
        List<String> udpPorts = portList(roleConfig.get(CONFIG_FIREWALL_UDP_PORTS));
        if (!tcpPorts.isEmpty() || !udpPorts.isEmpty()) {
            out.append('\n').append(INDENT).append("networking.firewall = {\n");
            if (!tcpPorts.isEmpty()) {
                out.append(INDENT).append(INDENT).append("allowedTCPPorts = [ ")
                        .append(String.join(" ", tcpPorts)).append(" ];\n");
            }
            if (!udpPorts.isEmpty()) {
                out.append(INDENT).append(INDENT).append("allowedUDPPorts = [ ")
                        .append(String.join(" ", udpPorts)).append(" ];\n");
            }
            out.append(INDENT).append("};\n");
        }
        
        Object stateVersion = roleConfig.getOrDefault(CONFIG_STATE_VERSION, DEFAULT_STATE_VERSION);
        out.append('\n').append(INDENT).append("system.stateVersion = ")
                .append(nixString(String.valueOf(stateVersion))).append(";\n");
        out.append("}\n");
        
        log.debug("Rendered {} artifact for node {}", role.getValue(), node.getName());
        return new GeneratedArtifact(node.getName(), out.toString());
    }
    
    /**
     * Join address advertised by the server, e.g. https://10.0.0.1:6443.
     */
    static String serverAddress(ClusterSpec spec) {
        Object port = spec.getRoleConfig(NodeRole.SERVER).getOrDefault(CONFIG_API_PORT, DEFAULT_API_PORT);
        return "https://" + hostLiteral(spec.getServer().getIp().trim()) + ":" + port;
    }
    
    static String agentTokenFile(ClusterSpec spec) {
        return String.valueOf(spec.getRoleConfig(NodeRole.AGENT).getOrDefault(CONFIG_TOKEN_FILE, DEFAULT_AGENT_TOKEN_FILE));
    }
    
    private static String hostLiteral(String ip) {
        return ip.contains(":") ? "[" + ip + "]" : ip;
    }
    
    private static List<String> stringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                result.add(String.valueOf(item));
            }
        }
        return result;
    }
    
    // non-integer entries are dropped; they never pass validation
    private static List<String> portList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item instanceof Integer) {
                    result.add(Integer.toString((Integer) item));
                } else {
                    log.warn("Skipping firewall port {} that is not a number", item);
                }
            }
        }
        return result;
    }
    
    private static String nixPath(String path) {
        return NIX_PATH.matcher(path).matches() && path.contains("/") ? path : nixString(path);
    }
    
    private static String nixString(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("${", "\\${")
                .replace("\n", "\\n").replace("\r", "\\r") + "\"";
    }
    
    private static String singleLine(String value) {
        return value.replace('\n', ' ').replace('\r', ' ').trim();
    }
}
