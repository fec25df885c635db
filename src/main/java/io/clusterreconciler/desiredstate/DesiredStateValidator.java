package io.clusterreconciler.desiredstate;

import com.google.common.net.InetAddresses;
import io.clusterreconciler.enums.NodeRole;
import io.clusterreconciler.models.ClusterSpec;
import io.clusterreconciler.models.NodeSpec;
import io.clusterreconciler.desiredstate.ValidationViolation.Type;
import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static io.clusterreconciler.config.Constants.*;

/**
 * Checks a parsed cluster spec and collects every violation instead of stopping at the first.
 */
@Slf4j
public class DesiredStateValidator {
    
    // node names become artifact file names and control-plane member names
    private static final Pattern NODE_NAME = Pattern.compile("[a-z0-9]([-a-z0-9]{0,61}[a-z0-9])?");
    
    private static final Pattern DOMAIN = Pattern.compile(
            "[A-Za-z0-9]([-A-Za-z0-9]{0,61}[A-Za-z0-9])?(\\.[A-Za-z0-9]([-A-Za-z0-9]{0,61}[A-Za-z0-9])?)*");
    
    private static final Set<String> LIST_KEYS = Set.of(
            CONFIG_IMPORTS, CONFIG_EXTRA_FLAGS, CONFIG_FIREWALL_TCP_PORTS, CONFIG_FIREWALL_UDP_PORTS);
    
    private static final Set<String> PORT_LIST_KEYS = Set.of(CONFIG_FIREWALL_TCP_PORTS, CONFIG_FIREWALL_UDP_PORTS);
    
    private static final Set<String> KNOWN_KEYS = Set.of(
            CONFIG_IMPORTS, CONFIG_EXTRA_FLAGS, CONFIG_API_PORT, CONFIG_TOKEN_FILE,
            CONFIG_FIREWALL_TCP_PORTS, CONFIG_FIREWALL_UDP_PORTS, CONFIG_STATE_VERSION, CONFIG_SSH_USER);
    
    public List<ValidationViolation> validate(ClusterSpec spec) {
        List<ValidationViolation> violations = new ArrayList<>();
        
        if (isBlank(spec.getDomain())) {
            violations.add(new ValidationViolation(null, Type.MISSING_FIELD, "domain is required"));
        } else if (!DOMAIN.matcher(spec.getDomain()).matches()) {
            violations.add(new ValidationViolation(null, Type.INVALID_DOMAIN,
                    "domain '" + spec.getDomain().strip() + "' is not a DNS name"));
        }
        
        Subnet subnet = parseSubnet(spec.getSubnet(), violations);
        
        validateConfigSection("server_config", spec.getServerConfig(), violations);
        validateConfigSection("agent_config", spec.getAgentConfig(), violations);
        
        List<NodeSpec> nodes = spec.getNodes() == null ? List.of() : spec.getNodes();
        Set<String> names = new HashSet<>();
        Map<InetAddress, String> addresses = new HashMap<>();
        List<String> servers = new ArrayList<>();
        
        for (int i = 0; i < nodes.size(); i++) {
            NodeSpec node = nodes.get(i);
            if (node == null) {
                violations.add(new ValidationViolation("nodes[" + i + "]", Type.MISSING_FIELD, "node entry is null"));
                continue;
            }
            String label = isBlank(node.getName()) ? "nodes[" + i + "]" : node.getName();
            
            // Name
            if (isBlank(node.getName())) {
                violations.add(new ValidationViolation(label, Type.MISSING_FIELD, "name is required"));
            } else if (!NODE_NAME.matcher(node.getName()).matches()) {
                violations.add(new ValidationViolation(label, Type.INVALID_NAME,
                        "name must be a lowercase DNS label"));
            } else if (!names.add(node.getName())) {
                violations.add(new ValidationViolation(label, Type.DUPLICATE_NAME,
                        "name '" + node.getName() + "' is declared more than once"));
            }
            
            // Address
            if (isBlank(node.getIp())) {
                violations.add(new ValidationViolation(label, Type.MISSING_FIELD, "ip is required"));
            } else if (!InetAddresses.isInetAddress(node.getIp().trim())) {
                violations.add(new ValidationViolation(label, Type.INVALID_IP,
                        "'" + node.getIp() + "' is not an IP address"));
            } else {
                InetAddress address = InetAddresses.forString(node.getIp().trim());
                String previous = addresses.putIfAbsent(address, label);
                if (previous != null) {
                    violations.add(new ValidationViolation(label, Type.DUPLICATE_IP,
                            "ip " + node.getIp() + " is already used by " + previous));
                }
                if (subnet != null && !subnet.contains(address)) {
                    violations.add(new ValidationViolation(label, Type.IP_OUTSIDE_SUBNET,
                            "ip " + node.getIp() + " is outside subnet " + subnet));
                }
            }
            
            // Role
            if (isBlank(node.getRole())) {
                violations.add(new ValidationViolation(label, Type.MISSING_FIELD, "role is required"));
            } else if (node.getNodeRole() == null) {
                violations.add(new ValidationViolation(label, Type.INVALID_ROLE,
                        "role '" + node.getRole() + "' is not one of server, agent"));
            } else if (node.getNodeRole() == NodeRole.SERVER) {
                servers.add(label);
            }
        }
        
        if (servers.isEmpty()) {
            violations.add(new ValidationViolation(null, Type.NO_SERVER, "exactly one server node is required, found none"));
        } else if (servers.size() > 1) {
            violations.add(new ValidationViolation(null, Type.MULTIPLE_SERVERS,
                    "exactly one server node is required, found " + servers.size() + ": "
                            + servers.stream().sorted().collect(Collectors.joining(", "))));
        }
        
        if (violations.isEmpty()) {
            log.debug("Desired state is valid: {} nodes, server {}", nodes.size(), servers.get(0));
        } else {
            log.debug("Desired state has {} violation(s)", violations.size());
        }
        return violations;
    }
    
    private Subnet parseSubnet(String cidr, List<ValidationViolation> violations) {
        if (isBlank(cidr)) {
            violations.add(new ValidationViolation(null, Type.MISSING_FIELD, "subnet is required"));
            return null;
        }
        try {
            return Subnet.parse(cidr.trim());
        } catch (IllegalArgumentException e) {
            violations.add(new ValidationViolation(null, Type.INVALID_SUBNET,
                    "subnet '" + cidr + "' is not a CIDR block: " + e.getMessage()));
            return null;
        }
    }
    
    private void validateConfigSection(String section, Map<String, Object> config, List<ValidationViolation> violations) {
        if (config == null) {
            violations.add(new ValidationViolation(null, Type.MISSING_CONFIG_SECTION, section + " is required"));
            return;
        }
        for (Map.Entry<String, Object> entry : config.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (!KNOWN_KEYS.contains(key)) {
                log.warn("Ignoring unknown setting {}.{}", section, key);
            } else if (LIST_KEYS.contains(key) && !(value instanceof List)) {
                violations.add(new ValidationViolation(null, Type.INVALID_CONFIG_VALUE,
                        section + "." + key + " must be a list"));
            } else if (CONFIG_API_PORT.equals(key) && !isPort(value)) {
                violations.add(new ValidationViolation(null, Type.INVALID_CONFIG_VALUE,
                        section + "." + key + " must be a port number"));
            } else if (PORT_LIST_KEYS.contains(key)
                    && !((List<?>) value).stream().allMatch(DesiredStateValidator::isPort)) {
                violations.add(new ValidationViolation(null, Type.INVALID_CONFIG_VALUE,
                        section + "." + key + " must only contain port numbers"));
            } else if (LIST_KEYS.contains(key) && ((List<?>) value).stream().anyMatch(item -> item == null
                    || item instanceof Map || item instanceof List)) {
                violations.add(new ValidationViolation(null, Type.INVALID_CONFIG_VALUE,
                        section + "." + key + " must only contain scalar values"));
            }
        }
    }
    
    private static boolean isPort(Object value) {
        return value instanceof Integer && (Integer) value > 0 && (Integer) value <= 65535;
    }
    
    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
