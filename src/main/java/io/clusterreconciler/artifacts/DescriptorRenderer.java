package io.clusterreconciler.artifacts;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.clusterreconciler.enums.NodeRole;
import io.clusterreconciler.models.ClusterSpec;
import io.clusterreconciler.models.DeploymentDescriptor;
import io.clusterreconciler.models.NodeSpec;

import java.util.Comparator;
import java.util.Map;

import static io.clusterreconciler.config.Constants.*;

/**
 * Renders the aggregate descriptor listing every declared node for the deployment executor.
 */
public class DescriptorRenderer {
    
    private final String defaultSshUser;
    private final ObjectWriter writer;
    
    public DescriptorRenderer(String defaultSshUser) {
        this.defaultSshUser = defaultSshUser;
        // fixed line separator keeps the output byte-identical across platforms
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withObjectIndenter(new DefaultIndenter("  ", "\n"))
                .withArrayIndenter(new DefaultIndenter("  ", "\n"));
        this.writer = new ObjectMapper().writer(printer);
    }
    
    public DeploymentDescriptor describe(ClusterSpec spec) {
        DeploymentDescriptor descriptor = new DeploymentDescriptor();
        descriptor.setDomain(spec.getDomain());
        spec.getNodes().stream()
                .sorted(Comparator.comparing(NodeSpec::getName))
                .forEach(node -> descriptor.getNodes().add(describeNode(node, spec)));
        return descriptor;
    }
    
    public String render(ClusterSpec spec) {
        try {
            return writer.writeValueAsString(describe(spec)) + "\n";
        } catch (JsonProcessingException e) {
            throw new ArtifactWriteException("Failed to render deployment descriptor: " + e.getOriginalMessage(), e);
        }
    }
    
    private DeploymentDescriptor.Node describeNode(NodeSpec node, ClusterSpec spec) {
        NodeRole role = node.getNodeRole();
        Map<String, Object> roleConfig = spec.getRoleConfig(role);
        String credentialRef = role == NodeRole.SERVER
                ? String.valueOf(roleConfig.getOrDefault(CONFIG_TOKEN_FILE, DEFAULT_SERVER_TOKEN_FILE))
                : NixHostArtifactRenderer.agentTokenFile(spec);
        String sshUser = String.valueOf(roleConfig.getOrDefault(CONFIG_SSH_USER, defaultSshUser));
        return new DeploymentDescriptor.Node(
                node.getName(),
                node.getEffectiveHostname(),
                node.getIp().trim(),
                role.getValue(),
                sshUser,
                credentialRef);
    }
}
