package io.clusterreconciler.artifacts;

import io.clusterreconciler.models.ClusterSpec;
import io.clusterreconciler.models.GeneratedArtifact;
import io.clusterreconciler.models.NodeSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.clusterreconciler.ClusterSpecFixtures.*;
import static org.assertj.core.api.Assertions.*;

class NixHostArtifactRendererTest {
    
    private NixHostArtifactRenderer renderer;
    private ClusterSpec spec;
    
    @BeforeEach
    void setUp() {
        renderer = new NixHostArtifactRenderer();
        spec = scenarioA();
    }
    
    @Test
    void testServerRenderedAsClusterInit() {
        GeneratedArtifact artifact = renderer.render(spec.findNode("n1").orElseThrow(), spec);
        
        assertThat(artifact.getKey()).isEqualTo("n1");
        assertThat(artifact.getContent())
                .contains("networking.hostName = \"n1\";")
                .contains("networking.domain = \"homelab.local\";")
                .contains("role = \"server\";")
                .contains("clusterInit = true;")
                .contains("\"--node-ip=10.0.0.1\"")
                .contains("\"--advertise-address=10.0.0.1\"")
                .contains("\"--tls-san=n1.homelab.local\"")
                .contains("\"--disable=traefik\"")
                .contains("allowedTCPPorts = [ 6443 10250 ];")
                .contains("system.stateVersion = \"24.05\";")
                .doesNotContain("serverAddr")
                .doesNotContain("tokenFile");
    }
    
    @Test
    void testAgentReferencesServerAndTokenPath() {
        String content = renderer.render(spec.findNode("n2").orElseThrow(), spec).getContent();
        
        assertThat(content)
                .contains("role = \"agent\";")
                .contains("serverAddr = \"https://10.0.0.1:6443\";")
                .contains("tokenFile = \"/run/secrets/k3s-token\";")
                .contains("\"--node-ip=10.0.0.2\"")
                .doesNotContain("clusterInit")
                .doesNotContain("--disable=traefik");
    }
    
    @Test
    void testRenderingIsByteIdentical() {
        NodeSpec node = spec.findNode("n2").orElseThrow();
        
        String first = renderer.render(node, spec).getContent();
        String second = renderer.render(node, spec).getContent();
        
        assertThat(second).isEqualTo(first);
    }
    
    @Test
    void testCustomApiPortAndImports() {
        // Given
        spec.getServerConfig().put("api_port", 7443);
        spec.getAgentConfig().put("imports", List.of("../common/{name}.nix"));
        
        // When
        String content = renderer.render(spec.findNode("n2").orElseThrow(), spec).getContent();
        
        // Then
        assertThat(content)
                .contains("serverAddr = \"https://10.0.0.1:7443\";")
                .contains("imports = [\n    ../common/n2.nix\n  ];");
    }
    
    @Test
    void testDefaultTokenFileWhenNotConfigured() {
        spec.getAgentConfig().remove("token_file");
        
        String content = renderer.render(spec.findNode("n2").orElseThrow(), spec).getContent();
        
        assertThat(content).contains("tokenFile = \"/etc/rancher/k3s/agent-token\";");
    }
    
    @Test
    void testStringsAreEscaped() {
        spec.findNode("n1").orElseThrow().setHostname("evil\"${x}");
        
        String content = renderer.render(spec.findNode("n1").orElseThrow(), spec).getContent();
        
        assertThat(content).contains("networking.hostName = \"evil\\\"\\${x}\";");
    }
    
    @Test
    void testOnlyIntegerFirewallPortsAreRendered() {
        // Given
        spec.getServerConfig().put("firewall_tcp_ports",
                List.of(22, "22 ]; services.openssh.enable = false; x = [ 1"));
        
        // When
        String content = renderer.render(spec.findNode("n1").orElseThrow(), spec).getContent();
        
        // Then
        assertThat(content)
                .contains("allowedTCPPorts = [ 22 ];")
                .doesNotContain("services.openssh");
    }
    
    @Test
    void testDomainStaysInsideHeaderComment() {
        spec.setDomain("homelab.local\nsecurity.sudo.enable = false;");
        
        String content = renderer.render(spec.findNode("n2").orElseThrow(), spec).getContent();
        
        assertThat(content.lines().filter(line -> line.startsWith("security.sudo"))).isEmpty();
        assertThat(content.lines().findFirst().orElseThrow())
                .startsWith("# Generated by cluster-reconciler")
                .contains("security.sudo.enable");
    }
}
