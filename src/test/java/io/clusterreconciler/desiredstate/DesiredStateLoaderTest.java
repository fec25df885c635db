package io.clusterreconciler.desiredstate;

import io.clusterreconciler.desiredstate.ValidationViolation.Type;
import io.clusterreconciler.enums.ErrorKind;
import io.clusterreconciler.models.ClusterSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class DesiredStateLoaderTest {
    
    private static final String VALID = "{\n"
            + "  \"domain\": \"homelab.local\",\n"
            + "  \"subnet\": \"10.0.0.0/24\",\n"
            + "  \"nodes\": [\n"
            + "    {\"name\": \"n1\", \"hostname\": \"nuc1\", \"ip\": \"10.0.0.1\", \"role\": \"server\", \"description\": \"first\"},\n"
            + "    {\"name\": \"n2\", \"ip\": \"10.0.0.2\", \"role\": \"agent\"}\n"
            + "  ],\n"
            + "  \"server_config\": {\"api_port\": 6443},\n"
            + "  \"agent_config\": {}\n"
            + "}";
    
    private DesiredStateLoader loader;
    
    @BeforeEach
    void setUp() {
        loader = new DesiredStateLoader(new DesiredStateValidator());
    }
    
    @Test
    void testParseValidDocument() {
        ClusterSpec spec = loader.parse(VALID);
        
        assertThat(spec.getDomain()).isEqualTo("homelab.local");
        assertThat(spec.getNodeNames()).containsExactly("n1", "n2");
        assertThat(spec.getServer().getName()).isEqualTo("n1");
        assertThat(spec.findNode("n1").orElseThrow().getEffectiveHostname()).isEqualTo("nuc1");
        assertThat(spec.findNode("n2").orElseThrow().getEffectiveHostname()).isEqualTo("n2");
    }
    
    @Test
    void testLoadFromFile(@TempDir Path dir) throws Exception {
        // Given
        Path file = dir.resolve("cluster.json");
        Files.writeString(file, VALID);
        
        // When
        ClusterSpec spec = loader.load(file);
        
        // Then
        assertThat(spec.getNodes()).hasSize(2);
    }
    
    @Test
    void testMissingFileIsValidationError(@TempDir Path dir) {
        assertThatThrownBy(() -> loader.load(dir.resolve("missing.json")))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> {
                    ValidationException validation = (ValidationException) e;
                    assertThat(validation.getKind()).isEqualTo(ErrorKind.VALIDATION);
                    assertThat(validation.getViolations()).extracting(ValidationViolation::getType)
                            .containsExactly(Type.UNREADABLE_DOCUMENT);
                });
    }
    
    @Test
    void testMalformedJsonIsValidationError() {
        assertThatThrownBy(() -> loader.parse("{ \"domain\": "))
                .isInstanceOf(ValidationException.class);
    }
    
    @Test
    void testDuplicateName() {
        assertThat(violationTypes(nodes(
                node("n1", "10.0.0.1", "server"),
                node("n1", "10.0.0.2", "agent"))))
                .containsExactly(Type.DUPLICATE_NAME);
    }
    
    @Test
    void testDuplicateIp() {
        assertThat(violationTypes(nodes(
                node("n1", "10.0.0.1", "server"),
                node("n2", "10.0.0.1", "agent"))))
                .containsExactly(Type.DUPLICATE_IP);
    }
    
    @Test
    void testIpOutsideSubnet() {
        assertThat(violationTypes(nodes(
                node("n1", "10.0.0.1", "server"),
                node("n2", "192.168.1.2", "agent"))))
                .containsExactly(Type.IP_OUTSIDE_SUBNET);
    }
    
    @Test
    void testZeroServers() {
        assertThat(violationTypes(nodes(
                node("n1", "10.0.0.1", "agent"),
                node("n2", "10.0.0.2", "agent"))))
                .containsExactly(Type.NO_SERVER);
    }
    
    @Test
    void testTwoServers() {
        assertThat(violationTypes(nodes(
                node("n1", "10.0.0.1", "server"),
                node("n2", "10.0.0.2", "server"))))
                .containsExactly(Type.MULTIPLE_SERVERS);
    }
    
    @Test
    void testInvalidRole() {
        assertThat(violationTypes(nodes(
                node("n1", "10.0.0.1", "server"),
                node("n2", "10.0.0.2", "worker"))))
                .containsExactly(Type.INVALID_ROLE);
    }
    
    @Test
    void testInvalidName() {
        assertThat(violationTypes(nodes(
                node("n1", "10.0.0.1", "server"),
                node("Node_2", "10.0.0.2", "agent"))))
                .containsExactly(Type.INVALID_NAME);
    }
    
    @Test
    void testCollectsAllViolations() {
        // Given: duplicate name, duplicate ip, out of subnet and no config sections at once
        String json = "{\"domain\": \"homelab.local\", \"subnet\": \"10.0.0.0/24\", \"nodes\": ["
                + node("n1", "10.0.0.1", "server") + ","
                + node("n1", "10.0.0.1", "agent") + ","
                + node("n3", "10.1.0.3", "agent") + "]}";
        
        // When
        List<Type> types = violationTypes(json);
        
        // Then
        assertThat(types).containsExactlyInAnyOrder(
                Type.MISSING_CONFIG_SECTION,
                Type.MISSING_CONFIG_SECTION,
                Type.DUPLICATE_NAME,
                Type.DUPLICATE_IP,
                Type.IP_OUTSIDE_SUBNET);
    }
    
    @Test
    void testInvalidConfigValues() {
        String json = "{\"domain\": \"homelab.local\", \"subnet\": \"10.0.0.0/24\", \"nodes\": ["
                + node("n1", "10.0.0.1", "server") + "],"
                + "\"server_config\": {\"api_port\": 70000, \"extra_flags\": \"--oops\", \"unknown\": 1},"
                + "\"agent_config\": {\"imports\": [{\"nested\": true}]}}";
        
        assertThat(violationTypes(json)).containsExactly(
                Type.INVALID_CONFIG_VALUE, Type.INVALID_CONFIG_VALUE, Type.INVALID_CONFIG_VALUE);
    }
    
    @Test
    void testMissingFields() {
        String json = "{\"nodes\": [{\"name\": \"n1\"}], \"server_config\": {}, \"agent_config\": {}}";
        
        assertThat(violationTypes(json)).containsExactlyInAnyOrder(
                Type.MISSING_FIELD, Type.MISSING_FIELD, Type.MISSING_FIELD, Type.MISSING_FIELD, Type.NO_SERVER);
    }
    
    @Test
    void testNullNodeEntryIsReported() {
        // Given
        String json = nodes("null", node("n1", "10.0.0.1", "server"));
        
        // When
        List<ValidationViolation> violations = violations(json);
        
        // Then
        assertThat(violations).extracting(ValidationViolation::getType).containsExactly(Type.MISSING_FIELD);
        assertThat(violations.get(0).getNode()).isEqualTo("nodes[0]");
    }
    
    @Test
    void testFirewallPortsMustBeNumbers() {
        String json = "{\"domain\": \"homelab.local\", \"subnet\": \"10.0.0.0/24\", \"nodes\": ["
                + node("n1", "10.0.0.1", "server") + "],"
                + "\"server_config\": {\"firewall_tcp_ports\": [22, \"22 ]; services.openssh.enable = false; x = [ 1\"]},"
                + "\"agent_config\": {\"firewall_udp_ports\": [8472, 0]}}";
        
        assertThat(violationTypes(json)).containsExactly(Type.INVALID_CONFIG_VALUE, Type.INVALID_CONFIG_VALUE);
    }
    
    @Test
    void testFirewallPortsAccepted() {
        String json = "{\"domain\": \"homelab.local\", \"subnet\": \"10.0.0.0/24\", \"nodes\": ["
                + node("n1", "10.0.0.1", "server") + "],"
                + "\"server_config\": {\"firewall_tcp_ports\": [6443, 10250]},"
                + "\"agent_config\": {\"firewall_udp_ports\": [8472]}}";
        
        assertThat(loader.parse(json).getServerConfig().get("firewall_tcp_ports")).isEqualTo(List.of(6443, 10250));
    }
    
    @Test
    void testDomainWithLineBreakIsRejected() {
        String json = "{\"domain\": \"homelab.local\\nsecurity.sudo.enable = false;\", \"subnet\": \"10.0.0.0/24\","
                + " \"nodes\": [" + node("n1", "10.0.0.1", "server") + "], \"server_config\": {}, \"agent_config\": {}}";
        
        assertThat(violationTypes(json)).containsExactly(Type.INVALID_DOMAIN);
    }
    
    private List<Type> violationTypes(String json) {
        return violations(json).stream().map(ValidationViolation::getType).collect(Collectors.toList());
    }
    
    private List<ValidationViolation> violations(String json) {
        try {
            loader.parse(json);
        } catch (ValidationException e) {
            return e.getViolations();
        }
        return fail("expected validation to fail");
    }
    
    private static String nodes(String... nodes) {
        return "{\"domain\": \"homelab.local\", \"subnet\": \"10.0.0.0/24\", \"nodes\": ["
                + String.join(",", nodes)
                + "], \"server_config\": {}, \"agent_config\": {}}";
    }
    
    private static String node(String name, String ip, String role) {
        return "{\"name\": \"" + name + "\", \"ip\": \"" + ip + "\", \"role\": \"" + role + "\"}";
    }
}
