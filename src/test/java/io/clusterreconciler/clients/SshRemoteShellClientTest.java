package io.clusterreconciler.clients;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SshRemoteShellClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final List<String> SERVICES = List.of("k3s", "k3s-agent");

    @Mock
    private CommandRunner runner;

    private SshRemoteShellClient client;

    @BeforeEach
    void setUp() {
        client = new SshRemoteShellClient(runner, "admin", Path.of("/keys/id_ed25519"), SERVICES, TIMEOUT);
    }

    @Test
    void testSshCommandIsNonInteractiveAndKeyBased() {
        List<String> command = client.ssh("10.0.0.3", TIMEOUT, "true");

        assertThat(command).containsExactly("ssh", "-i", "/keys/id_ed25519",
                "-o", "BatchMode=yes",
                "-o", "StrictHostKeyChecking=accept-new",
                "-o", "ConnectTimeout=10",
                "admin@10.0.0.3", "true");
    }

    @Test
    void testStopCommandDisablesUnitsAndRemovesToken() {
        String command = client.stopCommand();

        assertThat(command)
                .contains("if systemctl cat k3s >/dev/null 2>&1; then sudo systemctl disable --now k3s; fi")
                .contains("sudo systemctl disable --now k3s-agent")
                .endsWith("sudo rm -f /etc/rancher/k3s/agent-token");
    }

    @Test
    void testRootUserSkipsSudo() {
        SshRemoteShellClient rootClient = new SshRemoteShellClient(runner, "root", null, SERVICES, TIMEOUT);

        assertThat(rootClient.stopCommand()).doesNotContain("sudo");
        assertThat(rootClient.ssh("10.0.0.3", TIMEOUT, "true")).doesNotContain("-i");
    }

    @Test
    void testServiceStateActive() {
        when(runner.run(anyList(), isNull(), eq(TIMEOUT))).thenReturn(new CommandResult(0, "", false));

        assertThat(client.serviceState("10.0.0.3")).isEqualTo(ServiceState.ACTIVE);
    }

    @Test
    void testServiceStateInactive() {
        when(runner.run(anyList(), isNull(), eq(TIMEOUT))).thenReturn(new CommandResult(3, "", false));

        assertThat(client.serviceState("10.0.0.3")).isEqualTo(ServiceState.INACTIVE);
    }

    @Test
    void testServiceStateOfUnreachableHost() {
        when(runner.run(anyList(), isNull(), eq(TIMEOUT)))
                .thenReturn(new CommandResult(255, "ssh: connect to host 10.0.0.3 port 22: No route to host", false));

        assertThat(client.serviceState("10.0.0.3")).isEqualTo(ServiceState.UNREACHABLE);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testStopServiceRunsStopCommandOverSsh() {
        // Given
        when(runner.run(anyList(), isNull(), eq(TIMEOUT))).thenReturn(new CommandResult(0, "", false));

        // When
        RemoteOutcome outcome = client.stopService("10.0.0.3");

        // Then
        assertThat(outcome).isEqualTo(RemoteOutcome.SUCCESS);
        ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
        verify(runner).run(command.capture(), isNull(), eq(TIMEOUT));
        assertThat(command.getValue()).contains("admin@10.0.0.3");
        assertThat(command.getValue().get(command.getValue().size() - 1)).isEqualTo(client.stopCommand());
    }

    @Test
    void testStopServiceOnTimeoutIsUnreachable() {
        when(runner.run(anyList(), isNull(), eq(TIMEOUT))).thenReturn(CommandResult.timeout(""));

        assertThat(client.stopService("10.0.0.3")).isEqualTo(RemoteOutcome.UNREACHABLE);
    }

    @Test
    void testStopServiceFailureThrows() {
        when(runner.run(anyList(), isNull(), eq(TIMEOUT)))
                .thenReturn(new CommandResult(1, "sudo: a password is required", false));

        assertThatThrownBy(() -> client.stopService("10.0.0.3"))
                .isInstanceOf(RemoteCommandException.class)
                .hasMessageContaining("password");
    }

    @Test
    void testPing() {
        Duration pingTimeout = Duration.ofSeconds(3);
        when(runner.run(anyList(), isNull(), eq(pingTimeout)))
                .thenReturn(new CommandResult(0, "", false))
                .thenReturn(new CommandResult(255, "", false));

        assertThat(client.ping("10.0.0.1", pingTimeout)).isTrue();
        assertThat(client.ping("10.0.0.1", pingTimeout)).isFalse();
    }
}
