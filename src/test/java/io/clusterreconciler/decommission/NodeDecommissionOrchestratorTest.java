package io.clusterreconciler.decommission;

import io.clusterreconciler.clients.ConnectivityException;
import io.clusterreconciler.clients.ControlPlaneClient;
import io.clusterreconciler.clients.DrainOutcome;
import io.clusterreconciler.clients.RemoteCommandException;
import io.clusterreconciler.clients.RemoteOutcome;
import io.clusterreconciler.clients.RemoteShellClient;
import io.clusterreconciler.clients.ServiceState;
import io.clusterreconciler.enums.DecommissionStage;
import io.clusterreconciler.enums.ErrorKind;
import io.clusterreconciler.enums.ResultStatus;
import io.clusterreconciler.metrics.MetricsProvider;
import io.clusterreconciler.models.ClusterMember;
import io.clusterreconciler.models.ClusterSpec;
import io.clusterreconciler.models.DecommissionRecord;
import io.clusterreconciler.models.MembershipSnapshot;
import io.clusterreconciler.models.NodeResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static io.clusterreconciler.ClusterSpecFixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NodeDecommissionOrchestratorTest {

    private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(30);

    @Mock
    private ControlPlaneClient controlPlane;

    @Mock
    private RemoteShellClient remoteShell;

    @Mock
    private CredentialStore credentials;

    private MetricsProvider metricsProvider;

    private NodeDecommissionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        metricsProvider = new MetricsProvider(new SimpleMeterRegistry(), "test");
        orchestrator = new NodeDecommissionOrchestrator(controlPlane, remoteShell, credentials,
                metricsProvider, "k3s", DRAIN_TIMEOUT, 2);
    }

    // =================================================================
    // FULL RUNS
    // =================================================================

    @Test
    void testScenarioBDecommissionsOnlyTheStaleNode() throws Exception {
        // Given: live {n1, n2, n3}, desired {n1, n2}
        ClusterMember n3 = member("n3", "10.0.0.3", false);
        MembershipSnapshot snapshot = snapshot(
                List.of(member("n1", "10.0.0.1", true), member("n2", "10.0.0.2", false), n3), n3);
        when(credentials.nodesPendingDecommission()).thenReturn(new TreeSet<>());
        when(controlPlane.getMember("n3")).thenReturn(Optional.of(n3));
        when(controlPlane.drain("n3", DRAIN_TIMEOUT)).thenReturn(DrainOutcome.COMPLETED);
        when(controlPlane.deleteMember("n3")).thenReturn(true);
        when(remoteShell.stopService("10.0.0.3")).thenReturn(RemoteOutcome.SUCCESS);
        when(credentials.purge("n3")).thenReturn(true);

        // When
        DecommissionPlan plan = orchestrator.plan(scenarioA(), snapshot, false);
        DecommissionReport report = orchestrator.execute(plan, false);

        // Then
        assertThat(plan.nodeNames()).containsExactly("n3");
        assertThat(report.getNodeResults()).extracting(NodeResult::getStatus).containsExactly(ResultStatus.SUCCESS);
        DecommissionRecord record = report.getRecords().get(0);
        assertThat(record.getStage()).isEqualTo(DecommissionStage.TOKEN_PURGED);
        assertThat(record.getActions()).containsExactly("cordon", "drain", "delete", "stop", "purge");

        InOrder order = inOrder(controlPlane, credentials, remoteShell);
        order.verify(controlPlane).cordon("n3");
        order.verify(controlPlane).drain("n3", DRAIN_TIMEOUT);
        order.verify(credentials).recordDecommission("n3", "10.0.0.3");
        order.verify(controlPlane).deleteMember("n3");
        order.verify(remoteShell).stopService("10.0.0.3");
        order.verify(credentials).purge("n3");

        for (String untouched : List.of("n1", "n2")) {
            verify(controlPlane, never()).cordon(untouched);
            verify(controlPlane, never()).drain(eq(untouched), any());
            verify(controlPlane, never()).deleteMember(untouched);
            verify(credentials, never()).purge(untouched);
        }
        verify(remoteShell, never()).stopService("10.0.0.1");
        verify(remoteShell, never()).stopService("10.0.0.2");
        assertThat(metricsProvider.summary()).contains(
                "decommission_stage_transitions{cluster=k3s,stage=draining} count=1",
                "decommission_stage_transitions{cluster=k3s,stage=token-purged} count=1");
    }

    @Test
    void testNothingStaleMeansNothingToDo() throws Exception {
        when(credentials.nodesPendingDecommission()).thenReturn(new TreeSet<>());

        DecommissionPlan plan = orchestrator.plan(scenarioA(),
                snapshot(List.of(member("n1", "10.0.0.1", true), member("n2", "10.0.0.2", false))), false);
        DecommissionReport report = orchestrator.execute(plan, false);

        assertThat(plan.isEmpty()).isTrue();
        assertThat(report.getNodeResults()).isEmpty();
        verifyNoInteractions(controlPlane, remoteShell);
    }

    @Test
    void testMarkerOfRedeclaredNodeIsCleared() throws Exception {
        // Given: n2 was removed once and has been declared again
        when(credentials.nodesPendingDecommission()).thenReturn(new TreeSet<>(List.of("n2")));

        // When
        DecommissionPlan plan = orchestrator.plan(scenarioA(),
                snapshot(List.of(member("n1", "10.0.0.1", true), member("n2", "10.0.0.2", false))), false);
        orchestrator.execute(plan, false);

        // Then
        assertThat(plan.isEmpty()).isTrue();
        assertThat(plan.getObsoleteMarkers()).containsExactly("n2");
        verify(credentials).clearDecommission("n2");
        verify(credentials, never()).purge(anyString());
        verifyNoInteractions(controlPlane, remoteShell);
    }

    @Test
    void testDryRunKeepsObsoleteMarker() throws Exception {
        when(credentials.nodesPendingDecommission()).thenReturn(new TreeSet<>(List.of("n2")));

        DecommissionPlan plan = orchestrator.plan(scenarioA(),
                snapshot(List.of(member("n1", "10.0.0.1", true), member("n2", "10.0.0.2", false))), false);
        orchestrator.execute(plan, true);

        verify(credentials, never()).clearDecommission(anyString());
    }

    // =================================================================
    // SOLE SERVER GUARD
    // =================================================================

    @Test
    void testScenarioCSoleServerIsFatalWithoutMutation() {
        // Given: the only live server n1 is no longer declared
        ClusterMember n1 = member("n1", "10.0.0.1", true);
        MembershipSnapshot snapshot = snapshot(List.of(n1, member("n2", "10.0.0.2", false)), n1);
        ClusterSpec desired = spec(server("n9", "10.0.0.9"), agent("n2", "10.0.0.2"));

        // When / Then
        assertThatThrownBy(() -> orchestrator.plan(desired, snapshot, false))
                .isInstanceOf(DecommissionPreconditionException.class)
                .hasMessageContaining("n1")
                .satisfies(e -> assertThat(((DecommissionPreconditionException) e).getKind())
                        .isEqualTo(ErrorKind.PRECONDITION));
        verifyNoInteractions(controlPlane, remoteShell, credentials);
    }

    @Test
    void testServerMayGoWhenAnotherServerRemains() throws Exception {
        ClusterMember old = member("old", "10.0.0.5", true);
        MembershipSnapshot snapshot = snapshot(List.of(member("n1", "10.0.0.1", true), old), old);
        when(credentials.nodesPendingDecommission()).thenReturn(new TreeSet<>());

        DecommissionPlan plan = orchestrator.plan(scenarioA(), snapshot, false);

        assertThat(plan.nodeNames()).containsExactly("old");
    }

    @Test
    void testOperatorOverrideAllowsLastServerRemoval() throws Exception {
        ClusterMember n1 = member("n1", "10.0.0.1", true);
        MembershipSnapshot snapshot = snapshot(List.of(n1), n1);
        when(credentials.nodesPendingDecommission()).thenReturn(new TreeSet<>());

        DecommissionPlan plan = orchestrator.plan(spec(server("n9", "10.0.0.9")), snapshot, true);

        assertThat(plan.nodeNames()).containsExactly("n1");
        assertThat(plan.getRecords().get(0).getObservedStage()).isEqualTo(DecommissionStage.PENDING);
    }

    // =================================================================
    // RESUMPTION
    // =================================================================

    @Test
    void testResumesAfterInterruptionAtDeletedFromCluster() throws Exception {
        // Given: n3 already deleted from the control plane, services still running
        when(credentials.nodesPendingDecommission()).thenReturn(new TreeSet<>(List.of("n3")));
        when(credentials.decommissionAddress("n3")).thenReturn(Optional.of("10.0.0.3"));
        when(remoteShell.serviceState("10.0.0.3")).thenReturn(ServiceState.ACTIVE);
        when(remoteShell.stopService("10.0.0.3")).thenReturn(RemoteOutcome.SUCCESS);

        // When
        DecommissionPlan plan = orchestrator.plan(scenarioA(),
                snapshot(List.of(member("n1", "10.0.0.1", true), member("n2", "10.0.0.2", false))), false);
        DecommissionReport report = orchestrator.execute(plan, false);

        // Then
        DecommissionRecord record = report.getRecords().get(0);
        assertThat(record.getObservedStage()).isEqualTo(DecommissionStage.DELETED_FROM_CLUSTER);
        assertThat(record.getStage()).isEqualTo(DecommissionStage.TOKEN_PURGED);
        assertThat(record.getActions()).containsExactly("stop", "purge");
        assertThat(report.getNodeResults()).extracting(NodeResult::getStatus).containsExactly(ResultStatus.SUCCESS);
        verify(controlPlane, never()).cordon(anyString());
        verify(controlPlane, never()).drain(anyString(), any());
        verify(controlPlane, never()).deleteMember(anyString());
        verify(credentials).purge("n3");
    }

    @Test
    void testResumesAtPurgeWhenServicesAlreadyStopped() throws Exception {
        when(credentials.nodesPendingDecommission()).thenReturn(new TreeSet<>(List.of("n3")));
        when(credentials.decommissionAddress("n3")).thenReturn(Optional.of("10.0.0.3"));
        when(remoteShell.serviceState("10.0.0.3")).thenReturn(ServiceState.INACTIVE);

        DecommissionPlan plan = orchestrator.plan(scenarioA(), snapshot(List.of(member("n1", "10.0.0.1", true))), false);
        DecommissionReport report = orchestrator.execute(plan, false);

        assertThat(report.getRecords().get(0).getActions()).containsExactly("purge");
        verify(remoteShell, never()).stopService(anyString());
        verify(credentials).purge("n3");
    }

    @Test
    void testCordonedAndEmptyMemberResumesAtDelete() throws Exception {
        // Given
        ClusterMember cordoned = ClusterMember.builder().name("n3").address("10.0.0.3").schedulable(false).build();
        when(credentials.nodesPendingDecommission()).thenReturn(new TreeSet<>());
        when(controlPlane.countEvictablePods("n3")).thenReturn(0);
        when(remoteShell.stopService("10.0.0.3")).thenReturn(RemoteOutcome.SUCCESS);

        // When
        DecommissionPlan plan = orchestrator.plan(scenarioA(),
                snapshot(List.of(member("n1", "10.0.0.1", true), cordoned), cordoned), false);
        DecommissionReport report = orchestrator.execute(plan, false);

        // Then
        assertThat(plan.getRecords().get(0).getObservedStage()).isEqualTo(DecommissionStage.DRAINING);
        assertThat(report.getRecords().get(0).getActions()).containsExactly("delete", "stop", "purge");
        verify(controlPlane, never()).cordon(anyString());
        verify(controlPlane, never()).drain(anyString(), any());
    }

    @Test
    void testCordonedMemberWithPodsIsDrainedWithoutCordon() throws Exception {
        ClusterMember cordoned = ClusterMember.builder().name("n3").address("10.0.0.3").schedulable(false).build();
        when(credentials.nodesPendingDecommission()).thenReturn(new TreeSet<>());
        when(controlPlane.countEvictablePods("n3")).thenReturn(2);
        when(controlPlane.getMember("n3")).thenReturn(Optional.of(cordoned));
        when(controlPlane.drain("n3", DRAIN_TIMEOUT)).thenReturn(DrainOutcome.COMPLETED);
        when(remoteShell.stopService("10.0.0.3")).thenReturn(RemoteOutcome.SUCCESS);

        DecommissionPlan plan = orchestrator.plan(scenarioA(),
                snapshot(List.of(member("n1", "10.0.0.1", true), cordoned), cordoned), false);
        DecommissionReport report = orchestrator.execute(plan, false);

        assertThat(report.getRecords().get(0).getActions()).containsExactly("drain", "delete", "stop", "purge");
        verify(controlPlane, never()).cordon(anyString());
    }

    // =================================================================
    // DRY RUN
    // =================================================================

    @Test
    void testDryRunIssuesNoMutatingCalls() throws Exception {
        // Given
        ClusterMember n3 = member("n3", "10.0.0.3", false);
        when(credentials.nodesPendingDecommission()).thenReturn(new TreeSet<>(List.of("n4")));
        when(credentials.decommissionAddress("n4")).thenReturn(Optional.of("10.0.0.4"));
        when(remoteShell.serviceState("10.0.0.4")).thenReturn(ServiceState.ACTIVE);

        // When
        DecommissionPlan plan = orchestrator.plan(scenarioA(),
                snapshot(List.of(member("n1", "10.0.0.1", true), n3), n3), false);
        DecommissionReport report = orchestrator.execute(plan, true);

        // Then
        assertThat(report.getNodeResults()).extracting(NodeResult::getStatus)
                .containsExactly(ResultStatus.SKIPPED, ResultStatus.SKIPPED);
        assertThat(report.getRecords().get(0).getActions())
                .containsExactly("cordon and drain", "delete from cluster", "stop services", "purge credentials");
        assertThat(report.getRecords().get(1).getActions()).containsExactly("stop services", "purge credentials");
        verify(controlPlane, never()).cordon(anyString());
        verify(controlPlane, never()).drain(anyString(), any());
        verify(controlPlane, never()).deleteMember(anyString());
        verify(remoteShell, never()).stopService(anyString());
        verify(credentials, never()).recordDecommission(anyString(), any());
        verify(credentials, never()).purge(anyString());
    }

    // =================================================================
    // WARNINGS AND ISOLATION
    // =================================================================

    @Test
    void testDrainTimeoutIsWarningAndDecommissionProceeds() throws Exception {
        ClusterMember n3 = member("n3", "10.0.0.3", false);
        when(credentials.nodesPendingDecommission()).thenReturn(new TreeSet<>());
        when(controlPlane.getMember("n3")).thenReturn(Optional.of(n3));
        when(controlPlane.drain("n3", DRAIN_TIMEOUT)).thenReturn(DrainOutcome.TIMED_OUT_FORCED);
        when(remoteShell.stopService("10.0.0.3")).thenReturn(RemoteOutcome.SUCCESS);

        DecommissionReport report = orchestrator.execute(
                orchestrator.plan(scenarioA(), snapshot(List.of(member("n1", "10.0.0.1", true), n3), n3), false),
                false);

        NodeResult result = report.getNodeResults().get(0);
        assertThat(result.getStatus()).isEqualTo(ResultStatus.WARNING);
        assertThat(result.getKind()).isEqualTo(ErrorKind.DRAIN_TIMEOUT_WARNING);
        assertThat(report.getRecords().get(0).getStage()).isEqualTo(DecommissionStage.TOKEN_PURGED);
        verify(controlPlane).deleteMember("n3");
    }

    @Test
    void testUnreachableHostDoesNotBlockCleanup() throws Exception {
        ClusterMember n3 = member("n3", "10.0.0.3", false);
        when(credentials.nodesPendingDecommission()).thenReturn(new TreeSet<>());
        when(controlPlane.getMember("n3")).thenReturn(Optional.of(n3));
        when(controlPlane.drain("n3", DRAIN_TIMEOUT)).thenReturn(DrainOutcome.COMPLETED);
        when(remoteShell.stopService("10.0.0.3")).thenReturn(RemoteOutcome.UNREACHABLE);

        DecommissionReport report = orchestrator.execute(
                orchestrator.plan(scenarioA(), snapshot(List.of(member("n1", "10.0.0.1", true), n3), n3), false),
                false);

        NodeResult result = report.getNodeResults().get(0);
        assertThat(result.getStatus()).isEqualTo(ResultStatus.WARNING);
        assertThat(result.getKind()).isEqualTo(ErrorKind.CONNECTIVITY);
        verify(credentials).purge("n3");
    }

    @Test
    void testFailedStopCommandIsWarning() throws Exception {
        when(credentials.nodesPendingDecommission()).thenReturn(new TreeSet<>(List.of("n3")));
        when(credentials.decommissionAddress("n3")).thenReturn(Optional.of("10.0.0.3"));
        when(remoteShell.serviceState("10.0.0.3")).thenReturn(ServiceState.ACTIVE);
        when(remoteShell.stopService("10.0.0.3")).thenThrow(new RemoteCommandException("permission denied", 1));

        DecommissionReport report = orchestrator.execute(
                orchestrator.plan(scenarioA(), snapshot(List.of(member("n1", "10.0.0.1", true))), false), false);

        assertThat(report.getNodeResults().get(0).getKind()).isEqualTo(ErrorKind.REMOTE_COMMAND);
        verify(credentials).purge("n3");
    }

    @Test
    void testOneNodeFailingNeverBlocksOthers() throws Exception {
        // Given
        ClusterMember n3 = member("n3", "10.0.0.3", false);
        ClusterMember n4 = member("n4", "10.0.0.4", false);
        when(credentials.nodesPendingDecommission()).thenReturn(new TreeSet<>());
        when(controlPlane.getMember("n3")).thenReturn(Optional.of(n3));
        when(controlPlane.getMember("n4")).thenReturn(Optional.of(n4));
        when(controlPlane.drain(anyString(), eq(DRAIN_TIMEOUT))).thenReturn(DrainOutcome.COMPLETED);
        when(controlPlane.deleteMember("n3")).thenThrow(new ConnectivityException("api timeout"));
        when(remoteShell.stopService("10.0.0.4")).thenReturn(RemoteOutcome.SUCCESS);

        // When
        DecommissionReport report = orchestrator.execute(orchestrator.plan(scenarioA(),
                snapshot(List.of(member("n1", "10.0.0.1", true), n3, n4), n3, n4), false), false);

        // Then
        assertThat(report.hasErrors()).isTrue();
        assertThat(report.getNodeResults().stream().collect(Collectors.toMap(NodeResult::getNode, NodeResult::getStatus)))
                .containsEntry("n3", ResultStatus.ERROR)
                .containsEntry("n4", ResultStatus.SUCCESS);
        assertThat(report.getRecords().get(0).getStage()).isEqualTo(DecommissionStage.DRAINING);
        verify(credentials, never()).purge("n3");
        verify(credentials).purge("n4");
    }

    @Test
    void testPendingActionsFromEachStage() {
        assertThat(NodeDecommissionOrchestrator.pendingActions(DecommissionStage.PENDING)).hasSize(4);
        assertThat(NodeDecommissionOrchestrator.pendingActions(DecommissionStage.SERVICE_STOPPED))
                .containsExactly("purge credentials");
        assertThat(NodeDecommissionOrchestrator.pendingActions(DecommissionStage.TOKEN_PURGED)).isEmpty();
    }

    private static MembershipSnapshot snapshot(List<ClusterMember> live, ClusterMember... stale) {
        return new MembershipSnapshot(live, List.of(stale), List.of());
    }
}
