package io.clusterreconciler.decommission;

import io.clusterreconciler.ReconcilerException;
import io.clusterreconciler.clients.ConnectivityException;
import io.clusterreconciler.clients.ControlPlaneClient;
import io.clusterreconciler.clients.DrainOutcome;
import io.clusterreconciler.clients.RemoteCommandException;
import io.clusterreconciler.clients.RemoteOutcome;
import io.clusterreconciler.clients.RemoteShellClient;
import io.clusterreconciler.clients.ServiceState;
import io.clusterreconciler.enums.DecommissionStage;
import io.clusterreconciler.enums.ErrorKind;
import io.clusterreconciler.enums.PipelinePhase;
import io.clusterreconciler.metrics.MetricsProvider;
import io.clusterreconciler.metrics.MetricsUtils;
import io.clusterreconciler.models.ClusterMember;
import io.clusterreconciler.models.ClusterSpec;
import io.clusterreconciler.models.DecommissionRecord;
import io.clusterreconciler.models.MembershipSnapshot;
import io.clusterreconciler.models.NodeResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static io.clusterreconciler.metrics.MetricsConstants.DECOMMISSION_TRANSITIONS_METRIC_NAME;
import static io.clusterreconciler.metrics.MetricsConstants.DECOMMISSION_WARNINGS_METRIC_NAME;

/**
 * Drives stale nodes through cordon, drain, delete, stop and purge.
 * <p>
 * The stage of every node is derived from what is observed at the start of a run:
 * <ul>
 *   <li>registered and schedulable, or still running evictable pods: PENDING</li>
 *   <li>registered, cordoned and empty: DRAINING</li>
 *   <li>deleted from the control plane (resumption marker only) with services still active or
 *       the host unreachable: DELETED_FROM_CLUSTER</li>
 *   <li>deleted with services inactive: SERVICE_STOPPED</li>
 * </ul>
 * A run resumes from that stage, so re-running after an interruption neither repeats finished
 * transitions nor fails on conditions that are already satisfied. Nodes are processed
 * concurrently; an error on one node never stops the others.
 */
@Slf4j
public class NodeDecommissionOrchestrator {

    private final ControlPlaneClient controlPlane;
    private final RemoteShellClient remoteShell;
    private final CredentialStore credentials;
    private final MetricsProvider metricsProvider;
    private final String clusterName;
    private final Duration drainTimeout;
    private final int parallelism;

    public NodeDecommissionOrchestrator(ControlPlaneClient controlPlane, RemoteShellClient remoteShell,
                                        CredentialStore credentials, MetricsProvider metricsProvider,
                                        String clusterName, Duration drainTimeout, int parallelism) {
        this.controlPlane = controlPlane;
        this.remoteShell = remoteShell;
        this.credentials = credentials;
        this.metricsProvider = metricsProvider;
        this.clusterName = clusterName;
        this.drainTimeout = drainTimeout;
        this.parallelism = parallelism;
    }

    /**
     * Work out which nodes need decommissioning and where each one stands. Read-only.
     *
     * @param spec validated desired state
     * @param snapshot live membership
     * @param allowServerRemoval operator override of the sole-server guard
     * @throws DecommissionPreconditionException if the cluster would be left without a live server
     * @throws ConnectivityException if the control plane cannot be queried
     */
    public DecommissionPlan plan(ClusterSpec spec, MembershipSnapshot snapshot, boolean allowServerRemoval) {
        checkServerGuard(snapshot, allowServerRemoval);

        Map<String, DecommissionRecord> records = new TreeMap<>();
        for (ClusterMember member : snapshot.getStaleMembers()) {
            records.put(member.getName(), resolveRegistered(member));
        }

        SortedSet<String> target = spec.getNodeNames();
        SortedSet<String> obsoleteMarkers = new TreeSet<>();
        for (String node : pendingMarkers()) {
            if (target.contains(node)) {
                log.info("Decommission - {} is declared again, its marker is obsolete", node);
                obsoleteMarkers.add(node);
            } else if (!records.containsKey(node)) {
                records.put(node, resolveDeleted(node));
            }
        }

        List<DecommissionRecord> plan = new ArrayList<>(records.values());
        for (DecommissionRecord record : plan) {
            log.info("Decommission - {} observed at stage {}", record.getNodeName(), record.getObservedStage().getValue());
        }
        return new DecommissionPlan(plan, obsoleteMarkers);
    }

    /**
     * Drive every planned node to TOKEN_PURGED, or only report the would-be actions in dry-run.
     */
    public DecommissionReport execute(DecommissionPlan plan, boolean dryRun) {
        if (!dryRun) {
            clearObsoleteMarkers(plan);
        }
        if (plan.isEmpty()) {
            log.info("Decommission - no stale nodes");
            return new DecommissionReport(List.of(), List.of());
        }

        if (dryRun) {
            List<NodeResult> results = new ArrayList<>();
            for (DecommissionRecord record : plan.getRecords()) {
                record.getActions().addAll(pendingActions(record.getObservedStage()));
                log.info("DRY RUN: would decommission {}: {}", record.getNodeName(), record.getActions());
                results.add(NodeResult.skipped(record.getNodeName(), PipelinePhase.DECOMMISSION,
                        "would " + String.join(", ", record.getActions())));
            }
            return new DecommissionReport(plan.getRecords(), results);
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, plan.getRecords().size()));
        try {
            List<Future<NodeResult>> futures = new ArrayList<>();
            for (DecommissionRecord record : plan.getRecords()) {
                futures.add(executor.submit(() -> decommission(record)));
            }
            List<NodeResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), plan.getRecords().get(i)));
            }
            return new DecommissionReport(plan.getRecords(), results);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Actions still to be performed from the given stage, in order.
     */
    public static List<String> pendingActions(DecommissionStage stage) {
        List<String> actions = new ArrayList<>();
        DecommissionStage current = stage;
        while (!current.isTerminal()) {
            actions.add(actionFor(current));
            current = current.next();
        }
        return actions;
    }

    private void checkServerGuard(MembershipSnapshot snapshot, boolean allowServerRemoval) {
        List<String> staleServers = snapshot.getStaleMembers().stream()
                .filter(ClusterMember::isServer)
                .map(ClusterMember::getName)
                .collect(Collectors.toList());
        if (staleServers.isEmpty()) {
            return;
        }
        long remainingServers = snapshot.getLiveMembers().stream()
                .filter(ClusterMember::isServer)
                .filter(member -> !staleServers.contains(member.getName()))
                .count();
        if (remainingServers > 0) {
            return;
        }
        if (allowServerRemoval) {
            log.warn("Decommission - removing last live server {} on operator override", staleServers);
            return;
        }
        throw new DecommissionPreconditionException("Refusing to decommission " + staleServers
                + ": it is the only live server of the cluster. Re-run with --allow-server-removal to override.");
    }

    private DecommissionRecord resolveRegistered(ClusterMember member) {
        String address = member.getAddress() != null ? member.getAddress() : readMarker(member.getName()).orElse(null);
        int evictable = member.isSchedulable() ? -1 : controlPlane.countEvictablePods(member.getName());
        DecommissionStage stage = member.isSchedulable() || evictable > 0
                ? DecommissionStage.PENDING
                : DecommissionStage.DRAINING;
        return new DecommissionRecord(member.getName(), address, stage);
    }

    private DecommissionRecord resolveDeleted(String node) {
        String address = readMarker(node).orElse(null);
        ServiceState state = address == null ? ServiceState.UNREACHABLE : remoteShell.serviceState(address);
        DecommissionStage stage = state == ServiceState.INACTIVE
                ? DecommissionStage.SERVICE_STOPPED
                : DecommissionStage.DELETED_FROM_CLUSTER;
        log.debug("Decommission - {} already deleted from the cluster, services {}", node, state);
        return new DecommissionRecord(node, address, stage);
    }

    private NodeResult decommission(DecommissionRecord record) {
        String node = record.getNodeName();
        ErrorKind warningKind = null;
        try {
            while (!record.getStage().isTerminal()) {
                DecommissionStage from = record.getStage();
                ErrorKind warning = transition(record);
                if (warning != null && warningKind == null) {
                    warningKind = warning;
                }
                log.info("Decommission - {}: {} -> {}", node, from.getValue(), record.getStage().getValue());
                metricsProvider.counter(DECOMMISSION_TRANSITIONS_METRIC_NAME,
                        MetricsUtils.buildStageTags(clusterName, record.getStage())).increment();
            }
        } catch (ReconcilerException e) {
            log.error("Decommission - {} failed at stage {}: {}", node, record.getStage().getValue(), e.getMessage());
            return NodeResult.error(node, PipelinePhase.DECOMMISSION, e.getKind(),
                    "stopped at " + record.getStage().getValue() + ": " + e.getMessage());
        } catch (IOException e) {
            log.error("Decommission - {} failed at stage {}: {}", node, record.getStage().getValue(), e.getMessage());
            return NodeResult.error(node, PipelinePhase.DECOMMISSION, ErrorKind.ARTIFACT_WRITE,
                    "stopped at " + record.getStage().getValue() + ": credential cache: " + e.getMessage());
        }

        if (!record.getWarnings().isEmpty()) {
            metricsProvider.counter(DECOMMISSION_WARNINGS_METRIC_NAME, MetricsUtils.buildClusterTags(clusterName))
                    .increment(record.getWarnings().size());
            return NodeResult.warning(node, PipelinePhase.DECOMMISSION, warningKind,
                    "decommissioned with warnings: " + String.join("; ", record.getWarnings()));
        }
        return NodeResult.success(node, PipelinePhase.DECOMMISSION,
                "decommissioned from " + record.getObservedStage().getValue());
    }

    /**
     * Perform the transition out of the record's current stage.
     *
     * @return the kind of the warning raised, or null
     */
    private ErrorKind transition(DecommissionRecord record) throws IOException {
        String node = record.getNodeName();
        switch (record.getStage()) {
            case PENDING: {
                Optional<ClusterMember> member = controlPlane.getMember(node);
                if (member.isEmpty()) {
                    // removed by someone else since planning
                    record.setStage(DecommissionStage.DELETED_FROM_CLUSTER);
                    return null;
                }
                if (member.get().isSchedulable()) {
                    controlPlane.cordon(node);
                    record.getActions().add("cordon");
                }
                DrainOutcome outcome = controlPlane.drain(node, drainTimeout);
                record.getActions().add("drain");
                record.setStage(DecommissionStage.DRAINING);
                if (outcome == DrainOutcome.TIMED_OUT_FORCED) {
                    record.getWarnings().add("drain timed out after " + drainTimeout.toSeconds()
                            + "s, remaining pods force deleted");
                    log.warn("Decommission - {}: drain timed out, proceeding with forced removal", node);
                    return ErrorKind.DRAIN_TIMEOUT_WARNING;
                }
                return null;
            }
            case DRAINING: {
                credentials.recordDecommission(node, record.getAddress());
                controlPlane.deleteMember(node);
                record.getActions().add("delete");
                record.setStage(DecommissionStage.DELETED_FROM_CLUSTER);
                return null;
            }
            case DELETED_FROM_CLUSTER: {
                record.setStage(DecommissionStage.SERVICE_STOPPED);
                if (record.getAddress() == null) {
                    record.getWarnings().add("no known address, services not stopped");
                    log.warn("Decommission - {}: no known address, skipping service stop", node);
                    return ErrorKind.CONNECTIVITY;
                }
                try {
                    RemoteOutcome outcome = remoteShell.stopService(record.getAddress());
                    record.getActions().add("stop");
                    if (outcome == RemoteOutcome.UNREACHABLE) {
                        record.getWarnings().add("host " + record.getAddress() + " unreachable, services not stopped");
                        log.warn("Decommission - {}: host {} unreachable, continuing with cleanup",
                                node, record.getAddress());
                        return ErrorKind.CONNECTIVITY;
                    }
                    return null;
                } catch (RemoteCommandException e) {
                    record.getWarnings().add("stopping services failed: " + e.getMessage());
                    log.warn("Decommission - {}: {}", node, e.getMessage());
                    return ErrorKind.REMOTE_COMMAND;
                }
            }
            case SERVICE_STOPPED: {
                credentials.purge(node);
                record.getActions().add("purge");
                record.setStage(DecommissionStage.TOKEN_PURGED);
                return null;
            }
            default:
                return null;
        }
    }

    private void clearObsoleteMarkers(DecommissionPlan plan) {
        for (String node : plan.getObsoleteMarkers()) {
            try {
                credentials.clearDecommission(node);
            } catch (IOException e) {
                log.warn("Decommission - cannot clear marker of {}: {}", node, e.getMessage());
            }
        }
    }

    private SortedSet<String> pendingMarkers() {
        try {
            return credentials.nodesPendingDecommission();
        } catch (IOException e) {
            throw new ConnectivityException("Failed to read credential cache: " + e.getMessage(), e);
        }
    }

    private Optional<String> readMarker(String node) {
        try {
            return credentials.decommissionAddress(node);
        } catch (IOException e) {
            log.warn("Decommission - cannot read marker of {}: {}", node, e.getMessage());
            return Optional.empty();
        }
    }

    private static NodeResult await(Future<NodeResult> future, DecommissionRecord record) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return NodeResult.error(record.getNodeName(), PipelinePhase.DECOMMISSION, ErrorKind.CONNECTIVITY,
                    "interrupted at " + record.getStage().getValue());
        } catch (ExecutionException e) {
            log.error("Decommission - {} failed unexpectedly", record.getNodeName(), e.getCause());
            return NodeResult.error(record.getNodeName(), PipelinePhase.DECOMMISSION, ErrorKind.REMOTE_COMMAND,
                    "failed at " + record.getStage().getValue() + ": " + e.getCause().getMessage());
        }
    }

    private static String actionFor(DecommissionStage stage) {
        switch (stage) {
            case PENDING:
                return "cordon and drain";
            case DRAINING:
                return "delete from cluster";
            case DELETED_FROM_CLUSTER:
                return "stop services";
            case SERVICE_STOPPED:
                return "purge credentials";
            default:
                return "none";
        }
    }
}
