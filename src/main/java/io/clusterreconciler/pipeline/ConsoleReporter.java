package io.clusterreconciler.pipeline;

import io.clusterreconciler.clients.DeployExecutor;
import io.clusterreconciler.decommission.DecommissionPlan;
import io.clusterreconciler.decommission.NodeDecommissionOrchestrator;
import io.clusterreconciler.desiredstate.ValidationViolation;
import io.clusterreconciler.enums.ArtifactAction;
import io.clusterreconciler.models.ArtifactPlan;
import io.clusterreconciler.models.ClusterSpec;
import io.clusterreconciler.models.DecommissionRecord;
import io.clusterreconciler.models.NodeResult;
import io.clusterreconciler.models.NodeSpec;

import java.io.PrintStream;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Operator-facing output: plans, the per-node status table and next steps.
 * Diagnostics go to the log, not here.
 */
public class ConsoleReporter {
    
    private static final String STATUS_ROW = "%-20s %-13s %-8s %-22s %s%n";
    
    private final PrintStream out;
    
    public ConsoleReporter(PrintStream out) {
        this.out = out;
    }
    
    public void printViolations(List<ValidationViolation> violations) {
        out.println();
        out.println("Desired state is invalid (" + violations.size() + " problem(s)):");
        for (ValidationViolation violation : violations) {
            out.println("  - " + violation);
        }
    }
    
    public void printArtifactPlan(ArtifactPlan plan, String location, boolean written) {
        out.println();
        out.println("Artifacts in " + location + (written ? "" : " (not written)") + ":");
        printKeys("create", plan.keysWith(ArtifactAction.CREATE));
        printKeys("update", plan.keysWith(ArtifactAction.UPDATE));
        printKeys("delete", plan.keysWith(ArtifactAction.DELETE));
        out.println("  unchanged: " + plan.keysWith(ArtifactAction.UNCHANGED).size());
        out.println("  descriptor: " + plan.getDescriptor().getAction().name().toLowerCase());
    }
    
    public void printDecommissionPlan(DecommissionPlan plan) {
        out.println();
        if (plan.isEmpty()) {
            out.println("No stale nodes to decommission.");
            return;
        }
        out.println("Nodes to decommission:");
        for (DecommissionRecord record : plan.getRecords()) {
            out.println("  " + record.getNodeName()
                    + " (" + (record.getAddress() == null ? "address unknown" : record.getAddress()) + ")"
                    + " at " + record.getObservedStage().getValue() + ": "
                    + String.join(" -> ", NodeDecommissionOrchestrator.pendingActions(record.getObservedStage())));
        }
    }
    
    public void printDeploymentPlan(ClusterSpec spec, DeployExecutor executor) {
        out.println();
        out.println("Deployment plan for " + spec.getDomain() + ":");
        List<NodeSpec> nodes = spec.getNodes().stream()
                .sorted(Comparator.comparing(NodeSpec::getName))
                .collect(Collectors.toList());
        for (NodeSpec node : nodes) {
            String marker = node.isServer() ? "*" : " ";
            String description = node.getDescription() == null ? "" : " - " + node.getDescription();
            out.println("  " + marker + " " + node.getName() + " (" + node.getNodeRole().getValue() + ") "
                    + node.getIp() + description);
        }
        out.println("  (* = cluster-init server)");
        out.println();
        for (NodeSpec node : nodes) {
            out.println("  Deploy command: " + executor.describe(node.getName()));
        }
    }
    
    public void printDryRunDeploy(ClusterSpec spec, DeployExecutor executor) {
        out.println();
        for (String node : spec.getNodeNames()) {
            out.println("[DRY RUN] Would run: " + executor.describe(node));
        }
    }
    
    public void printStatusTable(List<NodeResult> results) {
        out.println();
        if (results.isEmpty()) {
            out.println("No per-node results.");
            return;
        }
        out.printf(STATUS_ROW, "NODE", "PHASE", "STATUS", "KIND", "MESSAGE");
        for (NodeResult result : results) {
            out.printf(STATUS_ROW,
                    result.getNode() == null ? "-" : result.getNode(),
                    result.getPhase().getValue(),
                    result.getStatus().name(),
                    result.getKind() == null ? "-" : result.getKind().name(),
                    result.getMessage() == null ? "" : result.getMessage());
        }
    }
    
    public void printNextSteps(ClusterSpec spec, boolean deployed) {
        out.println();
        out.println("Next steps:");
        if (deployed) {
            NodeSpec server = spec.getServer();
            out.println("  1. Set up join tokens on agents (first deployment only), from "
                    + server.getName() + " (" + server.getIp() + ")");
            out.println("  2. Verify cluster membership: kubectl get nodes");
            out.println("  3. Check workloads: kubectl get pods -A");
        } else {
            out.println("  1. Review the generated configurations");
            out.println("  2. Re-run without --dry-run / --skip-deploy to deploy");
        }
    }
    
    public void printMessage(String message) {
        out.println(message);
    }
    
    private void printKeys(String label, List<String> keys) {
        if (!keys.isEmpty()) {
            out.println("  " + label + ": " + String.join(", ", keys));
        }
    }
}
