package io.clusterreconciler.pipeline;

import io.clusterreconciler.ReconcilerException;
import io.clusterreconciler.artifacts.ArtifactReconciler;
import io.clusterreconciler.artifacts.ArtifactReconciliationResult;
import io.clusterreconciler.artifacts.ArtifactStore;
import io.clusterreconciler.clients.DeployExecutor;
import io.clusterreconciler.clients.EvaluatorClient;
import io.clusterreconciler.clients.ExecutionResult;
import io.clusterreconciler.decommission.DecommissionPlan;
import io.clusterreconciler.decommission.DecommissionReport;
import io.clusterreconciler.decommission.NodeDecommissionOrchestrator;
import io.clusterreconciler.desiredstate.DesiredStateLoader;
import io.clusterreconciler.desiredstate.ValidationException;
import io.clusterreconciler.enums.ErrorKind;
import io.clusterreconciler.enums.ExitCode;
import io.clusterreconciler.enums.PipelinePhase;
import io.clusterreconciler.enums.PipelineState;
import io.clusterreconciler.enums.ResultStatus;
import io.clusterreconciler.membership.ClusterMembershipInspector;
import io.clusterreconciler.metrics.MetricsProvider;
import io.clusterreconciler.metrics.MetricsUtils;
import io.clusterreconciler.models.ClusterSpec;
import io.clusterreconciler.models.MembershipSnapshot;
import io.clusterreconciler.models.NodeResult;
import io.clusterreconciler.models.NodeSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static io.clusterreconciler.metrics.MetricsConstants.PHASE_DURATION_METRIC_NAME;

/**
 * Sequences one run:
 * <ol>
 *   <li>load and validate the desired state</li>
 *   <li>reconcile artifacts ({@code --skip-deploy} stops here)</li>
 *   <li>decommission stale nodes when cleanup is requested, after its own confirmation</li>
 *   <li>evaluate every target node and the deploy descriptor</li>
 *   <li>render the plan and wait for confirmation ({@code --dry-run} stops here)</li>
 *   <li>deploy every target node</li>
 *   <li>verify reachability of every target node</li>
 * </ol>
 * Every run ends with the per-node status table.
 */
@Slf4j
public class DeploymentPipelineCoordinator {

    private final DesiredStateLoader loader;
    private final ArtifactStore artifactStore;
    private final ArtifactReconciler artifactReconciler;
    private final ClusterMembershipInspector membershipInspector;
    private final NodeDecommissionOrchestrator decommissionOrchestrator;
    private final EvaluatorClient evaluator;
    private final DeployExecutor deployExecutor;
    private final ReachabilityVerifier verifier;
    private final ConfirmationPrompt prompt;
    private final ConsoleReporter reporter;
    private final MetricsProvider metricsProvider;
    private final String clusterName;

    public DeploymentPipelineCoordinator(DesiredStateLoader loader,
                                         ArtifactStore artifactStore,
                                         ArtifactReconciler artifactReconciler,
                                         ClusterMembershipInspector membershipInspector,
                                         NodeDecommissionOrchestrator decommissionOrchestrator,
                                         EvaluatorClient evaluator,
                                         DeployExecutor deployExecutor,
                                         ReachabilityVerifier verifier,
                                         ConfirmationPrompt prompt,
                                         ConsoleReporter reporter,
                                         MetricsProvider metricsProvider,
                                         String clusterName) {
        this.loader = loader;
        this.artifactStore = artifactStore;
        this.artifactReconciler = artifactReconciler;
        this.membershipInspector = membershipInspector;
        this.decommissionOrchestrator = decommissionOrchestrator;
        this.evaluator = evaluator;
        this.deployExecutor = deployExecutor;
        this.verifier = verifier;
        this.prompt = prompt;
        this.reporter = reporter;
        this.metricsProvider = metricsProvider;
        this.clusterName = clusterName;
    }

    public PipelineResult run(PipelineOptions options) {
        ReconciliationContext context = new ReconciliationContext(options, artifactStore);
        ConfirmationPrompt confirmation = options.isAssumeYes() ? new AssumeYesConfirmationPrompt() : prompt;
        log.info("Starting pipeline run for cluster {} with {}", clusterName, options);

        try {
            context.transition(PipelineState.LOADING);
            ClusterSpec spec = timed(PipelinePhase.VALIDATE, () -> loader.load(options.getTopologyFile()));
            context.setSpec(spec);
            for (NodeSpec node : spec.getNodes()) {
                context.addResult(NodeResult.success(node.getName(), PipelinePhase.VALIDATE,
                        node.getNodeRole().getValue() + " " + node.getIp()));
            }

            if (options.isValidateOnly()) {
                reporter.printArtifactPlan(artifactReconciler.plan(spec), artifactStore.describe(), false);
                return finish(context, PipelineState.COMPLETED);
            }

            context.transition(PipelineState.RECONCILING_ARTIFACTS);
            ArtifactReconciliationResult artifacts = timed(PipelinePhase.ARTIFACT,
                    () -> artifactReconciler.reconcile(spec, options.isDryRun()));
            context.addResults(artifacts.getNodeResults());
            reporter.printArtifactPlan(artifacts.getPlan(), artifactStore.describe(), artifacts.isApplied());

            if (options.isSkipDeploy()) {
                if (options.isCleanup()) {
                    log.warn("Cleanup of cluster {} ignored: --skip-deploy stops after artifact generation", clusterName);
                    reporter.printMessage("Cleanup ignored with --skip-deploy.");
                }
                reporter.printNextSteps(spec, false);
                return finish(context, PipelineState.COMPLETED);
            }

            if (options.isCleanup()) {
                context.transition(PipelineState.DECOMMISSIONING);
                if (!decommission(context, spec, confirmation)) {
                    return finish(context, PipelineState.CANCELLED);
                }
            }

            if (!options.isDryRun()) {
                context.transition(PipelineState.EVALUATING);
                timed(PipelinePhase.EVALUATE, () -> {
                    evaluate(context, spec);
                    return null;
                });
            }

            context.transition(PipelineState.AWAITING_CONFIRMATION);
            reporter.printDeploymentPlan(spec, deployExecutor);
            if (options.isDryRun()) {
                reporter.printDryRunDeploy(spec, deployExecutor);
                reporter.printNextSteps(spec, false);
                return finish(context, PipelineState.COMPLETED);
            }
            if (!confirmation.confirm("Deploy " + spec.getNodes().size() + " node(s) to cluster " + clusterName + "?")) {
                log.info("Deployment cancelled by operator");
                return finish(context, PipelineState.CANCELLED);
            }

            context.transition(PipelineState.DEPLOYING);
            timed(PipelinePhase.DEPLOY, () -> {
                deploy(context, spec);
                return null;
            });

            context.transition(PipelineState.VERIFYING);
            context.addResults(timed(PipelinePhase.VERIFY, () -> verifier.verify(spec)));

            reporter.printNextSteps(spec, true);
            return finish(context, PipelineState.COMPLETED);
        } catch (ValidationException e) {
            log.error("Validation failed: {}", e.getMessage());
            reporter.printViolations(e.getViolations());
            context.addResult(NodeResult.error(null, PipelinePhase.VALIDATE, ErrorKind.VALIDATION, e.getMessage()));
            return finish(context, PipelineState.FAILED);
        } catch (ReconcilerException e) {
            log.error("Pipeline failed in state {}: {}", context.getState(), e.getMessage(), e);
            context.addResult(NodeResult.error(null, phaseOf(context.getState()), e.getKind(), e.getMessage()));
            return finish(context, PipelineState.FAILED);
        }
    }

    /**
     * @return false if the operator declined
     */
    private boolean decommission(ReconciliationContext context, ClusterSpec spec, ConfirmationPrompt confirmation) {
        PipelineOptions options = context.getOptions();
        MembershipSnapshot snapshot = membershipInspector.inspect(spec);
        DecommissionPlan plan = decommissionOrchestrator.plan(spec, snapshot, options.isAllowServerRemoval());
        reporter.printDecommissionPlan(plan);
        if (plan.isEmpty()) {
            if (!plan.getObsoleteMarkers().isEmpty() && !options.isDryRun()) {
                decommissionOrchestrator.execute(plan, false);
            }
            return true;
        }
        if (!options.isDryRun() && !confirmation.confirm(
                "Decommission " + plan.getRecords().size() + " node(s) from cluster " + clusterName + "?")) {
            log.info("Decommission cancelled by operator");
            return false;
        }
        DecommissionReport report = timed(PipelinePhase.DECOMMISSION,
                () -> decommissionOrchestrator.execute(plan, options.isDryRun()));
        context.addResults(report.getNodeResults());
        return true;
    }

    private void evaluate(ReconciliationContext context, ClusterSpec spec) {
        List<ExecutionResult> failures = new ArrayList<>();
        for (String node : spec.getNodeNames()) {
            ExecutionResult result = evaluator.evaluate(node);
            record(context, PipelinePhase.EVALUATE, ErrorKind.BUILD, result, "evaluated", failures);
        }
        ExecutionResult descriptor = evaluator.evaluateDescriptor();
        record(context, PipelinePhase.EVALUATE, ErrorKind.BUILD, descriptor, "descriptor evaluated", failures);
        if (!failures.isEmpty()) {
            throw new BuildException(failures);
        }
    }

    private void deploy(ReconciliationContext context, ClusterSpec spec) {
        List<String> nodes = new ArrayList<>(spec.getNodeNames());
        Map<String, ExecutionResult> results = deployExecutor.deploy(nodes);
        List<ExecutionResult> failures = new ArrayList<>();
        for (String node : nodes) {
            ExecutionResult result = results.getOrDefault(node,
                    new ExecutionResult(node, false, "no result from deployment executor"));
            record(context, PipelinePhase.DEPLOY, ErrorKind.DEPLOY, result, "deployed", failures);
        }
        if (!failures.isEmpty()) {
            throw new DeployException(failures);
        }
    }

    private static void record(ReconciliationContext context, PipelinePhase phase, ErrorKind kind,
                               ExecutionResult result, String successMessage, List<ExecutionResult> failures) {
        if (result.isSuccess()) {
            context.addResult(NodeResult.success(result.getTarget(), phase, successMessage));
        } else {
            log.error("{} failed for {}: {}", phase.getValue(), result.getTarget(), result.getDetail());
            context.addResult(NodeResult.error(result.getTarget(), phase, kind, result.getDetail()));
            failures.add(result);
        }
    }

    private PipelineResult finish(ReconciliationContext context, PipelineState state) {
        context.transition(state);
        List<NodeResult> results = context.getResults();
        reporter.printStatusTable(results);

        ExitCode exitCode;
        if (state == PipelineState.CANCELLED) {
            exitCode = ExitCode.CANCELLED;
        } else if (state == PipelineState.FAILED) {
            exitCode = ExitCode.FAILURE;
        } else if (results.stream().anyMatch(result -> result.getStatus() == ResultStatus.ERROR
                || result.getStatus() == ResultStatus.WARNING)) {
            exitCode = ExitCode.DEGRADED;
        } else {
            exitCode = ExitCode.SUCCESS;
        }
        metricsProvider.summary().forEach(line -> log.info("Metric - {}", line));
        log.info("Pipeline finished in state {} with exit code {}", state, exitCode.getCode());
        return new PipelineResult(state, exitCode, results);
    }

    private <T> T timed(PipelinePhase phase, Supplier<T> work) {
        return metricsProvider.timer(PHASE_DURATION_METRIC_NAME, MetricsUtils.buildPhaseTags(clusterName, phase))
                .record(work);
    }

    private static PipelinePhase phaseOf(PipelineState state) {
        if (state == null) {
            return PipelinePhase.VALIDATE;
        }
        switch (state) {
            case RECONCILING_ARTIFACTS:
                return PipelinePhase.ARTIFACT;
            case DECOMMISSIONING:
                return PipelinePhase.DECOMMISSION;
            case EVALUATING:
                return PipelinePhase.EVALUATE;
            case DEPLOYING:
                return PipelinePhase.DEPLOY;
            case VERIFYING:
                return PipelinePhase.VERIFY;
            default:
                return PipelinePhase.VALIDATE;
        }
    }
}
