package io.clusterreconciler.artifacts;

import io.clusterreconciler.enums.ArtifactAction;
import io.clusterreconciler.enums.PipelinePhase;
import io.clusterreconciler.metrics.MetricsProvider;
import io.clusterreconciler.metrics.MetricsUtils;
import io.clusterreconciler.models.ArtifactChange;
import io.clusterreconciler.models.ArtifactPlan;
import io.clusterreconciler.models.ClusterSpec;
import io.clusterreconciler.models.GeneratedArtifact;
import io.clusterreconciler.models.NodeResult;
import io.clusterreconciler.models.NodeSpec;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

import static io.clusterreconciler.metrics.MetricsConstants.*;

/**
 * Diffs the declared node set against the materialized artifacts and regenerates them.
 * <p>
 * Every artifact is rendered in memory before anything is written, the whole batch is handed
 * to the store at once, and an unchanged spec produces no write at all.
 */
@Slf4j
public class ArtifactReconciler {
    
    private final ArtifactStore store;
    private final ArtifactRenderer renderer;
    private final DescriptorRenderer descriptorRenderer;
    private final MetricsProvider metricsProvider;
    private final String clusterName;
    
    public ArtifactReconciler(ArtifactStore store, ArtifactRenderer renderer,
                              DescriptorRenderer descriptorRenderer, MetricsProvider metricsProvider,
                              String clusterName) {
        this.store = store;
        this.renderer = renderer;
        this.descriptorRenderer = descriptorRenderer;
        this.metricsProvider = metricsProvider;
        this.clusterName = clusterName;
    }
    
    /**
     * Compute the artifact plan for a validated spec and apply it unless dry-run.
     *
     * @param spec validated desired state
     * @param dryRun compute and report only
     * @return the plan with one result per affected node
     * @throws ArtifactWriteException if rendering, reading or committing fails; nothing is half-applied
     */
    public ArtifactReconciliationResult reconcile(ClusterSpec spec, boolean dryRun) {
        log.info("Starting artifact reconciliation in {}", store.describe());
        
        ArtifactPlan plan = plan(spec);
        List<String> toCreate = plan.keysWith(ArtifactAction.CREATE);
        List<String> toUpdate = plan.keysWith(ArtifactAction.UPDATE);
        List<String> toDelete = plan.keysWith(ArtifactAction.DELETE);
        log.info("Artifact plan: create={}, update={}, delete={}, unchanged={}, descriptor={}",
                toCreate, toUpdate, toDelete, plan.keysWith(ArtifactAction.UNCHANGED).size(),
                plan.getDescriptor().getAction());
        
        boolean applied = false;
        if (!plan.hasChanges()) {
            log.info("Artifacts are up to date, nothing to write");
        } else if (dryRun) {
            log.info("DRY RUN: artifact changes computed but not written");
        } else {
            store.apply(plan);
            applied = true;
            Map<String, String> tags = MetricsUtils.buildClusterTags(clusterName);
            metricsProvider.counter(ARTIFACTS_CREATED_METRIC_NAME, tags).increment(toCreate.size());
            metricsProvider.counter(ARTIFACTS_UPDATED_METRIC_NAME, tags).increment(toUpdate.size());
            metricsProvider.counter(ARTIFACTS_DELETED_METRIC_NAME, tags).increment(toDelete.size());
        }
        
        List<NodeResult> results = new ArrayList<>();
        for (ArtifactChange change : plan.getArtifacts()) {
            results.add(toResult(change, dryRun));
        }
        return new ArtifactReconciliationResult(plan, applied, results);
    }
    
    /**
     * Diff without side effects.
     */
    public ArtifactPlan plan(ClusterSpec spec) {
        SortedSet<String> target = spec.getNodeNames();
        SortedSet<String> existing;
        try {
            existing = store.listArtifactKeys();
        } catch (IOException e) {
            throw new ArtifactWriteException("Failed to list existing artifacts: " + e.getMessage(), e);
        }
        
        SortedSet<String> allKeys = new TreeSet<>(target);
        allKeys.addAll(existing);
        
        List<ArtifactChange> changes = new ArrayList<>();
        for (String key : allKeys) {
            if (!target.contains(key)) {
                // undeclared artifacts never survive a reconciliation
                changes.add(new ArtifactChange(key, ArtifactAction.DELETE, null));
                continue;
            }
            NodeSpec node = spec.findNode(key).orElseThrow();
            GeneratedArtifact artifact = render(node, spec);
            Optional<String> current = existing.contains(key) ? read(key) : Optional.empty();
            changes.add(new ArtifactChange(key, classify(current, artifact.getContent()), artifact.getContent()));
        }
        
        String descriptor = descriptorRenderer.render(spec);
        Optional<String> currentDescriptor;
        try {
            currentDescriptor = store.readDescriptor();
        } catch (IOException e) {
            throw new ArtifactWriteException("Failed to read deployment descriptor: " + e.getMessage(), e);
        }
        ArtifactChange descriptorChange = new ArtifactChange(
                "descriptor", classify(currentDescriptor, descriptor), descriptor);
        
        return new ArtifactPlan(changes, descriptorChange);
    }
    
    private GeneratedArtifact render(NodeSpec node, ClusterSpec spec) {
        try {
            return renderer.render(node, spec);
        } catch (RuntimeException e) {
            if (e instanceof ArtifactWriteException) {
                throw e;
            }
            throw new ArtifactWriteException("Failed to render artifact for " + node.getName() + ": " + e.getMessage(), e);
        }
    }
    
    private Optional<String> read(String key) {
        try {
            return store.readArtifact(key);
        } catch (IOException e) {
            throw new ArtifactWriteException("Failed to read artifact " + key + ": " + e.getMessage(), e);
        }
    }
    
    private static ArtifactAction classify(Optional<String> current, String rendered) {
        if (current.isEmpty()) {
            return ArtifactAction.CREATE;
        }
        return current.get().equals(rendered) ? ArtifactAction.UNCHANGED : ArtifactAction.UPDATE;
    }
    
    private static NodeResult toResult(ArtifactChange change, boolean dryRun) {
        String verb = switch (change.getAction()) {
            case CREATE -> "created";
            case UPDATE -> "updated";
            case DELETE -> "deleted";
            case UNCHANGED -> "unchanged";
        };
        if (dryRun && change.getAction().isChange()) {
            return NodeResult.skipped(change.getKey(), PipelinePhase.ARTIFACT, "would be " + verb);
        }
        return NodeResult.success(change.getKey(), PipelinePhase.ARTIFACT, "artifact " + verb);
    }
}
