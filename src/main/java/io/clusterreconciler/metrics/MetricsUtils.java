package io.clusterreconciler.metrics;

import io.clusterreconciler.enums.DecommissionStage;
import io.clusterreconciler.enums.PipelinePhase;

import java.util.HashMap;
import java.util.Map;

import static io.clusterreconciler.metrics.MetricsConstants.CLUSTER_TAG;
import static io.clusterreconciler.metrics.MetricsConstants.PHASE_TAG;
import static io.clusterreconciler.metrics.MetricsConstants.STAGE_TAG;

/**
 * Utility class for handling metrics.
 */
public class MetricsUtils {
    /**
     * Builds the tags of a decommission stage transition.
     *
     * @param cluster the cluster name
     * @param stage the stage reached
     * @return a map of metrics tags
     */
    public static Map<String, String> buildStageTags(String cluster, DecommissionStage stage) {
        Map<String, String> tags = buildClusterTags(cluster);
        tags.put(STAGE_TAG, stage.getValue());
        return tags;
    }

    /**
     * Builds the tags of a pipeline phase timer.
     *
     * @param cluster the cluster name
     * @param phase the pipeline phase
     * @return a map of metrics tags
     */
    public static Map<String, String> buildPhaseTags(String cluster, PipelinePhase phase) {
        Map<String, String> tags = buildClusterTags(cluster);
        tags.put(PHASE_TAG, phase.getValue());
        return tags;
    }

    public static Map<String, String> buildClusterTags(String cluster) {
        Map<String, String> tags = new HashMap<>();
        tags.put(CLUSTER_TAG, cluster);
        return tags;
    }
}
