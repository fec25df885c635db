package io.clusterreconciler.pipeline;

import io.clusterreconciler.clients.RemoteShellClient;
import io.clusterreconciler.enums.ErrorKind;
import io.clusterreconciler.enums.PipelinePhase;
import io.clusterreconciler.metrics.MetricsProvider;
import io.clusterreconciler.metrics.MetricsUtils;
import io.clusterreconciler.models.ClusterSpec;
import io.clusterreconciler.models.NodeResult;
import io.clusterreconciler.models.NodeSpec;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static io.clusterreconciler.metrics.MetricsConstants.VERIFICATION_FAILURES_METRIC_NAME;

/**
 * Post-deploy check that every target node answers on its management channel.
 * Failures are warnings: the deployment has already happened.
 */
@Slf4j
public class ReachabilityVerifier {
    
    private final RemoteShellClient remoteShell;
    private final MetricsProvider metricsProvider;
    private final String clusterName;
    private final Duration timeout;
    private final int parallelism;
    
    public ReachabilityVerifier(RemoteShellClient remoteShell, MetricsProvider metricsProvider, String clusterName,
                                Duration timeout, int parallelism) {
        this.remoteShell = remoteShell;
        this.metricsProvider = metricsProvider;
        this.clusterName = clusterName;
        this.timeout = timeout;
        this.parallelism = parallelism;
    }
    
    public List<NodeResult> verify(ClusterSpec spec) {
        List<NodeSpec> nodes = spec.getNodes().stream()
                .sorted(Comparator.comparing(NodeSpec::getName))
                .collect(Collectors.toList());
        if (nodes.isEmpty()) {
            return List.of();
        }
        
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, nodes.size()));
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (NodeSpec node : nodes) {
                futures.add(executor.submit(() -> remoteShell.ping(node.getIp(), timeout)));
            }
            
            List<NodeResult> results = new ArrayList<>();
            for (int i = 0; i < nodes.size(); i++) {
                NodeSpec node = nodes.get(i);
                String failure = null;
                try {
                    if (!futures.get(i).get()) {
                        failure = "not reachable at " + node.getIp() + " within " + timeout.toSeconds() + "s";
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    failure = "verification interrupted";
                } catch (ExecutionException e) {
                    failure = "verification failed: " + e.getCause().getMessage();
                }
                
                if (failure == null) {
                    log.info("Verify - {} ({}) is reachable", node.getName(), node.getIp());
                    results.add(NodeResult.success(node.getName(), PipelinePhase.VERIFY, "reachable"));
                } else {
                    log.warn("Verify - {} {}", node.getName(), failure);
                    metricsProvider.counter(VERIFICATION_FAILURES_METRIC_NAME, MetricsUtils.buildClusterTags(clusterName))
                            .increment();
                    results.add(NodeResult.warning(node.getName(), PipelinePhase.VERIFY,
                            ErrorKind.VERIFICATION_WARNING, failure));
                }
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}
