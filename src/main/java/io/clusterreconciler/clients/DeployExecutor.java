package io.clusterreconciler.clients;

import java.util.List;
import java.util.Map;

/**
 * External deployment executor.
 */
public interface DeployExecutor {
    
    /**
     * Push the built configuration to every listed node.
     *
     * @return one result per node, in the order given
     */
    Map<String, ExecutionResult> deploy(List<String> nodes);
    
    /**
     * Command line used for one node, for the deployment plan.
     */
    String describe(String node);
}
