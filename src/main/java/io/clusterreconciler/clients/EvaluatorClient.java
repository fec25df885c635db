package io.clusterreconciler.clients;

/**
 * External configuration evaluator. Both calls return the evaluator's result and never throw for a
 * failed evaluation.
 */
public interface EvaluatorClient {
    
    ExecutionResult evaluate(String node);
    
    /**
     * Evaluate the aggregate deployment descriptor.
     */
    ExecutionResult evaluateDescriptor();
}
