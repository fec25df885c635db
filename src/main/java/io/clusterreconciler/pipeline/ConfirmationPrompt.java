package io.clusterreconciler.pipeline;

/**
 * How the pipeline obtains the operator's go-ahead before a mutating step.
 */
public interface ConfirmationPrompt {
    
    /**
     * Blocks until the operator answers.
     *
     * @return true only on an explicit affirmative answer
     */
    boolean confirm(String question);
}
