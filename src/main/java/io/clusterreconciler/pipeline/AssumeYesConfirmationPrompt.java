package io.clusterreconciler.pipeline;

import lombok.extern.slf4j.Slf4j;

/**
 * Non-interactive override used with {@code --yes}.
 */
@Slf4j
public class AssumeYesConfirmationPrompt implements ConfirmationPrompt {
    
    @Override
    public boolean confirm(String question) {
        log.info("{} -> yes (assumed)", question);
        return true;
    }
}
