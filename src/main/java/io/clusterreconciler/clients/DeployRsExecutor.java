package io.clusterreconciler.clients;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link DeployExecutor} that runs the configured deploy command once per node, by default
 * {@code deploy --remote-build .#<node>}. Every node is attempted even after a failure so that
 * the result shows exactly which nodes received the new configuration.
 */
@Slf4j
public class DeployRsExecutor implements DeployExecutor {
    
    private final CommandRunner runner;
    private final Path flakeDir;
    private final List<String> command;
    private final Duration timeout;
    
    public DeployRsExecutor(CommandRunner runner, Path flakeDir, List<String> command, Duration timeout) {
        this.runner = runner;
        this.flakeDir = flakeDir;
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }
    
    @Override
    public Map<String, ExecutionResult> deploy(List<String> nodes) {
        Map<String, ExecutionResult> results = new LinkedHashMap<>();
        for (String node : nodes) {
            log.info("Deploying {}", node);
            CommandResult result = runner.run(CommandTemplates.expand(command, ".", node), flakeDir, timeout);
            if (result.isSuccess()) {
                log.info("Deployed {}", node);
                results.put(node, new ExecutionResult(node, true, null));
            } else {
                String detail = result.isTimedOut()
                        ? "deploy timed out after " + timeout.toSeconds() + "s"
                        : CommandTemplates.lastLine(result.getOutput());
                log.error("Deploy of {} failed: {}", node, detail);
                results.put(node, new ExecutionResult(node, false, detail));
            }
        }
        return results;
    }
    
    @Override
    public String describe(String node) {
        return String.join(" ", CommandTemplates.expand(command, ".", node));
    }
}
