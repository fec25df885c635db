package io.clusterreconciler.clients;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * {@link EvaluatorClient} running a configurable command template, by default {@code nix eval}
 * against the flake. {@code {flake}} and {@code {node}} are substituted in every argument.
 */
@Slf4j
public class NixEvaluatorClient implements EvaluatorClient {
    
    private static final String DESCRIPTOR_TARGET = "deploy.nodes";
    
    private final CommandRunner runner;
    private final Path flakeDir;
    private final List<String> nodeCommand;
    private final List<String> descriptorCommand;
    private final Duration timeout;
    
    public NixEvaluatorClient(CommandRunner runner, Path flakeDir, List<String> nodeCommand,
                              List<String> descriptorCommand, Duration timeout) {
        this.runner = runner;
        this.flakeDir = flakeDir;
        this.nodeCommand = List.copyOf(nodeCommand);
        this.descriptorCommand = List.copyOf(descriptorCommand);
        this.timeout = timeout;
    }
    
    @Override
    public ExecutionResult evaluate(String node) {
        return execute(node, CommandTemplates.expand(nodeCommand, ".", node));
    }
    
    @Override
    public ExecutionResult evaluateDescriptor() {
        return execute(DESCRIPTOR_TARGET, CommandTemplates.expand(descriptorCommand, ".", null));
    }
    
    private ExecutionResult execute(String target, List<String> command) {
        log.info("Evaluating {}", target);
        CommandResult result = runner.run(command, flakeDir, timeout);
        if (result.isTimedOut()) {
            return new ExecutionResult(target, false, "evaluation timed out after " + timeout.toSeconds() + "s");
        }
        if (!result.isSuccess()) {
            return new ExecutionResult(target, false, CommandTemplates.lastLine(result.getOutput()));
        }
        log.debug("Evaluated {}: {}", target, CommandTemplates.lastLine(result.getOutput()));
        return new ExecutionResult(target, true, null);
    }
}
