package io.clusterreconciler.clients;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}, stderr merged into stdout.
 */
@Slf4j
public class ProcessCommandRunner implements CommandRunner {
    
    private static final long OUTPUT_DRAIN_SECONDS = 5;
    
    @Override
    public CommandResult run(List<String> command, Path workingDir, Duration timeout) {
        String commandLine = String.join(" ", command);
        log.debug("Running command: {} (timeout {}s)", commandLine, timeout.toSeconds());
        
        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
            if (workingDir != null) {
                builder.directory(workingDir.toFile());
            }
            process = builder.start();
        } catch (IOException e) {
            throw new ConnectivityException("Failed to start command '" + commandLine + "': " + e.getMessage(), e);
        }
        
        // read concurrently so a chatty process never blocks on a full pipe
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                process.destroyForcibly();
                log.warn("Command timed out after {}s: {}", timeout.toSeconds(), commandLine);
                return CommandResult.timeout(collect(output));
            }
            CommandResult result = new CommandResult(process.exitValue(), collect(output), false);
            log.debug("Command exited with {}: {}", result.getExitCode(), commandLine);
            return result;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ConnectivityException("Interrupted while running '" + commandLine + "'", e);
        }
    }
    
    private static String readAll(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            log.debug("Command output stream closed early: {}", e.getMessage());
            return "";
        }
    }
    
    private static String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Command output unavailable: {}", e.getMessage());
            return "";
        }
    }
}
