package io.clusterreconciler.clients;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external program with a bounded timeout.
 */
public interface CommandRunner {
    
    /**
     * @param command program and arguments, never passed through a shell
     * @param workingDir working directory, null for the current one
     * @param timeout the process is killed once this elapses
     * @throws ConnectivityException if the program could not be started at all
     */
    CommandResult run(List<String> command, Path workingDir, Duration timeout);
}
