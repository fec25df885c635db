package io.clusterreconciler.cli;

import io.clusterreconciler.config.ReconcilerConfig;
import io.clusterreconciler.enums.ExitCode;
import io.clusterreconciler.lock.FileRunLock;
import io.clusterreconciler.lock.LockException;
import io.clusterreconciler.pipeline.ConsoleReporter;
import io.clusterreconciler.pipeline.DeploymentPipelineCoordinator;
import io.clusterreconciler.pipeline.PipelineOptions;
import io.clusterreconciler.pipeline.PipelineResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;

/**
 * Command line entry: parses options, takes the run lock and runs the pipeline once.
 */
@Slf4j
public class ReconcilerCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {
    
    private final DeploymentPipelineCoordinator coordinator;
    private final ReconcilerConfig config;
    private final ConsoleReporter reporter;
    
    private ExitCode exitCode = ExitCode.SUCCESS;
    
    public ReconcilerCommandLineRunner(DeploymentPipelineCoordinator coordinator, ReconcilerConfig config,
                                       ConsoleReporter reporter) {
        this.coordinator = coordinator;
        this.config = config;
        this.reporter = reporter;
    }
    
    @Override
    public void run(ApplicationArguments args) {
        if (CommandLineOptions.isHelp(args)) {
            reporter.printMessage(CommandLineOptions.usage(config.getClusterName()));
            return;
        }
        
        PipelineOptions options;
        try {
            options = CommandLineOptions.parse(args, config.getClusterName(), config.getTopologyFile());
        } catch (UsageException e) {
            log.error("Invalid command line: {}", e.getMessage());
            reporter.printMessage(e.getMessage());
            reporter.printMessage(CommandLineOptions.usage(config.getClusterName()));
            exitCode = ExitCode.USAGE;
            return;
        }
        
        try (FileRunLock lock = FileRunLock.acquire(config.getArtifactRoot())) {
            log.debug("Holding {}", lock.getLockFile());
            PipelineResult result = coordinator.run(options);
            exitCode = result.getExitCode();
        } catch (LockException e) {
            log.error("Cannot start run: {}", e.getMessage());
            reporter.printMessage("Another reconciler run is in progress: " + e.getMessage());
            exitCode = ExitCode.FAILURE;
        }
    }
    
    @Override
    public int getExitCode() {
        return exitCode.getCode();
    }
}
