package io.clusterreconciler;

import io.clusterreconciler.artifacts.ArtifactReconciler;
import io.clusterreconciler.artifacts.ArtifactStore;
import io.clusterreconciler.artifacts.DescriptorRenderer;
import io.clusterreconciler.artifacts.FileSystemArtifactStore;
import io.clusterreconciler.artifacts.NixHostArtifactRenderer;
import io.clusterreconciler.cli.ReconcilerCommandLineRunner;
import io.clusterreconciler.clients.CommandRunner;
import io.clusterreconciler.clients.ControlPlaneClient;
import io.clusterreconciler.clients.DeployExecutor;
import io.clusterreconciler.clients.DeployRsExecutor;
import io.clusterreconciler.clients.EvaluatorClient;
import io.clusterreconciler.clients.Fabric8ControlPlaneClient;
import io.clusterreconciler.clients.NixEvaluatorClient;
import io.clusterreconciler.clients.ProcessCommandRunner;
import io.clusterreconciler.clients.RemoteShellClient;
import io.clusterreconciler.clients.SshRemoteShellClient;
import io.clusterreconciler.config.ReconcilerConfig;
import io.clusterreconciler.decommission.CredentialStore;
import io.clusterreconciler.decommission.FileSystemCredentialStore;
import io.clusterreconciler.decommission.NodeDecommissionOrchestrator;
import io.clusterreconciler.desiredstate.DesiredStateLoader;
import io.clusterreconciler.desiredstate.DesiredStateValidator;
import io.clusterreconciler.membership.ClusterMembershipInspector;
import io.clusterreconciler.metrics.MetricsProvider;
import io.clusterreconciler.pipeline.ConfirmationPrompt;
import io.clusterreconciler.pipeline.ConsoleConfirmationPrompt;
import io.clusterreconciler.pipeline.ConsoleReporter;
import io.clusterreconciler.pipeline.DeploymentPipelineCoordinator;
import io.clusterreconciler.pipeline.ReachabilityVerifier;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Main Spring Boot application class for the cluster reconciler.
 *
 * Runs one reconciliation of the declared topology against the generated host artifacts and the
 * live k3s cluster, then exits with the pipeline's exit code.
 */
@Slf4j
@SpringBootApplication
public class ClusterReconcilerApplication {

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = SpringApplication.exit(SpringApplication.run(ClusterReconcilerApplication.class, args));
        } catch (Exception e) {
            log.error("Failed to run cluster reconciler: {}", e.getMessage(), e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    @Bean
    @Primary
    public ReconcilerConfig config() {
        ReconcilerConfig config = new ReconcilerConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public MetricsProvider metricsProvider(MeterRegistry registry, ReconcilerConfig config) {
        return new MetricsProvider(registry, config.getReconcilerId());
    }

    @Bean
    public CommandRunner commandRunner() {
        return new ProcessCommandRunner();
    }

    /**
     * Kubernetes client for the configured kube context; no connection is made until first use.
     */
    @Bean
    public KubernetesClient kubernetesClient(ReconcilerConfig config) {
        log.info("Initializing Kubernetes client for context {}",
                config.getKubeContext() == null ? "(current)" : config.getKubeContext());
        Config clientConfig = Config.autoConfigure(config.getKubeContext());
        int timeoutMillis = (int) config.getControlPlaneTimeout().toMillis();
        clientConfig.setConnectionTimeout(timeoutMillis);
        clientConfig.setRequestTimeout(timeoutMillis);
        return new KubernetesClientBuilder().withConfig(clientConfig).build();
    }

    @Bean
    public ControlPlaneClient controlPlaneClient(KubernetesClient kubernetesClient) {
        return new Fabric8ControlPlaneClient(kubernetesClient);
    }

    @Bean
    public RemoteShellClient remoteShellClient(CommandRunner commandRunner, ReconcilerConfig config) {
        return new SshRemoteShellClient(commandRunner, config.getSshUser(), config.getSshKey(),
                config.getServices(), config.getRemoteTimeout());
    }

    @Bean
    public EvaluatorClient evaluatorClient(CommandRunner commandRunner, ReconcilerConfig config) {
        return new NixEvaluatorClient(commandRunner, config.getFlakeDir(), config.getEvaluateCommand(),
                config.getEvaluateDescriptorCommand(), config.getEvaluateTimeout());
    }

    @Bean
    public DeployExecutor deployExecutor(CommandRunner commandRunner, ReconcilerConfig config) {
        return new DeployRsExecutor(commandRunner, config.getFlakeDir(), config.getDeployCommand(),
                config.getDeployTimeout());
    }

    @Bean
    public DesiredStateLoader desiredStateLoader() {
        return new DesiredStateLoader(new DesiredStateValidator());
    }

    @Bean
    public ArtifactStore artifactStore(ReconcilerConfig config) {
        log.info("Using artifact root {}", config.getArtifactRoot().toAbsolutePath());
        return new FileSystemArtifactStore(config.getArtifactRoot());
    }

    @Bean
    public ArtifactReconciler artifactReconciler(ArtifactStore artifactStore, ReconcilerConfig config,
                                                 MetricsProvider metricsProvider) {
        return new ArtifactReconciler(artifactStore, new NixHostArtifactRenderer(),
                new DescriptorRenderer(config.getSshUser()), metricsProvider, config.getClusterName());
    }

    @Bean
    public CredentialStore credentialStore(ReconcilerConfig config) {
        return new FileSystemCredentialStore(config.getCredentialDir());
    }

    @Bean
    public ClusterMembershipInspector clusterMembershipInspector(ControlPlaneClient controlPlaneClient,
                                                                 MetricsProvider metricsProvider,
                                                                 ReconcilerConfig config) {
        return new ClusterMembershipInspector(controlPlaneClient, metricsProvider, config.getClusterName());
    }

    @Bean
    public NodeDecommissionOrchestrator nodeDecommissionOrchestrator(ControlPlaneClient controlPlaneClient,
                                                                     RemoteShellClient remoteShellClient,
                                                                     CredentialStore credentialStore,
                                                                     MetricsProvider metricsProvider,
                                                                     ReconcilerConfig config) {
        return new NodeDecommissionOrchestrator(controlPlaneClient, remoteShellClient, credentialStore,
                metricsProvider, config.getClusterName(), config.getDrainTimeout(), config.getParallelism());
    }

    @Bean
    public ReachabilityVerifier reachabilityVerifier(RemoteShellClient remoteShellClient,
                                                     MetricsProvider metricsProvider, ReconcilerConfig config) {
        return new ReachabilityVerifier(remoteShellClient, metricsProvider, config.getClusterName(),
                config.getPingTimeout(), config.getParallelism());
    }

    @Bean
    public ConsoleReporter consoleReporter() {
        return new ConsoleReporter(System.out);
    }

    @Bean
    public ConfirmationPrompt confirmationPrompt() {
        return new ConsoleConfirmationPrompt(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    @Bean
    public DeploymentPipelineCoordinator deploymentPipelineCoordinator(DesiredStateLoader loader,
                                                                       ArtifactStore artifactStore,
                                                                       ArtifactReconciler artifactReconciler,
                                                                       ClusterMembershipInspector inspector,
                                                                       NodeDecommissionOrchestrator orchestrator,
                                                                       EvaluatorClient evaluatorClient,
                                                                       DeployExecutor deployExecutor,
                                                                       ReachabilityVerifier verifier,
                                                                       ConfirmationPrompt confirmationPrompt,
                                                                       ConsoleReporter reporter,
                                                                       MetricsProvider metricsProvider,
                                                                       ReconcilerConfig config) {
        log.info("Initializing DeploymentPipelineCoordinator for cluster {}", config.getClusterName());
        return new DeploymentPipelineCoordinator(loader, artifactStore, artifactReconciler, inspector, orchestrator,
                evaluatorClient, deployExecutor, verifier, confirmationPrompt, reporter, metricsProvider,
                config.getClusterName());
    }

    @Bean
    public ReconcilerCommandLineRunner reconcilerCommandLineRunner(DeploymentPipelineCoordinator coordinator,
                                                                   ReconcilerConfig config,
                                                                   ConsoleReporter reporter) {
        return new ReconcilerCommandLineRunner(coordinator, config, reporter);
    }
}
