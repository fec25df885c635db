package io.clusterreconciler.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static io.clusterreconciler.config.Constants.*;

/**
 * Configuration for the reconciler.
 * Loads configuration from application.yml with fallbacks to constants.
 * The same file carries Spring's own settings, which are ignored here.
 */
@Slf4j
@Getter
public class ReconcilerConfig {

    public static final List<String> DEFAULT_EVALUATE_COMMAND = List.of(
            "nix", "eval", "{flake}#nixosConfigurations.{node}.config.system.build.toplevel.drvPath");
    public static final List<String> DEFAULT_EVALUATE_DESCRIPTOR_COMMAND = List.of(
            "nix", "eval", "{flake}#deploy.nodes", "--apply", "builtins.attrNames");
    public static final List<String> DEFAULT_DEPLOY_COMMAND = List.of(
            "deploy", "--remote-build", "{flake}#{node}");
    public static final List<String> DEFAULT_SERVICES = List.of(SERVICE_SERVER, SERVICE_AGENT);

    private final String reconcilerId;
    private final String clusterName;
    private final String kubeContext;
    private final Path topologyFile;
    private final Path artifactRoot;
    private final Path flakeDir;
    private final Path credentialDir;
    private final String sshUser;
    private final Path sshKey;
    private final List<String> services;
    private final Duration drainTimeout;
    private final Duration controlPlaneTimeout;
    private final Duration remoteTimeout;
    private final Duration pingTimeout;
    private final Duration evaluateTimeout;
    private final Duration deployTimeout;
    private final int parallelism;
    private final List<String> evaluateCommand;
    private final List<String> evaluateDescriptorCommand;
    private final List<String> deployCommand;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "RECONCILER_CONFIG_FILE";

    public ReconcilerConfig() {
        this(null);
    }

    /**
     * Build the configuration from an already parsed model; a null model triggers
     * the usual environment / classpath lookup.
     */
    public ReconcilerConfig(ConfigModel model) {
        ConfigModel config = model != null ? model : loadYamlConfig();

        this.reconcilerId = parse(config, c -> c.getReconciler().getId(), "reconciler");
        this.clusterName = parse(config, c -> c.getCluster().getName(), DEFAULT_CLUSTER_NAME);
        this.kubeContext = parse(config, c -> c.getCluster().getKube_context(), null);
        this.topologyFile = Paths.get(parse(config, c -> c.getTopology().getFile(), DEFAULT_TOPOLOGY_FILE));
        this.artifactRoot = Paths.get(parse(config, c -> c.getArtifacts().getRoot(), DEFAULT_ARTIFACT_ROOT));
        this.flakeDir = Paths.get(parse(config, c -> c.getArtifacts().getFlake_dir(), DEFAULT_FLAKE_DIR));
        this.credentialDir = Paths.get(parse(config, c -> c.getCredentials().getDir(), DEFAULT_CREDENTIAL_DIR));
        this.sshUser = parse(config, c -> c.getRemote().getSsh_user(), DEFAULT_SSH_USER);
        String key = parse(config, c -> c.getRemote().getSsh_key(), null);
        this.sshKey = key != null ? Paths.get(expandHome(key)) : null;
        this.services = parseList(config, c -> c.getRemote().getServices(), DEFAULT_SERVICES);
        this.drainTimeout = parseSeconds(config, c -> c.getTimeouts().getDrain_seconds(), DEFAULT_DRAIN_TIMEOUT_SECONDS);
        this.controlPlaneTimeout = parseSeconds(config, c -> c.getTimeouts().getControl_plane_seconds(),
                DEFAULT_CONTROL_PLANE_TIMEOUT_SECONDS);
        this.remoteTimeout = parseSeconds(config, c -> c.getTimeouts().getRemote_seconds(), DEFAULT_REMOTE_TIMEOUT_SECONDS);
        this.pingTimeout = parseSeconds(config, c -> c.getTimeouts().getPing_seconds(), DEFAULT_PING_TIMEOUT_SECONDS);
        this.evaluateTimeout = parseSeconds(config, c -> c.getTimeouts().getEvaluate_seconds(),
                DEFAULT_EVALUATE_TIMEOUT_SECONDS);
        this.deployTimeout = parseSeconds(config, c -> c.getTimeouts().getDeploy_seconds(), DEFAULT_DEPLOY_TIMEOUT_SECONDS);
        this.parallelism = parsePositiveInt(config, c -> c.getExecution().getParallelism(), DEFAULT_PARALLELISM);
        this.evaluateCommand = parseList(config, c -> c.getEvaluator().getCommand(), DEFAULT_EVALUATE_COMMAND);
        this.evaluateDescriptorCommand = parseList(config, c -> c.getEvaluator().getDescriptor_command(),
                DEFAULT_EVALUATE_DESCRIPTOR_COMMAND);
        this.deployCommand = parseList(config, c -> c.getDeploy().getCommand(), DEFAULT_DEPLOY_COMMAND);

        log.info("Loaded reconciler config - cluster: {}, topology: {}, artifacts: {}, parallelism: {}",
                clusterName, topologyFile, artifactRoot, parallelism);
    }

    private ConfigModel loadYamlConfig() {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(EXTERNAL_CONFIG_ENV_VAR);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", DEFAULT_CONFIG_FILE_CLASSPATH);
            inputStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try {
            ConfigModel config = yaml.load(inputStream);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        } finally {
            try {
                inputStream.close();
            } catch (IOException e) {
                log.error("Error closing config file input stream: {}", e.getMessage());
            }
        }
    }

    private static <T> T read(ConfigModel config, Function<ConfigModel, T> getter) {
        try {
            return getter.apply(config);
        } catch (NullPointerException e) {
            // section absent
            return null;
        }
    }

    private static String parse(ConfigModel config, Function<ConfigModel, String> getter, String defaultValue) {
        String value = read(config, getter);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    private static List<String> parseList(ConfigModel config, Function<ConfigModel, List<String>> getter,
                                          List<String> defaultValue) {
        List<String> value = read(config, getter);
        return value != null && !value.isEmpty() ? List.copyOf(value) : defaultValue;
    }

    private static Duration parseSeconds(ConfigModel config, Function<ConfigModel, Long> getter, long defaultSeconds) {
        Long value = read(config, getter);
        if (value == null) {
            return Duration.ofSeconds(defaultSeconds);
        }
        if (value <= 0) {
            log.warn("Ignoring non-positive timeout {}s, using default {}s", value, defaultSeconds);
            return Duration.ofSeconds(defaultSeconds);
        }
        return Duration.ofSeconds(value);
    }

    private static int parsePositiveInt(ConfigModel config, Function<ConfigModel, Integer> getter, int defaultValue) {
        Integer value = read(config, getter);
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            log.warn("Ignoring non-positive value {}, using default {}", value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private static String expandHome(String path) {
        if (path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Map<String, Object> spring; // Spring Boot settings, read by Spring itself
        private Map<String, Object> logging; // Logback levels, read by Spring itself
        private Reconciler reconciler;
        private Cluster cluster;
        private Topology topology;
        private Artifacts artifacts;
        private Credentials credentials;
        private Remote remote;
        private Timeouts timeouts;
        private Execution execution;
        private Command evaluator;
        private Command deploy;
    }

    @Data
    public static class Reconciler {
        private String id;
    }

    @Data
    public static class Cluster {
        private String name;
        private String kube_context;
    }

    @Data
    public static class Topology {
        private String file;
    }

    @Data
    public static class Artifacts {
        private String root;
        private String flake_dir;
    }

    @Data
    public static class Credentials {
        private String dir;
    }

    @Data
    public static class Remote {
        private String ssh_user;
        private String ssh_key;
        private List<String> services;
    }

    @Data
    public static class Timeouts {
        private Long drain_seconds;
        private Long control_plane_seconds;
        private Long remote_seconds;
        private Long ping_seconds;
        private Long evaluate_seconds;
        private Long deploy_seconds;
    }

    @Data
    public static class Execution {
        private Integer parallelism;
    }

    @Data
    public static class Command {
        private List<String> command;
        private List<String> descriptor_command;
    }
}
