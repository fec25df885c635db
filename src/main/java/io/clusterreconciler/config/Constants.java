package io.clusterreconciler.config;

/**
 * Application constants.
 */
public final class Constants {
    
    private Constants() {
        // Utility class
    }
    
    // Default configuration values
    public static final String DEFAULT_TOPOLOGY_FILE = "cluster.json";
    public static final String DEFAULT_ARTIFACT_ROOT = "generated";
    public static final String DEFAULT_CREDENTIAL_DIR = ".credentials";
    public static final String DEFAULT_FLAKE_DIR = ".";
    public static final String DEFAULT_CLUSTER_NAME = "k3s";
    public static final String DEFAULT_SSH_USER = "root";
    public static final int DEFAULT_PARALLELISM = 4;
    
    // Default timeouts
    public static final long DEFAULT_DRAIN_TIMEOUT_SECONDS = 120L;
    public static final long DEFAULT_CONTROL_PLANE_TIMEOUT_SECONDS = 15L;
    public static final long DEFAULT_REMOTE_TIMEOUT_SECONDS = 30L;
    public static final long DEFAULT_PING_TIMEOUT_SECONDS = 5L;
    public static final long DEFAULT_EVALUATE_TIMEOUT_SECONDS = 300L;
    public static final long DEFAULT_DEPLOY_TIMEOUT_SECONDS = 1800L;
    public static final long DRAIN_POLL_INTERVAL_MILLIS = 2000L;
    
    // Artifact layout
    public static final String PATH_HOSTS = "hosts";
    public static final String ARTIFACT_SUFFIX = ".nix";
    public static final String DESCRIPTOR_FILE = "deploy-nodes.json";
    public static final String STAGING_SUFFIX = ".staging";
    public static final String PREVIOUS_SUFFIX = ".previous";
    public static final String LOCK_SUFFIX = ".lock";
    
    // Credential cache layout
    public static final String CREDENTIAL_DECOMMISSION_MARKER = "decommission-address";
    
    // Role configuration keys (server_config / agent_config)
    public static final String CONFIG_IMPORTS = "imports";
    public static final String CONFIG_EXTRA_FLAGS = "extra_flags";
    public static final String CONFIG_API_PORT = "api_port";
    public static final String CONFIG_TOKEN_FILE = "token_file";
    public static final String CONFIG_FIREWALL_TCP_PORTS = "firewall_tcp_ports";
    public static final String CONFIG_FIREWALL_UDP_PORTS = "firewall_udp_ports";
    public static final String CONFIG_STATE_VERSION = "state_version";
    public static final String CONFIG_SSH_USER = "ssh_user";
    
    // Role configuration defaults
    public static final int DEFAULT_API_PORT = 6443;
    public static final String DEFAULT_SERVER_TOKEN_FILE = "/var/lib/rancher/k3s/server/node-token";
    public static final String DEFAULT_AGENT_TOKEN_FILE = "/etc/rancher/k3s/agent-token";
    public static final String DEFAULT_STATE_VERSION = "24.05";
    
    // Control plane labels and conditions
    public static final String LABEL_CONTROL_PLANE = "node-role.kubernetes.io/control-plane";
    public static final String LABEL_MASTER = "node-role.kubernetes.io/master";
    public static final String CONDITION_READY = "Ready";
    public static final String ADDRESS_INTERNAL_IP = "InternalIP";
    public static final String ANNOTATION_MIRROR_POD = "kubernetes.io/config.mirror";
    public static final String OWNER_KIND_DAEMON_SET = "DaemonSet";
    
    // Remote services managed on cluster nodes
    public static final String SERVICE_SERVER = "k3s.service";
    public static final String SERVICE_AGENT = "k3s-agent.service";
    
    // ssh exits with 255 when the connection itself fails
    public static final int SSH_CONNECTION_FAILURE_EXIT_CODE = 255;
    
    // CLI options
    public static final String OPTION_DRY_RUN = "dry-run";
    public static final String OPTION_CLEANUP_PREFIX = "cleanup-";
    public static final String OPTION_SKIP_DEPLOY = "skip-deploy";
    public static final String OPTION_YES = "yes";
    public static final String OPTION_ALLOW_SERVER_REMOVAL = "allow-server-removal";
    public static final String OPTION_VALIDATE_ONLY = "validate-only";
    public static final String OPTION_TOPOLOGY = "topology";
    public static final String OPTION_HELP = "help";
}
