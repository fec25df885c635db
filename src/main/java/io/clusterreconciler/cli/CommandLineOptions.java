package io.clusterreconciler.cli;

import io.clusterreconciler.pipeline.PipelineOptions;
import org.springframework.boot.ApplicationArguments;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;

import static io.clusterreconciler.config.Constants.*;

/**
 * Maps command line options onto {@link PipelineOptions}.
 */
public final class CommandLineOptions {
    
    private static final Set<String> FLAGS = Set.of(OPTION_DRY_RUN, OPTION_SKIP_DEPLOY, OPTION_YES,
            OPTION_ALLOW_SERVER_REMOVAL, OPTION_VALIDATE_ONLY, OPTION_HELP);
    
    private CommandLineOptions() {
    }
    
    public static boolean isHelp(ApplicationArguments args) {
        return args.containsOption(OPTION_HELP);
    }
    
    /**
     * @param clusterName name accepted in {@code --cleanup-<cluster>}
     * @param defaultTopology topology file used without {@code --topology}
     * @throws UsageException for unknown options, flags given a value or stray arguments
     */
    public static PipelineOptions parse(ApplicationArguments args, String clusterName, Path defaultTopology) {
        if (!args.getNonOptionArgs().isEmpty()) {
            throw new UsageException("Unexpected arguments: " + String.join(" ", args.getNonOptionArgs()));
        }
        String cleanupOption = OPTION_CLEANUP_PREFIX + clusterName;
        for (String name : args.getOptionNames()) {
            if (FLAGS.contains(name) || name.equals(cleanupOption)) {
                if (!args.getOptionValues(name).isEmpty()) {
                    throw new UsageException("Option --" + name + " takes no value");
                }
            } else if (name.equals(OPTION_TOPOLOGY)) {
                List<String> values = args.getOptionValues(name);
                if (values.size() != 1 || values.get(0).isBlank()) {
                    throw new UsageException("Option --" + OPTION_TOPOLOGY + " needs exactly one path");
                }
            } else if (name.startsWith(OPTION_CLEANUP_PREFIX)) {
                throw new UsageException("Unknown cluster in --" + name + ", this reconciler manages '" + clusterName + "'");
            } else {
                throw new UsageException("Unknown option --" + name);
            }
        }
        
        boolean dryRun = args.containsOption(OPTION_DRY_RUN);
        boolean validateOnly = args.containsOption(OPTION_VALIDATE_ONLY);
        if (validateOnly && args.getOptionNames().size() > 1 + (args.containsOption(OPTION_TOPOLOGY) ? 1 : 0)) {
            throw new UsageException("--" + OPTION_VALIDATE_ONLY + " cannot be combined with other modes");
        }
        
        Path topology = args.containsOption(OPTION_TOPOLOGY)
                ? Paths.get(args.getOptionValues(OPTION_TOPOLOGY).get(0))
                : defaultTopology;
        
        return PipelineOptions.builder()
                .topologyFile(topology)
                .dryRun(dryRun)
                .cleanup(args.containsOption(cleanupOption))
                .skipDeploy(args.containsOption(OPTION_SKIP_DEPLOY))
                .assumeYes(args.containsOption(OPTION_YES))
                .allowServerRemoval(args.containsOption(OPTION_ALLOW_SERVER_REMOVAL))
                .validateOnly(validateOnly)
                .build();
    }
    
    public static String usage(String clusterName) {
        return String.join(System.lineSeparator(),
                "Usage: cluster-reconciler [options]",
                "",
                "Options:",
                "  --dry-run                 Show what would be done, change nothing",
                "  --" + OPTION_CLEANUP_PREFIX + clusterName + padding(clusterName)
                        + "Decommission nodes removed from the topology",
                "  --skip-deploy             Only generate configurations, don't deploy",
                "  --yes                     Do not ask for confirmation",
                "  --allow-server-removal    Allow decommissioning the last live server",
                "  --validate-only           Validate the topology and exit",
                "  --topology=<file>         Topology document (default from configuration)",
                "  --help                    Show this help");
    }
    
    private static String padding(String clusterName) {
        int width = 26 - (2 + OPTION_CLEANUP_PREFIX.length() + clusterName.length());
        return " ".repeat(Math.max(1, width));
    }
}
