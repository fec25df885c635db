package io.clusterreconciler.clients;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static io.clusterreconciler.config.Constants.DEFAULT_AGENT_TOKEN_FILE;
import static io.clusterreconciler.config.Constants.SSH_CONNECTION_FAILURE_EXIT_CODE;

/**
 * {@link RemoteShellClient} over the system ssh binary, non-interactive and key based.
 */
@Slf4j
public class SshRemoteShellClient implements RemoteShellClient {
    
    private final CommandRunner runner;
    private final String user;
    private final Path key;
    private final List<String> services;
    private final Duration timeout;
    
    public SshRemoteShellClient(CommandRunner runner, String user, Path key, List<String> services, Duration timeout) {
        this.runner = runner;
        this.user = user;
        this.key = key;
        this.services = List.copyOf(services);
        this.timeout = timeout;
    }
    
    @Override
    public ServiceState serviceState(String address) {
        String units = String.join(" ", services);
        CommandResult result = runner.run(
                ssh(address, timeout, "systemctl is-active --quiet " + units + " || systemctl is-enabled --quiet " + units),
                null, timeout);
        if (isUnreachable(result)) {
            log.debug("Service state of {} unknown, host unreachable", address);
            return ServiceState.UNREACHABLE;
        }
        return result.getExitCode() == 0 ? ServiceState.ACTIVE : ServiceState.INACTIVE;
    }
    
    @Override
    public RemoteOutcome stopService(String address) {
        CommandResult result = runner.run(ssh(address, timeout, stopCommand()), null, timeout);
        if (isUnreachable(result)) {
            log.warn("Cannot stop services on {}: host unreachable", address);
            return RemoteOutcome.UNREACHABLE;
        }
        if (!result.isSuccess()) {
            throw new RemoteCommandException("Stopping services on " + address + " failed: " + result.getOutput(),
                    result.getExitCode());
        }
        log.info("Stopped and disabled {} on {}", services, address);
        return RemoteOutcome.SUCCESS;
    }
    
    @Override
    public boolean ping(String address, Duration pingTimeout) {
        CommandResult result = runner.run(ssh(address, pingTimeout, "true"), null, pingTimeout);
        return result.isSuccess();
    }
    
    String stopCommand() {
        String sudo = "root".equals(user) ? "" : "sudo ";
        List<String> steps = new ArrayList<>();
        for (String unit : services) {
            // units that are not installed on this role are skipped
            steps.add("if systemctl cat " + unit + " >/dev/null 2>&1; then " + sudo + "systemctl disable --now " + unit + "; fi");
        }
        steps.add(sudo + "rm -f " + DEFAULT_AGENT_TOKEN_FILE);
        return String.join(" && ", steps);
    }
    
    List<String> ssh(String address, Duration connectTimeout, String command) {
        List<String> args = new ArrayList<>(List.of("ssh"));
        if (key != null) {
            args.add("-i");
            args.add(key.toString());
        }
        args.addAll(List.of(
                "-o", "BatchMode=yes",
                "-o", "StrictHostKeyChecking=accept-new",
                "-o", "ConnectTimeout=" + Math.max(1, connectTimeout.toSeconds())));
        args.add(user + "@" + address);
        args.add(command);
        return args;
    }
    
    private static boolean isUnreachable(CommandResult result) {
        return result.isTimedOut() || result.getExitCode() == SSH_CONNECTION_FAILURE_EXIT_CODE;
    }
}
