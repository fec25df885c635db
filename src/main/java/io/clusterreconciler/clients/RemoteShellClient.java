package io.clusterreconciler.clients;

import java.time.Duration;

/**
 * Management channel to the physical nodes.
 */
public interface RemoteShellClient {
    
    /**
     * @param address host to contact
     * @return ACTIVE if any managed unit is active or enabled, UNREACHABLE if the host cannot be contacted
     */
    ServiceState serviceState(String address);
    
    /**
     * Stop and disable the managed units and remove the on-host join token.
     *
     * @throws RemoteCommandException if the host answered but the command failed
     */
    RemoteOutcome stopService(String address);
    
    boolean ping(String address, Duration timeout);
}
