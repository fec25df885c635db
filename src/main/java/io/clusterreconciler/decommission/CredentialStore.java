package io.clusterreconciler.decommission;

import java.io.IOException;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Locally cached join-credential material, one entry per node.
 * The entry also carries the resumption marker written before a member is deleted from the
 * control plane, so that a node that is already gone from the cluster can still be finished.
 */
public interface CredentialStore {
    
    /**
     * Record that the node is being decommissioned, with the address its services run on.
     */
    void recordDecommission(String node, String address) throws IOException;
    
    /**
     * @return the recorded address, empty if no marker or no known address
     */
    Optional<String> decommissionAddress(String node) throws IOException;
    
    /**
     * Remove the resumption marker only, keeping any other cached material.
     *
     * @return true if a marker was removed
     */
    boolean clearDecommission(String node) throws IOException;
    
    /**
     * Nodes with a resumption marker that have not been purged yet.
     */
    SortedSet<String> nodesPendingDecommission() throws IOException;
    
    /**
     * Delete every cached file of the node.
     *
     * @return true if anything was deleted
     */
    boolean purge(String node) throws IOException;
}
