package io.clusterreconciler.desiredstate;

import com.google.common.net.InetAddresses;

import java.net.InetAddress;

/**
 * CIDR block, IPv4 or IPv6.
 */
public final class Subnet {
    
    private final InetAddress network;
    private final int prefixLength;
    
    private Subnet(InetAddress network, int prefixLength) {
        this.network = network;
        this.prefixLength = prefixLength;
    }
    
    /**
     * Parse "address/prefix" notation.
     *
     * @throws IllegalArgumentException if the text is not a valid CIDR block
     */
    public static Subnet parse(String cidr) {
        if (cidr == null) {
            throw new IllegalArgumentException("CIDR is null");
        }
        int slash = cidr.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("Missing prefix length in '" + cidr + "'");
        }
        InetAddress network = InetAddresses.forString(cidr.substring(0, slash).trim());
        int prefixLength;
        try {
            prefixLength = Integer.parseInt(cidr.substring(slash + 1).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid prefix length in '" + cidr + "'", e);
        }
        int maxPrefix = network.getAddress().length * 8;
        if (prefixLength < 0 || prefixLength > maxPrefix) {
            throw new IllegalArgumentException("Prefix length " + prefixLength + " out of range 0-" + maxPrefix);
        }
        return new Subnet(network, prefixLength);
    }
    
    public boolean contains(InetAddress address) {
        byte[] net = network.getAddress();
        byte[] candidate = address.getAddress();
        if (net.length != candidate.length) {
            return false;
        }
        int fullBytes = prefixLength / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (net[i] != candidate[i]) {
                return false;
            }
        }
        int remainingBits = prefixLength % 8;
        if (remainingBits == 0) {
            return true;
        }
        int mask = (0xFF << (8 - remainingBits)) & 0xFF;
        return (net[fullBytes] & mask) == (candidate[fullBytes] & mask);
    }
    
    @Override
    public String toString() {
        return InetAddresses.toAddrString(network) + "/" + prefixLength;
    }
}
