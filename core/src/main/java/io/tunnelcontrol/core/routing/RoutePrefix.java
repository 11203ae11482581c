package io.tunnelcontrol.core.routing;

/**
 * An IPv4 route in CIDR form.
 *
 * @param network      first address of the block, unsigned
 * @param prefixLength 0-32; the block holds {@code 2^(32 - prefixLength)} addresses
 */
public record RoutePrefix(long network, int prefixLength) implements Comparable<RoutePrefix> {

    /** The whole IPv4 space, {@code 0.0.0.0/0}. */
    public static final RoutePrefix DEFAULT_ROUTE = new RoutePrefix(0L, 0);

    public RoutePrefix {
        if (prefixLength < 0 || prefixLength > 32) {
            throw new IllegalArgumentException("Prefix length must be 0-32, got " + prefixLength);
        }
        if (network < 0 || network > Ipv4.MAX_ADDRESS) {
            throw new IllegalArgumentException("Network address out of range: " + network);
        }
        // Fields are not assigned yet; derive the host mask from the parameter.
        long hostMask = (1L << (32 - prefixLength)) - 1;
        if ((network & hostMask) != 0) {
            throw new IllegalArgumentException("Host bits set in " + Ipv4.format(network) + "/" + prefixLength);
        }
    }

    /** Number of addresses covered. */
    public long size() {
        return 1L << (32 - prefixLength);
    }

    /** Last address in the block. */
    public long last() {
        return network + size() - 1;
    }

    public boolean contains(long address) {
        return address >= network && address <= last();
    }

    /** Dotted form of the network address. */
    public String address() {
        return Ipv4.format(network);
    }

    @Override
    public int compareTo(RoutePrefix other) {
        int byNetwork = Long.compare(network, other.network);
        return byNetwork != 0 ? byNetwork : Integer.compare(prefixLength, other.prefixLength);
    }

    @Override
    public String toString() {
        return address() + "/" + prefixLength;
    }
}
