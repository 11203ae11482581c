package io.tunnelcontrol.core.tunnel;

/** Traffic counters reported by the relay engine. */
public record RelayStats(long uploadBytes, long downloadBytes, long activeConnections) {

    public static final RelayStats EMPTY = new RelayStats(0, 0, 0);
}
