package io.tunnelcontrol.core.tunnel;

import java.util.Optional;

/**
 * Command surface of the tunnel session. Commands are asynchronous: they return once accepted
 * and report progress through {@link #stateFeed()}.
 */
public interface TunnelService {

    void connect(TunnelConfiguration configuration);

    void disconnect();

    ConnectionState state();

    StateFeed stateFeed();

    /** Relay counters while connected. */
    Optional<RelayStats> stats();
}
