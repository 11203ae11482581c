package io.tunnelcontrol.core.tunnel;

import java.util.Optional;

/**
 * Packet relay between the virtual interface and the SOCKS5 proxy. Opaque to the control plane: it
 * is started, stopped and polled for counters, nothing more.
 */
public interface RelayEngine {

    /**
     * Starts relaying.
     *
     * @return {@code true} if the engine is running afterwards
     */
    boolean start(InterfaceHandle handle, RelaySettings settings);

    /** Stops relaying; a no-op when not running. */
    void stop();

    boolean isRunning();

    /** Current counters, empty when not running or unavailable. */
    Optional<RelayStats> stats();
}
