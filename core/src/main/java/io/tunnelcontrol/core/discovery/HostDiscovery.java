package io.tunnelcontrol.core.discovery;

import java.util.List;

/** Source of proxy hosts announced on the local network. */
public interface HostDiscovery {

    /** Receives the full current host list after every change. */
    @FunctionalInterface
    interface Listener {
        void onHostsChanged(List<ProxyHost> hosts);
    }

    /**
     * Starts browsing.
     *
     * @return handle that stops browsing when closed
     */
    AutoCloseable start(Listener listener);
}
