package io.tunnelcontrol.core.control;

/** Proxy endpoint of the last successful API connect. */
public record RemoteTarget(String host, int port) {

    /** {@code host:port}. */
    public String address() {
        return host + ":" + port;
    }
}
