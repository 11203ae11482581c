package io.tunnelcontrol.core.discovery;

import java.util.Objects;

/**
 * A candidate SOCKS5 proxy, either announced on the local network or entered by hand. Two records
 * are the same host when {@code hostname} and {@code port} match; the descriptive fields do not
 * take part in equality.
 *
 * @param hostname       address to connect to
 * @param port           proxy port
 * @param hostName       friendly machine name from the announcement
 * @param osName         operating system of the announcing machine
 * @param version        proxy software version
 * @param startupSetting free-form startup settings of the proxy
 * @param certEndpoint   relative URL of the proxy's CA certificate
 * @param discovered     {@code true} when found through discovery
 */
public record ProxyHost(
        String hostname,
        int port,
        String hostName,
        String osName,
        String version,
        String startupSetting,
        String certEndpoint,
        boolean discovered) {

    public static ProxyHost manual(String hostname, int port) {
        return new ProxyHost(hostname, port, null, null, null, null, null, false);
    }

    public String address() {
        return hostname + ":" + port;
    }

    /** Friendly name when announced, otherwise the address. */
    public String label() {
        return hostName != null && !hostName.isBlank() ? hostName : address();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ProxyHost that && port == that.port && Objects.equals(hostname, that.hostname);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hostname, port);
    }
}
