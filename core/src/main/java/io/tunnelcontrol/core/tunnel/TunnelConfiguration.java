package io.tunnelcontrol.core.tunnel;

import java.util.List;

/**
 * Parameters of one connect attempt. Immutable once created; a new instance is built for every
 * attempt.
 *
 * @param proxyHost   SOCKS5 proxy host, a dotted quad or a DNS name
 * @param proxyPort   SOCKS5 proxy port, 1-65535
 * @param username    SOCKS5 user, or {@code null} for no authentication
 * @param password    SOCKS5 password, or {@code null}
 * @param allowedApps application identifiers to capture; empty captures everything but ourselves
 * @param blockQuic   degrade UDP so clients fall back from HTTP/3 to TCP
 */
public record TunnelConfiguration(
        String proxyHost, int proxyPort, String username, String password, List<String> allowedApps, boolean blockQuic) {

    public TunnelConfiguration {
        if (proxyHost == null || proxyHost.isBlank()) {
            throw new IllegalArgumentException("proxyHost must not be blank");
        }
        if (proxyPort < 1 || proxyPort > 65535) {
            throw new IllegalArgumentException("proxyPort must be 1-65535, got " + proxyPort);
        }
        allowedApps = allowedApps == null ? List.of() : List.copyOf(allowedApps);
    }

    /** Configuration without credentials, app filtering or QUIC blocking. */
    public static TunnelConfiguration of(String proxyHost, int proxyPort) {
        return new TunnelConfiguration(proxyHost, proxyPort, null, null, List.of(), false);
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty();
    }

    /** {@code host:port} of the proxy. */
    public String target() {
        return proxyHost + ":" + proxyPort;
    }

    @Override
    public String toString() {
        return "TunnelConfiguration[target=" + target()
                + ", auth=" + hasCredentials()
                + ", allowedApps=" + allowedApps.size()
                + ", blockQuic=" + blockQuic + "]";
    }
}
