package io.tunnelcontrol.core.tunnel;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything the relay engine needs to forward interface traffic to the SOCKS5 proxy.
 *
 * <p>
 * DNS queries to {@code mapDnsAddress:mapDnsPort} are answered from a fake-IP pool inside
 * {@code mapDnsNetwork/mapDnsNetmask}, so host names survive until the proxy resolves them.
 */
public record RelaySettings(
        String proxyHost,
        int proxyPort,
        String username,
        String password,
        int mtu,
        String mapDnsAddress,
        int mapDnsPort,
        String mapDnsNetwork,
        String mapDnsNetmask,
        int mapDnsCacheSize,
        int connectTimeoutMs,
        int tcpTimeoutMs,
        int udpTimeoutMs) {

    public static final int MTU = 1500;
    public static final String MAP_DNS_ADDRESS = "198.18.0.2";
    public static final int MAP_DNS_PORT = 53;
    public static final String MAP_DNS_NETWORK = "240.0.0.0";
    public static final String MAP_DNS_NETMASK = "240.0.0.0";
    public static final int MAP_DNS_CACHE_SIZE = 10_000;
    public static final int CONNECT_TIMEOUT_MS = 10_000;
    public static final int TCP_TIMEOUT_MS = 300_000;
    public static final int UDP_TIMEOUT_MS = 60_000;

    /**
     * UDP idle timeout with QUIC blocking on. Every UDP flow expires almost at once, which breaks
     * HTTP/3 along with any other UDP traffic.
     */
    public static final int BLOCKED_UDP_TIMEOUT_MS = 1;

    public static RelaySettings forConfiguration(TunnelConfiguration config) {
        return new RelaySettings(
                config.proxyHost(),
                config.proxyPort(),
                config.username(),
                config.password(),
                MTU,
                MAP_DNS_ADDRESS,
                MAP_DNS_PORT,
                MAP_DNS_NETWORK,
                MAP_DNS_NETMASK,
                MAP_DNS_CACHE_SIZE,
                CONNECT_TIMEOUT_MS,
                TCP_TIMEOUT_MS,
                config.blockQuic() ? BLOCKED_UDP_TIMEOUT_MS : UDP_TIMEOUT_MS);
    }

    /** Relay configuration tree in the layout a tun2socks-style engine reads; the password is omitted. */
    public Map<String, Object> describe() {
        Map<String, Object> socks = new LinkedHashMap<>();
        socks.put("address", proxyHost);
        socks.put("port", proxyPort);
        socks.put("udp", "udp");
        if (username != null && !username.isEmpty()) {
            socks.put("username", username);
        }
        Map<String, Object> mapDns = new LinkedHashMap<>();
        mapDns.put("address", mapDnsAddress);
        mapDns.put("port", mapDnsPort);
        mapDns.put("network", mapDnsNetwork);
        mapDns.put("netmask", mapDnsNetmask);
        mapDns.put("cache-size", mapDnsCacheSize);
        Map<String, Object> misc = new LinkedHashMap<>();
        misc.put("connect-timeout", connectTimeoutMs);
        misc.put("tcp-read-write-timeout", tcpTimeoutMs);
        misc.put("udp-read-write-timeout", udpTimeoutMs);

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("tunnel", Map.of("mtu", mtu));
        root.put("socks5", socks);
        root.put("mapdns", mapDns);
        root.put("misc", misc);
        return root;
    }

    @Override
    public String toString() {
        return "RelaySettings[proxy=" + proxyHost + ":" + proxyPort + ", mtu=" + mtu + ", udpTimeoutMs=" + udpTimeoutMs
                + "]";
    }
}
