package io.tunnelcontrol.core.tunnel;

import io.tunnelcontrol.core.routing.AppFilter;
import io.tunnelcontrol.core.routing.RoutePlanner;
import io.tunnelcontrol.core.routing.RoutePrefix;
import java.util.List;

/**
 * Request to the platform for a virtual network interface.
 *
 * @param sessionName   label shown by the platform for the session
 * @param address       interface address
 * @param prefixLength  interface network prefix
 * @param mtu           interface MTU
 * @param dnsServer     resolver handed to captured applications (the relay's fake-IP DNS)
 * @param routes        destinations routed into the interface
 * @param appFilter     which applications are captured
 */
public record InterfaceSpec(
        String sessionName,
        String address,
        int prefixLength,
        int mtu,
        String dnsServer,
        List<RoutePrefix> routes,
        AppFilter appFilter) {

    public static final String DEFAULT_SESSION_NAME = "Tunnel Control";
    public static final String INTERFACE_ADDRESS = "198.18.0.1";
    public static final int INTERFACE_PREFIX_LENGTH = 24;

    public InterfaceSpec {
        routes = List.copyOf(routes);
    }

    /** Plans the interface for a connect attempt: exclusion routes plus the app filter. */
    public static InterfaceSpec plan(TunnelConfiguration config, String sessionName, String selfPackage) {
        return new InterfaceSpec(
                sessionName,
                INTERFACE_ADDRESS,
                INTERFACE_PREFIX_LENGTH,
                RelaySettings.MTU,
                RelaySettings.MAP_DNS_ADDRESS,
                RoutePlanner.plan(config.proxyHost()),
                AppFilter.of(config.allowedApps(), selfPackage));
    }
}
