package io.tunnelcontrol.core.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the tunnel route set that covers all of IPv4 except the upstream proxy's own address,
 * so that the relay's connection to the proxy never loops back into the tunnel.
 *
 * <p>
 * The plan is built by halving {@code 0.0.0.0/0}: a half that does not contain the proxy is
 * emitted whole, the half that does is split again, and the final {@code /32} is dropped. For any
 * address this yields exactly 32 prefixes, one per length 1..32, in ascending address order.
 */
public final class RoutePlanner {

    private static final Logger LOG = LoggerFactory.getLogger(RoutePlanner.class);

    private RoutePlanner() {
        // utility class
    }

    /**
     * Route set for a proxy host. A host that is not a dotted quad (a DNS name, an IPv6 literal)
     * gets the single default route; it resolves outside the planner.
     */
    public static List<RoutePrefix> plan(String proxyHost) {
        OptionalLong address = Ipv4.parse(proxyHost);
        if (address.isEmpty()) {
            LOG.warn("Proxy host is not an IPv4 address, routing everything: {}", proxyHost);
            return List.of(RoutePrefix.DEFAULT_ROUTE);
        }
        List<RoutePrefix> routes = excluding(address.getAsLong());
        LOG.debug("Planned {} routes excluding {}/32", routes.size(), proxyHost);
        return routes;
    }

    /** The 32 prefixes whose union is the whole space minus {@code address/32}. */
    public static List<RoutePrefix> excluding(long address) {
        if (address < 0 || address > Ipv4.MAX_ADDRESS) {
            throw new IllegalArgumentException("IPv4 address out of range: " + address);
        }
        List<RoutePrefix> routes = new ArrayList<>(32);
        collect(RoutePrefix.DEFAULT_ROUTE, address, routes);
        return Collections.unmodifiableList(routes);
    }

    private static void collect(RoutePrefix block, long excluded, List<RoutePrefix> out) {
        if (!block.contains(excluded)) {
            out.add(block);
            return;
        }
        if (block.prefixLength() == 32) {
            return;
        }
        int childLength = block.prefixLength() + 1;
        long half = block.size() / 2;
        collect(new RoutePrefix(block.network(), childLength), excluded, out);
        collect(new RoutePrefix(block.network() + half, childLength), excluded, out);
    }
}
