package io.tunnelcontrol.core.discovery;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects announcements into a de-duplicated host list, keyed by service name, and notifies a
 * {@link HostDiscovery.Listener} on every change. Discovery back ends feed it from their callbacks.
 */
public final class HostDirectory {

    private static final Logger LOG = LoggerFactory.getLogger(HostDirectory.class);

    private final Map<String, ProxyHost> byService = new LinkedHashMap<>();
    private final HostDiscovery.Listener listener;

    public HostDirectory(HostDiscovery.Listener listener) {
        this.listener = listener;
    }

    public void serviceResolved(String serviceName, ProxyHost host) {
        List<ProxyHost> snapshot;
        synchronized (byService) {
            ProxyHost previous = byService.put(serviceName, host);
            if (host.equals(previous)) {
                return;
            }
            snapshot = snapshot();
        }
        LOG.debug("Host resolved: {} -> {}", serviceName, host.address());
        notifyListener(snapshot);
    }

    public void serviceLost(String serviceName) {
        List<ProxyHost> snapshot;
        synchronized (byService) {
            if (byService.remove(serviceName) == null) {
                return;
            }
            snapshot = snapshot();
        }
        LOG.debug("Host lost: {}", serviceName);
        notifyListener(snapshot);
    }

    public List<ProxyHost> hosts() {
        synchronized (byService) {
            return snapshot();
        }
    }

    private List<ProxyHost> snapshot() {
        List<ProxyHost> hosts = new ArrayList<>();
        for (ProxyHost host : byService.values()) {
            if (!hosts.contains(host)) {
                hosts.add(host);
            }
        }
        return List.copyOf(hosts);
    }

    private void notifyListener(List<ProxyHost> hosts) {
        try {
            listener.onHostsChanged(hosts);
        } catch (Exception e) {
            LOG.warn("HostDiscovery.Listener.onHostsChanged failed", e);
        }
    }
}
