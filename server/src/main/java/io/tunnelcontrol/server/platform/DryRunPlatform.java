package io.tunnelcontrol.server.platform;

import io.tunnelcontrol.core.tunnel.InterfaceHandle;
import io.tunnelcontrol.core.tunnel.InterfaceSpec;
import io.tunnelcontrol.core.tunnel.TunnelPlatform;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TunnelPlatform} that allocates nothing. Each request is logged and answered with a
 * named handle, so the control plane runs end to end on a host without a tunnel driver.
 */
public final class DryRunPlatform implements TunnelPlatform {

    private static final Logger LOG = LoggerFactory.getLogger(DryRunPlatform.class);

    private final AtomicInteger sequence = new AtomicInteger();
    private final AtomicInteger open = new AtomicInteger();

    @Override
    public InterfaceHandle establish(InterfaceSpec spec) {
        String name = "dryrun" + sequence.getAndIncrement();
        open.incrementAndGet();
        LOG.info(
                "[dry-run] Interface {} for session '{}': address={}/{}, mtu={}, dns={}, routes={}, apps={}",
                name,
                spec.sessionName(),
                spec.address(),
                spec.prefixLength(),
                spec.mtu(),
                spec.dnsServer(),
                spec.routes().size(),
                spec.appFilter());
        LOG.debug("[dry-run] Interface {} routes: {}", name, spec.routes());
        return new Handle(name);
    }

    /** Interfaces handed out and not yet closed. */
    public int openInterfaces() {
        return open.get();
    }

    private final class Handle implements InterfaceHandle {

        private final String name;
        private boolean closed;

        Handle(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public synchronized void close() {
            if (!closed) {
                closed = true;
                open.decrementAndGet();
                LOG.info("[dry-run] Interface {} released", name);
            }
        }
    }
}
