package io.tunnelcontrol.core.tunnel;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one tunnel session through its lifecycle.
 *
 * <p>
 * Transitions:
 * <ul>
 * <li>{@code disconnected → connecting → connected | error}</li>
 * <li>{@code connected → disconnecting → disconnected}</li>
 * <li>permission revoked: any state {@code → disconnected}</li>
 * </ul>
 *
 * <p>
 * All platform and relay calls run on a single worker thread, so they never overlap and state is
 * published in the order the work happened. Commands return as soon as they are queued. There is no
 * automatic retry: a failed connect stays in {@code error} until the next command.
 */
public final class TunnelSessionController implements TunnelService, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TunnelSessionController.class);

    private final TunnelPlatform platform;
    private final RelayEngine relay;
    private final StateFeed feed;
    private final String sessionName;
    private final String selfPackage;
    private final ExecutorService worker;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    // Confined to the worker thread.
    private InterfaceHandle handle;

    public TunnelSessionController(TunnelPlatform platform, RelayEngine relay, String selfPackage) {
        this(platform, relay, new StateFeed(), InterfaceSpec.DEFAULT_SESSION_NAME, selfPackage);
    }

    public TunnelSessionController(
            TunnelPlatform platform, RelayEngine relay, StateFeed feed, String sessionName, String selfPackage) {
        this.platform = platform;
        this.relay = relay;
        this.feed = feed;
        this.sessionName = sessionName;
        this.selfPackage = selfPackage;
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "tunnel-session");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void connect(TunnelConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration must not be null");
        }
        submit("connect", () -> doConnect(configuration));
    }

    @Override
    public void disconnect() {
        submit("disconnect", this::doDisconnect);
    }

    /** The platform withdrew our right to run a tunnel; tear down without passing through disconnecting. */
    public void onPermissionRevoked() {
        LOG.warn("Tunnel permission revoked");
        submit("revoke", () -> {
            cleanup();
            transition(ConnectionState.DISCONNECTED);
        });
    }

    @Override
    public ConnectionState state() {
        return state;
    }

    @Override
    public StateFeed stateFeed() {
        return feed;
    }

    @Override
    public Optional<RelayStats> stats() {
        if (state != ConnectionState.CONNECTED || !relay.isRunning()) {
            return Optional.empty();
        }
        return relay.stats();
    }

    /** Stops the worker after tearing down any live session. Waits briefly for the teardown. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        worker.execute(this::cleanup);
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Tunnel worker did not stop within 5s");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }

    private void doConnect(TunnelConfiguration configuration) {
        if (state == ConnectionState.CONNECTED || state == ConnectionState.CONNECTING) {
            LOG.warn("Connect ignored, session is {}", state);
            return;
        }
        // Leftovers from an earlier failed attempt.
        cleanup();
        transition(ConnectionState.CONNECTING);
        LOG.info("Connecting to {}", configuration);

        InterfaceSpec spec = InterfaceSpec.plan(configuration, sessionName, selfPackage);
        InterfaceHandle established;
        try {
            established = platform.establish(spec);
        } catch (RuntimeException e) {
            LOG.error("Failed to establish tunnel interface: {}", e.getMessage(), e);
            transition(ConnectionState.ERROR);
            return;
        }
        if (established == null) {
            LOG.error("Tunnel interface was not established, permission may be missing");
            transition(ConnectionState.ERROR);
            return;
        }
        handle = established;
        LOG.debug("Interface {} established with {} routes", established.name(), spec.routes().size());

        boolean started;
        try {
            started = relay.start(established, RelaySettings.forConfiguration(configuration));
        } catch (RuntimeException e) {
            LOG.error("Relay engine failed to start: {}", e.getMessage(), e);
            started = false;
        }
        if (!started) {
            cleanup();
            transition(ConnectionState.ERROR);
            return;
        }

        transition(ConnectionState.CONNECTED);
        RelayStats initial = relay.stats().orElse(RelayStats.EMPTY);
        LOG.info(
                "Tunnel connected to {}: upload={}, download={}, connections={}",
                configuration.target(),
                initial.uploadBytes(),
                initial.downloadBytes(),
                initial.activeConnections());
    }

    private void doDisconnect() {
        if (state == ConnectionState.DISCONNECTED && handle == null) {
            LOG.debug("Disconnect requested while already disconnected");
            transition(ConnectionState.DISCONNECTED);
            return;
        }
        transition(ConnectionState.DISCONNECTING);
        cleanup();
        transition(ConnectionState.DISCONNECTED);
        LOG.info("Tunnel disconnected");
    }

    /** Best effort: stop the relay, release the interface, log what fails. */
    private void cleanup() {
        try {
            if (relay.isRunning()) {
                relay.stop();
            }
        } catch (RuntimeException e) {
            LOG.warn("Error stopping relay engine: {}", e.getMessage(), e);
        }
        InterfaceHandle current = handle;
        handle = null;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                LOG.warn("Error closing interface {}: {}", current.name(), e.getMessage(), e);
            }
        }
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state;
        state = next;
        LOG.debug("State {} -> {}", previous, next);
        feed.publish(next);
    }

    private void submit(String command, Runnable task) {
        try {
            worker.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    LOG.error("Tunnel {} failed unexpectedly: {}", command, e.getMessage(), e);
                    cleanup();
                    transition(ConnectionState.ERROR);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Tunnel session controller is closed", e);
        }
    }
}
