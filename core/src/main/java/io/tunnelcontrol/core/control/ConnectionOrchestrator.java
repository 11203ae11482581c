package io.tunnelcontrol.core.control;

import io.tunnelcontrol.core.settings.ConnectionStorage;
import io.tunnelcontrol.core.tunnel.ConnectionState;
import io.tunnelcontrol.core.tunnel.StateFeed;
import io.tunnelcontrol.core.tunnel.TunnelService;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Idempotent, single-flight connect and disconnect on top of the asynchronous {@link TunnelService}.
 *
 * <p>
 * At most one command is in flight; a concurrent caller is rejected rather than queued. A command
 * subscribes to the state feed before it is issued and waits, bounded, for a terminal state. Only
 * states published after the subscription count, so a stale {@code error} from an earlier attempt
 * cannot end a new wait. Neither operation throws: every outcome, including a timeout, is an
 * {@link ApiResponse}.
 *
 * <p>
 * The remembered target is dropped whenever the session ends, including endings no command asked
 * for (revoked permission, relay failure). A successful connect is written to the optional
 * {@link ConnectionStorage}.
 */
public final class ConnectionOrchestrator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionOrchestrator.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_DISCONNECT_TIMEOUT = Duration.ofSeconds(10);

    private static final Set<ConnectionState> CONNECT_OUTCOMES =
            EnumSet.of(ConnectionState.CONNECTED, ConnectionState.ERROR);
    private static final Set<ConnectionState> DISCONNECT_OUTCOMES =
            EnumSet.of(ConnectionState.DISCONNECTED, ConnectionState.ERROR);

    private final TunnelService tunnel;
    private final Supplier<TunnelOptions> options;
    private final ConnectionStorage connections;
    private final Duration connectTimeout;
    private final Duration disconnectTimeout;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicReference<RemoteTarget> target = new AtomicReference<>();
    private final StateFeed.Subscription sessionWatch;

    public ConnectionOrchestrator(TunnelService tunnel) {
        this(tunnel, TunnelOptions.DEFAULT, DEFAULT_CONNECT_TIMEOUT, DEFAULT_DISCONNECT_TIMEOUT);
    }

    public ConnectionOrchestrator(
            TunnelService tunnel, TunnelOptions options, Duration connectTimeout, Duration disconnectTimeout) {
        this(tunnel, () -> options, null, connectTimeout, disconnectTimeout);
    }

    /**
     * @param options     read on every connect, so persisted filter changes apply to the next session
     * @param connections receives every successful connect; {@code null} remembers nothing
     */
    public ConnectionOrchestrator(
            TunnelService tunnel,
            Supplier<TunnelOptions> options,
            ConnectionStorage connections,
            Duration connectTimeout,
            Duration disconnectTimeout) {
        this.tunnel = tunnel;
        this.options = options;
        this.connections = connections;
        this.connectTimeout = connectTimeout;
        this.disconnectTimeout = disconnectTimeout;
        this.sessionWatch = tunnel.stateFeed().subscribe(this::onSessionState);
    }

    public ApiResponse connect(ConnectRequest request) {
        if (!inFlight.compareAndSet(false, true)) {
            return ApiResponse.failure("Operation already in progress");
        }
        try {
            ConnectionState state = tunnel.state();
            RemoteTarget current = target.get();
            switch (state) {
                case CONNECTED:
                    if (request.targets(current)) {
                        return ApiResponse.success("Already connected");
                    }
                    return ApiResponse.failure("Already connected to "
                            + (current != null ? current.address() : "unknown") + ". Disconnect first.");
                case CONNECTING:
                    return ApiResponse.failure("Connection already in progress");
                case DISCONNECTING:
                    return ApiResponse.failure("Disconnect in progress");
                default:
                    break;
            }

            LOG.info("Connect requested: {}", request);
            Outcome outcome =
                    awaitAfter(() -> tunnel.connect(request.toConfiguration(options.get())), CONNECT_OUTCOMES, connectTimeout);
            if (outcome.timedOut()) {
                LOG.warn("Connect to {}:{} timed out in state {}", request.host(), request.port(), outcome.state());
                return ApiResponse.failure("Connection timed out (state: " + outcome.state().wireName() + ")");
            }
            if (outcome.state() == ConnectionState.CONNECTED) {
                target.set(new RemoteTarget(request.host(), request.port()));
                remember(request);
                return ApiResponse.success("Connected");
            }
            return ApiResponse.failure("Connection failed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ApiResponse.failure("Connection interrupted");
        } catch (RuntimeException e) {
            LOG.error("Connect to {}:{} failed", request.host(), request.port(), e);
            return ApiResponse.failure("Connection error");
        } finally {
            inFlight.set(false);
        }
    }

    /** Always succeeds once it gets to run; the message says how the session ended. */
    public ApiResponse disconnect() {
        if (!inFlight.compareAndSet(false, true)) {
            return ApiResponse.failure("Operation already in progress");
        }
        try {
            ConnectionState state = tunnel.state();
            if (state == ConnectionState.DISCONNECTED) {
                target.set(null);
                return ApiResponse.success("Already disconnected");
            }
            if (state == ConnectionState.ERROR) {
                target.set(null);
                return ApiResponse.success("Disconnected (was in error state)");
            }

            LOG.info("Disconnect requested in state {}", state);
            Outcome outcome = awaitAfter(tunnel::disconnect, DISCONNECT_OUTCOMES, disconnectTimeout);
            target.set(null);
            if (outcome.timedOut()) {
                LOG.warn("Disconnect timed out in state {}", outcome.state());
                return ApiResponse.success("Disconnect requested (timed out in state: " + outcome.state().wireName()
                        + ")");
            }
            if (outcome.state() == ConnectionState.DISCONNECTED) {
                return ApiResponse.success("Disconnected");
            }
            return ApiResponse.success("Disconnected (with error state)");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            target.set(null);
            return ApiResponse.success("Disconnect requested (interrupted)");
        } catch (RuntimeException e) {
            LOG.error("Disconnect failed", e);
            return ApiResponse.failure("Disconnect error");
        } finally {
            inFlight.set(false);
        }
    }

    /** Non-blocking projection of the current session; ignores the single-flight guard. */
    public StatusResponse status() {
        ConnectionState state = tunnel.state();
        RemoteTarget current = target.get();
        if (state == ConnectionState.CONNECTED && current != null) {
            return new StatusResponse(true, state.wireName(), current.host(), current.port());
        }
        return new StatusResponse(state == ConnectionState.CONNECTED, state.wireName(), null, null);
    }

    /** Target remembered from the last successful connect, if still held. */
    public RemoteTarget currentTarget() {
        return target.get();
    }

    public boolean isBusy() {
        return inFlight.get();
    }

    /** Stops watching the session; the orchestrator keeps working but no longer sees unrequested endings. */
    @Override
    public void close() {
        sessionWatch.close();
    }

    /** Commands handle their own outcomes; this only catches endings nobody asked for. */
    private void onSessionState(ConnectionState state) {
        if (DISCONNECT_OUTCOMES.contains(state) && !inFlight.get()) {
            RemoteTarget previous = target.getAndSet(null);
            if (previous != null) {
                LOG.info("Session to {} ended in state {}", previous.address(), state.wireName());
            }
        }
    }

    private void remember(ConnectRequest request) {
        if (connections == null) {
            return;
        }
        try {
            connections.save(new ConnectionStorage.SavedConnection(
                    request.host(), request.port(), request.hasAuthentication(), request.username(),
                    request.password()));
        } catch (RuntimeException e) {
            LOG.warn("Connected, but the connection could not be remembered", e);
        }
    }

    private Outcome awaitAfter(Runnable command, Set<ConnectionState> expected, Duration timeout)
            throws InterruptedException {
        CompletableFuture<ConnectionState> reached = new CompletableFuture<>();
        try (StateFeed.Subscription ignored = tunnel.stateFeed().subscribe(state -> {
            if (expected.contains(state)) {
                reached.complete(state);
            }
        })) {
            command.run();
            return new Outcome(reached.get(timeout.toMillis(), TimeUnit.MILLISECONDS), false);
        } catch (TimeoutException e) {
            return new Outcome(tunnel.state(), true);
        } catch (ExecutionException e) {
            throw new IllegalStateException("State wait completed exceptionally", e.getCause());
        }
    }

    private record Outcome(ConnectionState state, boolean timedOut) {}
}
