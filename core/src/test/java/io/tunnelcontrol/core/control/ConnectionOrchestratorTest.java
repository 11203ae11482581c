package io.tunnelcontrol.core.control;

import static io.tunnelcontrol.core.tunnel.ConnectionState.CONNECTED;
import static io.tunnelcontrol.core.tunnel.ConnectionState.CONNECTING;
import static io.tunnelcontrol.core.tunnel.ConnectionState.DISCONNECTED;
import static io.tunnelcontrol.core.tunnel.ConnectionState.DISCONNECTING;
import static io.tunnelcontrol.core.tunnel.ConnectionState.ERROR;
import static org.assertj.core.api.Assertions.assertThat;

import io.tunnelcontrol.core.settings.ConnectionStorage;
import io.tunnelcontrol.core.settings.InMemoryKeyValueStore;
import io.tunnelcontrol.core.tunnel.ConnectionState;
import io.tunnelcontrol.core.tunnel.RelayStats;
import io.tunnelcontrol.core.tunnel.StateFeed;
import io.tunnelcontrol.core.tunnel.TunnelConfiguration;
import io.tunnelcontrol.core.tunnel.TunnelService;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Connection orchestrator")
class ConnectionOrchestratorTest {

    private static final ConnectRequest HOME = new ConnectRequest("192.168.1.100", 9852, null, null);

    private FakeTunnel tunnel;
    private ConnectionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        tunnel = new FakeTunnel();
        orchestrator = new ConnectionOrchestrator(
                tunnel, new TunnelOptions(List.of("com.example.browser"), true), Duration.ofSeconds(2),
                Duration.ofSeconds(2));
    }

    @Nested
    @DisplayName("Connect")
    class Connect {

        @Test
        @DisplayName("Reaches connected → success, target remembered, options applied")
        void connected() {
            ApiResponse response = orchestrator.connect(HOME);

            assertThat(response).isEqualTo(ApiResponse.success("Connected"));
            assertThat(orchestrator.currentTarget()).isEqualTo(new RemoteTarget("192.168.1.100", 9852));
            TunnelConfiguration sent = tunnel.connects.get(0);
            assertThat(sent.allowedApps()).containsExactly("com.example.browser");
            assertThat(sent.blockQuic()).isTrue();
            assertThat(orchestrator.isBusy()).isFalse();
        }

        @Test
        @DisplayName("Reaches error → failure")
        void failed() {
            tunnel.onConnect = List.of(CONNECTING, ERROR);

            assertThat(orchestrator.connect(HOME)).isEqualTo(ApiResponse.failure("Connection failed"));
            assertThat(orchestrator.currentTarget()).isNull();
        }

        @Test
        @DisplayName("Same target while connected → idempotent success, no new command")
        void sameTarget() {
            orchestrator.connect(HOME);

            ApiResponse again = orchestrator.connect(new ConnectRequest("192.168.1.100", 9852, "u", "p"));

            assertThat(again).isEqualTo(ApiResponse.success("Already connected"));
            assertThat(tunnel.connects).hasSize(1);
        }

        @Test
        @DisplayName("Other target while connected → conflict naming the current one")
        void otherTarget() {
            orchestrator.connect(HOME);

            ApiResponse conflict = orchestrator.connect(new ConnectRequest("10.0.0.5", 1080, null, null));

            assertThat(conflict)
                    .isEqualTo(ApiResponse.failure("Already connected to 192.168.1.100:9852. Disconnect first."));
            assertThat(tunnel.connects).hasSize(1);
        }

        @Test
        @DisplayName("Connected by someone else (unknown target) → conflict")
        void unknownTarget() {
            tunnel.state = CONNECTED;

            assertThat(orchestrator.connect(HOME))
                    .isEqualTo(ApiResponse.failure("Already connected to unknown. Disconnect first."));
        }

        @Test
        @DisplayName("Transitional states → rejected without a command")
        void transitional() {
            tunnel.state = CONNECTING;
            assertThat(orchestrator.connect(HOME)).isEqualTo(ApiResponse.failure("Connection already in progress"));

            tunnel.state = DISCONNECTING;
            assertThat(orchestrator.connect(HOME)).isEqualTo(ApiResponse.failure("Disconnect in progress"));

            assertThat(tunnel.connects).isEmpty();
        }

        @Test
        @DisplayName("No terminal state in time → failure naming the last state")
        void timeout() {
            tunnel.onConnect = List.of(CONNECTING);
            orchestrator = new ConnectionOrchestrator(
                    tunnel, TunnelOptions.DEFAULT, Duration.ofMillis(100), Duration.ofMillis(100));

            assertThat(orchestrator.connect(HOME))
                    .isEqualTo(ApiResponse.failure("Connection timed out (state: connecting)"));
            assertThat(orchestrator.isBusy()).isFalse();
        }

        @Test
        @DisplayName("Stale error from an earlier attempt does not end the wait")
        void staleError() {
            tunnel.state = ERROR;

            assertThat(orchestrator.connect(HOME)).isEqualTo(ApiResponse.success("Connected"));
        }

        @Test
        @DisplayName("Command throws → fixed failure message without the cause, guard released")
        void commandThrows() {
            tunnel.connectFailure = new IllegalArgumentException("proxyHost must not be blank");

            assertThat(orchestrator.connect(HOME)).isEqualTo(ApiResponse.failure("Connection error"));
            assertThat(orchestrator.isBusy()).isFalse();
            assertThat(tunnel.feed.subscriberCount()).as("only the session watch remains").isEqualTo(1);
        }

        @Test
        @DisplayName("Options are read on every connect")
        void optionsPerConnect() {
            AtomicReference<TunnelOptions> options = new AtomicReference<>(TunnelOptions.DEFAULT);
            orchestrator = new ConnectionOrchestrator(
                    tunnel, options::get, null, Duration.ofSeconds(2), Duration.ofSeconds(2));

            orchestrator.connect(HOME);
            orchestrator.disconnect();
            options.set(new TunnelOptions(List.of("com.example.mail"), false));
            orchestrator.connect(HOME);

            assertThat(tunnel.connects.get(0).allowedApps()).isEmpty();
            assertThat(tunnel.connects.get(1).allowedApps()).containsExactly("com.example.mail");
        }

        @Test
        @DisplayName("Successful connect is remembered, a failed one is not")
        void remembersConnection() {
            ConnectionStorage storage = new ConnectionStorage(new InMemoryKeyValueStore(), new InMemoryKeyValueStore());
            orchestrator = new ConnectionOrchestrator(
                    tunnel, () -> TunnelOptions.DEFAULT, storage, Duration.ofSeconds(2), Duration.ofSeconds(2));

            tunnel.onConnect = List.of(CONNECTING, ERROR);
            orchestrator.connect(HOME);
            assertThat(storage.load()).isEmpty();

            tunnel.onConnect = List.of(CONNECTING, CONNECTED);
            orchestrator.connect(new ConnectRequest("192.168.1.100", 9852, "alice", "secret"));
            assertThat(storage.load()).contains(
                    new ConnectionStorage.SavedConnection("192.168.1.100", 9852, true, "alice", "secret"));
        }
    }

    @Nested
    @DisplayName("Disconnect")
    class Disconnect {

        @Test
        @DisplayName("Idle → success without a command")
        void idle() {
            assertThat(orchestrator.disconnect()).isEqualTo(ApiResponse.success("Already disconnected"));
            assertThat(tunnel.disconnects.get()).isZero();
        }

        @Test
        @DisplayName("Error state → success without a command, target cleared")
        void fromError() {
            orchestrator.connect(HOME);
            tunnel.state = ERROR;

            assertThat(orchestrator.disconnect()).isEqualTo(ApiResponse.success("Disconnected (was in error state)"));
            assertThat(orchestrator.currentTarget()).isNull();
            assertThat(tunnel.disconnects.get()).isZero();
        }

        @Test
        @DisplayName("Connected → clean disconnect")
        void clean() {
            orchestrator.connect(HOME);

            assertThat(orchestrator.disconnect()).isEqualTo(ApiResponse.success("Disconnected"));
            assertThat(orchestrator.currentTarget()).isNull();
            assertThat(orchestrator.status()).isEqualTo(new StatusResponse(false, "disconnected", null, null));
        }

        @Test
        @DisplayName("Ends in error → still success, message says so")
        void endsInError() {
            orchestrator.connect(HOME);
            tunnel.onDisconnect = List.of(DISCONNECTING, ERROR);

            assertThat(orchestrator.disconnect()).isEqualTo(ApiResponse.success("Disconnected (with error state)"));
        }

        @Test
        @DisplayName("Disconnect command throws → fixed failure message")
        void commandThrows() {
            orchestrator.connect(HOME);
            tunnel.disconnectFailure = new IllegalStateException("worker rejected");

            assertThat(orchestrator.disconnect()).isEqualTo(ApiResponse.failure("Disconnect error"));
            assertThat(orchestrator.isBusy()).isFalse();
        }

        @Test
        @DisplayName("Session ends without a command (revoked) → target cleared")
        void endedElsewhere() {
            orchestrator.connect(HOME);

            tunnel.publish(DISCONNECTED);

            assertThat(orchestrator.currentTarget()).isNull();
            assertThat(orchestrator.status()).isEqualTo(new StatusResponse(false, "disconnected", null, null));
        }

        @Test
        @DisplayName("Relay failure after connect → target cleared")
        void failedElsewhere() {
            orchestrator.connect(HOME);

            tunnel.publish(ERROR);

            assertThat(orchestrator.currentTarget()).isNull();
        }

        @Test
        @DisplayName("close() stops watching the session")
        void closedWatch() {
            orchestrator.connect(HOME);

            orchestrator.close();
            tunnel.publish(DISCONNECTED);

            assertThat(tunnel.feed.subscriberCount()).isZero();
            assertThat(orchestrator.currentTarget()).isEqualTo(new RemoteTarget("192.168.1.100", 9852));
        }

        @Test
        @DisplayName("No terminal state in time → success naming the last state")
        void timeout() {
            orchestrator = new ConnectionOrchestrator(
                    tunnel, TunnelOptions.DEFAULT, Duration.ofSeconds(2), Duration.ofMillis(100));
            orchestrator.connect(HOME);
            tunnel.onDisconnect = List.of(DISCONNECTING);

            assertThat(orchestrator.disconnect())
                    .isEqualTo(ApiResponse.success("Disconnect requested (timed out in state: disconnecting)"));
            assertThat(orchestrator.currentTarget()).isNull();
        }
    }

    @Nested
    @DisplayName("Single flight and status")
    class SingleFlight {

        @Test
        @DisplayName("A second command while one is in flight → rejected, the first completes")
        void concurrentCallerRejected() throws Exception {
            CountDownLatch issued = new CountDownLatch(1);
            tunnel.onConnect = List.of(CONNECTING);
            tunnel.afterConnect = issued::countDown;

            CompletableFuture<ApiResponse> first = CompletableFuture.supplyAsync(() -> orchestrator.connect(HOME));
            assertThat(issued.await(2, TimeUnit.SECONDS)).isTrue();

            assertThat(orchestrator.isBusy()).isTrue();
            assertThat(orchestrator.disconnect()).isEqualTo(ApiResponse.failure("Operation already in progress"));
            assertThat(orchestrator.connect(HOME)).isEqualTo(ApiResponse.failure("Operation already in progress"));

            tunnel.publish(CONNECTED);
            assertThat(first.get(2, TimeUnit.SECONDS)).isEqualTo(ApiResponse.success("Connected"));
            assertThat(tunnel.connects).hasSize(1);
        }

        @Test
        @DisplayName("status() reports host and port only while connected")
        void status() {
            assertThat(orchestrator.status()).isEqualTo(new StatusResponse(false, "disconnected", null, null));

            orchestrator.connect(HOME);

            assertThat(orchestrator.status()).isEqualTo(new StatusResponse(true, "connected", "192.168.1.100", 9852));
            assertThat(orchestrator.status().toJson().toString())
                    .isEqualTo("{\"connected\":true,\"state\":\"connected\",\"host\":\"192.168.1.100\",\"port\":9852}");
        }

        @Test
        @DisplayName("Status JSON without a target omits host and port")
        void statusJsonWhileDisconnected() {
            assertThat(orchestrator.status().toJson().toString())
                    .isEqualTo("{\"connected\":false,\"state\":\"disconnected\"}");
        }

        @Test
        @DisplayName("Response JSON shape")
        void responseJson() {
            assertThat(ApiResponse.failure("Connection failed").toJson().toString())
                    .isEqualTo("{\"success\":false,\"message\":\"Connection failed\"}");
        }
    }

    /** Synchronous stand-in for the session controller: publishes scripted states from the command. */
    static final class FakeTunnel implements TunnelService {
        final StateFeed feed = new StateFeed();
        final List<TunnelConfiguration> connects = new CopyOnWriteArrayList<>();
        final AtomicInteger disconnects = new AtomicInteger();
        volatile ConnectionState state = DISCONNECTED;
        volatile List<ConnectionState> onConnect = List.of(CONNECTING, CONNECTED);
        volatile List<ConnectionState> onDisconnect = List.of(DISCONNECTING, DISCONNECTED);
        volatile RuntimeException connectFailure;
        volatile RuntimeException disconnectFailure;
        volatile Runnable afterConnect = () -> {};

        @Override
        public void connect(TunnelConfiguration configuration) {
            if (connectFailure != null) {
                throw connectFailure;
            }
            connects.add(configuration);
            onConnect.forEach(this::publish);
            afterConnect.run();
        }

        @Override
        public void disconnect() {
            if (disconnectFailure != null) {
                throw disconnectFailure;
            }
            disconnects.incrementAndGet();
            onDisconnect.forEach(this::publish);
        }

        void publish(ConnectionState next) {
            state = next;
            feed.publish(next);
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
            return Optional.empty();
        }
    }
}
