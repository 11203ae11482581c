package io.tunnelcontrol.server.gateway;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import io.tunnelcontrol.core.tunnel.ConnectionState;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Integration tests for the control API over plain HTTP.
 *
 * <pre>
 *   TestClient ← HTTP → ControlGateway → orchestrator → dry-run tunnel
 * </pre>
 */
@DisplayName("Control API over HTTP")
class ControlApiTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GatewayHarness harness;

    @BeforeEach
    void startGateway() {
        harness = GatewayHarness.start(GatewayHarness.http());
    }

    @AfterEach
    void stopGateway() {
        harness.close();
    }

    @Nested
    @DisplayName("Health")
    class Health {

        @Test
        @DisplayName("GET /health → 200 {status: ok, service: tunnel-control}")
        void health() throws Exception {
            HttpResponse<String> response = harness.get("/health");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("content-type")).hasValueSatisfying(
                    type -> assertThat(type).startsWith("application/json"));
            JsonNode body = MAPPER.readTree(response.body());
            assertThat(body.get("status").asText()).isEqualTo("ok");
            assertThat(body.get("service").asText()).isEqualTo("tunnel-control");
        }

        @Test
        @DisplayName("GET / → same body as /health")
        void root() throws Exception {
            HttpResponse<String> root = harness.get("/");

            assertThat(root.statusCode()).isEqualTo(200);
            assertThat(root.body()).isEqualTo(harness.get("/health").body());
        }
    }

    @Nested
    @DisplayName("Connect and status")
    class ConnectAndStatus {

        @Test
        @DisplayName("Fresh gateway → status disconnected without host/port")
        void initialStatus() throws Exception {
            JsonNode status = MAPPER.readTree(harness.get("/status").body());

            assertThat(status.get("connected").asBoolean()).isFalse();
            assertThat(status.get("state").asText()).isEqualTo("disconnected");
            assertThat(status.has("host")).isFalse();
            assertThat(status.has("port")).isFalse();
        }

        @Test
        @DisplayName("POST /connect → 200 Connected; status reports the target; disconnect → 200")
        void fullCycle() throws Exception {
            HttpResponse<String> connect = harness.post("/connect", "{\"host\":\"192.168.1.100\",\"port\":9852}");

            assertThat(connect.statusCode()).isEqualTo(200);
            assertThat(MAPPER.readTree(connect.body()).get("success").asBoolean()).isTrue();
            assertThat(MAPPER.readTree(connect.body()).get("message").asText()).isEqualTo("Connected");
            assertThat(harness.platform.openInterfaces()).isEqualTo(1);
            assertThat(harness.relay.lastConfiguration()).contains("192.168.1.100");

            JsonNode status = MAPPER.readTree(harness.get("/status").body());
            assertThat(status.get("connected").asBoolean()).isTrue();
            assertThat(status.get("state").asText()).isEqualTo("connected");
            assertThat(status.get("host").asText()).isEqualTo("192.168.1.100");
            assertThat(status.get("port").asInt()).isEqualTo(9852);

            HttpResponse<String> disconnect = harness.post("/disconnect", "");
            assertThat(disconnect.statusCode()).isEqualTo(200);
            assertThat(MAPPER.readTree(disconnect.body()).get("message").asText()).isEqualTo("Disconnected");
            assertThat(harness.platform.openInterfaces()).isZero();
        }

        @Test
        @DisplayName("Same target twice → 200 Already connected; other target → 400")
        void repeatedConnect() throws Exception {
            harness.post("/connect", "{\"host\":\"192.168.1.100\",\"port\":9852}");

            HttpResponse<String> same = harness.post("/connect", "{\"host\":\"192.168.1.100\",\"port\":9852}");
            HttpResponse<String> other = harness.post("/connect", "{\"host\":\"10.0.0.7\",\"port\":1080}");

            assertThat(same.statusCode()).isEqualTo(200);
            assertThat(MAPPER.readTree(same.body()).get("message").asText()).isEqualTo("Already connected");
            assertThat(other.statusCode()).isEqualTo(400);
            assertThat(MAPPER.readTree(other.body()).get("message").asText())
                    .isEqualTo("Already connected to 192.168.1.100:9852. Disconnect first.");
        }

        @Test
        @DisplayName("Permission revoked after connect → status drops host and port")
        void revokedSession() throws Exception {
            harness.post("/connect", "{\"host\":\"192.168.1.100\",\"port\":9852}");
            CountDownLatch ended = new CountDownLatch(1);
            harness.controller.stateFeed().subscribe(state -> {
                if (state == ConnectionState.DISCONNECTED) {
                    ended.countDown();
                }
            });

            harness.controller.onPermissionRevoked();

            assertThat(ended.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(harness.orchestrator.currentTarget()).isNull();
            JsonNode status = MAPPER.readTree(harness.get("/status").body());
            assertThat(status.get("state").asText()).isEqualTo("disconnected");
            assertThat(status.has("host")).isFalse();
        }

        @Test
        @DisplayName("Disconnect while disconnected → 200 Already disconnected")
        void idleDisconnect() throws Exception {
            HttpResponse<String> response = harness.post("/disconnect", "");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(MAPPER.readTree(response.body()).get("message").asText()).isEqualTo("Already disconnected");
        }
    }

    @Nested
    @DisplayName("Invalid connect bodies → 400")
    class InvalidBodies {

        @Test
        void emptyBody() throws Exception {
            assertRejected(harness.post("/connect", ""));
        }

        @Test
        void malformedJson() throws Exception {
            assertRejected(harness.post("/connect", "{\"host\":"));
        }

        @Test
        void missingPort() throws Exception {
            assertRejected(harness.post("/connect", "{\"host\":\"192.168.1.100\"}"));
        }

        @Test
        void portOutOfRange() throws Exception {
            assertRejected(harness.post("/connect", "{\"host\":\"192.168.1.100\",\"port\":70000}"));
        }

        @Test
        @DisplayName("Whitespace host → 400 naming the host field, nothing internal leaked")
        void blankHost() throws Exception {
            HttpResponse<String> response = harness.post("/connect", "{\"host\":\"   \",\"port\":1080}");

            assertRejected(response);
            assertThat(MAPPER.readTree(response.body()).get("message").asText())
                    .isEqualTo("Invalid request: Missing or invalid \"host\" field");
            assertThat(harness.controller.state()).isEqualTo(ConnectionState.DISCONNECTED);
        }

        private void assertRejected(HttpResponse<String> response) throws Exception {
            assertThat(response.statusCode()).isEqualTo(400);
            JsonNode body = MAPPER.readTree(response.body());
            assertThat(body.get("success").asBoolean()).isFalse();
            assertThat(body.get("message").asText()).isNotBlank();
            assertThat(harness.platform.openInterfaces()).isZero();
        }
    }

    @Nested
    @DisplayName("Routing")
    class Routing {

        @Test
        @DisplayName("Unknown path → 404 with JSON error body")
        void unknownPath() throws Exception {
            HttpResponse<String> response = harness.get("/nope");

            assertThat(response.statusCode()).isEqualTo(404);
            JsonNode body = MAPPER.readTree(response.body());
            assertThat(body.get("success").asBoolean()).isFalse();
            assertThat(body.get("message").asText()).isEqualTo("Not found: /nope");
        }

        @Test
        @DisplayName("Wrong method on a known path → 404")
        void wrongMethod() throws Exception {
            assertThat(harness.get("/connect").statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("GET /swagger → HTML page embedding the OpenAPI document")
        void swagger() throws Exception {
            HttpResponse<String> response = harness.get("/swagger");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("content-type")).hasValueSatisfying(
                    type -> assertThat(type).startsWith("text/html"));
            assertThat(response.body()).contains("SwaggerUIBundle").contains("Tunnel Control API");
        }
    }

    @Nested
    @DisplayName("CORS")
    class Cors {

        @Test
        @DisplayName("Every response carries Access-Control-Allow-Origin: *")
        void allowOrigin() throws Exception {
            assertThat(harness.get("/status").headers().firstValue("Access-Control-Allow-Origin"))
                    .hasValue("*");
            assertThat(harness.get("/nope").headers().firstValue("Access-Control-Allow-Origin"))
                    .hasValue("*");
        }

        @Test
        @DisplayName("OPTIONS preflight → 200 with allow headers, no body")
        void preflight() throws Exception {
            HttpResponse<String> response = harness.send(harness.request("/connect")
                    .header("Origin", "http://example.test")
                    .header("Access-Control-Request-Method", "POST")
                    .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                    .build());

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Access-Control-Allow-Methods")).hasValue("GET, POST, OPTIONS");
            assertThat(response.headers().firstValue("Access-Control-Allow-Headers"))
                    .hasValue("Content-Type, Authorization");
            assertThat(response.headers().firstValue("Access-Control-Max-Age")).hasValue("86400");
            assertThat(response.body()).isEmpty();
        }
    }
}
