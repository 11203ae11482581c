package io.tunnelcontrol.server.gateway;

import io.tunnelcontrol.core.control.ConnectionOrchestrator;
import io.tunnelcontrol.core.identity.CertificateDetails;
import io.tunnelcontrol.core.identity.CertificateMaterial;
import io.tunnelcontrol.core.identity.TlsIdentityManager;
import io.tunnelcontrol.core.settings.InMemoryKeyValueStore;
import io.tunnelcontrol.core.settings.ServerRuntimeSettings;
import io.tunnelcontrol.core.tunnel.TunnelSessionController;
import io.tunnelcontrol.server.platform.DryRunPlatform;
import io.tunnelcontrol.server.platform.DryRunRelay;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.KeyStore;
import java.time.Duration;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;

/**
 * Starts a {@link ControlGateway} on a free loopback port over the dry-run platform and sends
 * requests to it with the JDK {@link HttpClient}.
 *
 * <pre>
 *   TestClient ← HTTP(S) → ControlGateway → ConnectionOrchestrator → TunnelSessionController (dry run)
 * </pre>
 */
final class GatewayHarness implements AutoCloseable {

    static final String HOST = "127.0.0.1";

    final DryRunPlatform platform = new DryRunPlatform();
    final DryRunRelay relay = new DryRunRelay();
    final TunnelSessionController controller = new TunnelSessionController(platform, relay, "io.tunnelcontrol.test");
    final ConnectionOrchestrator orchestrator = new ConnectionOrchestrator(controller);
    final TlsIdentityManager identity = new TlsIdentityManager(new InMemoryKeyValueStore());
    final ControlGateway gateway = new ControlGateway(HOST, orchestrator, identity);

    private HttpClient client;

    static GatewayHarness start(ServerRuntimeSettings settings) {
        GatewayHarness harness = new GatewayHarness();
        harness.gateway.start(settings);
        return harness;
    }

    static ServerRuntimeSettings http() {
        return new ServerRuntimeSettings(true, freePort(), false, false, null);
    }

    static ServerRuntimeSettings https() {
        return new ServerRuntimeSettings(true, freePort(), true, false, null);
    }

    static ServerRuntimeSettings httpsWithAuth(String token) {
        return new ServerRuntimeSettings(true, freePort(), true, true, token);
    }

    /** A port that was free a moment ago; the settings model does not accept port 0. */
    static int freePort() {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    HttpResponse<String> get(String path) throws Exception {
        return send(request(path).GET().build());
    }

    HttpResponse<String> post(String path, String body) throws Exception {
        return send(request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
    }

    HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create(gateway.address() + path))
                .timeout(Duration.ofSeconds(30));
    }

    HttpResponse<String> send(HttpRequest request) throws Exception {
        return client().send(request, HttpResponse.BodyHandlers.ofString());
    }

    /** Trusts exactly the gateway's generated certificate when serving HTTPS. */
    synchronized HttpClient client() throws Exception {
        if (client == null) {
            HttpClient.Builder builder = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1);
            if (gateway.isHttps()) {
                builder.sslContext(trusting(identity.current().orElseThrow()));
            }
            client = builder.build();
        }
        return client;
    }

    static SSLContext trusting(CertificateMaterial material) throws Exception {
        KeyStore trustStore = KeyStore.getInstance("PKCS12");
        trustStore.load(null, null);
        trustStore.setCertificateEntry("tunnel-control", CertificateDetails.parse(material.certificateDer()));
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trustStore);
        SSLContext sslContext = SSLContext.getInstance("TLS");
        sslContext.init(null, tmf.getTrustManagers(), null);
        return sslContext;
    }

    @Override
    public void close() {
        gateway.stop();
        orchestrator.close();
        controller.close();
    }
}
