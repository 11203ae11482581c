package io.tunnelcontrol.core.discovery;

import io.tunnelcontrol.core.error.ProxyCertificateException;
import io.tunnelcontrol.core.settings.KeyValueStore;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads the CA certificate a proxy publishes at its {@link ProxyHost#certEndpoint()} and keeps
 * the latest one in a {@link KeyValueStore}, so the user can install it to inspect TLS traffic.
 *
 * <p>
 * The endpoint is fetched over plain HTTP on the proxy port. The body is stored as received; the
 * proxy decides between PEM and DER-in-base64.
 */
public final class ProxyCertificateFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(ProxyCertificateFetcher.class);

    static final String KEY_CERTIFICATE = "proxy_ca_certificate";
    static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final KeyValueStore store;
    private final HttpClient client;

    public ProxyCertificateFetcher(KeyValueStore store) {
        this(store, HttpClient.newBuilder().connectTimeout(TIMEOUT).build());
    }

    public ProxyCertificateFetcher(KeyValueStore store, HttpClient client) {
        this.store = store;
        this.client = client;
    }

    /**
     * Fetches and stores the CA of an announced host.
     *
     * @throws ProxyCertificateException if the host announces no endpoint or the fetch fails
     */
    public String download(ProxyHost host) {
        if (host.certEndpoint() == null || host.certEndpoint().isBlank()) {
            throw new ProxyCertificateException("Host " + host.label() + " does not publish a CA certificate");
        }
        return download(host.hostname(), host.port(), host.certEndpoint());
    }

    /**
     * Fetches {@code http://hostname:port/certEndpoint} and stores the body.
     *
     * @return the certificate text
     * @throws ProxyCertificateException on a non-200 status, an empty body, or an I/O failure
     */
    public String download(String hostname, int port, String certEndpoint) {
        URI uri = endpoint(hostname, port, certEndpoint);
        LOG.debug("Fetching proxy CA certificate from {}", uri);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(TIMEOUT)
                .header("Accept", "*/*")
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProxyCertificateException("Failed to fetch CA certificate from " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProxyCertificateException("Interrupted while fetching CA certificate from " + uri, e);
        }
        if (response.statusCode() != 200) {
            throw new ProxyCertificateException(
                    "CA certificate endpoint " + uri + " answered HTTP " + response.statusCode());
        }
        String certificate = response.body();
        if (certificate == null || certificate.isBlank()) {
            throw new ProxyCertificateException("CA certificate endpoint " + uri + " returned an empty body");
        }
        store.put(KEY_CERTIFICATE, certificate);
        LOG.info("Proxy CA certificate stored: source={}, bytes={}", uri, certificate.length());
        return certificate;
    }

    /** The last downloaded certificate, if any. */
    public Optional<String> stored() {
        return store.get(KEY_CERTIFICATE);
    }

    public void delete() {
        store.remove(KEY_CERTIFICATE);
        LOG.debug("Proxy CA certificate deleted");
    }

    /** Endpoint paths are relative to the proxy root; a missing leading slash is added. */
    static URI endpoint(String hostname, int port, String certEndpoint) {
        String path = certEndpoint.startsWith("/") ? certEndpoint : "/" + certEndpoint;
        return URI.create("http://" + hostname + ":" + port + path);
    }
}
