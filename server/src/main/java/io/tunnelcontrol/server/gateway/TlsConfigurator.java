package io.tunnelcontrol.server.gateway;

import io.javalin.config.JavalinConfig;
import io.tunnelcontrol.core.error.CertificateEncodingException;
import io.tunnelcontrol.core.identity.CertificateDetails;
import io.tunnelcontrol.core.identity.CertificateMaterial;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.HexFormat;
import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.SecureRequestCustomizer;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.SslConnectionFactory;
import org.eclipse.jetty.util.ssl.SslContextFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configures Javalin's embedded Jetty to serve HTTPS with the generated TLS identity.
 *
 * <p>
 * The PEM material never touches disk as a key store: it is loaded into an in-memory PKCS12
 * {@link KeyStore} protected by a throwaway password and handed to Jetty 11's
 * {@link SslContextFactory.Server}. The connector carries its own host and port, so the server
 * must be started with {@code Javalin.start()} and no arguments.
 */
public final class TlsConfigurator {

    private static final Logger LOG = LoggerFactory.getLogger(TlsConfigurator.class);

    static final String KEY_ALIAS = "tunnel-control";

    private TlsConfigurator() {}

    /**
     * Adds an HTTPS {@link ServerConnector} bound to {@code host:port}.
     *
     * @param javalinConfig the Javalin configuration to modify
     * @param material      PEM key and certificate to serve
     * @param host          interface to bind
     * @param port          port to bind; 0 picks an ephemeral port
     * @throws CertificateEncodingException if the material cannot be loaded into a key store
     */
    public static void configureHttps(JavalinConfig javalinConfig, CertificateMaterial material, String host, int port) {
        char[] password = randomPassword();
        KeyStore keyStore = keyStore(material, password);

        javalinConfig.jetty.addConnector((server, httpConfig) -> {
            SslContextFactory.Server sslContextFactory = new SslContextFactory.Server();
            sslContextFactory.setKeyStore(keyStore);
            sslContextFactory.setKeyStorePassword(new String(password));

            // Clients reach the server by LAN IP, which never matches an SNI host name.
            SecureRequestCustomizer customizer = new SecureRequestCustomizer();
            customizer.setSniHostCheck(false);
            HttpConfiguration httpsConfig = new HttpConfiguration(httpConfig);
            httpsConfig.addCustomizer(customizer);

            ServerConnector sslConnector = new ServerConnector(
                    server,
                    new SslConnectionFactory(sslContextFactory, "http/1.1"),
                    new HttpConnectionFactory(httpsConfig));
            sslConnector.setHost(host);
            sslConnector.setPort(port);

            LOG.info("Inbound TLS configured: host={}, port={}, fingerprint={}", host, port, material.fingerprint());
            return sslConnector;
        });
    }

    /** Loads the PEM pair into a fresh PKCS12 key store under {@value #KEY_ALIAS}. */
    static KeyStore keyStore(CertificateMaterial material, char[] password) {
        try {
            PrivateKey key =
                    KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(material.privateKeyDer()));
            Certificate certificate = CertificateDetails.parse(material.certificateDer());
            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(null, null);
            keyStore.setKeyEntry(KEY_ALIAS, key, password, new Certificate[] {certificate});
            return keyStore;
        } catch (GeneralSecurityException | IOException e) {
            throw new CertificateEncodingException("Failed to load TLS identity into a key store", e);
        }
    }

    private static char[] randomPassword() {
        byte[] bytes = new byte[16];
        new SecureRandom().nextBytes(bytes);
        return HexFormat.of().formatHex(bytes).toCharArray();
    }
}
