package io.tunnelcontrol.core.identity;

import io.tunnelcontrol.core.error.CertificateEncodingException;
import io.tunnelcontrol.core.settings.KeyValueStore;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single TLS identity used by the control API when it serves HTTPS.
 *
 * <p>
 * Material is created lazily by {@link #ensure()}, persisted in the confidential store and
 * survives restarts; {@link #regenerate()} replaces it wholesale. Operations are serialized on
 * this instance, so concurrent {@code ensure} calls generate at most once.
 *
 * <p>
 * Key and certificate are written in one store update. A stored pair whose key does not match the
 * certificate is treated as absent, so the next {@link #ensure()} replaces it.
 */
public final class TlsIdentityManager {

    private static final Logger LOG = LoggerFactory.getLogger(TlsIdentityManager.class);

    static final String PRIVATE_KEY_KEY = "web_server_private_key";
    static final String CERTIFICATE_KEY = "web_server_certificate";

    private final KeyValueStore secureStore;
    private final CertificateGenerator generator;
    private final CertificateProfile defaultProfile;

    public TlsIdentityManager(KeyValueStore secureStore) {
        this(secureStore, new CertificateGenerator(), CertificateProfile.defaults());
    }

    public TlsIdentityManager(
            KeyValueStore secureStore, CertificateGenerator generator, CertificateProfile defaultProfile) {
        this.secureStore = secureStore;
        this.generator = generator;
        this.defaultProfile = defaultProfile;
    }

    /** {@link #ensure(String, int)} with the configured common name and validity. */
    public boolean ensure() {
        return ensure(defaultProfile.commonName(), defaultProfile.validityDays());
    }

    /**
     * Generates and stores material if none exists yet.
     *
     * @return {@code true} if new material was generated, {@code false} if it already existed
     */
    public synchronized boolean ensure(String commonName, int validityDays) {
        if (load().isPresent()) {
            return false;
        }
        store(generate(defaultProfile.withCommonName(commonName).withValidityDays(validityDays)));
        return true;
    }

    /** Unconditionally replaces the stored material. */
    public synchronized CertificateMaterial regenerate() {
        CertificateMaterial material = generate(defaultProfile);
        store(material);
        LOG.info("TLS identity regenerated: fingerprint={}", material.fingerprint());
        return material;
    }

    public synchronized Optional<CertificateMaterial> current() {
        return load();
    }

    /** SHA-256 fingerprint of the current certificate, if any. */
    public synchronized Optional<String> fingerprint() {
        return load().map(CertificateMaterial::fingerprint);
    }

    public synchronized boolean hasIdentity() {
        return load().isPresent();
    }

    /** Forgets the stored key and certificate; the next {@link #ensure()} generates anew. */
    public synchronized void delete() {
        secureStore.remove(PRIVATE_KEY_KEY);
        secureStore.remove(CERTIFICATE_KEY);
        LOG.info("TLS identity deleted");
    }

    private CertificateMaterial generate(CertificateProfile profile) {
        long start = System.nanoTime();
        CertificateMaterial material = generator.generate(profile);
        LOG.info(
                "Generated self-signed certificate: cn={}, validityDays={}, fingerprint={}, elapsedMs={}",
                profile.commonName(),
                profile.validityDays(),
                material.fingerprint(),
                (System.nanoTime() - start) / 1_000_000);
        return material;
    }

    private void store(CertificateMaterial material) {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(PRIVATE_KEY_KEY, material.privateKeyPem());
        entries.put(CERTIFICATE_KEY, material.certificatePem());
        secureStore.putAll(entries);
    }

    private Optional<CertificateMaterial> load() {
        Optional<String> key = secureStore.get(PRIVATE_KEY_KEY);
        Optional<String> certificate = secureStore.get(CERTIFICATE_KEY);
        if (key.isEmpty() || certificate.isEmpty()) {
            return Optional.empty();
        }
        CertificateMaterial material;
        try {
            byte[] der = Pem.decode(certificate.get(), Pem.CERTIFICATE);
            material = new CertificateMaterial(key.get(), certificate.get(), CertificateGenerator.fingerprint(der));
            if (!matches(material)) {
                LOG.warn("Stored TLS key does not match the stored certificate; identity will be regenerated");
                return Optional.empty();
            }
        } catch (CertificateEncodingException | IllegalArgumentException e) {
            LOG.warn("Stored TLS identity is unreadable; identity will be regenerated", e);
            return Optional.empty();
        }
        return Optional.of(material);
    }

    /** Same RSA modulus and exponent on both sides of the pair. */
    static boolean matches(CertificateMaterial material) {
        RSAPublicKey publicKey = (RSAPublicKey) CertificateDetails.parse(material.certificateDer()).getPublicKey();
        try {
            RSAPrivateCrtKey privateKey = (RSAPrivateCrtKey) KeyFactory.getInstance("RSA")
                    .generatePrivate(new PKCS8EncodedKeySpec(material.privateKeyDer()));
            return privateKey.getModulus().equals(publicKey.getModulus())
                    && privateKey.getPublicExponent().equals(publicKey.getPublicExponent());
        } catch (GeneralSecurityException | ClassCastException e) {
            throw new CertificateEncodingException("Stored private key could not be decoded", e);
        }
    }
}
