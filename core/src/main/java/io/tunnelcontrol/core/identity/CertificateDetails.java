package io.tunnelcontrol.core.identity;

import io.tunnelcontrol.core.error.CertificateEncodingException;
import java.io.ByteArrayInputStream;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPublicKey;
import java.time.Instant;
import java.util.Locale;

/**
 * Human-facing summary of a certificate, read back through the JDK's X.509 parser.
 *
 * @param subject      RFC 2253 subject name
 * @param serialNumber serial as upper-case hex
 * @param notBefore    start of validity
 * @param notAfter     end of validity
 * @param publicKey    key algorithm and size, e.g. {@code RSA 2048}
 * @param fingerprint  SHA-256 fingerprint
 */
public record CertificateDetails(
        String subject, String serialNumber, Instant notBefore, Instant notAfter, String publicKey, String fingerprint) {

    /**
     * Parses the certificate half of {@code material}.
     *
     * @throws CertificateEncodingException if the JDK rejects the certificate
     */
    public static CertificateDetails of(CertificateMaterial material) {
        X509Certificate certificate = parse(material.certificateDer());
        String key = certificate.getPublicKey() instanceof RSAPublicKey rsa
                ? "RSA " + rsa.getModulus().bitLength()
                : certificate.getPublicKey().getAlgorithm();
        return new CertificateDetails(
                certificate.getSubjectX500Principal().getName(),
                certificate.getSerialNumber().toString(16).toUpperCase(Locale.ROOT),
                certificate.getNotBefore().toInstant(),
                certificate.getNotAfter().toInstant(),
                key,
                material.fingerprint());
    }

    /** Decodes DER bytes into a JDK certificate object. */
    public static X509Certificate parse(byte[] der) {
        try {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            return (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(der));
        } catch (CertificateException e) {
            throw new CertificateEncodingException("Certificate could not be parsed", e);
        }
    }

    /** Whether {@code now} lies inside the validity window. */
    public boolean isValidAt(Instant now) {
        return !now.isBefore(notBefore) && !now.isAfter(notAfter);
    }
}
