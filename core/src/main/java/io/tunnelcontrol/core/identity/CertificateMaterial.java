package io.tunnelcontrol.core.identity;

/**
 * The gateway's TLS identity: a PKCS#8 private key and its self-signed certificate, both PEM, plus
 * the certificate's SHA-256 fingerprint for out-of-band verification.
 */
public record CertificateMaterial(String privateKeyPem, String certificatePem, String fingerprint) {

    public CertificateMaterial {
        if (privateKeyPem == null || certificatePem == null || fingerprint == null) {
            throw new IllegalArgumentException("Certificate material must be complete");
        }
    }

    /** DER bytes of the certificate. */
    public byte[] certificateDer() {
        return Pem.decode(certificatePem, Pem.CERTIFICATE);
    }

    /** DER bytes of the PKCS#8 {@code PrivateKeyInfo}. */
    public byte[] privateKeyDer() {
        return Pem.decode(privateKeyPem, Pem.PRIVATE_KEY);
    }

    @Override
    public String toString() {
        return "CertificateMaterial[fingerprint=" + fingerprint + "]";
    }
}
