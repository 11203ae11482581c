package io.tunnelcontrol.core.error;

/**
 * Certificate or key material could not be produced: a DER structure was malformed or a required
 * JCA algorithm is missing. Indicates a defect, not bad user input.
 */
public final class CertificateEncodingException extends TunnelControlException {

    private static final long serialVersionUID = 1L;

    public CertificateEncodingException(String message) {
        super(message);
    }

    public CertificateEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
