package io.tunnelcontrol.core.error;

/** The proxy's CA certificate could not be fetched or was empty. */
public final class ProxyCertificateException extends TunnelControlException {

    private static final long serialVersionUID = 1L;

    public ProxyCertificateException(String message) {
        super(message);
    }

    public ProxyCertificateException(String message, Throwable cause) {
        super(message, cause);
    }
}
