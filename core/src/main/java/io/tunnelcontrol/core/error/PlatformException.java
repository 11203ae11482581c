package io.tunnelcontrol.core.error;

/**
 * Failure reported by the virtual-interface platform or the relay engine. The session controller
 * turns it into the {@code error} connection state; it never reaches an API client directly.
 */
public final class PlatformException extends TunnelControlException {

    private static final long serialVersionUID = 1L;

    public PlatformException(String message) {
        super(message);
    }

    public PlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
