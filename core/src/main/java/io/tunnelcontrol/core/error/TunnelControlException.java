package io.tunnelcontrol.core.error;

/**
 * Abstract base for all tunnel-control exceptions. Never thrown directly; use one of the concrete
 * subclasses so callers can map the failure to a response or a session state.
 */
public abstract class TunnelControlException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected TunnelControlException(String message) {
        super(message);
    }

    protected TunnelControlException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
