package io.tunnelcontrol.core.error;

/** Rejected settings change, e.g. enabling auth while HTTPS is off or an out-of-range port. */
public final class SettingsException extends TunnelControlException {

    private static final long serialVersionUID = 1L;

    public SettingsException(String message) {
        super(message);
    }
}
