package io.tunnelcontrol.core.tunnel;

import java.util.Locale;

/** Lifecycle of the tunnel session. Serialized in lower case ({@code "connected"}). */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    DISCONNECTING,
    ERROR;

    /** Lower-case name used on the wire and in logs. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire name, case-insensitively.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static ConnectionState fromWireName(String value) {
        return ConnectionState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /** {@code true} while a connect or disconnect is underway. */
    public boolean isTransitional() {
        return this == CONNECTING || this == DISCONNECTING;
    }

    @Override
    public String toString() {
        return wireName();
    }
}
