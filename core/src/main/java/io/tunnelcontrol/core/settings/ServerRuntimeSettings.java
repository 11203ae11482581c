package io.tunnelcontrol.core.settings;

/**
 * Persisted runtime settings of the control API.
 *
 * <p>
 * Invariant: {@code authEnabled} implies {@code httpsEnabled}. The canonical constructor coerces
 * auth off when HTTPS is off, so a bearer token never travels in clear text.
 *
 * @param autoStart    start the gateway with the application
 * @param port         listen port, 1-65535
 * @param httpsEnabled serve over TLS with the generated identity
 * @param authEnabled  require {@code Authorization: Bearer <token>}
 * @param token        32 lower-case hex characters, or {@code null} if never generated
 */
public record ServerRuntimeSettings(boolean autoStart, int port, boolean httpsEnabled, boolean authEnabled, String token) {

    public static final boolean DEFAULT_AUTO_START = true;
    public static final int DEFAULT_PORT = 18080;

    public static final ServerRuntimeSettings DEFAULTS =
            new ServerRuntimeSettings(DEFAULT_AUTO_START, DEFAULT_PORT, false, false, null);

    public ServerRuntimeSettings {
        if (!isValidPort(port)) {
            throw new IllegalArgumentException("port must be 1-65535, got " + port);
        }
        authEnabled = authEnabled && httpsEnabled;
    }

    public static boolean isValidPort(int port) {
        return port >= 1 && port <= 65535;
    }

    public ServerRuntimeSettings withAutoStart(boolean value) {
        return new ServerRuntimeSettings(value, port, httpsEnabled, authEnabled, token);
    }

    public ServerRuntimeSettings withPort(int value) {
        return new ServerRuntimeSettings(autoStart, value, httpsEnabled, authEnabled, token);
    }

    /** Turning HTTPS off also turns auth off. */
    public ServerRuntimeSettings withHttpsEnabled(boolean value) {
        return new ServerRuntimeSettings(autoStart, port, value, value && authEnabled, token);
    }

    public ServerRuntimeSettings withAuthEnabled(boolean value) {
        return new ServerRuntimeSettings(autoStart, port, httpsEnabled, value, token);
    }

    public ServerRuntimeSettings withToken(String value) {
        return new ServerRuntimeSettings(autoStart, port, httpsEnabled, authEnabled, value);
    }

    /** Scheme the gateway serves under these settings. */
    public String scheme() {
        return httpsEnabled ? "https" : "http";
    }

    @Override
    public String toString() {
        return "ServerRuntimeSettings[autoStart=" + autoStart + ", port=" + port + ", httpsEnabled=" + httpsEnabled
                + ", authEnabled=" + authEnabled + ", token=" + (token == null ? "none" : "****") + "]";
    }
}
