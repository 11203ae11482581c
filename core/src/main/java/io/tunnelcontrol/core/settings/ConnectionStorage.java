package io.tunnelcontrol.core.settings;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remembers the last proxy the tunnel connected to, so a later session can offer it again. The
 * endpoint and username go to the plain store, the password to the confidential store.
 */
public final class ConnectionStorage {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionStorage.class);

    static final String KEY_HOSTNAME = "last_hostname";
    static final String KEY_PORT = "last_port";
    static final String KEY_USE_AUTH = "last_use_auth";
    static final String KEY_USERNAME = "last_username";
    static final String KEY_PASSWORD = "last_password";

    private final KeyValueStore store;
    private final KeyValueStore secureStore;

    public ConnectionStorage(KeyValueStore store, KeyValueStore secureStore) {
        this.store = store;
        this.secureStore = secureStore;
    }

    /** Replaces the saved connection; credentials are kept only when it uses authentication. */
    public synchronized void save(SavedConnection connection) {
        store.put(KEY_HOSTNAME, connection.hostname());
        store.put(KEY_PORT, Integer.toString(connection.port()));
        store.put(KEY_USE_AUTH, Boolean.toString(connection.useAuthentication()));
        if (connection.useAuthentication() && connection.username() != null) {
            store.put(KEY_USERNAME, connection.username());
        } else {
            store.remove(KEY_USERNAME);
        }
        if (connection.useAuthentication() && connection.password() != null) {
            secureStore.put(KEY_PASSWORD, connection.password());
        } else {
            secureStore.remove(KEY_PASSWORD);
        }
        LOG.debug("Saved last connection: {}", connection);
    }

    /** The saved connection, or empty when none was saved or the stored port is unreadable. */
    public synchronized Optional<SavedConnection> load() {
        Optional<String> hostname = store.get(KEY_HOSTNAME);
        Optional<Integer> port = store.get(KEY_PORT).flatMap(ConnectionStorage::parsePort);
        if (hostname.isEmpty() || port.isEmpty()) {
            return Optional.empty();
        }
        boolean useAuth = store.get(KEY_USE_AUTH).map(value -> Boolean.parseBoolean(value.trim())).orElse(false);
        return Optional.of(new SavedConnection(
                hostname.get(),
                port.get(),
                useAuth,
                store.get(KEY_USERNAME).orElse(null),
                secureStore.get(KEY_PASSWORD).orElse(null)));
    }

    public synchronized void clear() {
        store.remove(KEY_HOSTNAME);
        store.remove(KEY_PORT);
        store.remove(KEY_USE_AUTH);
        store.remove(KEY_USERNAME);
        secureStore.remove(KEY_PASSWORD);
        LOG.debug("Saved connection cleared");
    }

    private static Optional<Integer> parsePort(String value) {
        try {
            int port = Integer.parseInt(value.trim());
            if (ServerRuntimeSettings.isValidPort(port)) {
                return Optional.of(port);
            }
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring unreadable saved port '{}'", value);
            return Optional.empty();
        }
        LOG.warn("Ignoring out-of-range saved port {}", value);
        return Optional.empty();
    }

    /**
     * A remembered proxy endpoint.
     *
     * @param hostname          proxy host
     * @param port              proxy port
     * @param useAuthentication whether credentials were sent
     * @param username          SOCKS5 username, or {@code null}
     * @param password          SOCKS5 password, or {@code null}; never printed
     */
    public record SavedConnection(
            String hostname, int port, boolean useAuthentication, String username, String password) {

        @Override
        public String toString() {
            return "SavedConnection[" + hostname + ":" + port + ", auth=" + useAuthentication + "]";
        }
    }
}
