package io.tunnelcontrol.core.settings;

import io.tunnelcontrol.core.error.SettingsException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes {@link ServerRuntimeSettings}. Flags and the port go to the plain store; the auth
 * token goes to the confidential store and is never logged.
 */
public final class SettingsService {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsService.class);

    static final String KEY_AUTO_START = "web_server_auto_start";
    static final String KEY_PORT = "web_server_port";
    static final String KEY_HTTPS_ENABLED = "web_server_https_enabled";
    static final String KEY_AUTH_ENABLED = "web_server_auth_enabled";
    static final String KEY_AUTH_TOKEN = "web_server_auth_token";

    static final int TOKEN_BYTES = 16;

    private final KeyValueStore store;
    private final KeyValueStore secureStore;
    private final SecureRandom random;

    public SettingsService(KeyValueStore store, KeyValueStore secureStore) {
        this(store, secureStore, new SecureRandom());
    }

    public SettingsService(KeyValueStore store, KeyValueStore secureStore, SecureRandom random) {
        this.store = store;
        this.secureStore = secureStore;
        this.random = random;
    }

    /** Current settings; absent or unreadable values fall back to the defaults. */
    public synchronized ServerRuntimeSettings load() {
        ServerRuntimeSettings defaults = ServerRuntimeSettings.DEFAULTS;
        int port = store.get(KEY_PORT).map(this::parsePort).orElse(defaults.port());
        return new ServerRuntimeSettings(
                bool(KEY_AUTO_START, defaults.autoStart()),
                port,
                bool(KEY_HTTPS_ENABLED, defaults.httpsEnabled()),
                bool(KEY_AUTH_ENABLED, defaults.authEnabled()),
                secureStore.get(KEY_AUTH_TOKEN).orElse(null));
    }

    public synchronized void save(ServerRuntimeSettings settings) {
        store.put(KEY_AUTO_START, Boolean.toString(settings.autoStart()));
        store.put(KEY_PORT, Integer.toString(settings.port()));
        store.put(KEY_HTTPS_ENABLED, Boolean.toString(settings.httpsEnabled()));
        store.put(KEY_AUTH_ENABLED, Boolean.toString(settings.authEnabled()));
        if (settings.token() != null) {
            secureStore.put(KEY_AUTH_TOKEN, settings.token());
        } else {
            secureStore.remove(KEY_AUTH_TOKEN);
        }
        LOG.debug("Settings saved: {}", settings);
    }

    public synchronized ServerRuntimeSettings setAutoStart(boolean enabled) {
        return update(load().withAutoStart(enabled));
    }

    /**
     * @throws SettingsException if {@code port} is outside 1-65535
     */
    public synchronized ServerRuntimeSettings setPort(int port) {
        if (!ServerRuntimeSettings.isValidPort(port)) {
            throw new SettingsException("Port must be between 1 and 65535, got " + port);
        }
        return update(load().withPort(port));
    }

    /** Disabling HTTPS also disables auth. */
    public synchronized ServerRuntimeSettings setHttpsEnabled(boolean enabled) {
        ServerRuntimeSettings current = load();
        if (!enabled && current.authEnabled()) {
            LOG.info("HTTPS disabled, authentication disabled with it");
        }
        return update(current.withHttpsEnabled(enabled));
    }

    /**
     * Enabling auth generates a token when none exists yet.
     *
     * @throws SettingsException if enabling while HTTPS is off
     */
    public synchronized ServerRuntimeSettings setAuthEnabled(boolean enabled) {
        ServerRuntimeSettings current = load();
        if (enabled && !current.httpsEnabled()) {
            throw new SettingsException("Authentication requires HTTPS to be enabled");
        }
        ServerRuntimeSettings next = current.withAuthEnabled(enabled);
        if (enabled && next.token() == null) {
            next = next.withToken(newToken());
            LOG.info("Authentication token generated");
        }
        return update(next);
    }

    public synchronized Optional<String> token() {
        return secureStore.get(KEY_AUTH_TOKEN);
    }

    /** Stores a caller-provided token, e.g. one restored from a backup. */
    public synchronized void setToken(String token) {
        if (token == null || token.isBlank()) {
            throw new SettingsException("Token must not be blank");
        }
        secureStore.put(KEY_AUTH_TOKEN, token);
    }

    /** Replaces the token; clients holding the old one get 403 from then on. */
    public synchronized String generateNewToken() {
        String token = newToken();
        secureStore.put(KEY_AUTH_TOKEN, token);
        LOG.info("Authentication token regenerated");
        return token;
    }

    public synchronized void clearToken() {
        secureStore.remove(KEY_AUTH_TOKEN);
    }

    /** Back to defaults with no token. */
    public synchronized ServerRuntimeSettings reset() {
        store.remove(KEY_AUTO_START);
        store.remove(KEY_PORT);
        store.remove(KEY_HTTPS_ENABLED);
        store.remove(KEY_AUTH_ENABLED);
        secureStore.remove(KEY_AUTH_TOKEN);
        LOG.info("Settings reset to defaults");
        return ServerRuntimeSettings.DEFAULTS;
    }

    /** 16 random bytes as 32 lower-case hex characters. */
    String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private ServerRuntimeSettings update(ServerRuntimeSettings settings) {
        save(settings);
        return settings;
    }

    private boolean bool(String key, boolean fallback) {
        return store.get(key).map(value -> Boolean.parseBoolean(value.trim())).orElse(fallback);
    }

    private Integer parsePort(String value) {
        try {
            int port = Integer.parseInt(value.trim());
            if (ServerRuntimeSettings.isValidPort(port)) {
                return port;
            }
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring unreadable stored port '{}'", value);
            return ServerRuntimeSettings.DEFAULT_PORT;
        }
        LOG.warn("Ignoring out-of-range stored port {}", value);
        return ServerRuntimeSettings.DEFAULT_PORT;
    }
}
