package io.tunnelcontrol.server.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ServerConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code tunnel-control.yaml} from the current directory if it exists,
 * otherwise starts from the built-in defaults</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path, which must exist</li>
 * </ul>
 *
 * <p>
 * Layout:
 *
 * <pre>
 * server:   { bind-host }
 * storage:  { data-dir }
 * identity: { common-name, validity-days, san-ips: [..] }
 * tunnel:   { connect-timeout-ms, disconnect-timeout-ms, allowed-apps: [..], block-quic,
 *             self-package, session-name }
 * settings: { auto-start, port, https-enabled, auth-enabled }
 * logging:  { format, level, app-level, http-level }
 * </pre>
 *
 * <p>
 * Every key can be overridden by an environment variable, which takes precedence over the YAML
 * value. A variable is "set" only if it is defined AND its trimmed value is non-empty. List values
 * are comma-separated.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "tunnel-control.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration named by {@code args}, or the default file, or the defaults.
     *
     * @throws ConfigLoadException if an explicitly named file is missing or any file is invalid
     */
    public static ServerConfig load(String[] args) {
        return load(args, System::getenv);
    }

    public static ServerConfig load(String[] args, Function<String, String> envLookup) {
        Path explicit = explicitConfigPath(args);
        if (explicit != null) {
            return load(explicit, envLookup);
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.exists(fallback)) {
            return load(fallback, envLookup);
        }
        return fromTree(YAML_MAPPER.createObjectNode(), envLookup);
    }

    /**
     * Loads a {@link ServerConfig} from the given YAML file, applying environment overrides from the
     * supplied lookup function ({@code null} means undefined).
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return fromTree(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns the path following {@code --config}, or {@code null} when the flag is absent.
     *
     * @throws IllegalArgumentException if {@code --config} is the last argument
     */
    public static Path explicitConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return null;
    }

    static ServerConfig fromTree(JsonNode root, Function<String, String> envLookup) {
        ServerConfig.Builder builder = ServerConfig.builder();

        // --- YAML mapping ---

        JsonNode server = root.path("server");
        if (server.has("bind-host")) builder.bindHost(server.get("bind-host").asText());

        JsonNode storage = root.path("storage");
        if (storage.has("data-dir")) builder.dataDir(storage.get("data-dir").asText());

        JsonNode identity = root.path("identity");
        if (identity.has("common-name"))
            builder.identityCommonName(identity.get("common-name").asText());
        if (identity.has("validity-days"))
            builder.identityValidityDays(identity.get("validity-days").asInt());
        if (identity.has("san-ips")) builder.identitySanIps(textList(identity.get("san-ips")));

        JsonNode tunnel = root.path("tunnel");
        if (tunnel.has("connect-timeout-ms"))
            builder.connectTimeoutMs(tunnel.get("connect-timeout-ms").asInt());
        if (tunnel.has("disconnect-timeout-ms"))
            builder.disconnectTimeoutMs(tunnel.get("disconnect-timeout-ms").asInt());
        if (tunnel.has("allowed-apps")) builder.allowedApps(textList(tunnel.get("allowed-apps")));
        if (tunnel.has("block-quic")) builder.blockQuic(tunnel.get("block-quic").asBoolean());
        if (tunnel.has("self-package")) builder.selfPackage(tunnel.get("self-package").asText());
        if (tunnel.has("session-name")) builder.sessionName(tunnel.get("session-name").asText());

        JsonNode settings = root.path("settings");
        if (settings.has("auto-start"))
            builder.settingsAutoStart(settings.get("auto-start").asBoolean());
        if (settings.has("port")) builder.settingsPort(settings.get("port").asInt());
        if (settings.has("https-enabled"))
            builder.settingsHttpsEnabled(settings.get("https-enabled").asBoolean());
        if (settings.has("auth-enabled"))
            builder.settingsAuthEnabled(settings.get("auth-enabled").asBoolean());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
        if (logging.has("app-level")) builder.loggingAppLevel(logging.get("app-level").asText());
        if (logging.has("http-level")) builder.loggingHttpLevel(logging.get("http-level").asText());

        // --- Environment variable overlay ---
        applyEnvOverrides(builder, envLookup);

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static void applyEnvOverrides(ServerConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "SERVER_BIND_HOST", builder::bindHost);
        envString(envLookup, "STORAGE_DATA_DIR", builder::dataDir);
        envString(envLookup, "IDENTITY_COMMON_NAME", builder::identityCommonName);
        envString(envLookup, "TUNNEL_SELF_PACKAGE", builder::selfPackage);
        envString(envLookup, "TUNNEL_SESSION_NAME", builder::sessionName);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envString(envLookup, "LOG_APP_LEVEL", builder::loggingAppLevel);
        envString(envLookup, "LOG_HTTP_LEVEL", builder::loggingHttpLevel);

        envInt(envLookup, "IDENTITY_VALIDITY_DAYS", builder::identityValidityDays);
        envInt(envLookup, "TUNNEL_CONNECT_TIMEOUT_MS", builder::connectTimeoutMs);
        envInt(envLookup, "TUNNEL_DISCONNECT_TIMEOUT_MS", builder::disconnectTimeoutMs);

        envBool(envLookup, "TUNNEL_BLOCK_QUIC", builder::blockQuic);

        envList(envLookup, "IDENTITY_SAN_IPS", builder::identitySanIps);
        envList(envLookup, "TUNNEL_ALLOWED_APPS", builder::allowedApps);

        envBool(envLookup, "SETTINGS_AUTO_START", builder::settingsAutoStart);
        envInt(envLookup, "SETTINGS_PORT", builder::settingsPort);
        envBool(envLookup, "SETTINGS_HTTPS_ENABLED", builder::settingsHttpsEnabled);
        envBool(envLookup, "SETTINGS_AUTH_ENABLED", builder::settingsAuthEnabled);
    }

    // --- Env var helpers ---

    /**
     * Returns {@code true} if the env var is "set": defined AND non-blank after trimming.
     */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException("Environment variable " + envVar + " is not an integer: " + value, e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    /** Comma-separated list; blank items are dropped. */
    private static void envList(Function<String, String> envLookup, String envVar, Consumer<List<String>> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Arrays.stream(envLookup.apply(envVar).split(","))
                    .map(String::trim)
                    .filter(item -> !item.isEmpty())
                    .toList());
        }
    }

    // --- YAML helpers ---

    /** A YAML sequence of scalars, or a single comma-separated scalar. */
    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> values.add(item.asText().trim()));
        } else if (!node.isNull()) {
            for (String item : node.asText().split(",")) {
                values.add(item.trim());
            }
        }
        values.removeIf(String::isEmpty);
        return values;
    }
}
