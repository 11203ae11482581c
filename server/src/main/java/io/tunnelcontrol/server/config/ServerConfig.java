package io.tunnelcontrol.server.config;

import io.tunnelcontrol.core.identity.CertificateProfile;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Process-level configuration of the standalone control server.
 *
 * <p>
 * Distinct from {@link io.tunnelcontrol.core.settings.ServerRuntimeSettings}, which is persisted
 * and changed at runtime. The optional {@code settings*} values here are seeds: when set they are
 * written into the runtime settings at startup.
 *
 * <p>
 * Use {@link #builder()} to construct instances with defaults.
 *
 * @param bindHost              interface the gateway binds to
 * @param dataDir               directory holding the settings and secrets stores; blank keeps
 *                              everything in memory
 * @param identityCommonName    CN of the generated certificate
 * @param identityValidityDays  lifetime of the generated certificate
 * @param identitySanIps        IPv4 literals added to the certificate's SAN
 * @param connectTimeoutMs      bound on an API connect
 * @param disconnectTimeoutMs   bound on an API disconnect
 * @param allowedApps           application allow-list applied to every connect
 * @param blockQuic             QUIC blocking applied to every connect
 * @param selfPackage           identifier of this application, kept off the tunnel
 * @param sessionName           label of the tunnel session
 * @param loggingFormat         json or text
 * @param loggingLevel          root log level
 * @param loggingAppLevel       level of the {@code io.tunnelcontrol} loggers, or {@code null} to
 *                              follow the root level
 * @param loggingHttpLevel      level of the embedded HTTP server (Jetty and Javalin)
 * @param settingsAutoStart     seed for the persisted auto-start flag, or {@code null}
 * @param settingsPort          seed for the persisted port, or {@code null}
 * @param settingsHttpsEnabled  seed for the persisted HTTPS flag, or {@code null}
 * @param settingsAuthEnabled   seed for the persisted auth flag, or {@code null}
 */
public record ServerConfig(
        String bindHost,
        String dataDir,
        String identityCommonName,
        int identityValidityDays,
        List<String> identitySanIps,
        int connectTimeoutMs,
        int disconnectTimeoutMs,
        List<String> allowedApps,
        boolean blockQuic,
        String selfPackage,
        String sessionName,
        String loggingFormat,
        String loggingLevel,
        String loggingAppLevel,
        String loggingHttpLevel,
        Boolean settingsAutoStart,
        Integer settingsPort,
        Boolean settingsHttpsEnabled,
        Boolean settingsAuthEnabled) {

    static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    public ServerConfig {
        identitySanIps = List.copyOf(identitySanIps);
        allowedApps = List.copyOf(allowedApps);
    }

    /** Creates a new builder with sensible defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Certificate profile built from the identity settings. */
    public CertificateProfile certificateProfile() {
        return new CertificateProfile(
                identityCommonName, identityValidityDays, CertificateProfile.DEFAULT_DNS_NAMES, identitySanIps);
    }

    /** Effective level of this application's own loggers. */
    public String effectiveAppLevel() {
        return loggingAppLevel != null ? loggingAppLevel : loggingLevel;
    }

    /** {@code true} when stores live on disk. */
    public boolean persistent() {
        return dataDir != null && !dataDir.isBlank();
    }

    /** Builder for {@link ServerConfig}. Every field has a default. */
    public static final class Builder {
        private String bindHost = "0.0.0.0";
        private String dataDir = "./tunnel-control-data";
        private String identityCommonName = CertificateProfile.DEFAULT_COMMON_NAME;
        private int identityValidityDays = CertificateProfile.DEFAULT_VALIDITY_DAYS;
        private List<String> identitySanIps = CertificateProfile.DEFAULT_IP_ADDRESSES;
        private int connectTimeoutMs = 30_000;
        private int disconnectTimeoutMs = 10_000;
        private List<String> allowedApps = List.of();
        private boolean blockQuic = false;
        private String selfPackage = "io.tunnelcontrol";
        private String sessionName = "Tunnel Control";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";
        private String loggingAppLevel;
        private String loggingHttpLevel = "WARN";
        private Boolean settingsAutoStart;
        private Integer settingsPort;
        private Boolean settingsHttpsEnabled;
        private Boolean settingsAuthEnabled;

        Builder() {}

        public Builder bindHost(String bindHost) {
            this.bindHost = bindHost;
            return this;
        }

        public Builder dataDir(String dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder identityCommonName(String identityCommonName) {
            this.identityCommonName = identityCommonName;
            return this;
        }

        public Builder identityValidityDays(int identityValidityDays) {
            this.identityValidityDays = identityValidityDays;
            return this;
        }

        public Builder identitySanIps(List<String> identitySanIps) {
            this.identitySanIps = identitySanIps;
            return this;
        }

        public Builder connectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder disconnectTimeoutMs(int disconnectTimeoutMs) {
            this.disconnectTimeoutMs = disconnectTimeoutMs;
            return this;
        }

        public Builder allowedApps(List<String> allowedApps) {
            this.allowedApps = allowedApps;
            return this;
        }

        public Builder blockQuic(boolean blockQuic) {
            this.blockQuic = blockQuic;
            return this;
        }

        public Builder selfPackage(String selfPackage) {
            this.selfPackage = selfPackage;
            return this;
        }

        public Builder sessionName(String sessionName) {
            this.sessionName = sessionName;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder loggingAppLevel(String loggingAppLevel) {
            this.loggingAppLevel = loggingAppLevel;
            return this;
        }

        public Builder loggingHttpLevel(String loggingHttpLevel) {
            this.loggingHttpLevel = loggingHttpLevel;
            return this;
        }

        public Builder settingsAutoStart(Boolean settingsAutoStart) {
            this.settingsAutoStart = settingsAutoStart;
            return this;
        }

        public Builder settingsPort(Integer settingsPort) {
            this.settingsPort = settingsPort;
            return this;
        }

        public Builder settingsHttpsEnabled(Boolean settingsHttpsEnabled) {
            this.settingsHttpsEnabled = settingsHttpsEnabled;
            return this;
        }

        public Builder settingsAuthEnabled(Boolean settingsAuthEnabled) {
            this.settingsAuthEnabled = settingsAuthEnabled;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws IllegalArgumentException if a value is out of range
         */
        public ServerConfig build() {
            if (connectTimeoutMs <= 0) {
                throw new IllegalArgumentException("tunnel.connect-timeout-ms must be positive, got " + connectTimeoutMs);
            }
            if (disconnectTimeoutMs <= 0) {
                throw new IllegalArgumentException(
                        "tunnel.disconnect-timeout-ms must be positive, got " + disconnectTimeoutMs);
            }
            if (settingsPort != null && (settingsPort < 1 || settingsPort > 65535)) {
                throw new IllegalArgumentException("settings.port must be 1-65535, got " + settingsPort);
            }
            // Validates the identity values (CN, validity, SAN literals).
            new CertificateProfile(identityCommonName, identityValidityDays, List.of(), identitySanIps);
            if (!"json".equalsIgnoreCase(loggingFormat) && !"text".equalsIgnoreCase(loggingFormat)) {
                throw new IllegalArgumentException("logging.format must be 'json' or 'text', got " + loggingFormat);
            }
            requireLevel("logging.level", loggingLevel);
            if (loggingAppLevel != null) {
                requireLevel("logging.app-level", loggingAppLevel);
            }
            requireLevel("logging.http-level", loggingHttpLevel);
            return new ServerConfig(
                    bindHost,
                    dataDir,
                    identityCommonName,
                    identityValidityDays,
                    identitySanIps,
                    connectTimeoutMs,
                    disconnectTimeoutMs,
                    allowedApps,
                    blockQuic,
                    selfPackage,
                    sessionName,
                    loggingFormat,
                    loggingLevel,
                    loggingAppLevel,
                    loggingHttpLevel,
                    settingsAutoStart,
                    settingsPort,
                    settingsHttpsEnabled,
                    settingsAuthEnabled);
        }

        private static void requireLevel(String key, String value) {
            if (value == null || !LOG_LEVELS.contains(value.trim().toUpperCase(Locale.ROOT))) {
                throw new IllegalArgumentException(key + " must be one of " + LOG_LEVELS + ", got " + value);
            }
        }
    }
}
