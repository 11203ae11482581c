package io.tunnelcontrol.server.gateway;

import io.tunnelcontrol.core.control.ConnectionOrchestrator;
import io.tunnelcontrol.core.control.TunnelOptions;
import io.tunnelcontrol.core.discovery.ProxyCertificateFetcher;
import io.tunnelcontrol.core.identity.CertificateGenerator;
import io.tunnelcontrol.core.identity.TlsIdentityManager;
import io.tunnelcontrol.core.settings.AppFilterStorage;
import io.tunnelcontrol.core.settings.ConnectionStorage;
import io.tunnelcontrol.core.settings.InMemoryKeyValueStore;
import io.tunnelcontrol.core.settings.KeyValueStore;
import io.tunnelcontrol.core.settings.ServerRuntimeSettings;
import io.tunnelcontrol.core.settings.SettingsService;
import io.tunnelcontrol.core.tunnel.StateFeed;
import io.tunnelcontrol.core.tunnel.TunnelSessionController;
import io.tunnelcontrol.server.config.ConfigLoader;
import io.tunnelcontrol.server.config.ServerConfig;
import io.tunnelcontrol.server.platform.DryRunPlatform;
import io.tunnelcontrol.server.platform.DryRunRelay;
import io.tunnelcontrol.server.store.JsonFileKeyValueStore;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the standalone startup sequence.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure Logback from {@code logging.*}</li>
 * <li>Open the settings and secrets stores</li>
 * <li>Apply configured settings seeds</li>
 * <li>Wire identity manager, connection and app filter storage, session controller and
 * orchestrator</li>
 * <li>Start the control API if auto-start is on or {@code --start} was passed</li>
 * </ol>
 *
 * <p>
 * Separate from {@link io.tunnelcontrol.server.StandaloneMain} so integration tests can start the
 * whole application without {@code main()}.
 */
public final class TunnelControlApp {

    private static final Logger LOG = LoggerFactory.getLogger(TunnelControlApp.class);

    static final String SETTINGS_FILE = "settings.json";
    static final String SECRETS_FILE = "secrets.json";
    static final String START_FLAG = "--start";

    private final ServerConfig config;
    private final SettingsService settings;
    private final ConnectionStorage connections;
    private final AppFilterStorage appFilter;
    private final ProxyCertificateFetcher proxyCertificates;
    private final TlsIdentityManager identity;
    private final TunnelSessionController controller;
    private final ConnectionOrchestrator orchestrator;
    private final ControlGateway gateway;

    private TunnelControlApp(
            ServerConfig config,
            SettingsService settings,
            ConnectionStorage connections,
            AppFilterStorage appFilter,
            ProxyCertificateFetcher proxyCertificates,
            TlsIdentityManager identity,
            TunnelSessionController controller,
            ConnectionOrchestrator orchestrator,
            ControlGateway gateway) {
        this.config = config;
        this.settings = settings;
        this.connections = connections;
        this.appFilter = appFilter;
        this.proxyCertificates = proxyCertificates;
        this.identity = identity;
        this.controller = controller;
        this.orchestrator = orchestrator;
        this.gateway = gateway;
    }

    /**
     * Executes the startup sequence.
     *
     * @param args command-line arguments ({@code --config <path>}, {@code --start})
     * @return the application, serving if auto-start applied
     * @throws io.tunnelcontrol.server.config.ConfigLoadException if the configuration is invalid
     */
    public static TunnelControlApp start(String[] args) {
        long startTime = System.nanoTime();

        ServerConfig config = ConfigLoader.load(args);
        LogbackConfigurator.configure(config);
        Path explicit = ConfigLoader.explicitConfigPath(args);
        LOG.info("Configuration loaded from {}", explicit != null ? explicit : "defaults and environment");

        KeyValueStore store;
        KeyValueStore secrets;
        if (config.persistent()) {
            Path dataDir = Path.of(config.dataDir());
            store = JsonFileKeyValueStore.open(dataDir.resolve(SETTINGS_FILE));
            secrets = JsonFileKeyValueStore.confidential(dataDir.resolve(SECRETS_FILE));
            LOG.info("State stored under {}", dataDir.toAbsolutePath());
        } else {
            store = new InMemoryKeyValueStore();
            secrets = new InMemoryKeyValueStore();
            LOG.warn("No data directory configured, settings and TLS identity are kept in memory only");
        }

        SettingsService settings = new SettingsService(store, secrets);
        applySeeds(config, settings);
        ConnectionStorage connections = new ConnectionStorage(store, secrets);
        AppFilterStorage appFilter = new AppFilterStorage(store);
        ProxyCertificateFetcher proxyCertificates = new ProxyCertificateFetcher(store);
        connections.load().ifPresent(last -> LOG.info("Last connection: {}:{}", last.hostname(), last.port()));

        TlsIdentityManager identity =
                new TlsIdentityManager(secrets, new CertificateGenerator(), config.certificateProfile());
        TunnelSessionController controller = new TunnelSessionController(
                new DryRunPlatform(), new DryRunRelay(), new StateFeed(), config.sessionName(), config.selfPackage());
        ConnectionOrchestrator orchestrator = new ConnectionOrchestrator(
                controller,
                () -> new TunnelOptions(appFilter.effectiveApps(config.allowedApps()), config.blockQuic()),
                connections,
                Duration.ofMillis(config.connectTimeoutMs()),
                Duration.ofMillis(config.disconnectTimeoutMs()));
        ControlGateway gateway = new ControlGateway(config.bindHost(), orchestrator, identity);

        TunnelControlApp app = new TunnelControlApp(
                config, settings, connections, appFilter, proxyCertificates, identity, controller, orchestrator, gateway);

        ServerRuntimeSettings runtime = settings.load();
        if (runtime.autoStart() || Arrays.asList(args).contains(START_FLAG)) {
            try {
                gateway.start(runtime);
            } catch (RuntimeException e) {
                orchestrator.close();
                controller.close();
                throw e;
            }
        } else {
            LOG.info("Auto-start disabled; control API not started");
        }

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "tunnel-control started: api={}, https={}, auth={}, allowedApps={}, blockQuic={}, startupMs={}",
                gateway.isRunning() ? gateway.address() : "stopped",
                runtime.httpsEnabled(),
                runtime.authEnabled(),
                describeApps(appFilter.effectiveApps(config.allowedApps())),
                config.blockQuic(),
                elapsedMs);
        if (runtime.authEnabled() && config.persistent()) {
            LOG.info("Bearer token is stored in {}", Path.of(config.dataDir()).resolve(SECRETS_FILE));
        }
        return app;
    }

    /** Writes the configured seeds into the persisted settings; HTTPS goes first since auth depends on it. */
    static void applySeeds(ServerConfig config, SettingsService settings) {
        if (config.settingsAutoStart() != null) {
            settings.setAutoStart(config.settingsAutoStart());
        }
        if (config.settingsPort() != null) {
            settings.setPort(config.settingsPort());
        }
        if (config.settingsHttpsEnabled() != null) {
            settings.setHttpsEnabled(config.settingsHttpsEnabled());
        }
        if (config.settingsAuthEnabled() != null) {
            settings.setAuthEnabled(config.settingsAuthEnabled());
        }
    }

    private static Object describeApps(List<String> apps) {
        return apps.isEmpty() ? "all" : apps;
    }

    public ServerConfig config() {
        return config;
    }

    public SettingsService settings() {
        return settings;
    }

    /** Last successfully connected proxy, offered again on the next session. */
    public ConnectionStorage connections() {
        return connections;
    }

    /** Persisted per-application filter; read on every connect. */
    public AppFilterStorage appFilter() {
        return appFilter;
    }

    /** CA certificates published by announced proxies. */
    public ProxyCertificateFetcher proxyCertificates() {
        return proxyCertificates;
    }

    public TlsIdentityManager identity() {
        return identity;
    }

    public TunnelSessionController controller() {
        return controller;
    }

    public ConnectionOrchestrator orchestrator() {
        return orchestrator;
    }

    public ControlGateway gateway() {
        return gateway;
    }

    /** Stops the control API, then tears down any live tunnel session. */
    public void stop() {
        gateway.stop();
        orchestrator.close();
        controller.close();
        LOG.info("tunnel-control stopped");
    }
}
