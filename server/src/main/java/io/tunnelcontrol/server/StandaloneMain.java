package io.tunnelcontrol.server;

import io.tunnelcontrol.server.gateway.TunnelControlApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone control server.
 *
 * <p>
 * Delegates to {@link TunnelControlApp#start(String[])} for the full startup sequence and stops it
 * from a shutdown hook. On failure, logs the error and exits with a non-zero status code.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/config.yaml --start})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            TunnelControlApp app = TunnelControlApp.start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "tunnel-control-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
