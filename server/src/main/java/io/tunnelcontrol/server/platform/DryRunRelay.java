package io.tunnelcontrol.server.platform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tunnelcontrol.core.tunnel.InterfaceHandle;
import io.tunnelcontrol.core.tunnel.RelayEngine;
import io.tunnelcontrol.core.tunnel.RelaySettings;
import io.tunnelcontrol.core.tunnel.RelayStats;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link RelayEngine} that moves no packets. It logs the engine configuration it was given. */
public final class DryRunRelay implements RelayEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DryRunRelay.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private volatile boolean running;
    private volatile String lastConfiguration;

    @Override
    public boolean start(InterfaceHandle handle, RelaySettings settings) {
        lastConfiguration = render(settings);
        running = true;
        LOG.info("[dry-run] Relay started on {}: {}", handle.name(), lastConfiguration);
        return true;
    }

    @Override
    public void stop() {
        if (running) {
            running = false;
            LOG.info("[dry-run] Relay stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public Optional<RelayStats> stats() {
        return running ? Optional.of(RelayStats.EMPTY) : Optional.empty();
    }

    /** JSON configuration from the most recent start, or {@code null}. */
    public String lastConfiguration() {
        return lastConfiguration;
    }

    private static String render(RelaySettings settings) {
        try {
            return MAPPER.writeValueAsString(settings.describe());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Relay configuration is not serializable", e);
        }
    }
}
