package io.tunnelcontrol.server.gateway;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.tunnelcontrol.core.control.ConnectionOrchestrator;

/** {@code GET /status}: {@code {"connected", "state", "host"?, "port"?}}. Never blocks. */
public final class StatusHandler implements Handler {

    private final ConnectionOrchestrator orchestrator;

    public StatusHandler(ConnectionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.result(orchestrator.status().toJson().toString());
    }
}
