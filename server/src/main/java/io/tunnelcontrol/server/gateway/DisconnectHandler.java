package io.tunnelcontrol.server.gateway;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.tunnelcontrol.core.control.ApiResponse;
import io.tunnelcontrol.core.control.ConnectionOrchestrator;

/**
 * {@code POST /disconnect}: no body. Always 200; a rejected or failed disconnect is reported in the
 * body's {@code success} flag.
 */
public final class DisconnectHandler implements Handler {

    private final ConnectionOrchestrator orchestrator;

    public DisconnectHandler(ConnectionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void handle(Context ctx) {
        ApiResponse response = orchestrator.disconnect();
        ctx.status(200);
        ctx.result(response.toJson().toString());
    }
}
