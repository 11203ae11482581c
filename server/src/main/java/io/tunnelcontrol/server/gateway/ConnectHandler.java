package io.tunnelcontrol.server.gateway;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.tunnelcontrol.core.control.ApiResponse;
import io.tunnelcontrol.core.control.ConnectRequest;
import io.tunnelcontrol.core.control.ConnectionOrchestrator;
import io.tunnelcontrol.core.error.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code POST /connect}: validates the body, then blocks on the orchestrator until the tunnel is
 * connected, failed or the connect timeout passes. Success maps to 200, any failure to 400.
 */
public final class ConnectHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectHandler.class);

    private final ConnectionOrchestrator orchestrator;

    public ConnectHandler(ConnectionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void handle(Context ctx) {
        ConnectRequest request;
        try {
            request = ConnectRequest.parse(ctx.body());
        } catch (InvalidRequestException e) {
            LOG.debug("Rejected connect request: {}", e.getMessage());
            ctx.status(400);
            ctx.result(ErrorResponses.badRequest(e.getMessage()).toString());
            return;
        }

        ApiResponse response = orchestrator.connect(request);
        ctx.status(response.success() ? 200 : 400);
        ctx.result(response.toJson().toString());
    }
}
