package io.tunnelcontrol.server.gateway;

import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * Liveness handler for {@code GET /} and {@code GET /health}. Never subject to authentication.
 *
 * <p>
 * Returns a fixed {@code 200 OK} with {@code {"status": "ok", "service": "tunnel-control"}}.
 */
public final class HealthHandler implements Handler {

    public static final String SERVICE_NAME = "tunnel-control";

    private static final String HEALTH_RESPONSE = "{\"status\":\"ok\",\"service\":\"" + SERVICE_NAME + "\"}";

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(HEALTH_RESPONSE);
    }
}
