package io.tunnelcontrol.server.gateway;

import io.javalin.http.Context;
import io.javalin.http.Handler;

/** Catch-all for unrouted paths and methods: 404 with the JSON error body. */
public final class NotFoundHandler implements Handler {

    @Override
    public void handle(Context ctx) {
        ctx.status(404);
        ctx.contentType("application/json");
        ctx.result(ErrorResponses.notFound(ctx.path()).toString());
    }
}
