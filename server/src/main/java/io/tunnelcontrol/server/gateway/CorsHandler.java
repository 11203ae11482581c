package io.tunnelcontrol.server.gateway;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.javalin.http.HandlerType;

/**
 * Before-handler that allows any origin. Every response carries
 * {@code Access-Control-Allow-Origin: *}, auth rejections included; an {@code OPTIONS} preflight
 * is answered here with 200 and never reaches authentication or routing.
 */
public final class CorsHandler implements Handler {

    static final String ALLOW_ORIGIN = "*";
    static final String ALLOW_METHODS = "GET, POST, OPTIONS";
    static final String ALLOW_HEADERS = "Content-Type, Authorization";
    static final String MAX_AGE_SECONDS = "86400";

    @Override
    public void handle(Context ctx) {
        ctx.header("Access-Control-Allow-Origin", ALLOW_ORIGIN);
        if (ctx.method() != HandlerType.OPTIONS) {
            return;
        }
        ctx.header("Access-Control-Allow-Methods", ALLOW_METHODS);
        ctx.header("Access-Control-Allow-Headers", ALLOW_HEADERS);
        ctx.header("Access-Control-Max-Age", MAX_AGE_SECONDS);
        ctx.status(200);
        ctx.result("");
        ctx.skipRemainingHandlers();
    }
}
