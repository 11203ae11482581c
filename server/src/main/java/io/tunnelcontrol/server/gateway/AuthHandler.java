package io.tunnelcontrol.server.gateway;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.javalin.http.HandlerType;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Before-handler enforcing {@code Authorization: Bearer <token>}.
 *
 * <p>
 * Public routes ({@code /}, {@code /health}, {@code /swagger}) and CORS preflights pass through. A
 * missing header or another scheme gets 401; a wrong token gets 403. The token comparison takes
 * the same time whatever the mismatch position.
 */
public final class AuthHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(AuthHandler.class);

    static final String BEARER_PREFIX = "Bearer ";

    private final byte[] expectedToken;

    public AuthHandler(String expectedToken) {
        if (expectedToken == null || expectedToken.isEmpty()) {
            throw new IllegalArgumentException("Authentication requires a token");
        }
        this.expectedToken = expectedToken.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void handle(Context ctx) {
        if (ctx.method() == HandlerType.OPTIONS || ApiRoute.isPublic(normalize(ctx.path()))) {
            return;
        }

        String header = ctx.header("Authorization");
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            LOG.debug("Rejected {} {}: no bearer credential", ctx.method(), ctx.path());
            ctx.status(401);
            ctx.header("WWW-Authenticate", "Bearer");
            ctx.result(ErrorResponses.unauthorized().toString());
            ctx.skipRemainingHandlers();
            return;
        }

        byte[] presented = header.substring(BEARER_PREFIX.length()).getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(presented, expectedToken)) {
            LOG.warn("Rejected {} {} from {}: invalid token", ctx.method(), ctx.path(), ctx.ip());
            ctx.status(403);
            ctx.result(ErrorResponses.forbidden().toString());
            ctx.skipRemainingHandlers();
        }
    }

    /** Trailing slashes are ignored by routing, so they are ignored here too. */
    private static String normalize(String path) {
        String normalized = path;
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
