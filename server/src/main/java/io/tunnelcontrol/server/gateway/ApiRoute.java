package io.tunnelcontrol.server.gateway;

import io.javalin.http.HandlerType;
import java.util.List;

/**
 * One entry of the control API route table.
 *
 * @param method       HTTP method
 * @param path         exact path
 * @param description  one-line summary, logged at startup and used as the OpenAPI summary
 * @param requiresAuth whether the bearer check applies when auth is on
 */
public record ApiRoute(HandlerType method, String path, String description, boolean requiresAuth) {

    /** The complete route table; anything else is a 404. */
    public static final List<ApiRoute> ALL = List.of(
            new ApiRoute(HandlerType.GET, "/", "Health check endpoint", false),
            new ApiRoute(HandlerType.GET, "/health", "Health check endpoint", false),
            new ApiRoute(HandlerType.POST, "/connect", "Connect the tunnel through the given proxy host", true),
            new ApiRoute(HandlerType.POST, "/disconnect", "Disconnect the tunnel", true),
            new ApiRoute(HandlerType.GET, "/status", "Current tunnel status", true),
            new ApiRoute(HandlerType.GET, "/swagger", "Swagger UI API documentation", false));

    /** Whether {@code path} is served without authentication, whatever the method. */
    public static boolean isPublic(String path) {
        for (ApiRoute route : ALL) {
            if (!route.requiresAuth() && route.path().equals(path)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return method + " " + path + (requiresAuth ? "" : " (public)");
    }
}
