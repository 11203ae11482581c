package io.tunnelcontrol.server.gateway;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tunnelcontrol.core.control.ApiResponse;

/**
 * Builds the JSON error bodies of the control API. All share the command response shape
 * {@code {"success": false, "message": "..."}} so clients parse one format; nothing internal
 * (exception classes, stack traces) ever lands in a body.
 */
public final class ErrorResponses {

    static final String MISSING_BEARER = "Missing or invalid Authorization header. Expected: Bearer <token>";
    static final String INVALID_TOKEN = "Invalid authentication token";
    static final String INTERNAL_ERROR = "Internal server error";

    private ErrorResponses() {
        // utility class
    }

    /** 400: the message is client-safe by construction. */
    public static ObjectNode badRequest(String message) {
        return ApiResponse.failure(message).toJson();
    }

    /**
     * 401: no {@code Authorization} header, or not a Bearer credential. Auth errors also carry the
     * text under {@code error}, the key older clients read.
     */
    public static ObjectNode unauthorized() {
        return ApiResponse.failure(MISSING_BEARER).toJson().put("error", MISSING_BEARER);
    }

    /** 403: a Bearer credential that does not match. */
    public static ObjectNode forbidden() {
        return ApiResponse.failure(INVALID_TOKEN).toJson().put("error", INVALID_TOKEN);
    }

    /** 404 for any unrouted path. */
    public static ObjectNode notFound(String path) {
        return ApiResponse.failure("Not found: " + path).toJson();
    }

    /** 500 without details. */
    public static ObjectNode internalError() {
        return ApiResponse.failure(INTERNAL_ERROR).toJson();
    }
}
