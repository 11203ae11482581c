package io.tunnelcontrol.core.control;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Outcome of a command: {@code {"success": bool, "message": string}}. Failures are values, not
 * exceptions, so conflicts and timeouts travel the same path as successes.
 */
public record ApiResponse(boolean success, String message) {

    public static ApiResponse success(String message) {
        return new ApiResponse(true, message);
    }

    public static ApiResponse failure(String message) {
        return new ApiResponse(false, message);
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("success", success);
        node.put("message", message);
        return node;
    }
}
