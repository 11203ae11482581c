package io.tunnelcontrol.core.control;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Snapshot served by {@code GET /status}. {@code host} and {@code port} are present only while
 * connected.
 */
public record StatusResponse(boolean connected, String state, String host, Integer port) {

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("connected", connected);
        node.put("state", state);
        if (host != null) {
            node.put("host", host);
        }
        if (port != null) {
            node.put("port", port);
        }
        return node;
    }
}
