package io.tunnelcontrol.core.control;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tunnelcontrol.core.error.InvalidRequestException;
import io.tunnelcontrol.core.tunnel.TunnelConfiguration;

/**
 * Body of {@code POST /connect}.
 *
 * <p>
 * {@code host} must be a JSON string with at least one non-whitespace character and {@code port} a JSON integer in 1-65535;
 * {@code "8080"} and {@code 8080.0} are rejected. {@code username} and {@code password} are
 * optional strings.
 */
public record ConnectRequest(String host, int port, String username, String password) {

    static final String BODY_REQUIRED = "Request body is required";
    static final String INVALID_PREFIX = "Invalid request: ";
    static final String INVALID_HOST = "Missing or invalid \"host\" field";
    static final String INVALID_PORT = "Missing or invalid \"port\" field (must be 1-65535)";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Parses and validates a raw request body.
     *
     * @throws InvalidRequestException with a client-safe message
     */
    public static ConnectRequest parse(String body) {
        if (body == null || body.isBlank()) {
            throw new InvalidRequestException(BODY_REQUIRED);
        }
        JsonNode json;
        try {
            json = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException(INVALID_PREFIX + e.getOriginalMessage());
        }
        return fromJson(json);
    }

    /**
     * Validates an already parsed body.
     *
     * @throws InvalidRequestException naming the first offending field
     */
    public static ConnectRequest fromJson(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new InvalidRequestException(INVALID_PREFIX + "expected a JSON object");
        }
        JsonNode host = json.get("host");
        if (host == null || !host.isTextual() || host.asText().isBlank()) {
            throw new InvalidRequestException(INVALID_PREFIX + INVALID_HOST, "host");
        }
        JsonNode port = json.get("port");
        if (port == null || !port.isIntegralNumber() || !port.canConvertToInt()) {
            throw new InvalidRequestException(INVALID_PREFIX + INVALID_PORT, "port");
        }
        int portValue = port.intValue();
        if (portValue < 1 || portValue > 65535) {
            throw new InvalidRequestException(INVALID_PREFIX + INVALID_PORT, "port");
        }
        return new ConnectRequest(
                host.asText(), portValue, optionalText(json, "username"), optionalText(json, "password"));
    }

    /** Both username and password present and non-empty. */
    public boolean hasAuthentication() {
        return username != null && !username.isEmpty() && password != null && !password.isEmpty();
    }

    /** Same proxy endpoint as {@code target}, compared exactly. */
    public boolean targets(RemoteTarget target) {
        return target != null && target.host().equals(host) && target.port() == port;
    }

    public TunnelConfiguration toConfiguration(TunnelOptions options) {
        return new TunnelConfiguration(host, port, username, password, options.allowedApps(), options.blockQuic());
    }

    private static String optionalText(JsonNode json, String field) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new InvalidRequestException(INVALID_PREFIX + "\"" + field + "\" must be a string", field);
        }
        return value.asText();
    }

    @Override
    public String toString() {
        return "ConnectRequest[host=" + host + ", port=" + port + ", auth=" + hasAuthentication() + "]";
    }
}
