package io.tunnelcontrol.core.discovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns resolved service announcements into {@link ProxyHost} records.
 *
 * <p>
 * Proxies announce themselves with a JSON TXT payload:
 *
 * <pre>
 * {"host": "192.168.1.100", "port": 9852, "hostName": "DESKTOP-HOME", "osName": "Windows 11",
 *  "fluxzyVersion": "1.0.0", "fluxzyStartupSetting": "...", "certEndpoint": "/cert"}
 * </pre>
 */
public final class HostRecords {

    private static final Logger LOG = LoggerFactory.getLogger(HostRecords.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Set<String> PAYLOAD_KEYS = Set.of("", "data", "json", "txt");

    private HostRecords() {
        // utility class
    }

    /**
     * Builds a record from the TXT payload. A missing, malformed or incomplete payload falls back to
     * the resolved address with the service name as the friendly name.
     */
    public static ProxyHost fromServiceInfo(String resolvedHost, int resolvedPort, String serviceName, String txt) {
        if (txt != null && !txt.isBlank()) {
            try {
                JsonNode payload = MAPPER.readTree(txt);
                JsonNode host = payload.get("host");
                JsonNode port = payload.get("port");
                if (host != null && host.isTextual() && port != null && port.canConvertToInt()) {
                    return new ProxyHost(
                            host.asText(),
                            port.asInt(),
                            text(payload, "hostName"),
                            text(payload, "osName"),
                            text(payload, "fluxzyVersion"),
                            text(payload, "fluxzyStartupSetting"),
                            text(payload, "certEndpoint"),
                            true);
                }
                LOG.debug("TXT payload of {} lacks host/port, using resolved address", serviceName);
            } catch (JsonProcessingException e) {
                LOG.debug("TXT payload of {} is not JSON: {}", serviceName, e.getOriginalMessage());
            }
        }
        return new ProxyHost(resolvedHost, resolvedPort, serviceName, null, null, null, null, true);
    }

    /**
     * Picks the JSON payload out of TXT attributes: a well-known key ({@code data}, {@code json},
     * {@code txt} or empty), else any value that looks like a JSON object, else all values joined.
     *
     * @return the payload, or {@code null} when there are no attributes
     */
    public static String extractPayload(Map<String, String> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return null;
        }
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            if (PAYLOAD_KEYS.contains(entry.getKey()) && entry.getValue() != null) {
                return entry.getValue();
            }
        }
        for (String value : attributes.values()) {
            if (value != null && value.trim().startsWith("{")) {
                return value;
            }
        }
        StringBuilder joined = new StringBuilder();
        attributes.values().stream().filter(v -> v != null).forEach(joined::append);
        return joined.toString();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
