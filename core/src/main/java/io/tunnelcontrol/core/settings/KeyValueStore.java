package io.tunnelcontrol.core.settings;

import java.util.Map;
import java.util.Optional;

/**
 * Durable string key-value storage. Two instances back the control plane: a plain one for
 * ordinary settings and a confidential one for the auth token and the TLS private key.
 *
 * <p>
 * Implementations MUST be thread-safe. A write is visible to subsequent reads on any thread.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void put(String key, String value);

    /**
     * Writes several entries as one update. Durable implementations persist them together, so a
     * crash cannot leave only some of them written.
     */
    default void putAll(Map<String, String> entries) {
        entries.forEach(this::put);
    }

    /** Removes the key; a no-op when it is absent. */
    void remove(String key);
}
