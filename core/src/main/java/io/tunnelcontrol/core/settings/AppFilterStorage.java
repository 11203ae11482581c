package io.tunnelcontrol.core.settings;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tunnelcontrol.core.error.StorageException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persisted per-application filter: a switch plus the list of application identifiers allowed
 * through the tunnel. The list is stored as a JSON array.
 */
public final class AppFilterStorage {

    private static final Logger LOG = LoggerFactory.getLogger(AppFilterStorage.class);

    static final String KEY_SELECTED_APPS = "selected_apps_whitelist";
    static final String KEY_FILTER_ENABLED = "app_filter_enabled";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final KeyValueStore store;

    public AppFilterStorage(KeyValueStore store) {
        this.store = store;
    }

    public synchronized void saveSelectedApps(List<String> applications) {
        List<String> cleaned = applications.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(app -> !app.isEmpty())
                .distinct()
                .toList();
        try {
            store.put(KEY_SELECTED_APPS, MAPPER.writeValueAsString(cleaned));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to encode the application list", e);
        }
    }

    /** Stored list; empty when nothing was saved or the stored value is unreadable. */
    public synchronized List<String> selectedApps() {
        Optional<String> raw = store.get(KEY_SELECTED_APPS);
        if (raw.isEmpty()) {
            return List.of();
        }
        try {
            return List.copyOf(MAPPER.readValue(raw.get(), STRING_LIST));
        } catch (JsonProcessingException e) {
            LOG.warn("Ignoring unreadable stored application list: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    public synchronized void setFilterEnabled(boolean enabled) {
        store.put(KEY_FILTER_ENABLED, Boolean.toString(enabled));
    }

    public synchronized boolean filterEnabled() {
        return store.get(KEY_FILTER_ENABLED).map(value -> Boolean.parseBoolean(value.trim())).orElse(false);
    }

    /**
     * Applications a new session should capture: the stored list when the filter is on and the list
     * is non-empty, otherwise {@code fallback}.
     */
    public synchronized List<String> effectiveApps(List<String> fallback) {
        if (filterEnabled()) {
            List<String> selected = selectedApps();
            if (!selected.isEmpty()) {
                return selected;
            }
        }
        return fallback;
    }

    public synchronized void clear() {
        store.remove(KEY_SELECTED_APPS);
        store.remove(KEY_FILTER_ENABLED);
    }
}
