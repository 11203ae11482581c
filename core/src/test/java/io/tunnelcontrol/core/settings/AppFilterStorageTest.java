package io.tunnelcontrol.core.settings;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Application filter storage")
class AppFilterStorageTest {

    private static final List<String> CONFIGURED = List.of("com.example.configured");

    private InMemoryKeyValueStore store;
    private AppFilterStorage storage;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        storage = new AppFilterStorage(store);
    }

    @Test
    @DisplayName("Defaults → filter off, no applications, configured list applies")
    void defaults() {
        assertThat(storage.filterEnabled()).isFalse();
        assertThat(storage.selectedApps()).isEmpty();
        assertThat(storage.effectiveApps(CONFIGURED)).isEqualTo(CONFIGURED);
    }

    @Test
    @DisplayName("List is cleaned and stored as a JSON array")
    void savedAsJson() {
        storage.saveSelectedApps(Arrays.asList(" com.example.browser ", "", null, "com.example.mail",
                "com.example.browser"));

        assertThat(storage.selectedApps()).containsExactly("com.example.browser", "com.example.mail");
        assertThat(store.get(AppFilterStorage.KEY_SELECTED_APPS))
                .contains("[\"com.example.browser\",\"com.example.mail\"]");
    }

    @Test
    @DisplayName("Filter on with a list → the stored list wins")
    void enabled() {
        storage.saveSelectedApps(List.of("com.example.browser"));
        storage.setFilterEnabled(true);

        assertThat(storage.effectiveApps(CONFIGURED)).containsExactly("com.example.browser");
    }

    @Test
    @DisplayName("Filter off, or on with an empty list → configured list")
    void fallback() {
        storage.saveSelectedApps(List.of("com.example.browser"));
        assertThat(storage.effectiveApps(CONFIGURED)).isEqualTo(CONFIGURED);

        storage.setFilterEnabled(true);
        storage.saveSelectedApps(List.of());
        assertThat(storage.effectiveApps(CONFIGURED)).isEqualTo(CONFIGURED);
    }

    @Test
    @DisplayName("Unreadable stored list → treated as empty")
    void unreadable() {
        store.put(AppFilterStorage.KEY_SELECTED_APPS, "not json");

        assertThat(storage.selectedApps()).isEmpty();
    }

    @Test
    @DisplayName("clear() resets both keys")
    void clear() {
        storage.saveSelectedApps(List.of("com.example.browser"));
        storage.setFilterEnabled(true);

        storage.clear();

        assertThat(storage.filterEnabled()).isFalse();
        assertThat(storage.selectedApps()).isEmpty();
    }
}
