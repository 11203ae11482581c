package io.tunnelcontrol.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import io.tunnelcontrol.core.error.StorageException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("JSON file key-value store")
class JsonFileKeyValueStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Absent file → empty store, nothing written until the first put")
    void lazyCreate() {
        Path file = tempDir.resolve("data/settings.json");
        JsonFileKeyValueStore store = JsonFileKeyValueStore.open(file);

        assertThat(store.get("web_server_port")).isEmpty();
        assertThat(file).doesNotExist();

        store.put("web_server_port", "9000");

        assertThat(file).exists();
    }

    @Test
    @DisplayName("Values survive reopening")
    void reopen() {
        Path file = tempDir.resolve("settings.json");
        JsonFileKeyValueStore first = JsonFileKeyValueStore.open(file);
        first.put("a", "1");
        first.put("b", "2");
        first.remove("a");

        JsonFileKeyValueStore second = JsonFileKeyValueStore.open(file);

        assertThat(second.get("a")).isEmpty();
        assertThat(second.get("b")).contains("2");
    }

    @Test
    @DisplayName("putAll → every entry persisted together; null values remove")
    void batch() {
        Path file = tempDir.resolve("secrets.json");
        JsonFileKeyValueStore store = JsonFileKeyValueStore.confidential(file);
        store.put("stale", "x");
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("web_server_private_key", "KEY");
        entries.put("web_server_certificate", "CERT");
        entries.put("stale", null);

        store.putAll(entries);

        JsonFileKeyValueStore reopened = JsonFileKeyValueStore.open(file);
        assertThat(reopened.get("web_server_private_key")).contains("KEY");
        assertThat(reopened.get("web_server_certificate")).contains("CERT");
        assertThat(reopened.get("stale")).isEmpty();
    }

    @Test
    @DisplayName("put(key, null) → removes the key")
    void putNull() {
        JsonFileKeyValueStore store = JsonFileKeyValueStore.open(tempDir.resolve("settings.json"));
        store.put("a", "1");

        store.put("a", null);

        assertThat(store.get("a")).isEmpty();
    }

    @Test
    @DisplayName("File content is a flat JSON object")
    void format() throws Exception {
        Path file = tempDir.resolve("settings.json");
        JsonFileKeyValueStore.open(file).put("web_server_auto_start", "false");

        assertThat(Files.readString(file)).contains("\"web_server_auto_start\"").contains("\"false\"");
        try (var listing = Files.list(tempDir)) {
            assertThat(listing).extracting(path -> path.getFileName().toString()).containsExactly("settings.json");
        }
    }

    @Test
    @DisplayName("Confidential store → owner-only permissions")
    void confidential() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path file = tempDir.resolve("secrets.json");

        JsonFileKeyValueStore.confidential(file).put("web_server_auth_token", "abc");

        assertThat(Files.getPosixFilePermissions(file)).isEqualTo(JsonFileKeyValueStore.OWNER_ONLY);
    }

    @Test
    @DisplayName("Corrupt file → StorageException on open")
    void corrupt() throws Exception {
        Path file = tempDir.resolve("settings.json");
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> JsonFileKeyValueStore.open(file))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("Failed to read key-value store");
    }
}
