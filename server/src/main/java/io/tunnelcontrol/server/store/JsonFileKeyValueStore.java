package io.tunnelcontrol.server.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tunnelcontrol.core.error.StorageException;
import io.tunnelcontrol.core.settings.KeyValueStore;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link KeyValueStore} persisted as one flat JSON object.
 *
 * <p>
 * The whole map is held in memory and rewritten on every change: written to a sibling temp file,
 * then moved over the target, so a crash leaves either the old or the new content. A
 * {@linkplain #confidential(Path) confidential} store restricts the file to its owner where the
 * file system supports POSIX permissions.
 */
public final class JsonFileKeyValueStore implements KeyValueStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileKeyValueStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<TreeMap<String, String>> MAP_TYPE = new TypeReference<>() {};

    static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final Path file;
    private final boolean confidential;
    private final Map<String, String> values;

    private JsonFileKeyValueStore(Path file, boolean confidential) {
        this.file = file;
        this.confidential = confidential;
        this.values = read(file);
    }

    /**
     * Opens (or lazily creates) a plain store at {@code file}.
     *
     * @throws StorageException if the file exists but cannot be read as a JSON object of strings
     */
    public static JsonFileKeyValueStore open(Path file) {
        return new JsonFileKeyValueStore(file, false);
    }

    /** Like {@link #open(Path)}, with owner-only file permissions. */
    public static JsonFileKeyValueStore confidential(Path file) {
        return new JsonFileKeyValueStore(file, true);
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public synchronized void put(String key, String value) {
        if (value == null) {
            remove(key);
            return;
        }
        String previous = values.put(key, value);
        if (!value.equals(previous)) {
            write();
        }
    }

    /** One file write for the whole batch. */
    @Override
    public synchronized void putAll(Map<String, String> entries) {
        boolean changed = false;
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            String previous = entry.getValue() == null
                    ? values.remove(entry.getKey())
                    : values.put(entry.getKey(), entry.getValue());
            changed |= !Objects.equals(previous, entry.getValue());
        }
        if (changed) {
            write();
        }
    }

    @Override
    public synchronized void remove(String key) {
        if (values.remove(key) != null) {
            write();
        }
    }

    public Path file() {
        return file;
    }

    private static Map<String, String> read(Path file) {
        if (!Files.exists(file)) {
            return new TreeMap<>();
        }
        try {
            TreeMap<String, String> loaded = MAPPER.readValue(file.toFile(), MAP_TYPE);
            return loaded != null ? loaded : new TreeMap<>();
        } catch (IOException e) {
            throw new StorageException("Failed to read key-value store " + file, e);
        }
    }

    private void write() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            if (confidential) {
                restrict(temp);
            }
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), values);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debug("Wrote {} entries to {}", values.size(), file);
        } catch (IOException e) {
            throw new StorageException("Failed to write key-value store " + file, e);
        }
    }

    private static void restrict(Path path) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(path, OWNER_ONLY);
        }
    }
}
