package work.envctl.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ConfigStore} backed by a JSON document; dotted keys address nested objects. The file may hold secure
 * parameter values, so on POSIX filesystems it is readable by its owner only.
 */
public final class JsonConfigStore implements ConfigStore {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path file;
    private final Map<String, Object> root;

    private JsonConfigStore(Path file, Map<String, Object> root) {
        this.file = file;
        this.root = root;
    }

    public static JsonConfigStore open(Path file) {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            return new JsonConfigStore(file, new LinkedHashMap<>());
        }
        try {
            Map<String, Object> content = MAPPER.readValue(file.toFile(), new TypeReference<LinkedHashMap<String, Object>>() {});
            return new JsonConfigStore(file, content == null ? new LinkedHashMap<>() : content);
        } catch (IOException ex) {
            throw new ConfigStoreException("Failed to read config: " + file, ex);
        }
    }

    public Path file() {
        return file;
    }

    @Override
    public Optional<Object> get(String key) {
        Object current = root;
        for (String segment : key.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(segment);
        }
        return Optional.ofNullable(current);
    }

    @Override
    @SuppressWarnings("unchecked")
    public void set(String key, Object value) {
        String[] segments = key.split("\\.");
        Map<String, Object> current = root;
        for (int i = 0; i < segments.length - 1; i++) {
            Object next = current.get(segments[i]);
            if (!(next instanceof Map)) {
                next = new LinkedHashMap<String, Object>();
                current.put(segments[i], next);
            }
            current = (Map<String, Object>) next;
        }
        current.put(segments[segments.length - 1], value);
    }

    @Override
    @SuppressWarnings("unchecked")
    public void unset(String key) {
        String[] segments = key.split("\\.");
        Map<String, Object> current = root;
        for (int i = 0; i < segments.length - 1; i++) {
            Object next = current.get(segments[i]);
            if (!(next instanceof Map)) {
                return;
            }
            current = (Map<String, Object>) next;
        }
        current.remove(segments[segments.length - 1]);
    }

    @Override
    public void save() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), root);
            if (Files.getFileStore(file).supportsFileAttributeView("posix")) {
                Files.setPosixFilePermissions(file, EnumSet.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE));
            }
        } catch (IOException ex) {
            throw new ConfigStoreException("Failed to write config: " + file, ex);
        }
    }
}
