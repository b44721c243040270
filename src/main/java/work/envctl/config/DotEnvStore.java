package work.envctl.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link EnvironmentStore} kept as a {@code .env} file of {@code KEY="value"} lines.
 */
public final class DotEnvStore implements EnvironmentStore {
    private final String name;
    private final Path file;
    private final Map<String, String> values;

    private DotEnvStore(String name, Path file, Map<String, String> values) {
        this.name = name;
        this.file = file;
        this.values = values;
    }

    public static DotEnvStore open(String name, Path file) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(file, "file");
        Map<String, String> values = new LinkedHashMap<>();
        if (Files.isRegularFile(file)) {
            try {
                for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                    parseLine(line, values);
                }
            } catch (IOException ex) {
                throw new ConfigStoreException("Failed to read environment: " + file, ex);
            }
        }
        return new DotEnvStore(name, file, values);
    }

    static void parseLine(String line, Map<String, String> into) {
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return;
        }
        int eq = trimmed.indexOf('=');
        if (eq <= 0) {
            return;
        }
        String key = trimmed.substring(0, eq).trim();
        String value = trimmed.substring(eq + 1).trim();
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1).replace("\\\"", "\"").replace("\\\\", "\\");
        }
        into.put(key, value);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value) {
        values.put(key, value);
    }

    @Override
    public void unset(String key) {
        values.remove(key);
    }

    @Override
    public Map<String, String> values() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public void save() {
        StringBuilder builder = new StringBuilder();
        values.forEach((key, value) -> builder.append(key)
            .append("=\"")
            .append(value.replace("\\", "\\\\").replace("\"", "\\\""))
            .append("\"\n"));
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, builder.toString(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ConfigStoreException("Failed to write environment: " + file, ex);
        }
    }
}
