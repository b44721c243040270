package work.envctl.params;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import work.envctl.shared.Placeholders;
import work.envctl.template.CompileException;

/**
 * Parameter values supplied next to the template, in the deployment-parameters JSON shape
 * ({@code {"parameters": {"name": {"value": ...}}}}). {@code ${NAME}} placeholders are expanded before parsing.
 */
public final class ParameterFile {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private final Map<String, Object> values;

    public ParameterFile(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ParameterFile empty() {
        return new ParameterFile(Map.of());
    }

    public static ParameterFile load(Path path, Function<String, String> lookup) {
        if (path == null || !Files.isRegularFile(path)) {
            return empty();
        }
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8), lookup);
        } catch (IOException ex) {
            throw new CompileException("Failed to read parameter file: " + path, ex);
        }
    }

    public static ParameterFile parse(String content, Function<String, String> lookup) {
        String expanded = Placeholders.expand(content, lookup);
        JsonNode root;
        try {
            root = MAPPER.readTree(expanded);
        } catch (IOException ex) {
            throw new CompileException("Parameter file is not valid JSON", ex);
        }
        Map<String, Object> values = new LinkedHashMap<>();
        JsonNode parameters = root == null ? null : root.get("parameters");
        if (parameters == null || !parameters.isObject()) {
            return new ParameterFile(values);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = parameters.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            JsonNode value = field.getValue().get("value");
            if (value != null && !value.isNull()) {
                values.put(field.getKey(), MAPPER.convertValue(value, Object.class));
            }
        }
        return new ParameterFile(values);
    }

    public Optional<Object> value(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public Map<String, Object> values() {
        return values;
    }
}
