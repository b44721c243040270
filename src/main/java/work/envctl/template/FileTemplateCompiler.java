package work.envctl.template;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads pre-compiled deployment templates (JSON or YAML) from disk. A directory module resolves to its
 * {@code main.json}, {@code main.yaml} or {@code main.yml}.
 */
public final class FileTemplateCompiler implements TemplateCompiler {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private static final List<String> ENTRY_POINTS = List.of("main.json", "main.yaml", "main.yml");
    private static final String SUBSCRIPTION_SCHEMA = "subscriptiondeploymenttemplate";

    @Override
    public Template compile(Path modulePath) {
        Path file = resolveEntryPoint(modulePath);
        byte[] content;
        JsonNode root;
        try {
            content = Files.readAllBytes(file);
            root = isYaml(file) ? YAML_MAPPER.readTree(content) : JSON_MAPPER.readTree(content);
            if (isYaml(file)) {
                content = JSON_MAPPER.writeValueAsBytes(root);
            }
        } catch (IOException ex) {
            throw new CompileException("Failed to read template: " + file, ex);
        }
        if (root == null || !root.isObject()) {
            throw new CompileException("Template must be an object: " + file);
        }
        return new Template(
            content,
            parseParameters(root.path("parameters")),
            parseOutputs(root.path("outputs")),
            parseScope(root),
            file.toString()
        );
    }

    private static Path resolveEntryPoint(Path modulePath) {
        if (modulePath == null) {
            throw new CompileException("Template module path is missing");
        }
        if (Files.isRegularFile(modulePath)) {
            return modulePath;
        }
        if (Files.isDirectory(modulePath)) {
            for (String candidate : ENTRY_POINTS) {
                Path file = modulePath.resolve(candidate);
                if (Files.isRegularFile(file)) {
                    return file;
                }
            }
        }
        throw new CompileException("Template module not found: " + modulePath);
    }

    private static boolean isYaml(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    static TargetScope parseScope(JsonNode root) {
        String explicit = root.path("targetScope").asText("");
        if (!explicit.isBlank()) {
            switch (explicit.trim().toLowerCase(Locale.ROOT)) {
                case "subscription":
                    return TargetScope.SUBSCRIPTION;
                case "resourcegroup":
                    return TargetScope.RESOURCE_GROUP;
                default:
                    throw new CompileException("Unsupported target scope: " + explicit);
            }
        }
        String schema = root.path("$schema").asText("").toLowerCase(Locale.ROOT);
        return schema.contains(SUBSCRIPTION_SCHEMA) ? TargetScope.SUBSCRIPTION : TargetScope.RESOURCE_GROUP;
    }

    static Map<String, ParameterDefinition> parseParameters(JsonNode parameters) {
        Map<String, ParameterDefinition> definitions = new LinkedHashMap<>();
        if (parameters == null || !parameters.isObject()) {
            return definitions;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = parameters.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            definitions.put(field.getKey(), parseParameter(field.getKey(), field.getValue()));
        }
        return definitions;
    }

    private static ParameterDefinition parseParameter(String name, JsonNode node) {
        String rawType = node.path("type").asText(null);
        ParameterType type;
        try {
            type = ParameterType.fromTemplateType(rawType);
        } catch (ParameterConfigurationException ex) {
            throw new ParameterConfigurationException("Parameter '" + name + "': " + ex.getMessage());
        }
        var builder = ParameterDefinition.builder(name, type)
            .secure(ParameterType.isSecureTemplateType(rawType));

        if (node.has("defaultValue") && !node.get("defaultValue").isNull()) {
            builder.defaultValue(ParameterValue.fromPlain(toPlain(node.get("defaultValue"))));
        }
        JsonNode allowed = node.get("allowedValues");
        if (allowed != null && allowed.isArray()) {
            List<ParameterValue> values = new ArrayList<>();
            for (JsonNode item : allowed) {
                values.add(ParameterValue.fromPlain(toPlain(item)));
            }
            builder.allowedValues(values);
        }
        if (node.hasNonNull("minValue")) {
            builder.minValue(node.get("minValue").asLong());
        }
        if (node.hasNonNull("maxValue")) {
            builder.maxValue(node.get("maxValue").asLong());
        }
        if (node.hasNonNull("minLength")) {
            builder.minLength(node.get("minLength").asInt());
        }
        if (node.hasNonNull("maxLength")) {
            builder.maxLength(node.get("maxLength").asInt());
        }
        JsonNode metadata = node.path("metadata");
        if (metadata.hasNonNull("description")) {
            builder.description(metadata.get("description").asText());
        }
        builder.metadata(parseMetadata(name, metadata));
        return builder.build();
    }

    private static ParameterMetadata parseMetadata(String name, JsonNode metadata) {
        JsonNode extension = metadata.path("envctl");
        if (!extension.isObject()) {
            extension = metadata.path("azd");
        }
        if (!extension.isObject()) {
            return ParameterMetadata.empty();
        }
        Optional<MetadataKind> kind = Optional.empty();
        if (extension.hasNonNull("type")) {
            String rawKind = extension.get("type").asText();
            kind = MetadataKind.from(rawKind);
            if (kind.isEmpty()) {
                throw new ParameterConfigurationException(
                    "Parameter '" + name + "' declares unsupported metadata type: " + rawKind);
            }
        }
        Optional<Object> defaultValue = extension.has("default") && !extension.get("default").isNull()
            ? Optional.of(toPlain(extension.get("default")))
            : Optional.empty();

        List<String> usageNames = new ArrayList<>();
        JsonNode usage = extension.path("usageName");
        if (usage.isTextual()) {
            usageNames.add(usage.asText());
        } else if (usage.isArray()) {
            for (JsonNode item : usage) {
                usageNames.add(item.asText());
            }
        }

        JsonNode generateNode = extension.has("autoGenerate") ? extension.get("autoGenerate") : extension.get("config");
        Optional<GenerateConfig> generate = Optional.empty();
        if (generateNode != null && generateNode.isObject()) {
            generate = Optional.of(new GenerateConfig(
                generateNode.path("length").asInt(0),
                generateNode.path("noLower").asBoolean(false),
                generateNode.path("noUpper").asBoolean(false),
                generateNode.path("noNumeric").asBoolean(false),
                generateNode.path("noSpecial").asBoolean(false),
                generateNode.path("minLower").asInt(0),
                generateNode.path("minUpper").asInt(0),
                generateNode.path("minNumeric").asInt(0),
                generateNode.path("minSpecial").asInt(0)
            ));
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> raw = (Map<String, Object>) toPlain(extension);
        return new ParameterMetadata(kind, defaultValue, usageNames, generate, raw);
    }

    static Map<String, OutputDefinition> parseOutputs(JsonNode outputs) {
        Map<String, OutputDefinition> definitions = new LinkedHashMap<>();
        if (outputs == null || !outputs.isObject()) {
            return definitions;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = outputs.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            String rawType = field.getValue().path("type").asText("string");
            ParameterType type;
            try {
                type = ParameterType.fromTemplateType(rawType);
            } catch (ParameterConfigurationException ex) {
                throw new CompileException("Output '" + field.getKey() + "': " + ex.getMessage());
            }
            definitions.put(field.getKey(), new OutputDefinition(field.getKey(), type));
        }
        return definitions;
    }

    private static Object toPlain(JsonNode node) {
        return JSON_MAPPER.convertValue(node, Object.class);
    }
}
