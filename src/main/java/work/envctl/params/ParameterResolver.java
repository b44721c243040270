package work.envctl.params;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.envctl.config.ConfigStore;
import work.envctl.config.ConfigStoreException;
import work.envctl.config.EnvironmentKeys;
import work.envctl.template.ParameterDefinition;
import work.envctl.template.ParameterValue;
import work.envctl.template.Template;

/**
 * Resolves template parameters from the parameter file, saved configuration and, for whatever is still
 * missing, interactive prompts. Results are cached per template for the lifetime of the resolver.
 */
public final class ParameterResolver {
    private static final Logger log = LoggerFactory.getLogger(ParameterResolver.class);

    private final ConfigStore config;
    private final ParameterPrompter prompter;
    private final Map<String, ResolvedParameters> cache = new HashMap<>();

    public ParameterResolver(ConfigStore config, ParameterPrompter prompter) {
        this.config = Objects.requireNonNull(config, "config");
        this.prompter = Objects.requireNonNull(prompter, "prompter");
    }

    public ResolvedParameters resolve(Template template, ParameterFile file) {
        ResolvedParameters cached = cache.get(template.source());
        if (cached != null) {
            return cached;
        }
        ParameterFile parameterFile = file == null ? ParameterFile.empty() : file;
        Map<String, ParameterValue> resolved = new LinkedHashMap<>();
        List<String> queued = new ArrayList<>();
        boolean dirty = false;

        for (ParameterDefinition definition : template.parameters().values()) {
            String name = definition.name();
            Optional<ParameterValue> fromFile = fileValue(definition, parameterFile);
            if (fromFile.isPresent()) {
                resolved.put(name, fromFile.get());
                continue;
            }
            String key = EnvironmentKeys.parameterKey(name);
            Optional<Object> saved = config.get(key);
            if (saved.isPresent()) {
                Optional<ParameterValue> compatible = ParameterValue.assignable(definition.type(), saved.get());
                if (compatible.isPresent()) {
                    resolved.put(name, compatible.get());
                    continue;
                }
                log.warn("Saved value for parameter '{}' is no longer a valid {}; discarding it", name,
                    definition.type().name().toLowerCase(Locale.ROOT));
                config.unset(key);
                dirty = true;
            }
            if (!definition.hasDefault()) {
                queued.add(name);
            }
        }

        Map<String, List<String>> references = new HashMap<>();
        for (String name : queued) {
            references.put(name, template.parameters().get(name).metadata().references());
        }
        List<String> order = ParameterDependencies.order(queued, references, template.parameters().keySet());

        for (String name : order) {
            ParameterDefinition definition = template.parameters().get(name);
            ParameterValue value = prompter.prompt(definition, reference -> lookup(template, resolved, reference));
            resolved.put(name, value);
            if (definition.secure()) {
                log.debug("Storing secure parameter {} in the environment config", name);
            }
            config.set(EnvironmentKeys.parameterKey(name), value.toPlain());
            dirty = true;
        }

        if (dirty) {
            try {
                config.save();
            } catch (ConfigStoreException ex) {
                log.warn("Failed to save parameter values: {}", ex.getMessage());
            }
        }

        ResolvedParameters result = new ResolvedParameters(ordered(template, resolved));
        cache.put(template.source(), result);
        return result;
    }

    private static Optional<ParameterValue> fileValue(ParameterDefinition definition, ParameterFile file) {
        Optional<Object> raw = file.value(definition.name());
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        if (raw.get() instanceof String str && str.isEmpty() && definition.hasDefault()) {
            return Optional.empty();
        }
        Optional<ParameterValue> converted = ParameterValue.fromFileValue(definition.type(), raw.get());
        if (converted.isEmpty()) {
            log.warn("Ignoring parameter file value for '{}': not convertible to {}", definition.name(),
                definition.type().name().toLowerCase(Locale.ROOT));
        }
        return converted;
    }

    private static String lookup(Template template, Map<String, ParameterValue> resolved, String name) {
        ParameterValue value = resolved.get(name);
        if (value == null) {
            value = template.parameter(name).flatMap(ParameterDefinition::defaultValue).orElse(null);
        }
        return value == null ? null : value.display();
    }

    private static Map<String, ParameterValue> ordered(Template template, Map<String, ParameterValue> resolved) {
        Map<String, ParameterValue> ordered = new LinkedHashMap<>();
        for (String name : template.parameters().keySet()) {
            ParameterValue value = resolved.get(name);
            if (value != null) {
                ordered.put(name, value);
            }
        }
        return ordered;
    }
}
