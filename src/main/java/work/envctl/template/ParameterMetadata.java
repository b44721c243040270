package work.envctl.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extension metadata attached to a parameter definition. Strings inside it may reference other parameters
 * with {@code $(p:<name>)} markers; those references order prompting and are substituted once the
 * referenced values are known.
 */
public record ParameterMetadata(
    Optional<MetadataKind> kind,
    Optional<Object> defaultValue,
    List<String> usageNames,
    Optional<GenerateConfig> generate,
    Map<String, Object> raw
) {
    private static final Pattern REFERENCE = Pattern.compile("\\$\\(p:([A-Za-z0-9_\\-]+)\\)");
    private static final ParameterMetadata EMPTY =
        new ParameterMetadata(Optional.empty(), Optional.empty(), List.of(), Optional.empty(), Map.of());

    public ParameterMetadata {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(defaultValue, "defaultValue");
        Objects.requireNonNull(generate, "generate");
        usageNames = usageNames == null ? List.of() : List.copyOf(usageNames);
        raw = raw == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }

    public static ParameterMetadata empty() {
        return EMPTY;
    }

    public boolean is(MetadataKind candidate) {
        return kind.filter(candidate::equals).isPresent();
    }

    /**
     * Names referenced through {@code $(p:name)} markers anywhere in the raw metadata, in first-seen order.
     */
    public List<String> references() {
        LinkedHashSet<String> names = new LinkedHashSet<>();
        collectReferences(raw, names);
        return new ArrayList<>(names);
    }

    /**
     * Usage requirements with every marker replaced through {@code resolver}.
     */
    public List<String> usageNames(Function<String, String> resolver) {
        List<String> resolved = new ArrayList<>(usageNames.size());
        for (String usage : usageNames) {
            resolved.add(substitute(usage, resolver));
        }
        return resolved;
    }

    public Optional<Object> defaultValue(Function<String, String> resolver) {
        return defaultValue.map(value -> value instanceof String str ? substitute(str, resolver) : value);
    }

    public static String substitute(String text, Function<String, String> resolver) {
        Matcher matcher = REFERENCE.matcher(text);
        StringBuilder builder = new StringBuilder();
        while (matcher.find()) {
            String replacement = resolver.apply(matcher.group(1));
            matcher.appendReplacement(builder, Matcher.quoteReplacement(replacement == null ? "" : replacement));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    private static void collectReferences(Object value, LinkedHashSet<String> names) {
        if (value instanceof String str) {
            Matcher matcher = REFERENCE.matcher(str);
            while (matcher.find()) {
                names.add(matcher.group(1));
            }
        } else if (value instanceof Map<?, ?> map) {
            for (Object nested : map.values()) {
                collectReferences(nested, names);
            }
        } else if (value instanceof List<?> list) {
            for (Object nested : list) {
                collectReferences(nested, names);
            }
        }
    }
}
