package work.envctl.params;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.envctl.template.ParameterValue;

/**
 * Concrete value for every parameter that needs one. Parameters left to their template default are absent.
 */
public final class ResolvedParameters {
    private final Map<String, ParameterValue> values;

    public ResolvedParameters(Map<String, ParameterValue> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Optional<ParameterValue> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Map<String, ParameterValue> values() {
        return values;
    }

    /**
     * Plain values keyed by name, as sent to the control plane.
     */
    public Map<String, Object> toPlainMap() {
        Map<String, Object> plain = new LinkedHashMap<>();
        values.forEach((name, value) -> plain.put(name, value.toPlain()));
        return plain;
    }
}
