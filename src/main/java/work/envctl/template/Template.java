package work.envctl.template;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiled deployment template: the opaque artifact sent to the control plane plus the structured
 * parameter/output metadata the orchestration core works from. Parameter order is declaration order.
 */
public final class Template {
    private final byte[] artifact;
    private final Map<String, ParameterDefinition> parameters;
    private final Map<String, OutputDefinition> outputs;
    private final TargetScope targetScope;
    private final String source;

    public Template(
        byte[] artifact,
        Map<String, ParameterDefinition> parameters,
        Map<String, OutputDefinition> outputs,
        TargetScope targetScope,
        String source
    ) {
        this.artifact = Arrays.copyOf(Objects.requireNonNull(artifact, "artifact"), artifact.length);
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(parameters, "parameters")));
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(outputs, "outputs")));
        this.targetScope = Objects.requireNonNull(targetScope, "targetScope");
        this.source = source == null ? "<memory>" : source;
    }

    public byte[] artifact() {
        return Arrays.copyOf(artifact, artifact.length);
    }

    public String artifactText() {
        return new String(artifact, StandardCharsets.UTF_8);
    }

    public Map<String, ParameterDefinition> parameters() {
        return parameters;
    }

    public Optional<ParameterDefinition> parameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    public Map<String, OutputDefinition> outputs() {
        return outputs;
    }

    public TargetScope targetScope() {
        return targetScope;
    }

    public String source() {
        return source;
    }
}
