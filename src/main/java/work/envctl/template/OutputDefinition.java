package work.envctl.template;

import java.util.Objects;

public record OutputDefinition(String name, ParameterType type) {
    public OutputDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }
}
