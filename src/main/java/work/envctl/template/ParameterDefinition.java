package work.envctl.template;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One declared template parameter.
 */
public record ParameterDefinition(
    String name,
    ParameterType type,
    boolean secure,
    Optional<ParameterValue> defaultValue,
    Optional<List<ParameterValue>> allowedValues,
    Optional<Long> minValue,
    Optional<Long> maxValue,
    Optional<Integer> minLength,
    Optional<Integer> maxLength,
    Optional<String> description,
    ParameterMetadata metadata
) {
    public ParameterDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(defaultValue, "defaultValue");
        Objects.requireNonNull(allowedValues, "allowedValues");
        Objects.requireNonNull(minValue, "minValue");
        Objects.requireNonNull(maxValue, "maxValue");
        Objects.requireNonNull(minLength, "minLength");
        Objects.requireNonNull(maxLength, "maxLength");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(metadata, "metadata");
        allowedValues = allowedValues.map(List::copyOf);
    }

    public boolean hasDefault() {
        return defaultValue.isPresent();
    }

    public static Builder builder(String name, ParameterType type) {
        return new Builder(name, type);
    }

    public static final class Builder {
        private final String name;
        private final ParameterType type;
        private boolean secure;
        private Optional<ParameterValue> defaultValue = Optional.empty();
        private Optional<List<ParameterValue>> allowedValues = Optional.empty();
        private Optional<Long> minValue = Optional.empty();
        private Optional<Long> maxValue = Optional.empty();
        private Optional<Integer> minLength = Optional.empty();
        private Optional<Integer> maxLength = Optional.empty();
        private Optional<String> description = Optional.empty();
        private ParameterMetadata metadata = ParameterMetadata.empty();

        private Builder(String name, ParameterType type) {
            this.name = name;
            this.type = type;
        }

        public Builder secure(boolean secure) {
            this.secure = secure;
            return this;
        }

        public Builder defaultValue(ParameterValue defaultValue) {
            this.defaultValue = Optional.ofNullable(defaultValue);
            return this;
        }

        public Builder allowedValues(List<ParameterValue> allowedValues) {
            this.allowedValues = Optional.ofNullable(allowedValues);
            return this;
        }

        public Builder minValue(long minValue) {
            this.minValue = Optional.of(minValue);
            return this;
        }

        public Builder maxValue(long maxValue) {
            this.maxValue = Optional.of(maxValue);
            return this;
        }

        public Builder minLength(int minLength) {
            this.minLength = Optional.of(minLength);
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = Optional.of(maxLength);
            return this;
        }

        public Builder description(String description) {
            this.description = Optional.ofNullable(description);
            return this;
        }

        public Builder metadata(ParameterMetadata metadata) {
            this.metadata = metadata == null ? ParameterMetadata.empty() : metadata;
            return this;
        }

        public ParameterDefinition build() {
            return new ParameterDefinition(
                name,
                type,
                secure,
                defaultValue,
                allowedValues,
                minValue,
                maxValue,
                minLength,
                maxLength,
                description,
                metadata
            );
        }
    }
}
