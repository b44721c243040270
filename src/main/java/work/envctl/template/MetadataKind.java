package work.envctl.template;

import java.util.Optional;

/**
 * Prompt semantics a parameter can opt into through its extension metadata {@code type} field.
 */
public enum MetadataKind {
    LOCATION("location"),
    RESOURCE_GROUP("resourceGroup"),
    GENERATE("generate"),
    GENERATE_OR_MANUAL("generateOrManual");

    private final String value;

    MetadataKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<MetadataKind> from(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (MetadataKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
