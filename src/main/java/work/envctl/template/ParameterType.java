package work.envctl.template;

import java.util.Locale;

/**
 * Declared kind of a template parameter or output.
 */
public enum ParameterType {
    STRING,
    BOOLEAN,
    NUMBER,
    ARRAY,
    OBJECT;

    /**
     * Maps a template type name, including the {@code bool}/{@code int}/{@code secure*} aliases.
     */
    public static ParameterType fromTemplateType(String value) {
        if (value == null || value.isBlank()) {
            throw new ParameterConfigurationException("Parameter type is missing");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "string":
            case "securestring":
                return STRING;
            case "bool":
            case "boolean":
                return BOOLEAN;
            case "int":
            case "number":
                return NUMBER;
            case "array":
                return ARRAY;
            case "object":
            case "secureobject":
                return OBJECT;
            default:
                throw new ParameterConfigurationException("Unsupported parameter type: " + value);
        }
    }

    public static boolean isSecureTemplateType(String value) {
        return value != null && value.trim().toLowerCase(Locale.ROOT).startsWith("secure");
    }
}
