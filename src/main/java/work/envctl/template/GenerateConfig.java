package work.envctl.template;

/**
 * Complexity policy for auto-generated parameter values.
 */
public record GenerateConfig(
    int length,
    boolean noLower,
    boolean noUpper,
    boolean noNumeric,
    boolean noSpecial,
    int minLower,
    int minUpper,
    int minNumeric,
    int minSpecial
) {
    public static final int DEFAULT_LENGTH = 15;

    public GenerateConfig {
        if (length <= 0) {
            length = DEFAULT_LENGTH;
        }
        if (minLower < 0 || minUpper < 0 || minNumeric < 0 || minSpecial < 0) {
            throw new ParameterConfigurationException("Auto-generate minimums must not be negative");
        }
    }

    public static GenerateConfig defaults() {
        return new GenerateConfig(DEFAULT_LENGTH, false, false, false, false, 0, 0, 0, 0);
    }
}
