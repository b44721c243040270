package work.envctl.params;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import work.envctl.template.GenerateConfig;
import work.envctl.template.ParameterConfigurationException;

/**
 * Generates random values that satisfy a {@link GenerateConfig} complexity policy.
 */
public final class PasswordGenerator {
    static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
    static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    static final String NUMERIC = "0123456789";
    static final String SPECIAL = "!#$%&()*+,-./:;<=>?@[]^_{|}~";

    private final Random random;

    public PasswordGenerator() {
        this(new SecureRandom());
    }

    public PasswordGenerator(Random random) {
        this.random = random;
    }

    public String generate(GenerateConfig config) {
        checkClass("lower", config.noLower(), config.minLower());
        checkClass("upper", config.noUpper(), config.minUpper());
        checkClass("numeric", config.noNumeric(), config.minNumeric());
        checkClass("special", config.noSpecial(), config.minSpecial());
        int required = config.minLower() + config.minUpper() + config.minNumeric() + config.minSpecial();
        if (required > config.length()) {
            throw new ParameterConfigurationException(
                "Auto-generate minimums (" + required + ") exceed the requested length " + config.length());
        }
        StringBuilder pool = new StringBuilder();
        if (!config.noLower()) {
            pool.append(LOWER);
        }
        if (!config.noUpper()) {
            pool.append(UPPER);
        }
        if (!config.noNumeric()) {
            pool.append(NUMERIC);
        }
        if (!config.noSpecial()) {
            pool.append(SPECIAL);
        }
        if (pool.length() == 0) {
            throw new ParameterConfigurationException("Auto-generate excludes every character class");
        }

        List<Character> chars = new ArrayList<>(config.length());
        pick(LOWER, config.minLower(), chars);
        pick(UPPER, config.minUpper(), chars);
        pick(NUMERIC, config.minNumeric(), chars);
        pick(SPECIAL, config.minSpecial(), chars);
        pick(pool.toString(), config.length() - chars.size(), chars);
        Collections.shuffle(chars, random);

        StringBuilder result = new StringBuilder(chars.size());
        for (Character ch : chars) {
            result.append(ch.charValue());
        }
        return result.toString();
    }

    private void pick(String source, int count, List<Character> into) {
        for (int i = 0; i < count; i++) {
            into.add(source.charAt(random.nextInt(source.length())));
        }
    }

    private static void checkClass(String name, boolean excluded, int minimum) {
        if (excluded && minimum > 0) {
            throw new ParameterConfigurationException(
                "Auto-generate cannot require " + name + " characters while excluding them");
        }
    }
}
