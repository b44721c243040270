package work.envctl.params;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;
import org.junit.jupiter.api.Test;
import work.envctl.template.GenerateConfig;
import work.envctl.template.ParameterConfigurationException;

class PasswordGeneratorTest {
    private final PasswordGenerator generator = new PasswordGenerator(new Random(42));

    @Test
    void defaultsProduceFifteenCharacters() {
        assertEquals(15, generator.generate(GenerateConfig.defaults()).length());
    }

    @Test
    void honoursMinimumsAndExclusions() {
        var config = new GenerateConfig(12, false, true, false, true, 3, 0, 4, 0);

        var value = generator.generate(config);

        assertEquals(12, value.length());
        assertTrue(value.chars().filter(ch -> PasswordGenerator.LOWER.indexOf(ch) >= 0).count() >= 3);
        assertTrue(value.chars().filter(Character::isDigit).count() >= 4);
        assertTrue(value.chars().noneMatch(ch -> PasswordGenerator.UPPER.indexOf(ch) >= 0));
        assertTrue(value.chars().noneMatch(ch -> PasswordGenerator.SPECIAL.indexOf(ch) >= 0));
    }

    @Test
    void rejectsMinimumForExcludedClass() {
        var config = new GenerateConfig(10, false, true, false, false, 0, 2, 0, 0);
        assertThrows(ParameterConfigurationException.class, () -> generator.generate(config));
    }

    @Test
    void rejectsMinimumsLongerThanLength() {
        var config = new GenerateConfig(4, false, false, false, false, 2, 2, 2, 0);
        assertThrows(ParameterConfigurationException.class, () -> generator.generate(config));
    }

    @Test
    void rejectsExcludingEveryClass() {
        var config = new GenerateConfig(8, true, true, true, true, 0, 0, 0, 0);
        assertThrows(ParameterConfigurationException.class, () -> generator.generate(config));
    }
}
