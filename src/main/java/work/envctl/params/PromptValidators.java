package work.envctl.params;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.envctl.template.ParameterDefinition;
import work.envctl.template.ParameterValue;

/**
 * Converts free-text answers into parameter values. Each method returns either the value or the message
 * shown before re-prompting.
 */
final class PromptValidators {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private PromptValidators() {}

    record Outcome(ParameterValue value, String error) {
        static Outcome ok(ParameterValue value) {
            return new Outcome(value, null);
        }

        static Outcome invalid(String error) {
            return new Outcome(null, error);
        }

        boolean valid() {
            return error == null;
        }
    }

    static Outcome number(ParameterDefinition definition, String text) {
        Optional<ParameterValue> parsed = ParameterValue.parseInteger(text);
        if (parsed.isEmpty()) {
            return Outcome.invalid("'" + text + "' is not a valid integer");
        }
        long value = ((ParameterValue.NumberValue) parsed.get()).value().longValueExact();
        if (definition.minValue().isPresent() && value < definition.minValue().get()) {
            return Outcome.invalid("Value must be at least " + definition.minValue().get());
        }
        if (definition.maxValue().isPresent() && value > definition.maxValue().get()) {
            return Outcome.invalid("Value must be at most " + definition.maxValue().get());
        }
        return Outcome.ok(parsed.get());
    }

    static Outcome string(ParameterDefinition definition, String text) {
        int length = text.length();
        if (definition.minLength().isPresent() && length < definition.minLength().get()) {
            return Outcome.invalid("Value must be at least " + definition.minLength().get() + " characters long");
        }
        if (definition.maxLength().isPresent() && length > definition.maxLength().get()) {
            return Outcome.invalid("Value must be at most " + definition.maxLength().get() + " characters long");
        }
        return Outcome.ok(ParameterValue.of(text));
    }

    static Outcome array(String text) {
        Object parsed = parseJson(text);
        if (parsed instanceof List<?>) {
            return Outcome.ok(ParameterValue.fromPlain(parsed));
        }
        return Outcome.invalid("Value must be a valid JSON array");
    }

    static Outcome object(String text) {
        Object parsed = parseJson(text);
        if (parsed instanceof Map<?, ?>) {
            return Outcome.ok(ParameterValue.fromPlain(parsed));
        }
        return Outcome.invalid("Value must be a valid JSON object");
    }

    private static Object parseJson(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(text, Object.class);
        } catch (IOException ex) {
            return null;
        }
    }
}
