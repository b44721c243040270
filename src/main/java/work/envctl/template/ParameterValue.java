package work.envctl.template;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Concrete parameter value. Untyped JSON-like input (parameter files, saved config, prompt text) is converted
 * into one of the five variants through the factory methods below, never through ad-hoc casts in callers.
 */
public sealed interface ParameterValue {

    ParameterType type();

    /**
     * Plain Java form used for serialization: {@link String}, {@link Boolean}, {@link Long} or
     * {@link BigDecimal}, {@link List}, {@link Map}.
     */
    Object toPlain();

    /**
     * Text shown in selection prompts.
     */
    default String display() {
        return String.valueOf(toPlain());
    }

    record StringValue(String value) implements ParameterValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ParameterType type() {
            return ParameterType.STRING;
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record BoolValue(boolean value) implements ParameterValue {
        @Override
        public ParameterType type() {
            return ParameterType.BOOLEAN;
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record NumberValue(BigDecimal value) implements ParameterValue {
        public NumberValue {
            Objects.requireNonNull(value, "value");
        }

        public static NumberValue of(long value) {
            return new NumberValue(BigDecimal.valueOf(value));
        }

        public boolean isIntegral() {
            return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
        }

        @Override
        public ParameterType type() {
            return ParameterType.NUMBER;
        }

        @Override
        public Object toPlain() {
            if (isIntegral()) {
                try {
                    return value.longValueExact();
                } catch (ArithmeticException ex) {
                    return value;
                }
            }
            return value;
        }
    }

    record ArrayValue(List<Object> items) implements ParameterValue {
        public ArrayValue {
            items = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(items, "items")));
        }

        @Override
        public ParameterType type() {
            return ParameterType.ARRAY;
        }

        @Override
        public Object toPlain() {
            return items;
        }
    }

    record ObjectValue(Map<String, Object> entries) implements ParameterValue {
        public ObjectValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(entries, "entries")));
        }

        @Override
        public ParameterType type() {
            return ParameterType.OBJECT;
        }

        @Override
        public Object toPlain() {
            return entries;
        }
    }

    static ParameterValue of(String value) {
        return new StringValue(value);
    }

    static ParameterValue of(boolean value) {
        return new BoolValue(value);
    }

    static ParameterValue of(long value) {
        return NumberValue.of(value);
    }

    /**
     * Infers the variant from a plain JSON-like value.
     */
    static ParameterValue fromPlain(Object raw) {
        if (raw instanceof ParameterValue value) {
            return value;
        }
        if (raw instanceof String str) {
            return new StringValue(str);
        }
        if (raw instanceof Boolean bool) {
            return new BoolValue(bool);
        }
        if (raw instanceof Number number) {
            return new NumberValue(toBigDecimal(number));
        }
        if (raw instanceof List<?> list) {
            return new ArrayValue(new ArrayList<>(list));
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, value) -> copy.put(String.valueOf(key), value));
            return new ObjectValue(copy);
        }
        throw new IllegalArgumentException("Unsupported parameter value: " + raw);
    }

    /**
     * Strict conversion: succeeds only when {@code raw} already has the declared shape. Numbers must be
     * integral. Used for values read back from saved configuration.
     */
    static Optional<ParameterValue> assignable(ParameterType type, Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        switch (type) {
            case STRING:
                return raw instanceof String str ? Optional.of(new StringValue(str)) : Optional.empty();
            case BOOLEAN:
                return raw instanceof Boolean bool ? Optional.of(new BoolValue(bool)) : Optional.empty();
            case NUMBER:
                if (raw instanceof Number number) {
                    NumberValue value = new NumberValue(toBigDecimal(number));
                    return value.isIntegral() ? Optional.of(value) : Optional.empty();
                }
                return Optional.empty();
            case ARRAY:
                return raw instanceof List<?> ? Optional.of(fromPlain(raw)) : Optional.empty();
            case OBJECT:
                return raw instanceof Map<?, ?> ? Optional.of(fromPlain(raw)) : Optional.empty();
            default:
                return Optional.empty();
        }
    }

    /**
     * Relaxed conversion for parameter-file values: booleans and numbers also accept convertible strings.
     */
    static Optional<ParameterValue> fromFileValue(ParameterType type, Object raw) {
        if (raw instanceof String str) {
            if (type == ParameterType.BOOLEAN) {
                return parseBoolean(str);
            }
            if (type == ParameterType.NUMBER) {
                return parseInteger(str);
            }
        }
        return assignable(type, raw);
    }

    /**
     * Accepts {@code 1}, {@code t}, {@code T}, {@code TRUE}, {@code true}, {@code True} and their false
     * counterparts.
     */
    static Optional<ParameterValue> parseBoolean(String text) {
        return switch (text.trim()) {
            case "1", "t", "T", "TRUE", "true", "True" -> Optional.of(new BoolValue(true));
            case "0", "f", "F", "FALSE", "false", "False" -> Optional.of(new BoolValue(false));
            default -> Optional.empty();
        };
    }

    static Optional<ParameterValue> parseInteger(String text) {
        if (text == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(NumberValue.of(Long.parseLong(text.trim())));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }
}
