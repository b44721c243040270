package work.envctl.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses user-friendly durations such as {@code 30s}, {@code 2m}, {@code 1h} or {@code 1m30s}.
 * A bare number is read as milliseconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        long totalMillis = 0L;
        int index = 0;
        while (index < trimmed.length()) {
            int digitsStart = index;
            while (index < trimmed.length() && Character.isDigit(trimmed.charAt(index))) {
                index++;
            }
            if (digitsStart == index) {
                throw new IllegalArgumentException("Invalid duration: " + raw);
            }
            long value = Long.parseLong(trimmed.substring(digitsStart, index));
            int unitStart = index;
            while (index < trimmed.length() && Character.isLetter(trimmed.charAt(index))) {
                index++;
            }
            totalMillis += value * multiplier(trimmed.substring(unitStart, index), raw);
        }
        return Optional.of(Duration.ofMillis(totalMillis));
    }

    private static long multiplier(String unit, String raw) {
        switch (unit) {
            case "":
            case "ms":
                return 1L;
            case "s":
                return 1_000L;
            case "m":
                return 60_000L;
            case "h":
                return 3_600_000L;
            default:
                throw new IllegalArgumentException("Unsupported duration unit '" + unit + "' in " + raw);
        }
    }
}
