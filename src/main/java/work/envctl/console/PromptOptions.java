package work.envctl.console;

import java.util.Objects;
import java.util.Optional;

/**
 * Free-text prompt request.
 */
public record PromptOptions(String message, Optional<String> help, Optional<String> defaultValue, boolean secure) {
    public PromptOptions {
        Objects.requireNonNull(message, "message");
        help = help == null ? Optional.empty() : help;
        defaultValue = defaultValue == null ? Optional.empty() : defaultValue;
    }

    public static PromptOptions of(String message) {
        return new PromptOptions(message, Optional.empty(), Optional.empty(), false);
    }

    public PromptOptions withHelp(String text) {
        return new PromptOptions(message, Optional.ofNullable(text), defaultValue, secure);
    }

    public PromptOptions withDefault(String value) {
        return new PromptOptions(message, help, Optional.ofNullable(value), secure);
    }

    public PromptOptions masked(boolean masked) {
        return new PromptOptions(message, help, defaultValue, masked);
    }
}
