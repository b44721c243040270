package work.envctl.shared;

import java.util.function.Function;

/**
 * Expands {@code ${NAME}} placeholders. Unknown names expand to the empty string, an unterminated
 * placeholder is kept verbatim.
 */
public final class Placeholders {
    private Placeholders() {}

    public static String expand(String value, Function<String, String> lookup) {
        if (value == null || value.indexOf("${") < 0) {
            return value;
        }
        StringBuilder builder = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '$' && i + 1 < value.length() && value.charAt(i + 1) == '{') {
                int close = value.indexOf('}', i + 2);
                if (close == -1) {
                    builder.append(value.substring(i));
                    break;
                }
                String token = value.substring(i + 2, close);
                if (!token.isEmpty()) {
                    String replacement = lookup.apply(token);
                    if (replacement != null) {
                        builder.append(replacement);
                    }
                }
                i = close;
                continue;
            }
            builder.append(ch);
        }
        return builder.toString();
    }

    public static String expandFromEnvironment(String value) {
        return expand(value, System::getenv);
    }
}
