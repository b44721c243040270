package work.envctl.console;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Line-oriented console over stdin/stdout. Masked input goes through {@link java.io.Console} when a real
 * terminal is attached.
 */
public final class TerminalConsole implements Console {
    private final BufferedReader in;
    private final PrintStream out;
    private final java.io.Console terminal;

    public TerminalConsole() {
        this(System.in, System.out, System.console());
    }

    public TerminalConsole(InputStream in, PrintStream out, java.io.Console terminal) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
        this.terminal = terminal;
    }

    @Override
    public String prompt(PromptOptions options) {
        StringBuilder question = new StringBuilder("? ").append(options.message());
        options.defaultValue().ifPresent(value -> question.append(" [").append(value).append(']'));
        question.append(": ");
        options.help().ifPresent(help -> out.println("  " + help));
        String answer;
        if (options.secure() && terminal != null) {
            char[] secret = terminal.readPassword("%s", question);
            if (secret == null) {
                throw new ConsoleException("No input available for: " + options.message());
            }
            answer = new String(secret);
        } else {
            out.print(question);
            out.flush();
            answer = readLine(options.message());
        }
        if (answer.isEmpty() && options.defaultValue().isPresent()) {
            return options.defaultValue().get();
        }
        return answer;
    }

    @Override
    public int select(String message, List<String> options, int defaultIndex) {
        if (options.isEmpty()) {
            throw new ConsoleException("Nothing to select for: " + message);
        }
        out.println("? " + message);
        for (int i = 0; i < options.size(); i++) {
            out.printf("  %s %d) %s%n", i == defaultIndex ? ">" : " ", i + 1, options.get(i));
        }
        while (true) {
            out.print("  Choice [" + (defaultIndex + 1) + "]: ");
            out.flush();
            String answer = readLine(message).trim();
            if (answer.isEmpty()) {
                return defaultIndex;
            }
            try {
                int choice = Integer.parseInt(answer);
                if (choice >= 1 && choice <= options.size()) {
                    return choice - 1;
                }
            } catch (NumberFormatException ex) {
                int byName = options.indexOf(answer);
                if (byName >= 0) {
                    return byName;
                }
            }
            out.println("  Enter a number between 1 and " + options.size());
        }
    }

    @Override
    public boolean confirm(String message, boolean defaultValue) {
        while (true) {
            out.print("? " + message + (defaultValue ? " (Y/n) " : " (y/N) "));
            out.flush();
            String answer = readLine(message).trim().toLowerCase(Locale.ROOT);
            if (answer.isEmpty()) {
                return defaultValue;
            }
            if ("y".equals(answer) || "yes".equals(answer)) {
                return true;
            }
            if ("n".equals(answer) || "no".equals(answer)) {
                return false;
            }
        }
    }

    @Override
    public void message(String text) {
        out.println(text);
    }

    @Override
    public void showSpinner(String title) {
        out.println("  (-) " + title);
    }

    @Override
    public void stopSpinner(String title, boolean success) {
        out.println((success ? "  (✓) Done: " : "  (x) Failed: ") + title);
    }

    private String readLine(String message) {
        try {
            String line = in.readLine();
            if (line == null) {
                throw new ConsoleException("No input available for: " + message);
            }
            return line;
        } catch (IOException ex) {
            throw new ConsoleException("Failed to read input for: " + message, ex);
        }
    }
}
