package work.envctl.console;

import java.util.List;

/**
 * Interactive user surface. Every method may raise {@link ConsoleException} when no answer can be read.
 */
public interface Console {

    String prompt(PromptOptions options);

    /**
     * Returns the index of the chosen option.
     */
    int select(String message, List<String> options, int defaultIndex);

    boolean confirm(String message, boolean defaultValue);

    void message(String text);

    void showSpinner(String title);

    void stopSpinner(String title, boolean success);
}
