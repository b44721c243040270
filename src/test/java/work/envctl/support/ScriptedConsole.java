package work.envctl.support;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import work.envctl.console.Console;
import work.envctl.console.ConsoleException;
import work.envctl.console.PromptOptions;

/**
 * Console that answers from queued responses and records what it was asked. Running out of answers fails
 * the test with {@link ConsoleException}.
 */
public final class ScriptedConsole implements Console {
    public final Deque<String> promptAnswers = new ArrayDeque<>();
    public final Deque<Integer> selectAnswers = new ArrayDeque<>();
    public final Deque<Boolean> confirmAnswers = new ArrayDeque<>();

    public final List<PromptOptions> prompts = new ArrayList<>();
    public final List<String> selectMessages = new ArrayList<>();
    public final List<List<String>> selectOptions = new ArrayList<>();
    public final List<Integer> selectDefaults = new ArrayList<>();
    public final List<String> confirmMessages = new ArrayList<>();
    public final List<String> messages = new ArrayList<>();

    public ScriptedConsole answerPrompt(String... answers) {
        for (String answer : answers) {
            promptAnswers.add(answer);
        }
        return this;
    }

    public ScriptedConsole answerSelect(Integer... answers) {
        for (Integer answer : answers) {
            selectAnswers.add(answer);
        }
        return this;
    }

    public ScriptedConsole answerConfirm(Boolean... answers) {
        for (Boolean answer : answers) {
            confirmAnswers.add(answer);
        }
        return this;
    }

    public int interactions() {
        return prompts.size() + selectMessages.size() + confirmMessages.size();
    }

    @Override
    public synchronized String prompt(PromptOptions options) {
        prompts.add(options);
        if (promptAnswers.isEmpty()) {
            throw new ConsoleException("Unexpected prompt: " + options.message());
        }
        return promptAnswers.poll();
    }

    @Override
    public synchronized int select(String message, List<String> options, int defaultIndex) {
        selectMessages.add(message);
        selectOptions.add(List.copyOf(options));
        selectDefaults.add(defaultIndex);
        if (selectAnswers.isEmpty()) {
            throw new ConsoleException("Unexpected selection: " + message);
        }
        return selectAnswers.poll();
    }

    @Override
    public synchronized boolean confirm(String message, boolean defaultValue) {
        confirmMessages.add(message);
        if (confirmAnswers.isEmpty()) {
            throw new ConsoleException("Unexpected confirmation: " + message);
        }
        return confirmAnswers.poll();
    }

    @Override
    public synchronized void message(String text) {
        messages.add(text);
    }

    @Override
    public void showSpinner(String title) {
    }

    @Override
    public void stopSpinner(String title, boolean success) {
    }
}
