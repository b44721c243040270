package work.envctl.console;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class TerminalConsoleTest {
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    @Test
    void promptFallsBackToDefault() {
        var console = console("\nexplicit\n");
        var options = PromptOptions.of("Resource group").withDefault("rg-dev");

        assertEquals("rg-dev", console.prompt(options));
        assertEquals("explicit", console.prompt(options));
        assertTrue(printed().contains("? Resource group [rg-dev]: "));
    }

    @Test
    void selectAcceptsNumberOrNameAndRepeatsOnInvalidInput() {
        var console = console("9\nwest\n\n2\n");
        var options = List.of("east", "west");

        assertEquals(1, console.select("Location", options, 0));
        assertEquals(0, console.select("Location", options, 0));
        assertEquals(1, console.select("Location", options, 0));
        assertTrue(printed().contains("Enter a number between 1 and 2"));
    }

    @Test
    void confirmUsesDefaultOnEmptyAnswer() {
        var console = console("\nmaybe\ny\n");

        assertFalse(console.confirm("Delete?", false));
        assertTrue(console.confirm("Delete?", false));
    }

    @Test
    void closedInputRaisesConsoleException() {
        var console = console("");

        assertThrows(ConsoleException.class, () -> console.confirm("Delete?", true));
    }

    private TerminalConsole console(String input) {
        return new TerminalConsole(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(output, true, StandardCharsets.UTF_8), null);
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }
}
