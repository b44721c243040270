package work.envctl.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesSeconds() {
        Optional<Duration> duration = DurationParser.parse("30s");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofSeconds(30), duration.get());
    }

    @Test
    void parsesCompoundDurations() {
        assertEquals(Optional.of(Duration.ofSeconds(90)), DurationParser.parse("1m30s"));
        assertEquals(Optional.of(Duration.ofMinutes(61)), DurationParser.parse("1H1m"));
    }

    @Test
    void parsesMillisecondsByDefault() {
        assertEquals(Optional.of(Duration.ofMillis(1500)), DurationParser.parse("1500"));
        assertEquals(Optional.of(Duration.ofMillis(250)), DurationParser.parse("250ms"));
    }

    @Test
    void handlesZeroAndBlank() {
        assertEquals(Optional.of(Duration.ZERO), DurationParser.parse("0"));
        assertEquals(Optional.empty(), DurationParser.parse("  "));
    }

    @Test
    void rejectsUnknownUnits() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("3d"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("s"));
    }
}
