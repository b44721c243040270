package work.envctl.deploy;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ExponentialJitterBackoffTest {
    private final ExponentialJitterBackoff backoff = new ExponentialJitterBackoff(new Random(3));

    @Test
    void startsAtMinimum() {
        var delay = backoff.next(Duration.ZERO, Duration.ofSeconds(1), Duration.ofSeconds(30));
        assertWithin(delay, 850, 1150);
    }

    @Test
    void doublesPreviousDelay() {
        var delay = backoff.next(Duration.ofSeconds(4), Duration.ofSeconds(1), Duration.ofSeconds(30));
        assertWithin(delay, 6800, 9200);
    }

    @Test
    void capsAtMaximum() {
        var delay = backoff.next(Duration.ofSeconds(20), Duration.ofSeconds(1), Duration.ofSeconds(30));
        assertWithin(delay, 25500, 34500);
    }

    @Test
    void rejectsInvertedBounds() {
        assertThrows(IllegalArgumentException.class,
            () -> backoff.next(Duration.ZERO, Duration.ofSeconds(5), Duration.ofSeconds(1)));
    }

    private static void assertWithin(Duration delay, long lowMs, long highMs) {
        assertTrue(delay.toMillis() >= lowMs && delay.toMillis() <= highMs, delay.toString());
    }
}
