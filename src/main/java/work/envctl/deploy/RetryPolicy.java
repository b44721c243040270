package work.envctl.deploy;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds for the read-after-write wait on a freshly issued deployment.
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, BackoffStrategy backoff) {
    public static final int DEFAULT_ATTEMPTS = 10;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        Objects.requireNonNull(backoff, "backoff");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_ATTEMPTS, DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY, new ExponentialJitterBackoff());
    }
}
