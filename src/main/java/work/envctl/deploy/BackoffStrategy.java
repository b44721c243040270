package work.envctl.deploy;

import java.time.Duration;

public interface BackoffStrategy {
    Duration next(Duration current, Duration min, Duration max);
}
