package work.envctl.deploy;

import java.time.Clock;

/**
 * Builds deployment names of the form {@code <base>-<unix-seconds>}.
 */
public final class DeploymentNames {
    public static final int MAX_LENGTH = 64;

    private DeploymentNames() {}

    public static String generate(String baseName, Clock clock) {
        String name = baseName + "-" + clock.instant().getEpochSecond();
        if (name.length() <= MAX_LENGTH) {
            return name;
        }
        // keep the rightmost characters so the timestamp survives
        return name.substring(name.length() - MAX_LENGTH);
    }
}
