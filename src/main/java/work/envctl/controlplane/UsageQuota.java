package work.envctl.controlplane;

import java.util.Objects;

/**
 * Current consumption and limit of one quota-bound usage in a location.
 */
public record UsageQuota(String name, long currentValue, long limit) {
    public UsageQuota {
        Objects.requireNonNull(name, "name");
    }

    public long remaining() {
        return limit - currentValue;
    }
}
