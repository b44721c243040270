package work.envctl.deploy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outputs of a provisioning pass. {@code skipped} is set when the previous deployment was reused.
 */
public record DeployResult(DeploymentRecord deployment, Map<String, DeploymentOutput> outputs, boolean skipped, String reason) {
    public DeployResult {
        Objects.requireNonNull(deployment, "deployment");
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }
}
