package work.envctl.deploy;

import java.util.Objects;

public record DeploymentOutput(String type, Object value) {
    public DeploymentOutput {
        Objects.requireNonNull(type, "type");
    }
}
