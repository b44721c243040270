package work.envctl.api;

import java.time.Clock;
import java.util.Objects;
import work.envctl.config.ConfigStore;
import work.envctl.config.EnvironmentStore;
import work.envctl.console.Console;
import work.envctl.controlplane.ControlPlane;
import work.envctl.deploy.RetryPolicy;
import work.envctl.params.PasswordGenerator;
import work.envctl.template.TemplateCompiler;

/**
 * Collaborators a {@link ProvisionRunner} works with.
 */
public record ProvisionServices(
    TemplateCompiler compiler,
    ControlPlane controlPlane,
    Console console,
    ConfigStore config,
    EnvironmentStore environment,
    Clock clock,
    RetryPolicy retryPolicy,
    PasswordGenerator passwordGenerator
) {
    public ProvisionServices {
        Objects.requireNonNull(compiler, "compiler");
        Objects.requireNonNull(controlPlane, "controlPlane");
        Objects.requireNonNull(console, "console");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(passwordGenerator, "passwordGenerator");
    }
}
