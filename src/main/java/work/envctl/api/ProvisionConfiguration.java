package work.envctl.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings for one envctl invocation.
 */
public record ProvisionConfiguration(
    Path projectDirectory,
    Optional<String> environmentName,
    boolean ignoreDeploymentState,
    boolean force,
    boolean purge,
    Optional<Duration> timeout,
    LogLevel logLevel
) {
    public ProvisionConfiguration {
        Objects.requireNonNull(projectDirectory, "projectDirectory");
        Objects.requireNonNull(environmentName, "environmentName");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path projectDirectory;
        private Optional<String> environmentName = Optional.empty();
        private boolean ignoreDeploymentState;
        private boolean force;
        private boolean purge;
        private Optional<Duration> timeout = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder projectDirectory(Path projectDirectory) {
            this.projectDirectory = projectDirectory;
            return this;
        }

        public Builder environmentName(Optional<String> environmentName) {
            this.environmentName = environmentName;
            return this;
        }

        public Builder ignoreDeploymentState(boolean ignoreDeploymentState) {
            this.ignoreDeploymentState = ignoreDeploymentState;
            return this;
        }

        public Builder force(boolean force) {
            this.force = force;
            return this;
        }

        public Builder purge(boolean purge) {
            this.purge = purge;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public ProvisionConfiguration build() {
            return new ProvisionConfiguration(
                projectDirectory,
                environmentName,
                ignoreDeploymentState,
                force,
                purge,
                timeout,
                logLevel
            );
        }
    }
}
