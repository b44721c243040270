package work.envctl.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;
import work.envctl.api.LogLevel;

/**
 * Applies the requested threshold to the Logback root logger.
 */
final class LoggingSetup {
    static final String ENV_VARIABLE = "ENVCTL_LOG_LEVEL";

    private LoggingSetup() {}

    static LogLevel resolve(String raw) {
        String candidate = raw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv(ENV_VARIABLE);
        }
        return LogLevel.from(candidate);
    }

    static void apply(LogLevel level) {
        if (LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME) instanceof Logger root) {
            root.setLevel(Level.toLevel(level.name(), Level.WARN));
        }
    }
}
