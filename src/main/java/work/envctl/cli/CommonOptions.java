package work.envctl.cli;

import picocli.CommandLine;

/**
 * Options every subcommand accepts.
 */
final class CommonOptions {
    @CommandLine.Option(
        names = {"-e", "--env", "--environment"},
        description = "Environment name (default: environment.default from envctl.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String environment;

    @CommandLine.Option(
        names = {"-C", "--cwd"},
        description = "Project directory containing envctl.toml.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String cwd;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String logLevelRaw;

    @CommandLine.Option(
        names = "--timeout",
        description = "Cancel the operation after this long (e.g. 30s, 10m, 1h).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String timeoutRaw;
}
