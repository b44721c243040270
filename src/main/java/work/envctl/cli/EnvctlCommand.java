package work.envctl.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import picocli.CommandLine;
import work.envctl.api.LogLevel;
import work.envctl.api.OperationResult;
import work.envctl.api.ProvisionConfiguration;
import work.envctl.api.ProvisionRunner;
import work.envctl.api.ProvisionServices;
import work.envctl.config.DotEnvStore;
import work.envctl.config.JsonConfigStore;
import work.envctl.console.TerminalConsole;
import work.envctl.controlplane.LocalControlPlane;
import work.envctl.deploy.RetryPolicy;
import work.envctl.destroy.DestroyOptions;
import work.envctl.params.PasswordGenerator;
import work.envctl.project.ProjectManifest;
import work.envctl.project.ProjectManifestLoader;
import work.envctl.runtime.OperationContext;
import work.envctl.shared.DurationParser;
import work.envctl.template.FileTemplateCompiler;

@CommandLine.Command(
    name = "envctl",
    description = "Provision and tear down template-described environments.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        EnvctlCommand.Provision.class,
        EnvctlCommand.Preview.class,
        EnvctlCommand.Show.class,
        EnvctlCommand.Destroy.class
    }
)
final class EnvctlCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Shared plumbing: loads the project, wires collaborators and prints the result as JSON.
     */
    abstract static class RunnerCommand implements Callable<Integer> {
        @CommandLine.Mixin
        CommonOptions options = new CommonOptions();

        @Override
        public Integer call() {
            LogLevel logLevel = LoggingSetup.resolve(options.logLevelRaw);
            LoggingSetup.apply(logLevel);
            Path projectDirectory = options.cwd == null
                ? Paths.get("").toAbsolutePath().normalize()
                : Paths.get(options.cwd).toAbsolutePath().normalize();
            Optional<Duration> timeout = DurationParser.parse(options.timeoutRaw);

            ProvisionConfiguration configuration = configure(ProvisionConfiguration.builder()
                .projectDirectory(projectDirectory)
                .environmentName(Optional.ofNullable(options.environment))
                .timeout(timeout)
                .logLevel(logLevel))
                .build();

            ProjectManifest manifest = ProjectManifestLoader.load(configuration.projectDirectory());
            String environmentName = configuration.environmentName()
                .or(manifest::defaultEnvironment)
                .orElseThrow(() -> new CommandLine.ParameterException(new CommandLine(this),
                    "No environment selected: pass --environment or set environment.default in " + ProjectManifest.FILE_NAME));
            Path environmentDirectory = manifest.environmentDirectory(environmentName);
            Clock clock = Clock.systemUTC();
            ProvisionServices services = new ProvisionServices(
                new FileTemplateCompiler(),
                new LocalControlPlane(manifest.controlPlaneState(), clock),
                new TerminalConsole(),
                JsonConfigStore.open(environmentDirectory.resolve("config.json")),
                DotEnvStore.open(environmentName, environmentDirectory.resolve(".env")),
                clock,
                RetryPolicy.defaults(),
                new PasswordGenerator()
            );
            ProvisionRunner runner = new ProvisionRunner(manifest, services, environmentName);
            OperationContext context = new OperationContext(projectDirectory);

            ScheduledExecutorService watchdog = configuration.timeout().map(limit -> scheduleCancel(context, limit)).orElse(null);
            try {
                OperationResult result = execute(runner, configuration, context);
                System.out.println(result.toPrettyJson());
                return result.status().exitCode();
            } finally {
                if (watchdog != null) {
                    watchdog.shutdownNow();
                }
            }
        }

        ProvisionConfiguration.Builder configure(ProvisionConfiguration.Builder builder) {
            return builder;
        }

        abstract OperationResult execute(ProvisionRunner runner, ProvisionConfiguration configuration, OperationContext context);

        private static ScheduledExecutorService scheduleCancel(OperationContext context, Duration limit) {
            ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "envctl-timeout");
                t.setDaemon(true);
                return t;
            });
            executor.schedule(context::cancel, limit.toMillis(), TimeUnit.MILLISECONDS);
            return executor;
        }
    }

    @CommandLine.Command(name = "provision", description = "Provision the environment's infrastructure.", mixinStandardHelpOptions = true)
    static final class Provision extends RunnerCommand {
        @CommandLine.Option(names = "--no-state", description = "Deploy even when nothing changed since the last deployment.")
        boolean noState;

        @Override
        ProvisionConfiguration.Builder configure(ProvisionConfiguration.Builder builder) {
            return builder.ignoreDeploymentState(noState);
        }

        @Override
        OperationResult execute(ProvisionRunner runner, ProvisionConfiguration configuration, OperationContext context) {
            return runner.provision(configuration.ignoreDeploymentState(), context);
        }
    }

    @CommandLine.Command(name = "preview", description = "Show the changes a provision would make.", mixinStandardHelpOptions = true)
    static final class Preview extends RunnerCommand {
        @Override
        OperationResult execute(ProvisionRunner runner, ProvisionConfiguration configuration, OperationContext context) {
            return runner.preview(context);
        }
    }

    @CommandLine.Command(name = "show", description = "Show the environment's current deployment and outputs.", mixinStandardHelpOptions = true)
    static final class Show extends RunnerCommand {
        @Override
        OperationResult execute(ProvisionRunner runner, ProvisionConfiguration configuration, OperationContext context) {
            return runner.show(context);
        }
    }

    @CommandLine.Command(name = "destroy", description = "Delete the environment's infrastructure.", mixinStandardHelpOptions = true)
    static final class Destroy extends RunnerCommand {
        @CommandLine.Option(names = "--force", description = "Delete without confirmation.")
        boolean force;

        @CommandLine.Option(names = "--purge", description = "Permanently delete soft-deleted resources without asking.")
        boolean purge;

        @Override
        ProvisionConfiguration.Builder configure(ProvisionConfiguration.Builder builder) {
            return builder.force(force).purge(purge);
        }

        @Override
        OperationResult execute(ProvisionRunner runner, ProvisionConfiguration configuration, OperationContext context) {
            return runner.destroy(new DestroyOptions(configuration.force(), configuration.purge()), context);
        }
    }
}
