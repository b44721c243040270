package work.envctl.deploy;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls a running deployment's operations on a daemon thread and publishes one line per resource state
 * change. Poll failures are logged and the next tick tries again.
 */
public final class ProgressReporter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    public static final Duration INITIAL_DELAY = Duration.ofSeconds(3);
    public static final Duration INTERVAL = Duration.ofSeconds(10);

    private final DeploymentTarget target;
    private final String deploymentName;
    private final Consumer<String> sink;
    private final Duration initialDelay;
    private final Duration interval;
    private final Map<String, ProvisioningState> reported = new HashMap<>();
    private final Object lock = new Object();
    private ScheduledExecutorService executor;

    public ProgressReporter(DeploymentTarget target, String deploymentName, Consumer<String> sink) {
        this(target, deploymentName, sink, INITIAL_DELAY, INTERVAL);
    }

    public ProgressReporter(
        DeploymentTarget target,
        String deploymentName,
        Consumer<String> sink,
        Duration initialDelay,
        Duration interval
    ) {
        this.target = Objects.requireNonNull(target, "target");
        this.deploymentName = Objects.requireNonNull(deploymentName, "deploymentName");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.initialDelay = initialDelay;
        this.interval = interval;
    }

    public void start() {
        synchronized (lock) {
            if (executor != null) {
                return;
            }
            executor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "deploy-progress-" + deploymentName);
                t.setDaemon(true);
                t.setUncaughtExceptionHandler((th, ex) -> log.error("Uncaught exception in '{}'", th.getName(), ex));
                return t;
            });
            executor.scheduleWithFixedDelay(this::poll, initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    void poll() {
        try {
            for (DeploymentOperation operation : target.operations(deploymentName)) {
                ProvisioningState previous = reported.put(operation.operationId(), operation.state());
                if (previous == operation.state()) {
                    continue;
                }
                sink.accept(describe(operation));
            }
        } catch (RuntimeException ex) {
            log.warn("Failed to read progress of deployment {}: {}", deploymentName, ex.getMessage());
        }
    }

    private static String describe(DeploymentOperation operation) {
        String verb;
        switch (operation.state()) {
            case SUCCEEDED:
                verb = "Done";
                break;
            case FAILED:
                verb = "Failed";
                break;
            default:
                verb = "Creating";
                break;
        }
        return verb + ": " + operation.resourceType() + " " + operation.resourceName();
    }

    boolean isStopped() {
        synchronized (lock) {
            return executor != null && executor.isShutdown();
        }
    }

    /**
     * Stops polling. Safe to call more than once.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
    }
}
