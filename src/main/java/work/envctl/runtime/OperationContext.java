package work.envctl.runtime;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Per-invocation context: working directory plus the cancellation token every blocking wait observes.
 */
public final class OperationContext {
    private final Path workingDirectory;
    private final CancellationToken cancellationToken;

    public OperationContext() {
        this(null, new CancellationToken());
    }

    public OperationContext(Path workingDirectory) {
        this(workingDirectory, new CancellationToken());
    }

    public OperationContext(Path workingDirectory, CancellationToken token) {
        this.workingDirectory = workingDirectory == null
            ? Paths.get("").toAbsolutePath().normalize()
            : workingDirectory.toAbsolutePath().normalize();
        this.cancellationToken = token == null ? new CancellationToken() : token;
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public void ensureNotCancelled() {
        if (cancellationToken.isCancelled()) {
            throw new OperationCancelledException("Operation cancelled");
        }
    }

    public void cancel() {
        cancellationToken.cancel();
    }

    /**
     * Blocks for {@code delay} unless the operation is cancelled first, in which case the wait ends
     * immediately with {@link OperationCancelledException}.
     */
    public void sleep(Duration delay) {
        ensureNotCancelled();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        if (cancellationToken.await(delay)) {
            throw new OperationCancelledException("Operation cancelled while waiting");
        }
    }

    public static final class CancellationToken {
        private final CountDownLatch cancelled = new CountDownLatch(1);

        public void cancel() {
            cancelled.countDown();
        }

        public boolean isCancelled() {
            return cancelled.getCount() == 0;
        }

        /**
         * Returns {@code true} when the token was cancelled before {@code timeout} elapsed.
         */
        boolean await(Duration timeout) {
            try {
                return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("Interrupted while waiting");
            }
        }
    }
}
