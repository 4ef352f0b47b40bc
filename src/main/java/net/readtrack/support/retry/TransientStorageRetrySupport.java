package net.readtrack.support.retry;

import java.util.function.Supplier;
import net.readtrack.exception.RetryInterruptedException;
import org.slf4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Executes storage operations with bounded retry and linear backoff.
 */
public final class TransientStorageRetrySupport {

    /**
     * Retry parameters that are constant per call site:
     * the logger, maximum attempts, and base backoff interval.
     */
    public record RetryConfig(Logger logger, int maxAttempts, long baseBackoffMillis) {
    }

    private TransientStorageRetrySupport() {
    }

    /**
     * Executes the action, retrying while it fails with a transient storage error.
     *
     * <p>Deadlocks, serialization failures, lock timeouts and dropped connections are retried;
     * every other exception propagates immediately. Uses linear backoff
     * ({@code baseBackoffMillis * attempt}).
     *
     * @throws RetryInterruptedException when the thread is interrupted during a backoff
     */
    public static <T> T execute(RetryConfig config,
                                String operationLabel,
                                Supplier<T> action) {
        int maxAttempts = config.maxAttempts();
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(
                "maxAttempts must be at least 1 for operation '" + operationLabel + "' but was " + maxAttempts
            );
        }
        DataAccessException lastException = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (TransientDataAccessException | RecoverableDataAccessException exception) {
                lastException = exception;
                if (attempt < maxAttempts) {
                    long backoff = Math.max(config.baseBackoffMillis(), 1L) * attempt;
                    config.logger().warn(
                        "Transient storage failure during {} (attempt {}/{}): {}. Retrying in {}ms",
                        operationLabel,
                        attempt,
                        maxAttempts,
                        exception.getMessage(),
                        backoff
                    );
                    sleepUnchecked(backoff, operationLabel);
                }
            }
        }
        throw lastException;
    }

    private static void sleepUnchecked(long durationMillis, String operationLabel) {
        try {
            Thread.sleep(durationMillis);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new RetryInterruptedException(operationLabel, interruptedException);
        }
    }
}
