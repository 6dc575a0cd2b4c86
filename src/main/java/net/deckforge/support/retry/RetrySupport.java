package net.deckforge.support.retry;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import net.deckforge.config.DeckForgeProperties;
import net.deckforge.exception.AssetProductionException;
import net.deckforge.support.concurrent.BuildCancellation;
import org.slf4j.Logger;

/**
 * Executes asset production steps with bounded retry and linear backoff.
 */
public final class RetrySupport {

    /**
     * Bundles the retry parameters that are constant per call site:
     * the logger, maximum attempts, and backoff step.
     */
    public record RetryConfig(Logger logger, int maxAttempts, Duration backoffStep) {

        public static RetryConfig from(Logger logger, DeckForgeProperties.Retry retry) {
            return new RetryConfig(logger, retry.getMaxAttempts(), retry.getBackoff());
        }
    }

    private RetrySupport() {
    }

    /**
     * Executes the action, retrying retryable failures.
     *
     * <p>Retries only on {@link AssetProductionException} whose
     * {@link AssetProductionException#isRetryable()} is {@code true}; every other
     * runtime exception propagates immediately. Uses linear backoff
     * ({@code backoffStep * attempt}). When attempts run out the last failure is
     * rethrown, so a retryable exception escaping this method means the bound was hit.
     *
     * @throws CancellationException if the run is cancelled before an attempt or during a backoff wait
     */
    public static <T> T execute(RetryConfig config,
                                String operationLabel,
                                BuildCancellation cancellation,
                                Supplier<T> action) {
        int maxAttempts = config.maxAttempts();
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(
                "maxAttempts must be at least 1 for operation '" + operationLabel + "' but was " + maxAttempts
            );
        }
        AssetProductionException lastException = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (cancellation.isCancelled()) {
                throw new CancellationException("Cancelled before " + operationLabel);
            }
            try {
                return action.get();
            } catch (AssetProductionException exception) {
                if (!exception.isRetryable()) {
                    throw exception;
                }
                lastException = exception;
                if (attempt < maxAttempts) {
                    Duration backoff = config.backoffStep().multipliedBy(attempt);
                    config.logger().warn(
                        "Transient failure during {} (attempt {}/{}): {}. Retrying in {}ms",
                        operationLabel,
                        attempt,
                        maxAttempts,
                        exception.getMessage(),
                        backoff.toMillis()
                    );
                    if (!cancellation.pause(backoff)) {
                        throw new CancellationException("Cancelled while waiting to retry " + operationLabel);
                    }
                }
            }
        }
        config.logger().warn("Giving up on {} after {} attempts", operationLabel, maxAttempts);
        throw lastException;
    }
}
