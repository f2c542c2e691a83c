package com.williamcallahan.verified_media_engine.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Helpers for CompletableFuture pipelines
 * - Timeouts that degrade to a fallback value instead of failing
 * - Settle-all joins bounded by a deadline
 * - Retry with exponential backoff and jitter
 */
public final class AsyncUtils {

    private static final Logger logger = LoggerFactory.getLogger(AsyncUtils.class);

    private AsyncUtils() {
    }

    /**
     * Runs an async operation, replacing timeout or failure with a fallback value
     *
     * @param operation supplier of the async operation
     * @param operationName name used in log lines
     * @param timeoutMs timeout in milliseconds
     * @param fallbackValue value returned when the operation fails or times out
     * @return future that always completes normally
     */
    public static <T> CompletableFuture<T> withTimeoutAndFallback(
            Supplier<CompletableFuture<T>> operation,
            String operationName,
            long timeoutMs,
            T fallbackValue) {
        CompletableFuture<T> started;
        try {
            started = operation.get();
        } catch (RuntimeException e) {
            logger.warn("Operation {} failed to start: {}", operationName, e.getMessage(), e);
            return CompletableFuture.completedFuture(fallbackValue);
        }
        if (started == null) {
            logger.warn("Operation {} returned no future", operationName);
            return CompletableFuture.completedFuture(fallbackValue);
        }
        return started
            .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .handle((result, ex) -> {
                if (ex != null) {
                    Throwable cause = unwrap(ex);
                    if (cause instanceof TimeoutException) {
                        logger.warn("Operation {} timed out after {}ms", operationName, timeoutMs);
                    } else {
                        logger.warn("Operation {} failed: {}", operationName, cause.getMessage(), cause);
                    }
                    return fallbackValue;
                }
                return result == null ? fallbackValue : result;
            });
    }

    /**
     * Waits for a set of futures until all complete or the deadline passes, whichever comes first
     * - Futures still running at the deadline are left out of the result
     * - Futures that completed exceptionally are left out of the result
     * - Result order follows the input order
     *
     * @param futures futures to join
     * @param deadlineMs overall deadline in milliseconds
     * @param operationName name used in log lines
     * @return future of the values that settled successfully in time
     */
    public static <T> CompletableFuture<List<T>> settleWithin(
            List<CompletableFuture<T>> futures,
            long deadlineMs,
            String operationName) {
        CompletableFuture<?>[] all = futures.toArray(new CompletableFuture<?>[0]);
        return CompletableFuture.allOf(all)
            .handle((ignored, ex) -> (Void) null)
            .completeOnTimeout(null, deadlineMs, TimeUnit.MILLISECONDS)
            .thenApply(ignored -> {
                List<T> settled = new ArrayList<>();
                int pending = 0;
                for (CompletableFuture<T> future : futures) {
                    if (!future.isDone()) {
                        pending++;
                        continue;
                    }
                    if (future.isCompletedExceptionally()) {
                        continue;
                    }
                    T value = future.getNow(null);
                    if (value != null) {
                        settled.add(value);
                    }
                }
                if (pending > 0) {
                    logger.warn("Operation {} reached its {}ms deadline with {} of {} tasks still running",
                        operationName, deadlineMs, pending, futures.size());
                }
                return settled;
            });
    }

    /**
     * Executes an async operation with retry, exponential backoff and jitter
     *
     * @param operation supplier of the operation to retry
     * @param operationName name used in log lines
     * @param logger logger of the calling class
     * @param executor executor used to schedule delayed retries
     * @param maxRetries maximum number of retries after the first attempt
     * @param initialBackoffMs delay before the first retry
     * @param maxBackoffMs cap for any single delay
     * @param backoffMultiplier growth factor between delays
     * @param jitterFactor 0.0 to 1.0; 0.2 means +/- 20%
     * @param isRetryablePredicate decides whether a failure triggers a retry; null retries everything
     * @return future completing with the first successful result, or the last failure
     */
    public static <T> CompletableFuture<T> withRetry(
            Supplier<CompletableFuture<T>> operation,
            String operationName,
            Logger logger,
            Executor executor,
            int maxRetries,
            long initialBackoffMs,
            long maxBackoffMs,
            double backoffMultiplier,
            double jitterFactor,
            Predicate<Throwable> isRetryablePredicate) {
        return attempt(operation, operationName, logger, executor, 0, maxRetries, initialBackoffMs,
            maxBackoffMs, backoffMultiplier, jitterFactor, isRetryablePredicate);
    }

    private static <T> CompletableFuture<T> attempt(
            Supplier<CompletableFuture<T>> operation,
            String operationName,
            Logger logger,
            Executor executor,
            int attempt,
            int maxRetries,
            long backoffMs,
            long maxBackoffMs,
            double backoffMultiplier,
            double jitterFactor,
            Predicate<Throwable> isRetryablePredicate) {
        CompletableFuture<T> current;
        try {
            current = operation.get();
        } catch (RuntimeException e) {
            current = CompletableFuture.failedFuture(e);
        }
        return current.exceptionallyCompose(ex -> {
            Throwable cause = unwrap(ex);
            boolean retryable = isRetryablePredicate == null || isRetryablePredicate.test(cause);
            if (attempt >= maxRetries || !retryable) {
                if (retryable) {
                    logger.warn("Operation '{}' failed after {} retries: {}", operationName, maxRetries, cause.getMessage());
                } else {
                    logger.debug("Operation '{}' failed with a non-retryable error on attempt {}: {}",
                        operationName, attempt + 1, cause.getMessage());
                }
                return CompletableFuture.failedFuture(cause);
            }

            long cappedBackoffMs = Math.min(backoffMs, maxBackoffMs);
            double boundedJitter = Math.max(0.0, Math.min(1.0, jitterFactor));
            long jitter = (long) (cappedBackoffMs * boundedJitter * (Math.random() * 2.0 - 1.0));
            long delayMs = Math.max(0, cappedBackoffMs + jitter);
            logger.warn("Operation '{}' failed on attempt {}/{}, retrying in {}ms: {}",
                operationName, attempt + 1, maxRetries + 1, delayMs, cause.getMessage());

            long nextBackoffMs = (long) (cappedBackoffMs * backoffMultiplier);
            CompletableFuture<T> retryFuture = new CompletableFuture<>();
            CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS, executor).execute(() ->
                AsyncUtils.<T>attempt(operation, operationName, logger, executor, attempt + 1, maxRetries,
                        nextBackoffMs, maxBackoffMs, backoffMultiplier, jitterFactor, isRetryablePredicate)
                    .whenComplete((result, failure) -> {
                        if (failure != null) {
                            retryFuture.completeExceptionally(failure);
                        } else {
                            retryFuture.complete(result);
                        }
                    }));
            return retryFuture;
        });
    }

    /**
     * Strips CompletionException and ExecutionException wrappers
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
