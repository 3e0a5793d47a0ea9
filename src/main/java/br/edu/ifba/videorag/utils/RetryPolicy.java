package br.edu.ifba.videorag.utils;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff, invoked explicitly around an asynchronous unit of work.
 *
 * <p>After the n-th failed attempt (1-based) the policy waits
 * {@code baseDelay * backoffFactor^(n-1)} before trying again, up to {@code maxAttempts}
 * attempts in total. The last failure is propagated unchanged.</p>
 *
 * <pre>{@code
 * RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(5), 2.0);
 * policy.execute(RetryScope.graphBuild(chunkId), () -> processChunk(chunk));
 * }</pre>
 */
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final double backoffFactor;
    private final RetryEventLogger eventLogger;

    public RetryPolicy(int maxAttempts, @NotNull Duration baseDelay, double backoffFactor) {
        this(maxAttempts, baseDelay, backoffFactor, new RetryEventLogger());
    }

    public RetryPolicy(int maxAttempts, @NotNull Duration baseDelay, double backoffFactor, @NotNull RetryEventLogger eventLogger) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1.0");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.backoffFactor = backoffFactor;
        this.eventLogger = eventLogger;
    }

    /**
     * Policy that runs the work exactly once.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay applied after the given failed attempt.
     *
     * @param failedAttempt 1-based number of the attempt that failed
     */
    @NotNull
    public Duration delayAfter(int failedAttempt) {
        final double millis = baseDelay.toMillis() * Math.pow(backoffFactor, failedAttempt - 1);
        return Duration.ofMillis(Math.round(millis));
    }

    /**
     * Runs {@code work}, retrying failed futures (and synchronous exceptions thrown by the supplier).
     *
     * @param scope stage and item the work belongs to, used in retry logs
     * @param work supplier of a fresh attempt
     * @return future of the first successful attempt, or failed with the last attempt's error
     */
    @NotNull
    public <T> CompletableFuture<T> execute(@NotNull RetryScope scope, @NotNull Supplier<CompletableFuture<T>> work) {
        final CompletableFuture<T> result = new CompletableFuture<>();
        attempt(scope, work, 1, result);
        return result;
    }

    private <T> void attempt(RetryScope scope, Supplier<CompletableFuture<T>> work, int attempt, CompletableFuture<T> result) {
        CompletableFuture<T> future;
        try {
            future = work.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        future.whenComplete((value, error) -> {
            if (error == null) {
                eventLogger.recovered(scope, attempt);
                result.complete(value);
                return;
            }
            final Throwable cause = Futures.unwrap(error);
            if (attempt >= maxAttempts) {
                if (maxAttempts > 1) {
                    eventLogger.abandoned(scope, attempt, cause);
                }
                result.completeExceptionally(cause);
                return;
            }
            final Duration delay = delayAfter(attempt);
            eventLogger.attemptFailed(scope, attempt, maxAttempts, delay, cause);
            final long delayMillis = delay.toMillis();
            final Executor delayed = delayMillis > 0
                ? CompletableFuture.delayedExecutor(delayMillis, TimeUnit.MILLISECONDS)
                : Runnable::run;
            delayed.execute(() -> attempt(scope, work, attempt + 1, result));
        });
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxAttempts=" + maxAttempts + ", baseDelay=" + baseDelay + ", backoffFactor=" + backoffFactor + "]";
    }
}
