package br.edu.ifba.videorag.utils;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Logs what {@link RetryPolicy} does with a failing stage item.
 *
 * <h2>MDC Context:</h2>
 * <ul>
 *   <li><code>retry.stage</code> - pipeline stage, e.g. {@code graph-build}</li>
 *   <li><code>retry.item</code> - chunk, clip or video id the attempt worked on</li>
 *   <li><code>retry.attempt</code> - attempt number (1-based)</li>
 *   <li><code>retry.failure</code> - simple name of the exception, when there is one</li>
 * </ul>
 *
 * <h2>Log Format Example:</h2>
 * <pre>
 * INFO  graph-build of demo_chunk_0002 failed on attempt 1/3 (LLMInferenceException: timeout), next attempt in 5000 ms
 * WARN  graph-build of demo_chunk_0002 abandoned after 3 attempts (LLMInferenceException: timeout)
 * INFO  graph-build of demo_chunk_0002 recovered on attempt 2
 * </pre>
 *
 * <p>Keys are removed once the line is written; keys set by the caller, such as {@code job.id},
 * are left alone.</p>
 */
public class RetryEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(RetryEventLogger.class);

    static final String MDC_STAGE = "retry.stage";
    static final String MDC_ITEM = "retry.item";
    static final String MDC_ATTEMPT = "retry.attempt";
    static final String MDC_FAILURE = "retry.failure";

    private static final int MAX_FAILURE_LENGTH = 200;

    /**
     * An attempt failed and another one is scheduled.
     *
     * @param attempt the attempt that just failed (1-based)
     * @param nextAttemptIn backoff before the next attempt
     */
    public void attemptFailed(
            @NotNull RetryScope scope,
            int attempt,
            int maxAttempts,
            @NotNull Duration nextAttemptIn,
            @Nullable Throwable failure) {
        withContext(scope, attempt, failure, () -> logger.info("{} failed on attempt {}/{} ({}), next attempt in {} ms",
            scope, attempt, maxAttempts, describe(failure), nextAttemptIn.toMillis()));
    }

    /**
     * The last allowed attempt failed; the item's failure goes back to the caller.
     */
    public void abandoned(@NotNull RetryScope scope, int attempts, @Nullable Throwable failure) {
        withContext(scope, attempts, failure, () -> logger.warn("{} abandoned after {} attempts ({})",
            scope, attempts, describe(failure)));
    }

    /**
     * The item succeeded after at least one failed attempt. First-attempt successes are not logged.
     */
    public void recovered(@NotNull RetryScope scope, int attempts) {
        if (attempts <= 1) {
            return;
        }
        withContext(scope, attempts, null, () -> logger.info("{} recovered on attempt {}", scope, attempts));
    }

    private static void withContext(RetryScope scope, int attempt, @Nullable Throwable failure, Runnable log) {
        try {
            MDC.put(MDC_STAGE, scope.stage());
            MDC.put(MDC_ITEM, scope.itemId());
            MDC.put(MDC_ATTEMPT, String.valueOf(attempt));
            if (failure != null) {
                MDC.put(MDC_FAILURE, failure.getClass().getSimpleName());
            }
            log.run();
        } finally {
            MDC.remove(MDC_STAGE);
            MDC.remove(MDC_ITEM);
            MDC.remove(MDC_ATTEMPT);
            MDC.remove(MDC_FAILURE);
        }
    }

    /**
     * {@code SimpleName: message}, with the message cut to 200 characters.
     */
    @NotNull
    static String describe(@Nullable Throwable failure) {
        if (failure == null) {
            return "no failure recorded";
        }
        final String message = failure.getMessage();
        if (message == null || message.isBlank()) {
            return failure.getClass().getSimpleName();
        }
        final String shortened = message.length() <= MAX_FAILURE_LENGTH
            ? message
            : message.substring(0, MAX_FAILURE_LENGTH) + "...";
        return failure.getClass().getSimpleName() + ": " + shortened;
    }
}
