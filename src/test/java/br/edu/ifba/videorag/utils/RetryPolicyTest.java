package br.edu.ifba.videorag.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private static final RetryScope SCOPE = RetryScope.graphBuild("demo_chunk_0000");

    @Nested
    @DisplayName("Backoff schedule")
    class BackoffTests {

        @Test
        @DisplayName("Delay after attempt n is base times factor to the n-1")
        void testDelays() {
            final RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(5), 2.0);

            assertEquals(Duration.ofSeconds(5), policy.delayAfter(1));
            assertEquals(Duration.ofSeconds(10), policy.delayAfter(2));
            assertEquals(Duration.ofSeconds(20), policy.delayAfter(3));
        }

        @Test
        @DisplayName("Invalid settings are rejected")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, 1.0));
            assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, Duration.ofSeconds(-1), 2.0));
            assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, Duration.ZERO, 0.5));
        }
    }

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        @Test
        @DisplayName("Succeeds on a later attempt")
        void testEventualSuccess() {
            final AtomicInteger calls = new AtomicInteger();
            final RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1), 2.0);

            final String result = policy.execute(SCOPE, () -> calls.incrementAndGet() < 3
                ? CompletableFuture.<String>failedFuture(new IllegalStateException("flaky"))
                : CompletableFuture.completedFuture("done")).join();

            assertEquals("done", result);
            assertEquals(3, calls.get());
        }

        @Test
        @DisplayName("Propagates the last failure after exhausting attempts")
        void testExhaustion() {
            final AtomicInteger calls = new AtomicInteger();
            final RetryPolicy policy = new RetryPolicy(2, Duration.ZERO, 1.0);

            final CompletionException error = assertThrows(CompletionException.class, () -> policy.execute(SCOPE,
                () -> CompletableFuture.failedFuture(new IllegalStateException("attempt " + calls.incrementAndGet()))).join());

            assertEquals(2, calls.get());
            assertInstanceOf(IllegalStateException.class, error.getCause());
            assertEquals("attempt 2", error.getCause().getMessage());
        }

        @Test
        @DisplayName("Each failed attempt is reported with its scope and backoff")
        void testEventsCarryScope() {
            final List<String> events = new ArrayList<>();
            final RetryEventLogger recorder = new RetryEventLogger() {
                @Override
                public void attemptFailed(RetryScope scope, int attempt, int maxAttempts, Duration nextAttemptIn, Throwable failure) {
                    events.add("failed " + scope.itemId() + " " + attempt + "/" + maxAttempts + " +" + nextAttemptIn.toMillis());
                }

                @Override
                public void abandoned(RetryScope scope, int attempts, Throwable failure) {
                    events.add("abandoned " + scope.itemId() + " " + attempts);
                }

                @Override
                public void recovered(RetryScope scope, int attempts) {
                    events.add("recovered " + scope.itemId() + " " + attempts);
                }
            };
            final AtomicInteger calls = new AtomicInteger();
            final RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(2), 2.0, recorder);

            policy.execute(SCOPE, () -> calls.incrementAndGet() < 3
                ? CompletableFuture.<String>failedFuture(new IllegalStateException("flaky"))
                : CompletableFuture.completedFuture("done")).join();

            assertEquals(List.of(
                "failed demo_chunk_0000 1/3 +2",
                "failed demo_chunk_0000 2/3 +4",
                "recovered demo_chunk_0000 3"), events);
        }

        @Test
        @DisplayName("A supplier that throws counts as a failed attempt")
        void testSynchronousThrow() {
            final AtomicInteger calls = new AtomicInteger();

            final CompletionException error = assertThrows(CompletionException.class, () -> RetryPolicy.noRetry()
                .execute(SCOPE, () -> {
                    calls.incrementAndGet();
                    throw new IllegalArgumentException("bad input");
                }).join());

            assertEquals(1, calls.get());
            assertInstanceOf(IllegalArgumentException.class, error.getCause());
        }
    }
}
