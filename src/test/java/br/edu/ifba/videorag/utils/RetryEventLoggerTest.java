package br.edu.ifba.videorag.utils;

import br.edu.ifba.videorag.llm.LLMInferenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link RetryEventLogger}.
 *
 * <p>The MDC keys are only set while the event is logged, so every test checks that they
 * are gone afterwards.</p>
 */
class RetryEventLoggerTest {

    private static final RetryScope CHUNK = RetryScope.graphBuild("lecture_chunk_0003");

    private RetryEventLogger logger;

    @BeforeEach
    void setUp() {
        logger = new RetryEventLogger();
        MDC.clear();
    }

    private static void assertRetryKeysCleared() {
        assertNull(MDC.get(RetryEventLogger.MDC_STAGE), "Stage should be cleared after logging");
        assertNull(MDC.get(RetryEventLogger.MDC_ITEM), "Item should be cleared after logging");
        assertNull(MDC.get(RetryEventLogger.MDC_ATTEMPT), "Attempt should be cleared after logging");
        assertNull(MDC.get(RetryEventLogger.MDC_FAILURE), "Failure should be cleared after logging");
    }

    @Nested
    @DisplayName("Failed attempts")
    class AttemptFailedTests {

        @Test
        @DisplayName("attemptFailed clears its MDC context")
        void testAttemptFailedClearsMDC() {
            logger.attemptFailed(CHUNK, 1, 3, Duration.ofSeconds(5), new LLMInferenceException("timeout"));

            assertRetryKeysCleared();
        }

        @Test
        @DisplayName("attemptFailed handles a null failure")
        void testNullFailure() {
            logger.attemptFailed(CHUNK, 2, 3, Duration.ofSeconds(10), null);

            assertRetryKeysCleared();
        }

        @Test
        @DisplayName("The job id set by the indexing worker survives")
        void testJobIdKept() {
            MDC.put("job.id", "job-1");

            logger.attemptFailed(CHUNK, 1, 3, Duration.ZERO, new RuntimeException("boom"));

            assertEquals("job-1", MDC.get("job.id"));
            MDC.remove("job.id");
        }
    }

    @Nested
    @DisplayName("Abandoned and recovered items")
    class OutcomeLoggingTests {

        @Test
        @DisplayName("abandoned clears its MDC context")
        void testAbandoned() {
            logger.abandoned(CHUNK, 3, new IllegalStateException("still broken"));

            assertRetryKeysCleared();
        }

        @Test
        @DisplayName("recovered is silent on the first attempt and clears MDC otherwise")
        void testRecovered() {
            logger.recovered(CHUNK, 1);
            logger.recovered(CHUNK, 2);

            assertRetryKeysCleared();
        }
    }

    @Nested
    @DisplayName("Failure description")
    class DescribeTests {

        @Test
        @DisplayName("Long messages are cut to 200 characters plus an ellipsis")
        void testLongMessage() {
            final String described = RetryEventLogger.describe(new LLMInferenceException("x".repeat(500)));

            assertEquals("LLMInferenceException: ".length() + 203, described.length());
            assertTrue(described.endsWith("..."));
        }

        @Test
        @DisplayName("Short, blank and missing failures")
        void testShortMessage() {
            assertEquals("LLMInferenceException: timeout", RetryEventLogger.describe(new LLMInferenceException("timeout")));
            assertEquals("IllegalStateException", RetryEventLogger.describe(new IllegalStateException()));
            assertEquals("no failure recorded", RetryEventLogger.describe(null));
        }
    }

    @Nested
    @DisplayName("Retry scope")
    class ScopeTests {

        @Test
        @DisplayName("Reads as stage of item")
        void testToString() {
            assertEquals("graph-build of lecture_chunk_0003", CHUNK.toString());
        }

        @Test
        @DisplayName("Stage and item are required")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new RetryScope(" ", "lecture_chunk_0003"));
            assertThrows(IllegalArgumentException.class, () -> new RetryScope(RetryScope.GRAPH_BUILD, ""));
        }
    }
}
