package br.edu.ifba.videorag.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyLimiterTest {

    @Test
    @DisplayName("No more than the limit run at once and queued tasks start as permits free up")
    void testBound() {
        final ConcurrencyLimiter limiter = new ConcurrencyLimiter("llm", 2);
        final List<CompletableFuture<Integer>> gates = new ArrayList<>();
        final List<CompletableFuture<Integer>> results = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            gates.add(new CompletableFuture<>());
        }

        for (int i = 0; i < 5; i++) {
            final int index = i;
            results.add(limiter.submit(() -> gates.get(index)));
        }
        assertEquals(2, limiter.inFlight(), "Only two tasks may start");

        for (int i = 0; i < 5; i++) {
            gates.get(i).complete(i);
        }

        for (int i = 0; i < 5; i++) {
            assertEquals(i, results.get(i).join());
        }
        assertEquals(0, limiter.inFlight());
        assertTrue(limiter.peakInFlight() <= 2, "Peak was " + limiter.peakInFlight());
    }

    @Test
    @DisplayName("A failing task releases its permit and propagates the failure")
    void testFailureReleasesPermit() {
        final ConcurrencyLimiter limiter = new ConcurrencyLimiter("captioning", 1);

        final CompletableFuture<String> failed = limiter.submit(() -> {
            throw new IllegalStateException("boom");
        });
        final CompletableFuture<String> next = limiter.submit(() -> CompletableFuture.completedFuture("ok"));

        final CompletionException error = assertThrows(CompletionException.class, failed::join);
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals("ok", next.join());
        assertEquals(0, limiter.inFlight());
    }

    @Test
    @DisplayName("A long queue of synchronously completing tasks drains without deep recursion")
    void testLongQueueOfCompletedTasks() throws Exception {
        final ConcurrencyLimiter limiter = new ConcurrencyLimiter("embedding", 1);
        final CompletableFuture<Integer> gate = new CompletableFuture<>();
        final CompletableFuture<Integer> held = limiter.submit(() -> gate);

        final int queued = 20_000;
        final List<CompletableFuture<Integer>> results = new ArrayList<>(queued);
        for (int i = 0; i < queued; i++) {
            final int value = i;
            results.add(limiter.submit(() -> CompletableFuture.completedFuture(value)));
        }
        assertEquals(1, limiter.inFlight(), "Everything should wait behind the held task");

        gate.complete(-1);

        CompletableFuture.allOf(results.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
        assertEquals(-1, held.join());
        assertEquals(queued - 1, results.get(queued - 1).join());
        assertEquals(0, limiter.inFlight(), "All permits should be returned");
        assertEquals(1, limiter.peakInFlight());
    }

    @Test
    @DisplayName("Synchronous failures in a long queue release every permit")
    void testLongQueueOfFailedTasks() throws Exception {
        final ConcurrencyLimiter limiter = new ConcurrencyLimiter("captioning", 2);
        final CompletableFuture<String> gateA = new CompletableFuture<>();
        final CompletableFuture<String> gateB = new CompletableFuture<>();
        limiter.submit(() -> gateA);
        limiter.submit(() -> gateB);

        final List<CompletableFuture<String>> results = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            results.add(limiter.submit(() -> CompletableFuture.failedFuture(new IllegalStateException("no frames"))));
        }
        gateA.complete("a");
        gateB.complete("b");

        final CompletableFuture<Void> all = CompletableFuture.allOf(results.toArray(new CompletableFuture[0]));
        final ExecutionException error = assertThrows(ExecutionException.class, () -> all.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertTrue(results.stream().allMatch(CompletableFuture::isCompletedExceptionally));
        assertEquals(0, limiter.inFlight());
        assertEquals("ok", limiter.submit(() -> CompletableFuture.completedFuture("ok")).join());
    }

    @Test
    @DisplayName("A limit below one is rejected")
    void testInvalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> new ConcurrencyLimiter("media", 0));
    }
}
