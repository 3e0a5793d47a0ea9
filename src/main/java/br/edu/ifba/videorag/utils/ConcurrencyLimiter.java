package br.edu.ifba.videorag.utils;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Non-blocking semaphore for asynchronous calls to one collaborator class.
 *
 * <p>At most {@code maxConcurrent} submitted tasks are in flight at any time; the rest wait in a
 * FIFO queue and start as permits are released. No thread is parked while waiting.</p>
 *
 * <p>Only one caller drains the queue at a time. A drain requested while another is running,
 * including one requested from a task that completed synchronously inside the loop, is picked up
 * by the running drain, so the stack depth stays constant however many tasks are queued.</p>
 */
public class ConcurrencyLimiter {

    private static final Logger logger = LoggerFactory.getLogger(ConcurrencyLimiter.class);

    private final String name;
    private final int maxConcurrent;
    private final Semaphore permits;
    private final Queue<Runnable> waiting = new ConcurrentLinkedQueue<>();
    private final AtomicInteger peakInFlight = new AtomicInteger();
    private final AtomicInteger drainRequests = new AtomicInteger();

    public ConcurrencyLimiter(@NotNull String name, int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1 for " + name);
        }
        this.name = name;
        this.maxConcurrent = maxConcurrent;
        this.permits = new Semaphore(maxConcurrent);
    }

    /**
     * Queues the task and starts it once a permit is available.
     *
     * @param task supplier invoked when the task starts; its future holds the permit until completion
     * @return future mirroring the task's outcome
     */
    @NotNull
    public <T> CompletableFuture<T> submit(@NotNull Supplier<CompletableFuture<T>> task) {
        final CompletableFuture<T> result = new CompletableFuture<>();
        waiting.add(() -> start(task, result));
        drain();
        return result;
    }

    private <T> void start(Supplier<CompletableFuture<T>> task, CompletableFuture<T> result) {
        peakInFlight.accumulateAndGet(inFlight(), Math::max);
        CompletableFuture<T> future;
        try {
            future = task.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        future.whenComplete((value, error) -> {
            permits.release();
            drain();
            if (error != null) {
                result.completeExceptionally(Futures.unwrap(error));
            } else {
                result.complete(value);
            }
        });
    }

    private void drain() {
        if (drainRequests.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        do {
            startQueued();
            missed = drainRequests.addAndGet(-missed);
        } while (missed != 0);
        if (!waiting.isEmpty()) {
            logger.trace("{} limiter saturated, {} task(s) queued", name, waiting.size());
        }
    }

    private void startQueued() {
        while (!waiting.isEmpty() && permits.tryAcquire()) {
            final Runnable next = waiting.poll();
            if (next == null) {
                permits.release();
                return;
            }
            next.run();
        }
    }

    @NotNull
    public String name() {
        return name;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public int inFlight() {
        return maxConcurrent - permits.availablePermits();
    }

    /**
     * Highest number of tasks observed in flight at once.
     */
    public int peakInFlight() {
        return peakInFlight.get();
    }
}
