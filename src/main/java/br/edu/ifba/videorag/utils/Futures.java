package br.edu.ifba.videorag.utils;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Helpers for joining batches of {@link CompletableFuture}s.
 */
public final class Futures {

    private Futures() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Waits for every future and collects the results in input order.
     * Fails as soon as the join completes if any element failed.
     */
    @NotNull
    public static <T> CompletableFuture<List<T>> allOf(@NotNull List<CompletableFuture<T>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .thenApply(v -> futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList()));
    }

    /**
     * Invokes an asynchronous call, turning a synchronous throw into a failed future.
     */
    @NotNull
    public static <T> CompletableFuture<T> call(@NotNull Supplier<CompletableFuture<T>> call) {
        try {
            final CompletableFuture<T> future = call.get();
            return future != null
                ? future
                : CompletableFuture.failedFuture(new IllegalStateException("Asynchronous call returned no future"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Strips the {@link CompletionException}/{@link ExecutionException} wrappers added by the futures API.
     */
    @NotNull
    public static Throwable unwrap(@NotNull Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Formats a failure as {@code "ExceptionType: message"}.
     */
    @NotNull
    public static String describe(@NotNull Throwable throwable) {
        final Throwable root = unwrap(throwable);
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }
}
