package br.edu.ifba.videorag.core;

import br.edu.ifba.videorag.utils.Futures;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of one item inside a concurrent batch.
 *
 * <p>A degraded result still carries a usable value (the safe default the batch substituted),
 * together with the failure that caused the substitution. This keeps "empty because absent"
 * distinguishable from "empty because the collaborator failed".</p>
 *
 * @param <T> value type
 */
public record ItemResult<T>(
    @NotNull T value,
    boolean degraded,
    @Nullable String failure
) {

    @NotNull
    public static <T> ItemResult<T> ok(@NotNull T value) {
        return new ItemResult<>(value, false, null);
    }

    @NotNull
    public static <T> ItemResult<T> degraded(@NotNull T fallback, @NotNull Throwable cause) {
        return new ItemResult<>(fallback, true, Futures.describe(cause));
    }
}
