package br.edu.ifba.videorag.llm;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Per-call options for {@link LLMFunction#complete}.
 *
 * @param role which configured model serves the call
 * @param jsonMode request a strict JSON object response
 * @param temperature sampling temperature, or {@code null} for the provider default
 * @param maxTokens completion token limit, or {@code null} for the provider default
 */
public record CompletionOptions(
    @NotNull ModelRole role,
    boolean jsonMode,
    @Nullable Double temperature,
    @Nullable Integer maxTokens
) {

    public enum ModelRole {
        /** Extraction, reformulation, judging and other short structured calls. */
        INDEXER,
        /** Final answer synthesis. */
        GENERATOR
    }

    public static CompletionOptions defaults() {
        return new CompletionOptions(ModelRole.INDEXER, false, null, null);
    }

    public static CompletionOptions json() {
        return new CompletionOptions(ModelRole.INDEXER, true, 0.0, null);
    }

    public static CompletionOptions generator(double temperature) {
        return new CompletionOptions(ModelRole.GENERATOR, false, temperature, null);
    }

    public CompletionOptions withTemperature(double newTemperature) {
        return new CompletionOptions(role, jsonMode, newTemperature, maxTokens);
    }

    public CompletionOptions withMaxTokens(int newMaxTokens) {
        return new CompletionOptions(role, jsonMode, temperature, newMaxTokens);
    }
}
