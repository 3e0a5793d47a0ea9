package br.edu.ifba.videorag.llm;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for chat completion.
 * Implementations handle the API calls to the LLM provider and fail the returned future
 * with {@link LLMInferenceException}.
 */
@FunctionalInterface
public interface LLMFunction {

    /**
     * Generate a completion from the LLM.
     *
     * @param prompt The user prompt
     * @param systemPrompt Optional system prompt for context
     * @param options Response mode, temperature, token limit and model role
     * @return CompletableFuture with the generated response text
     */
    CompletableFuture<String> complete(
        @NotNull String prompt,
        @Nullable String systemPrompt,
        @NotNull CompletionOptions options
    );

    /**
     * Convenience method for simple prompts without a system prompt.
     */
    default CompletableFuture<String> complete(@NotNull String prompt) {
        return complete(prompt, null, CompletionOptions.defaults());
    }
}
