package br.edu.ifba.videorag.adapters;

import br.edu.ifba.videorag.chat.ChatMessage;
import br.edu.ifba.videorag.chat.LlmChatClient;
import br.edu.ifba.videorag.chat.LlmChatRequest;
import br.edu.ifba.videorag.core.VideoRAGProperties;
import br.edu.ifba.videorag.llm.CompletionOptions;
import br.edu.ifba.videorag.llm.LLMFunction;
import br.edu.ifba.videorag.llm.LLMInferenceException;
import br.edu.ifba.videorag.utils.Futures;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jboss.logging.Logger;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter that bridges the chat-completions REST client to the engine's {@link LLMFunction}.
 * The model is chosen by the call's role; failed calls are retried with exponential backoff.
 */
@ApplicationScoped
public class QuarkusLLMAdapter implements LLMFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusLLMAdapter.class);

    @Inject
    @RestClient
    LlmChatClient chatClient;

    @Inject
    VideoRAGProperties properties;

    @Override
    @Retry(maxRetries = 3, delay = 2, delayUnit = ChronoUnit.SECONDS, maxDuration = 3, durationUnit = ChronoUnit.MINUTES)
    @ExponentialBackoff(factor = 2, maxDelay = 30, maxDelayUnit = ChronoUnit.SECONDS)
    public CompletableFuture<String> complete(
            @NotNull final String prompt,
            @Nullable final String systemPrompt,
            @NotNull final CompletionOptions options) {

        final String model = modelFor(options.role());
        final List<ChatMessage> messages = new ArrayList<>(2);
        if (systemPrompt != null && !systemPrompt.isEmpty()) {
            messages.add(ChatMessage.system(systemPrompt));
        }
        messages.add(ChatMessage.user(prompt));

        final LlmChatRequest request = new LlmChatRequest(
            model, messages, options.maxTokens(), options.temperature(), options.jsonMode());

        LOG.debugf("LLM request - model: %s, prompt length: %d, json: %s, temperature: %s",
            model, prompt.length(), options.jsonMode(), options.temperature());

        return Futures.call(() -> chatClient.chat(request).toCompletableFuture())
            .handle((response, error) -> {
                if (error != null) {
                    throw new LLMInferenceException("LLM call to " + model + " failed: " + Futures.describe(error),
                        Futures.unwrap(error));
                }
                final String content = response.firstContent();
                if (content == null) {
                    throw new LLMInferenceException("LLM " + model + " returned no choices");
                }
                if (response.usage() != null) {
                    LOG.debugf("LLM response - length: %d, tokens: %s", content.length(), response.usage().totalTokens());
                }
                return content;
            });
    }

    private String modelFor(final CompletionOptions.ModelRole role) {
        return switch (role) {
            case INDEXER -> properties.models().indexer();
            case GENERATOR -> properties.models().generator();
        };
    }
}
