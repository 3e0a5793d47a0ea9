package br.edu.ifba.videorag.adapters;

import br.edu.ifba.videorag.chat.ChatMessage;
import br.edu.ifba.videorag.chat.LlmChatRequest;
import br.edu.ifba.videorag.chat.VlmChatClient;
import br.edu.ifba.videorag.core.VideoRAGProperties;
import br.edu.ifba.videorag.media.CaptioningException;
import br.edu.ifba.videorag.media.CaptioningFunction;
import br.edu.ifba.videorag.utils.Futures;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jetbrains.annotations.NotNull;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter that captions frames with a vision-language chat model. Frames are sent inline as
 * base64 JPEG data URLs after the text prompt.
 */
@ApplicationScoped
public class QuarkusCaptioningAdapter implements CaptioningFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusCaptioningAdapter.class);
    private static final int CAPTION_MAX_TOKENS = 1024;

    @Inject
    @RestClient
    VlmChatClient vlmClient;

    @Inject
    VideoRAGProperties properties;

    @Override
    public CompletableFuture<String> caption(@NotNull final List<Path> framePaths, @NotNull final String prompt) {
        if (framePaths.isEmpty()) {
            return CompletableFuture.failedFuture(new CaptioningException("No frames to caption"));
        }
        final List<String> images;
        try {
            images = toDataUrls(framePaths);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new CaptioningException("Cannot read frames: " + e.getMessage(), e));
        }

        final String model = properties.models().vlm();
        final LlmChatRequest request = new LlmChatRequest(
            model, List.of(ChatMessage.userWithImages(prompt, images)), CAPTION_MAX_TOKENS, null, false);
        LOG.debugf("Caption request - model: %s, frames: %d", model, framePaths.size());

        return Futures.call(() -> vlmClient.chat(request).toCompletableFuture())
            .handle((response, error) -> {
                if (error != null) {
                    throw new CaptioningException("Captioning call failed: " + Futures.describe(error),
                        Futures.unwrap(error));
                }
                final String caption = response.firstContent();
                if (caption == null || caption.isBlank()) {
                    throw new CaptioningException("Captioning model " + model + " returned no caption");
                }
                return caption.strip();
            });
    }

    private static List<String> toDataUrls(final List<Path> framePaths) throws IOException {
        final List<String> urls = new ArrayList<>(framePaths.size());
        for (final Path frame : framePaths) {
            urls.add("data:image/jpeg;base64," + Base64.getEncoder().encodeToString(Files.readAllBytes(frame)));
        }
        return urls;
    }
}
