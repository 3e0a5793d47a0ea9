package br.edu.ifba.videorag.adapters;

import br.edu.ifba.videorag.core.VideoRAGProperties;
import br.edu.ifba.videorag.media.SpeechToTextClient;
import br.edu.ifba.videorag.media.SpeechToTextFunction;
import br.edu.ifba.videorag.media.TranscriptionException;
import br.edu.ifba.videorag.utils.Futures;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jetbrains.annotations.NotNull;
import org.jboss.logging.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter that uploads a clip to the speech-to-text endpoint and returns the plain transcript.
 */
@ApplicationScoped
public class QuarkusSpeechToTextAdapter implements SpeechToTextFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusSpeechToTextAdapter.class);
    private static final String RESPONSE_FORMAT = "text";

    @Inject
    @RestClient
    SpeechToTextClient speechToTextClient;

    @Inject
    VideoRAGProperties properties;

    @Override
    public CompletableFuture<String> transcribe(@NotNull final Path clipPath) {
        if (!Files.isRegularFile(clipPath)) {
            return CompletableFuture.failedFuture(new TranscriptionException("Clip not found: " + clipPath));
        }
        LOG.debugf("Transcribing %s", clipPath);
        return Futures.call(() -> speechToTextClient.transcribe(
                clipPath.toFile(),
                properties.models().speechToText(),
                RESPONSE_FORMAT,
                properties.models().transcriptionLanguage()).toCompletableFuture())
            .handle((text, error) -> {
                if (error != null) {
                    throw new TranscriptionException("Transcription of " + clipPath.getFileName() + " failed: "
                        + Futures.describe(error), Futures.unwrap(error));
                }
                return text == null ? "" : text.strip();
            });
    }
}
