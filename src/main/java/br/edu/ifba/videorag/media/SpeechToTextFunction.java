package br.edu.ifba.videorag.media;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Speech-to-text collaborator. Fails the returned future with {@link TranscriptionException}.
 */
@FunctionalInterface
public interface SpeechToTextFunction {

    CompletableFuture<String> transcribe(@NotNull Path clipPath);
}
