package br.edu.ifba.videorag.embedding;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * Body of an OpenAI-compatible {@code /embeddings} call.
 */
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmbeddingRequest(
    String model,
    List<String> input
) {}
