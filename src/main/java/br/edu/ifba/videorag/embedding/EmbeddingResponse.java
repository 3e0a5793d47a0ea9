package br.edu.ifba.videorag.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

@RegisterForReflection
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingResponse(
    String model,
    List<Embedding> data
) {

    @RegisterForReflection
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Embedding(
        List<Double> embedding,
        Integer index
    ) {}
}
