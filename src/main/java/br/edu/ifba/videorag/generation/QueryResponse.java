package br.edu.ifba.videorag.generation;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.List;

public record QueryResponse(
    @JsonProperty("query") @NotNull String query,
    @JsonProperty("answer") @NotNull String answer,
    @JsonProperty("retrieved_sources") @NotNull List<ResponseSource> retrievedSources
) {

    public QueryResponse {
        retrievedSources = List.copyOf(retrievedSources);
    }
}
