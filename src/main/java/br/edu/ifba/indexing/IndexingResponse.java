package br.edu.ifba.indexing;

import java.util.List;

public record IndexingResponse(
    List<String> jobIds,
    String message,
    List<String> statusEndpoints
) {
    public IndexingResponse {
        jobIds = List.copyOf(jobIds);
        statusEndpoints = List.copyOf(statusEndpoints);
    }
}
