package br.edu.ifba.query;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record QueryRequest(
    @NotBlank(message = "Query is required")
    @Size(min = 3, max = 512, message = "Query must be between 3 and 512 characters")
    String query
) {}
