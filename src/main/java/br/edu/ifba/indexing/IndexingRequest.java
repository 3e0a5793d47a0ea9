package br.edu.ifba.indexing;

import jakarta.validation.constraints.NotBlank;

/**
 * @param videoPath path of a video file, or of a directory of videos, on the server's file system
 */
public record IndexingRequest(
    @NotBlank(message = "videoPath must not be blank")
    String videoPath
) {}
