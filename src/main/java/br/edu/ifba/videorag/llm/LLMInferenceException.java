package br.edu.ifba.videorag.llm;

/**
 * Raised when a chat completion call fails or returns no usable content.
 */
public class LLMInferenceException extends RuntimeException {

    public LLMInferenceException(final String message) {
        super(message);
    }

    public LLMInferenceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
