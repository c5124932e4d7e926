package org.example.blueprint.service.llm;

/**
 * Exception thrown when an LLM provider encounters an error.
 * Carries the HTTP status when the provider answered with one.
 */
public class LlmProviderException extends RuntimeException {

    private final Integer statusCode;

    public LlmProviderException(String message) {
        this(message, null, null);
    }

    public LlmProviderException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public LlmProviderException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status returned by the provider, or null for transport-level failures
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
