package org.example.blueprint.service.llm;

/**
 * A text generation backend that compiles one seed prompt per call.
 * Implementations block until the backend answers or their own timeout elapses.
 */
public interface LlmProvider {

    /**
     * @param systemPrompt compiler instructions, or null to send the user prompt alone
     * @param options      sampling parameters and an optional model override
     * @return the raw generated text, never null
     * @throws LlmProviderException on transport failures, HTTP errors (with status code) or
     *                              a payload that holds no generated text
     */
    String generate(String systemPrompt, String prompt, LlmOptions options);

    /** Cheap readiness probe; false when credentials are missing or the backend is unreachable. */
    boolean isAvailable();

    /** Short backend name recorded in draft metadata and log lines. */
    String getProviderName();
}
