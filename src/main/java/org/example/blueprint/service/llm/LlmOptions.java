package org.example.blueprint.service.llm;

/**
 * Options for LLM generation requests.
 */
public record LlmOptions(
    double temperature,
    Integer maxTokens,  // nullable
    String model        // nullable, overrides the provider default
) {
    public static LlmOptions withTemperature(double temp) {
        return new LlmOptions(temp, null, null);
    }

    public LlmOptions withModel(String modelOverride) {
        if (modelOverride == null || modelOverride.isBlank()) {
            return this;
        }
        return new LlmOptions(temperature, maxTokens, modelOverride);
    }

    String modelOr(String fallback) {
        return model == null || model.isBlank() ? fallback : model;
    }
}
