package org.example.blueprint.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Run parameters captured when a batch is created. A resumed run reuses this record as-is.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchConfigSnapshot(
        @JsonProperty("concurrency") int concurrency,
        @JsonProperty("rate_limit") double callsPerSecond,
        @JsonProperty("max_retries") int maxRetries,
        @JsonProperty("continue_on_error") boolean continueOnError,
        @JsonProperty("mode") String mode,      // nullable
        @JsonProperty("model") String model     // nullable
) {

    public static final int DEFAULT_CONCURRENCY = 3;
    public static final int DEFAULT_MAX_RETRIES = 3;

    public BatchConfigSnapshot {
        concurrency = Math.max(1, concurrency);
        callsPerSecond = Math.max(0.0, callsPerSecond);
        maxRetries = Math.max(0, maxRetries);
    }

    public static BatchConfigSnapshot of(int concurrency, double callsPerSecond, int maxRetries, boolean continueOnError) {
        return new BatchConfigSnapshot(concurrency, callsPerSecond, maxRetries, continueOnError, null, null);
    }

    public boolean sequential() {
        return concurrency <= 1;
    }
}
