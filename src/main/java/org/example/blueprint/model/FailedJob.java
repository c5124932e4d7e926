package org.example.blueprint.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record FailedJob(
        @JsonProperty("input") String input,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("error_kind") FailureKind errorKind,   // absent in files written before classification was stored
        @JsonProperty("failed_at") Instant failedAt
) {
}
