package org.example.blueprint.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record CompletedJob(
        @JsonProperty("input") String input,
        @JsonProperty("result_location") String resultLocation,
        @JsonProperty("completed_at") Instant completedAt
) {
}
