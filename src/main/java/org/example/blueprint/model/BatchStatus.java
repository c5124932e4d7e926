package org.example.blueprint.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum BatchStatus {
    @JsonProperty("running")
    RUNNING,
    @JsonProperty("completed")
    COMPLETED,
    @JsonProperty("failed")
    FAILED,
    @JsonProperty("cancelled")
    CANCELLED;

    public boolean resumable() {
        return this != COMPLETED;
    }
}
