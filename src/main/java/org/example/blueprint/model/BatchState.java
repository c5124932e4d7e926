package org.example.blueprint.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Progress of one batch run. Serialized as the batch's state file.
 *
 * <p>Completed and failed inputs are kept in two disjoint maps keyed by the input text.
 * Mutators are synchronized on the instance; callers that need a consistent snapshot across a
 * mutation and a save hold the same monitor.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"batch_id", "start_time", "total_seeds", "completed", "failed",
        "current_index", "config_snapshot", "status", "input_file"})
public class BatchState {

    private final String batchId;
    private final Instant startTime;
    private final int totalJobCount;
    private final BatchConfigSnapshot configSnapshot;
    private final String inputFile;

    private final Map<String, CompletedJob> completed = new LinkedHashMap<>();
    private final Map<String, FailedJob> failed = new LinkedHashMap<>();
    private int currentIndex;
    private BatchStatus status;

    @JsonCreator
    public BatchState(
            @JsonProperty("batch_id") String batchId,
            @JsonProperty("start_time") Instant startTime,
            @JsonProperty("total_seeds") int totalJobCount,
            @JsonProperty("completed") List<CompletedJob> completed,
            @JsonProperty("failed") List<FailedJob> failed,
            @JsonProperty("current_index") int currentIndex,
            @JsonProperty("config_snapshot") BatchConfigSnapshot configSnapshot,
            @JsonProperty("status") BatchStatus status,
            @JsonProperty("input_file") String inputFile) {
        if (batchId == null || batchId.isBlank()) {
            throw new IllegalArgumentException("batch_id is required");
        }
        if (totalJobCount < 0) {
            throw new IllegalArgumentException("total_seeds must not be negative");
        }
        this.batchId = batchId;
        this.startTime = startTime != null ? startTime : Instant.now();
        this.totalJobCount = totalJobCount;
        this.configSnapshot = Objects.requireNonNull(configSnapshot, "config_snapshot is required");
        this.inputFile = inputFile;
        this.currentIndex = Math.max(0, currentIndex);
        this.status = status != null ? status : BatchStatus.RUNNING;
        if (completed != null) {
            completed.forEach(job -> this.completed.put(job.input(), job));
        }
        if (failed != null) {
            for (FailedJob job : failed) {
                if (this.completed.containsKey(job.input())) {
                    throw new IllegalArgumentException("Input recorded as both completed and failed: " + job.input());
                }
                this.failed.put(job.input(), job);
            }
        }
    }

    public static BatchState create(int totalJobCount, BatchConfigSnapshot configSnapshot, String inputFile) {
        return create(UUID.randomUUID().toString(), totalJobCount, configSnapshot, inputFile);
    }

    public static BatchState create(String batchId, int totalJobCount, BatchConfigSnapshot configSnapshot, String inputFile) {
        return new BatchState(batchId, Instant.now(), totalJobCount, List.of(), List.of(), 0,
                configSnapshot, BatchStatus.RUNNING, inputFile);
    }

    public synchronized void markCompleted(String input, String resultLocation) {
        if (failed.containsKey(input)) {
            throw new IllegalStateException("Input already recorded as failed: " + input);
        }
        completed.put(input, new CompletedJob(input, resultLocation, Instant.now()));
        currentIndex++;
    }

    public synchronized void markFailed(String input, String errorMessage, int attempts, FailureKind errorKind) {
        if (completed.containsKey(input)) {
            throw new IllegalStateException("Input already recorded as completed: " + input);
        }
        failed.put(input, new FailedJob(input, errorMessage, attempts, errorKind, Instant.now()));
        currentIndex++;
    }

    public synchronized boolean isProcessed(String input) {
        return completed.containsKey(input) || failed.containsKey(input);
    }

    /**
     * Filters {@code allInputs} down to the inputs with no recorded outcome, preserving order.
     */
    public synchronized List<String> remainingInputs(List<String> allInputs) {
        Set<String> remaining = new LinkedHashSet<>();
        for (String input : allInputs) {
            if (!isProcessed(input)) {
                remaining.add(input);
            }
        }
        return new ArrayList<>(remaining);
    }

    @JsonProperty("batch_id")
    public String getBatchId() {
        return batchId;
    }

    @JsonProperty("start_time")
    public Instant getStartTime() {
        return startTime;
    }

    @JsonProperty("total_seeds")
    public int getTotalJobCount() {
        return totalJobCount;
    }

    @JsonProperty("completed")
    public synchronized List<CompletedJob> getCompleted() {
        return List.copyOf(completed.values());
    }

    @JsonProperty("failed")
    public synchronized List<FailedJob> getFailed() {
        return List.copyOf(failed.values());
    }

    @JsonProperty("current_index")
    public synchronized int getCurrentIndex() {
        return currentIndex;
    }

    @JsonProperty("config_snapshot")
    public BatchConfigSnapshot getConfigSnapshot() {
        return configSnapshot;
    }

    @JsonProperty("status")
    public synchronized BatchStatus getStatus() {
        return status;
    }

    public synchronized void setStatus(BatchStatus status) {
        this.status = Objects.requireNonNull(status);
    }

    @JsonProperty("input_file")
    public String getInputFile() {
        return inputFile;
    }

    @JsonIgnore
    public synchronized int getSucceededCount() {
        return completed.size();
    }

    @JsonIgnore
    public synchronized int getFailedCount() {
        return failed.size();
    }

    @JsonIgnore
    public synchronized int getProcessedCount() {
        return completed.size() + failed.size();
    }
}
