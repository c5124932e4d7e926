package org.example.blueprint.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One unit of work inside a running batch. Lives only as long as the run; its outcome is what
 * gets persisted.
 */
public final class BatchJob {

    public enum JobStatus {
        PENDING,
        IN_FLIGHT,
        SUCCEEDED,
        FAILED
    }

    private final String jobId;
    private final String input;
    private final int position;

    private volatile JobStatus status = JobStatus.PENDING;
    private volatile int attempts;
    private volatile FailureKind lastFailureKind;

    public BatchJob(String input, int position) {
        this.input = input;
        this.position = position;
        this.jobId = deriveId(input);
    }

    static String deriveId(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 6);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String jobId() {
        return jobId;
    }

    public String input() {
        return input;
    }

    public int position() {
        return position;
    }

    public JobStatus status() {
        return status;
    }

    public int attempts() {
        return attempts;
    }

    public FailureKind lastFailureKind() {
        return lastFailureKind;
    }

    public void markInFlight() {
        status = JobStatus.IN_FLIGHT;
    }

    public void recordAttempt(int attempt) {
        attempts = attempt;
    }

    public void markSucceeded() {
        status = JobStatus.SUCCEEDED;
    }

    public void markFailed(FailureKind kind) {
        lastFailureKind = kind;
        status = JobStatus.FAILED;
    }

    @Override
    public String toString() {
        return "BatchJob[" + jobId + " #" + position + " " + status + "]";
    }
}
