package org.example.blueprint.service;

/**
 * A batch cannot be resumed because its state file is missing or unreadable. Starting a fresh
 * batch instead would redo completed work, so the operator has to decide.
 */
public class BatchStateUnavailableException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        CORRUPT
    }

    private final String batchId;
    private final Reason reason;

    public BatchStateUnavailableException(String batchId, Reason reason, String message) {
        super(message);
        this.batchId = batchId;
        this.reason = reason;
    }

    public String getBatchId() {
        return batchId;
    }

    public Reason getReason() {
        return reason;
    }
}
