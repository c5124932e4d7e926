package org.example.blueprint.service;

import org.example.blueprint.model.FailureKind;

/**
 * Terminal failure of one job: a permanent error, a transient one that outlived its retries, or an
 * interruption that ended the attempt before it had an outcome.
 */
public class JobExecutionException extends RuntimeException {

    private final FailureKind failureKind;
    private final int attempts;
    private final boolean interrupted;

    public JobExecutionException(String message, FailureKind failureKind, int attempts, Throwable cause) {
        this(message, failureKind, attempts, false, cause);
    }

    private JobExecutionException(String message, FailureKind failureKind, int attempts, boolean interrupted,
                                  Throwable cause) {
        super(message, cause);
        this.failureKind = failureKind;
        this.attempts = attempts;
        this.interrupted = interrupted;
    }

    public static JobExecutionException interrupted(String message, int attempts, Throwable cause) {
        return new JobExecutionException(message, FailureKind.PERMANENT, attempts, true, cause);
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean retriesExhausted() {
        return !interrupted && failureKind == FailureKind.TRANSIENT;
    }

    /**
     * True when the job was stopped by an interrupt rather than by an error of its own.
     */
    public boolean isInterrupted() {
        return interrupted;
    }
}
