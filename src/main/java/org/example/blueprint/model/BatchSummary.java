package org.example.blueprint.model;

import java.util.List;

/**
 * End-of-batch report handed back to the caller.
 *
 * @param submitted jobs dispatched by this run (a resumed run only counts what it resubmitted)
 * @param skipped   jobs with no recorded outcome when the run stopped
 */
public record BatchSummary(
        String batchId,
        BatchStatus status,
        int succeeded,
        int failed,
        int skipped,
        int total,
        int submitted,
        List<JobFailure> failures
) {

    public record JobFailure(
            String input,
            String errorMessage,
            int attempts,
            FailureKind kind
    ) {
    }

    public boolean allSucceeded() {
        return status == BatchStatus.COMPLETED && failed == 0 && succeeded == total;
    }
}
