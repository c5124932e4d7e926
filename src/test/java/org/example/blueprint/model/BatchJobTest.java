package org.example.blueprint.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class BatchJobTest {

    @Test
    void jobId_isStableShortHashOfInput() {
        BatchJob first = new BatchJob("a knight", 1);
        BatchJob again = new BatchJob("a knight", 7);

        assertEquals(12, first.jobId().length());
        assertEquals(first.jobId(), again.jobId());
        assertNotEquals(first.jobId(), new BatchJob("a bard", 1).jobId());
    }

    @Test
    void lifecycle_tracksAttemptsAndFailureKind() {
        BatchJob job = new BatchJob("a knight", 1);
        assertEquals(BatchJob.JobStatus.PENDING, job.status());

        job.markInFlight();
        job.recordAttempt(1);
        job.recordAttempt(2);
        job.markFailed(FailureKind.TRANSIENT);

        assertEquals(BatchJob.JobStatus.FAILED, job.status());
        assertEquals(2, job.attempts());
        assertEquals(FailureKind.TRANSIENT, job.lastFailureKind());
    }
}
