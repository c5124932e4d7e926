package org.example.blueprint.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchStateTest {

    private static final BatchConfigSnapshot CONFIG = BatchConfigSnapshot.of(2, 1.0, 3, true);

    @Test
    void create_startsRunningWithNoProgress() {
        BatchState state = BatchState.create(4, CONFIG, "seeds.txt");

        assertFalse(state.getBatchId().isBlank());
        assertEquals(BatchStatus.RUNNING, state.getStatus());
        assertEquals(4, state.getTotalJobCount());
        assertEquals(0, state.getCurrentIndex());
        assertEquals(0, state.getProcessedCount());
        assertEquals("seeds.txt", state.getInputFile());
    }

    @Test
    void markCompletedAndFailed_trackOutcomes() {
        BatchState state = BatchState.create("b1", 3, CONFIG, null);

        state.markCompleted("a", "drafts/a");
        state.markFailed("b", "Invalid API key", 1, FailureKind.PERMANENT);

        assertTrue(state.isProcessed("a"));
        assertTrue(state.isProcessed("b"));
        assertFalse(state.isProcessed("c"));
        assertEquals(1, state.getSucceededCount());
        assertEquals(1, state.getFailedCount());
        assertEquals(2, state.getCurrentIndex());
        assertEquals("drafts/a", state.getCompleted().get(0).resultLocation());
        assertEquals(FailureKind.PERMANENT, state.getFailed().get(0).errorKind());
    }

    @Test
    void outcomes_stayDisjoint() {
        BatchState state = BatchState.create("b1", 2, CONFIG, null);
        state.markCompleted("a", "drafts/a");
        state.markFailed("b", "boom", 1, FailureKind.PERMANENT);

        assertThrows(IllegalStateException.class, () -> state.markFailed("a", "late", 1, FailureKind.PERMANENT));
        assertThrows(IllegalStateException.class, () -> state.markCompleted("b", "drafts/b"));
        assertEquals(1, state.getSucceededCount());
        assertEquals(1, state.getFailedCount());
    }

    @Test
    void constructor_rejectsInputInBothLists() {
        Instant now = Instant.now();
        List<CompletedJob> completed = List.of(new CompletedJob("a", "drafts/a", now));
        List<FailedJob> failed = List.of(new FailedJob("a", "boom", 2, FailureKind.TRANSIENT, now));

        assertThrows(IllegalArgumentException.class,
                () -> new BatchState("b1", now, 1, completed, failed, 2, CONFIG, BatchStatus.RUNNING, null));
    }

    @Test
    void constructor_requiresIdAndConfig() {
        assertThrows(IllegalArgumentException.class, () -> BatchState.create(" ", 1, CONFIG, null));
        assertThrows(NullPointerException.class, () -> BatchState.create("b1", 1, null, null));
    }

    @Test
    void remainingInputs_skipsProcessedAndKeepsOrder() {
        BatchState state = BatchState.create("b1", 5, CONFIG, null);
        state.markCompleted("two", "drafts/two");
        state.markFailed("four", "boom", 1, FailureKind.PERMANENT);

        List<String> remaining = state.remainingInputs(List.of("one", "two", "three", "four", "five", "one"));

        assertEquals(List.of("one", "three", "five"), remaining);
    }

    @Test
    void remainingInputs_scalesToLargeInputFiles() {
        List<String> inputs = new ArrayList<>();
        for (int i = 0; i < 200_000; i++) {
            inputs.add("seed-" + (i % 100_000));
        }
        BatchState state = BatchState.create("big", 100_000, CONFIG, null);
        state.markCompleted("seed-0", "drafts/seed-0");

        List<String> remaining = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> state.remainingInputs(inputs));

        assertEquals(99_999, remaining.size());
        assertEquals("seed-1", remaining.get(0));
        assertEquals("seed-99999", remaining.get(remaining.size() - 1));
    }

    @Test
    void status_resumableUnlessCompleted() {
        assertTrue(BatchStatus.RUNNING.resumable());
        assertTrue(BatchStatus.FAILED.resumable());
        assertTrue(BatchStatus.CANCELLED.resumable());
        assertFalse(BatchStatus.COMPLETED.resumable());
    }

    @Test
    void configSnapshot_clampsOutOfRangeValues() {
        BatchConfigSnapshot config = BatchConfigSnapshot.of(0, -2.0, -1, false);

        assertEquals(1, config.concurrency());
        assertEquals(0.0, config.callsPerSecond());
        assertEquals(0, config.maxRetries());
        assertTrue(config.sequential());
    }
}
