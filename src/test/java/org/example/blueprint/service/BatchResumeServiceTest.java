package org.example.blueprint.service;

import org.example.blueprint.model.BatchConfigSnapshot;
import org.example.blueprint.model.BatchState;
import org.example.blueprint.model.BatchStatus;
import org.example.blueprint.model.BatchSummary;
import org.example.blueprint.model.FailureKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchResumeServiceTest {

    private static final List<String> SEEDS = IntStream.rangeClosed(1, 10).mapToObj(i -> "seed-" + i).toList();

    @Mock
    private GenerationJobExecutor jobExecutor;

    @TempDir
    Path tempDir;

    private BatchStateStore stateStore;
    private BatchResumeService resumeService;

    @BeforeEach
    void setUp() {
        GenerationErrorClassifier classifier = new GenerationErrorClassifier();
        stateStore = new BatchStateStore(tempDir.resolve("state"), Clock.systemUTC());
        RetryExecutor retryExecutor = new RetryExecutor(classifier, 0, 0, millis -> { }, () -> 0.5);
        BatchCompilationService compilationService =
                new BatchCompilationService(stateStore, retryExecutor, jobExecutor, classifier, 5, true);
        resumeService = new BatchResumeService(stateStore, compilationService);
    }

    private BatchState interruptedBatch(String batchId, int completedCount, BatchConfigSnapshot config) {
        BatchState state = BatchState.create(batchId, SEEDS.size(), config, "seeds.txt");
        for (int i = 0; i < completedCount; i++) {
            state.markCompleted(SEEDS.get(i), "drafts/" + SEEDS.get(i));
        }
        stateStore.save(state);
        return state;
    }

    @Test
    void resume_submitsOnlyUnprocessedInputs() {
        interruptedBatch("crashed", SEEDS.size() / 2, BatchConfigSnapshot.of(2, 0, 1, true));
        when(jobExecutor.execute(anyString(), any()))
                .thenAnswer(invocation -> CompletableFuture.completedFuture("drafts/" + invocation.getArgument(0)));

        BatchSummary summary = resumeService.resume("crashed", SEEDS);

        assertEquals(5, summary.submitted());
        assertEquals(10, summary.succeeded());
        assertEquals(BatchStatus.COMPLETED, summary.status());
        verify(jobExecutor, times(5)).execute(anyString(), any());
        for (int i = 0; i < 5; i++) {
            verify(jobExecutor, never()).execute(eq(SEEDS.get(i)), any());
        }
        assertTrue(stateStore.findById("crashed").isEmpty());
    }

    @Test
    void resume_skipsRecordedFailuresAndReusesConfigSnapshot() {
        BatchConfigSnapshot original = new BatchConfigSnapshot(1, 0, 0, true, "detailed", "llama3");
        BatchState state = BatchState.create("partial", 3, original, null);
        state.markCompleted("a", "drafts/a");
        state.markFailed("b", "Invalid API key", 1, FailureKind.PERMANENT);
        state.setStatus(BatchStatus.CANCELLED);
        stateStore.save(state);
        when(jobExecutor.execute(eq("c"), eq(original))).thenReturn(CompletableFuture.completedFuture("drafts/c"));

        BatchSummary summary = resumeService.resume("partial", List.of("a", "b", "c"));

        assertEquals(1, summary.submitted());
        assertEquals(2, summary.succeeded());
        assertEquals(1, summary.failed());
        assertEquals(BatchStatus.COMPLETED, summary.status());
        BatchState saved = stateStore.findById("partial").orElseThrow();
        assertEquals(BatchStatus.COMPLETED, saved.getStatus());
        assertEquals(FailureKind.PERMANENT, saved.getFailed().get(0).errorKind());
    }

    @Test
    void resume_missingStateIsNotFound() {
        BatchStateUnavailableException failure = assertThrows(BatchStateUnavailableException.class,
                () -> resumeService.resume("ghost", SEEDS));

        assertEquals(BatchStateUnavailableException.Reason.NOT_FOUND, failure.getReason());
        assertTrue(failure.getMessage().contains("ghost"));
        verifyNoInteractions(jobExecutor);
    }

    @Test
    void resume_corruptStateIsReportedAndNotTreatedAsFresh() throws Exception {
        Files.createDirectories(stateStore.getStateDirectory());
        Files.writeString(stateStore.stateFileFor("broken"), "{\"batch_id\": \"broken\", \"completed\": [");

        BatchStateUnavailableException failure = assertThrows(BatchStateUnavailableException.class,
                () -> resumeService.resume("broken", SEEDS));

        assertEquals(BatchStateUnavailableException.Reason.CORRUPT, failure.getReason());
        verifyNoInteractions(jobExecutor);
        assertTrue(Files.exists(stateStore.stateFileFor("broken")));
    }

    @Test
    void resumeMostRecent_picksNewestUnfinishedBatch() {
        BatchConfigSnapshot config = BatchConfigSnapshot.of(1, 0, 0, true);
        stateStore.save(new BatchState("old", Instant.now().minusSeconds(600), 1, List.of(), List.of(), 0,
                config, BatchStatus.FAILED, null));
        stateStore.save(new BatchState("done", Instant.now(), 1, List.of(), List.of(), 0,
                config, BatchStatus.COMPLETED, null));
        stateStore.save(new BatchState("recent", Instant.now().minusSeconds(60), 1, List.of(), List.of(), 0,
                config, BatchStatus.CANCELLED, null));

        BatchState picked = resumeService.loadMostRecentResumable();

        assertEquals("recent", picked.getBatchId());
    }

    @Test
    void resumeMostRecent_withoutCandidatesIsNotFound() {
        BatchStateUnavailableException failure = assertThrows(BatchStateUnavailableException.class,
                () -> resumeService.resumeMostRecent(SEEDS));

        assertEquals(BatchStateUnavailableException.Reason.NOT_FOUND, failure.getReason());
    }
}
