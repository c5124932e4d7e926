package org.example.blueprint.service;

import org.example.blueprint.model.BatchState;
import org.example.blueprint.model.BatchStatus;
import org.example.blueprint.model.BatchSummary;
import org.example.blueprint.service.BatchStateUnavailableException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Picks an interrupted batch back up from its state file and resubmits only the inputs that have
 * no recorded outcome, using the batch's original config snapshot.
 */
@Service
public class BatchResumeService {

    private static final Logger log = LoggerFactory.getLogger(BatchResumeService.class);

    private final BatchStateStore stateStore;
    private final BatchCompilationService compilationService;

    public BatchResumeService(BatchStateStore stateStore, BatchCompilationService compilationService) {
        this.stateStore = stateStore;
        this.compilationService = compilationService;
    }

    /**
     * @throws BatchStateUnavailableException when the state file is missing or unreadable
     */
    public BatchState loadState(String batchId) {
        Path stateFile = stateStore.stateFileFor(batchId);
        if (!Files.exists(stateFile)) {
            throw new BatchStateUnavailableException(batchId, Reason.NOT_FOUND,
                    "No saved state for batch " + batchId + " in " + stateStore.getStateDirectory()
                            + ". Check the batch id, or start a new batch.");
        }
        Optional<BatchState> state = stateStore.load(stateFile);
        if (state.isEmpty()) {
            throw new BatchStateUnavailableException(batchId, Reason.CORRUPT,
                    "State file " + stateFile + " for batch " + batchId + " is unreadable. "
                            + "Inspect or remove it before starting over; its completed work is unknown.");
        }
        if (!batchId.equals(state.get().getBatchId())) {
            throw new BatchStateUnavailableException(batchId, Reason.CORRUPT,
                    "State file " + stateFile + " belongs to batch " + state.get().getBatchId()
                            + ", not " + batchId + ".");
        }
        return state.get();
    }

    /**
     * The most recently started batch that has not completed.
     *
     * @throws BatchStateUnavailableException when there is none
     */
    public BatchState loadMostRecentResumable() {
        return stateStore.listStates().stream()
                .filter(state -> state.getStatus().resumable())
                .findFirst()
                .orElseThrow(() -> new BatchStateUnavailableException(null, Reason.NOT_FOUND,
                        "No resumable batch found in " + stateStore.getStateDirectory() + "."));
    }

    public BatchSummary resume(String batchId, List<String> allInputs) {
        return resume(loadState(batchId), allInputs);
    }

    public BatchSummary resumeMostRecent(List<String> allInputs) {
        return resume(loadMostRecentResumable(), allInputs);
    }

    public BatchSummary resume(BatchState state, List<String> allInputs) {
        List<String> remaining = state.remainingInputs(allInputs);
        int distinctInputs = new LinkedHashSet<>(allInputs).size();
        if (distinctInputs != state.getTotalJobCount()) {
            log.warn("Batch {} was created with {} inputs but {} were supplied for resume",
                    state.getBatchId(), state.getTotalJobCount(), distinctInputs);
        }

        log.info("Resuming batch {} (started {}): {}/{} completed, {} failed, {} remaining",
                state.getBatchId(), state.getStartTime(), state.getSucceededCount(), state.getTotalJobCount(),
                state.getFailedCount(), remaining.size());

        synchronized (state) {
            state.setStatus(BatchStatus.RUNNING);
            stateStore.save(state);
        }
        return compilationService.runBatch(state, remaining);
    }
}
