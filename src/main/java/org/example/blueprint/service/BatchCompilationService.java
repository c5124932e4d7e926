package org.example.blueprint.service;

import org.example.blueprint.config.GenerationRateLimiter;
import org.example.blueprint.model.BatchConfigSnapshot;
import org.example.blueprint.model.BatchJob;
import org.example.blueprint.model.BatchState;
import org.example.blueprint.model.BatchStatus;
import org.example.blueprint.model.BatchSummary;
import org.example.blueprint.model.BatchSummary.JobFailure;
import org.example.blueprint.model.FailedJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives a batch of generation jobs to completion, one at a time or with a bounded number in
 * flight. Every terminal job outcome is written to the batch's state file before the next
 * outcome is recorded, so a crash loses at most the jobs that were in flight.
 *
 * <p>Each attempt takes a rate limit permit immediately before handing the call to the
 * {@link GenerationJobExecutor}, which starts it without queueing. An interrupted attempt is left
 * unrecorded so that a resume picks it up again.
 */
@Service
public class BatchCompilationService {

    private static final Logger log = LoggerFactory.getLogger(BatchCompilationService.class);

    private final BatchStateStore stateStore;
    private final RetryExecutor retryExecutor;
    private final GenerationJobExecutor jobExecutor;
    private final GenerationErrorClassifier errorClassifier;
    private final long jobTimeoutSeconds;
    private final boolean deleteStateOnSuccess;
    private final ConcurrentHashMap<String, RunControl> activeRuns = new ConcurrentHashMap<>();

    public BatchCompilationService(
            BatchStateStore stateStore,
            RetryExecutor retryExecutor,
            GenerationJobExecutor jobExecutor,
            GenerationErrorClassifier errorClassifier,
            @Value("${batch.job.timeout-seconds:300}") long jobTimeoutSeconds,
            @Value("${batch.state.delete-on-success:true}") boolean deleteStateOnSuccess) {
        this.stateStore = stateStore;
        this.retryExecutor = retryExecutor;
        this.jobExecutor = jobExecutor;
        this.errorClassifier = errorClassifier;
        this.jobTimeoutSeconds = Math.max(1L, jobTimeoutSeconds);
        this.deleteStateOnSuccess = deleteStateOnSuccess;
    }

    /**
     * Creates and persists a new batch for {@code inputs} (duplicates collapsed, order kept) and runs it.
     */
    public BatchSummary startBatch(List<String> inputs, BatchConfigSnapshot config, String inputFile) {
        List<String> distinctInputs = new ArrayList<>(new LinkedHashSet<>(inputs));
        if (distinctInputs.isEmpty()) {
            throw new IllegalArgumentException("A batch needs at least one input");
        }
        if (distinctInputs.size() < inputs.size()) {
            log.info("Collapsed {} duplicate input(s)", inputs.size() - distinctInputs.size());
        }

        BatchState state = BatchState.create(distinctInputs.size(), config, inputFile);
        stateStore.save(state);
        log.info("Started batch {} with {} jobs (concurrency={}, rate={}/s, maxRetries={}, continueOnError={})",
                state.getBatchId(), distinctInputs.size(), config.concurrency(), config.callsPerSecond(),
                config.maxRetries(), config.continueOnError());
        return runBatch(state, distinctInputs);
    }

    /**
     * Runs {@code pendingInputs} against an existing batch using the batch's own config snapshot.
     * Inputs that already have a recorded outcome are skipped.
     */
    public BatchSummary runBatch(BatchState state, List<String> pendingInputs) {
        String batchId = state.getBatchId();
        BatchConfigSnapshot config = state.getConfigSnapshot();
        RunControl control = new RunControl(new GenerationRateLimiter(config.callsPerSecond()), Thread.currentThread());
        if (activeRuns.putIfAbsent(batchId, control) != null) {
            throw new IllegalStateException("Batch " + batchId + " is already running in this process");
        }

        try {
            List<BatchJob> jobs = new ArrayList<>();
            int position = state.getCurrentIndex();
            for (String input : state.remainingInputs(pendingInputs)) {
                jobs.add(new BatchJob(input, ++position));
            }

            int dispatched = config.sequential() || jobs.size() <= 1
                    ? runSequential(state, jobs, control)
                    : runParallel(state, jobs, control);
            return finish(state, control, dispatched);
        } finally {
            activeRuns.remove(batchId, control);
            if (control.callerInterrupted.get()) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Requests cooperative cancellation: no new jobs start, in-flight jobs finish and are recorded.
     *
     * @return false when no run with that id is active in this process
     */
    public boolean cancel(String batchId) {
        RunControl control = activeRuns.get(batchId);
        if (control == null) {
            return false;
        }
        if (control.cancelRequested.compareAndSet(false, true)) {
            log.info("Cancellation requested for batch {}", batchId);
        }
        return true;
    }

    public Set<String> activeBatchIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    private int runSequential(BatchState state, List<BatchJob> jobs, RunControl control) {
        int dispatched = 0;
        for (BatchJob job : jobs) {
            if (control.shouldStop()) {
                break;
            }
            dispatched++;
            runJob(state, job, control);
        }
        return dispatched;
    }

    private int runParallel(BatchState state, List<BatchJob> jobs, RunControl control) {
        int workers = Math.min(state.getConfigSnapshot().concurrency(), jobs.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, new BatchWorkerThreadFactory(state.getBatchId()));
        Semaphore gate = new Semaphore(workers);
        List<Future<?>> inFlight = new ArrayList<>();
        int dispatched = 0;
        try {
            for (BatchJob job : jobs) {
                if (control.shouldStop()) {
                    break;
                }
                gate.acquire();
                if (control.shouldStop()) {
                    gate.release();
                    break;
                }
                dispatched++;
                inFlight.add(pool.submit(() -> {
                    try {
                        runJob(state, job, control);
                    } finally {
                        gate.release();
                    }
                }));
            }
        } catch (InterruptedException e) {
            // re-asserted by runBatch once the final state is saved
            control.callerInterrupted.set(true);
            control.cancelRequested.set(true);
            log.warn("Dispatch interrupted for batch {}, waiting for in-flight jobs", state.getBatchId());
        } finally {
            awaitInFlight(inFlight, control);
            pool.shutdown();
        }
        return dispatched;
    }

    private void awaitInFlight(List<Future<?>> inFlight, RunControl control) {
        for (Future<?> future : inFlight) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    // In-flight jobs already spent API budget; keep waiting so their outcome is recorded.
                    control.callerInterrupted.set(true);
                } catch (ExecutionException e) {
                    log.error("Batch worker failed unexpectedly", e.getCause());
                    break;
                }
            }
        }
    }

    private void runJob(BatchState state, BatchJob job, RunControl control) {
        BatchConfigSnapshot config = state.getConfigSnapshot();
        String label = "Job " + job.jobId() + " [" + job.position() + "/" + state.getTotalJobCount() + "]";
        job.markInFlight();
        log.info("{} started", label);

        try {
            String resultLocation = retryExecutor.execute(label, attempt -> {
                job.recordAttempt(attempt);
                control.rateLimiter.acquire();
                return awaitResult(jobExecutor.execute(job.input(), config));
            }, config.maxRetries());

            job.markSucceeded();
            recordOutcome(state, control, () -> state.markCompleted(job.input(), resultLocation));
            log.info("{} succeeded after {} attempt(s) -> {}", label, job.attempts(), resultLocation);
        } catch (JobExecutionException e) {
            if (e.isInterrupted()) {
                leaveUnrecorded(state, job, control, label, e);
                return;
            }
            job.markFailed(e.getFailureKind());
            recordOutcome(state, control,
                    () -> state.markFailed(job.input(), e.getMessage(), e.getAttempts(), e.getFailureKind()));
            log.warn("{} failed ({}) after {} attempt(s): {}", label, e.getFailureKind(), e.getAttempts(), e.getMessage());
            if (!config.continueOnError() && control.halted.compareAndSet(false, true)) {
                log.warn("Halting batch {}: no new jobs will start (continue-on-error is off)", state.getBatchId());
            }
        }
    }

    /**
     * Clears the interrupt so the outcome of the other jobs can still be saved, and stops the run.
     * The job keeps no outcome and stays in the batch's remaining inputs.
     */
    private void leaveUnrecorded(BatchState state, BatchJob job, RunControl control, String label,
                                 JobExecutionException e) {
        boolean flagSet = Thread.interrupted();
        if (flagSet && Thread.currentThread() == control.caller && !(e.getCause() instanceof CallInterruptedException)) {
            control.callerInterrupted.set(true);
        }
        control.cancelRequested.set(true);
        log.warn("{} interrupted after {} attempt(s); left unrecorded for resume of batch {}",
                label, e.getAttempts(), state.getBatchId());
    }

    private String awaitResult(Future<String> future) throws Exception {
        try {
            String location = future.get(jobTimeoutSeconds, TimeUnit.SECONDS);
            if (location == null || location.isBlank()) {
                throw new IllegalStateException("Generation finished without a result location");
            }
            return location;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("Generation call timed out after " + jobTimeoutSeconds + "s");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (causedByInterrupt(cause)) {
                throw new CallInterruptedException(cause);
            }
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
    }

    private static boolean causedByInterrupt(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < 16; depth++) {
            if (current instanceof InterruptedException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private void recordOutcome(BatchState state, RunControl control, Runnable mutation) {
        synchronized (state) {
            mutation.run();
            try {
                stateStore.save(state);
            } catch (BatchStatePersistenceException e) {
                if (control.persistenceFailure.compareAndSet(null, e)) {
                    log.error("Stopping batch {}: progress can no longer be saved", state.getBatchId());
                }
                control.halted.set(true);
            }
        }
    }

    private BatchSummary finish(BatchState state, RunControl control, int dispatched) {
        BatchStatus finalStatus;
        if (control.halted.get()) {
            finalStatus = BatchStatus.FAILED;
        } else if (state.getProcessedCount() >= state.getTotalJobCount()) {
            finalStatus = BatchStatus.COMPLETED;
        } else if (control.cancelRequested.get()) {
            finalStatus = BatchStatus.CANCELLED;
        } else {
            log.warn("Batch {} ran out of inputs with {}/{} jobs recorded; leaving it resumable",
                    state.getBatchId(), state.getProcessedCount(), state.getTotalJobCount());
            finalStatus = BatchStatus.RUNNING;
        }

        RuntimeException persistenceFailure = control.persistenceFailure.get();
        synchronized (state) {
            state.setStatus(finalStatus);
            if (persistenceFailure == null) {
                stateStore.save(state);
            }
        }
        if (persistenceFailure != null) {
            throw persistenceFailure;
        }

        if (finalStatus == BatchStatus.COMPLETED && state.getFailedCount() == 0 && deleteStateOnSuccess) {
            stateStore.delete(state.getBatchId());
        }

        BatchSummary summary = summarize(state, dispatched);
        log.info("Batch {} {}: {} succeeded, {} failed, {} skipped of {} (submitted {} this run)",
                summary.batchId(), finalStatus.name().toLowerCase(), summary.succeeded(), summary.failed(),
                summary.skipped(), summary.total(), summary.submitted());
        return summary;
    }

    BatchSummary summarize(BatchState state, int submitted) {
        List<JobFailure> failures = new ArrayList<>();
        for (FailedJob failed : state.getFailed()) {
            failures.add(new JobFailure(
                    failed.input(),
                    failed.errorMessage(),
                    failed.attempts(),
                    failed.errorKind() != null ? failed.errorKind() : errorClassifier.classify(failed.errorMessage())
            ));
        }
        int succeeded = state.getSucceededCount();
        int failedCount = state.getFailedCount();
        return new BatchSummary(
                state.getBatchId(),
                state.getStatus(),
                succeeded,
                failedCount,
                Math.max(0, state.getTotalJobCount() - succeeded - failedCount),
                state.getTotalJobCount(),
                submitted,
                List.copyOf(failures)
        );
    }

    private static final class RunControl {
        private final GenerationRateLimiter rateLimiter;
        private final Thread caller;
        private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
        private final AtomicBoolean halted = new AtomicBoolean(false);
        private final AtomicBoolean callerInterrupted = new AtomicBoolean(false);
        private final AtomicReference<RuntimeException> persistenceFailure = new AtomicReference<>();

        private RunControl(GenerationRateLimiter rateLimiter, Thread caller) {
            this.rateLimiter = rateLimiter;
            this.caller = caller;
        }

        private boolean shouldStop() {
            return cancelRequested.get() || halted.get();
        }
    }

    /**
     * The call thread, not the waiting worker, was interrupted.
     */
    private static final class CallInterruptedException extends InterruptedException {
        private CallInterruptedException(Throwable cause) {
            super("Generation call was interrupted");
            initCause(cause);
        }
    }

    private static final class BatchWorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger nextThreadId = new AtomicInteger(1);
        private final String batchPrefix;

        private BatchWorkerThreadFactory(String batchId) {
            this.batchPrefix = batchId.length() > 8 ? batchId.substring(0, 8) : batchId;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "batch-" + batchPrefix + "-worker-" + nextThreadId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
