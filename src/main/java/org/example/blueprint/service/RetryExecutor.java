package org.example.blueprint.service;

import org.example.blueprint.model.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Runs one job's operation with bounded retries. Transient failures are retried after an
 * exponential, jittered backoff; permanent failures end the job on the spot.
 */
@Component
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    static final double JITTER_RATIO = 0.2;

    @FunctionalInterface
    public interface AttemptOperation<T> {
        T call(int attempt) throws Exception;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final GenerationErrorClassifier classifier;
    private final long initialDelayMillis;
    private final long maxDelayMillis;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    @Autowired
    public RetryExecutor(
            GenerationErrorClassifier classifier,
            @Value("${batch.retry.initial-delay-ms:1000}") long initialDelayMillis,
            @Value("${batch.retry.max-delay-ms:30000}") long maxDelayMillis) {
        this(classifier, initialDelayMillis, maxDelayMillis, Thread::sleep,
                () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryExecutor(
            GenerationErrorClassifier classifier,
            long initialDelayMillis,
            long maxDelayMillis,
            Sleeper sleeper,
            DoubleSupplier random) {
        this.classifier = classifier;
        this.initialDelayMillis = Math.max(0L, initialDelayMillis);
        this.maxDelayMillis = Math.max(this.initialDelayMillis, maxDelayMillis);
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * @param label      used in log lines only
     * @param operation  invoked with the 1-based attempt number
     * @param maxRetries additional attempts allowed after the first one for transient failures
     * @throws JobExecutionException carrying the last error and its classification; an interrupt
     *                               surfaces as {@link JobExecutionException#isInterrupted()} with the
     *                               thread's interrupt flag restored
     */
    public <T> T execute(String label, AttemptOperation<T> operation, int maxRetries) {
        int allowedRetries = Math.max(0, maxRetries);
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return operation.call(attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw JobExecutionException.interrupted("Interrupted during attempt " + attempt, attempt, e);
            } catch (Exception e) {
                FailureKind kind = classifier.classify(e);
                String message = describe(e);
                if (kind == FailureKind.PERMANENT) {
                    log.warn("{} failed permanently on attempt {}: {}", label, attempt, message);
                    throw new JobExecutionException(message, kind, attempt, e);
                }
                if (attempt > allowedRetries) {
                    log.warn("{} failed after {} attempts, retries exhausted: {}", label, attempt, message);
                    throw new JobExecutionException(message, kind, attempt, e);
                }
                long delayMs = computeBackoffMillis(attempt);
                log.warn("{} failed transiently ({}), retrying in {}ms (attempt {}/{})",
                        label, message, delayMs, attempt + 1, allowedRetries + 1);
                try {
                    sleeper.sleep(delayMs);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw JobExecutionException.interrupted("Interrupted while backing off: " + message,
                            attempt, interrupted);
                }
            }
        }
    }

    /**
     * Delay before the retry that follows {@code failedAttempt}: base * 2^(failedAttempt-1), capped,
     * then scaled by a random factor in [1 - 0.2, 1 + 0.2].
     */
    long computeBackoffMillis(int failedAttempt) {
        long delay = initialDelayMillis;
        for (int i = 1; i < failedAttempt; i++) {
            if (delay >= maxDelayMillis) {
                break;
            }
            delay = Math.min(maxDelayMillis, delay * 2);
        }
        double factor = 1.0 + JITTER_RATIO * (2.0 * random.getAsDouble() - 1.0);
        return Math.max(0L, Math.round(delay * factor));
    }

    static String describe(Throwable failure) {
        Throwable root = failure;
        while ((root.getMessage() == null || root.getMessage().isBlank()) && root.getCause() != null) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null || message.isBlank()) {
            return root.getClass().getSimpleName();
        }
        return message;
    }
}
