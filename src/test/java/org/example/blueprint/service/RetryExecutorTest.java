package org.example.blueprint.service;

import org.example.blueprint.model.FailureKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryExecutorTest {

    private final GenerationErrorClassifier classifier = new GenerationErrorClassifier();
    private final List<Long> sleeps = new ArrayList<>();

    private RetryExecutor executor(long initialMs, long maxMs, double randomValue) {
        return new RetryExecutor(classifier, initialMs, maxMs, sleeps::add, () -> randomValue);
    }

    @Test
    void execute_succeedsAfterTransientFailures() {
        RetryExecutor retryExecutor = executor(1000, 30000, 0.5);
        AtomicInteger calls = new AtomicInteger();

        String result = retryExecutor.execute("job", attempt -> {
            calls.incrementAndGet();
            if (attempt <= 2) {
                throw new RuntimeException("connection timeout");
            }
            return "drafts/ok";
        }, 3);

        assertEquals("drafts/ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(1000L, 2000L), sleeps);
    }

    @Test
    void execute_permanentFailureIsNotRetried() {
        RetryExecutor retryExecutor = executor(1000, 30000, 0.5);
        AtomicInteger calls = new AtomicInteger();

        JobExecutionException failure = assertThrows(JobExecutionException.class,
                () -> retryExecutor.execute("job", attempt -> {
                    calls.incrementAndGet();
                    throw new IllegalArgumentException("Invalid API key");
                }, 3));

        assertEquals(1, calls.get());
        assertEquals(1, failure.getAttempts());
        assertEquals(FailureKind.PERMANENT, failure.getFailureKind());
        assertEquals("Invalid API key", failure.getMessage());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void execute_transientFailureExhaustsRetries() {
        RetryExecutor retryExecutor = executor(1000, 30000, 0.5);
        AtomicInteger calls = new AtomicInteger();

        JobExecutionException failure = assertThrows(JobExecutionException.class,
                () -> retryExecutor.execute("job", attempt -> {
                    calls.incrementAndGet();
                    throw new RuntimeException("connection timeout");
                }, 2));

        assertEquals(3, calls.get());
        assertEquals(3, failure.getAttempts());
        assertEquals(FailureKind.TRANSIENT, failure.getFailureKind());
        assertTrue(failure.retriesExhausted());
        assertEquals(2, sleeps.size());
    }

    @Test
    void execute_zeroRetriesMakesSingleAttempt() {
        RetryExecutor retryExecutor = executor(1000, 30000, 0.5);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(JobExecutionException.class, () -> retryExecutor.execute("job", attempt -> {
            calls.incrementAndGet();
            throw new RuntimeException("503 Service Unavailable");
        }, 0));

        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void execute_interruptedBackoffEndsJobAsPermanent() {
        RetryExecutor retryExecutor = new RetryExecutor(classifier, 1000, 30000,
                millis -> {
                    throw new InterruptedException("shutdown");
                },
                () -> 0.5);

        try {
            JobExecutionException failure = assertThrows(JobExecutionException.class,
                    () -> retryExecutor.execute("job", attempt -> {
                        throw new RuntimeException("connection timeout");
                    }, 3));

            assertEquals(FailureKind.PERMANENT, failure.getFailureKind());
            assertEquals(1, failure.getAttempts());
            assertTrue(failure.isInterrupted());
            assertFalse(failure.retriesExhausted());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void computeBackoffMillis_doublesAndCaps() {
        RetryExecutor retryExecutor = executor(1000, 5000, 0.5);

        assertEquals(1000L, retryExecutor.computeBackoffMillis(1));
        assertEquals(2000L, retryExecutor.computeBackoffMillis(2));
        assertEquals(4000L, retryExecutor.computeBackoffMillis(3));
        assertEquals(5000L, retryExecutor.computeBackoffMillis(4));
        assertEquals(5000L, retryExecutor.computeBackoffMillis(30));
    }

    @Test
    void computeBackoffMillis_jitterStaysWithinTwentyPercent() {
        assertEquals(800L, executor(1000, 30000, 0.0).computeBackoffMillis(1));
        assertEquals(1200L, executor(1000, 30000, 1.0).computeBackoffMillis(1));
        assertEquals(3200L, executor(1000, 30000, 0.0).computeBackoffMillis(3));
        assertEquals(4800L, executor(1000, 30000, 1.0).computeBackoffMillis(3));
    }

    @Test
    void describe_fallsBackToCauseThenClassName() {
        assertEquals("inner", RetryExecutor.describe(new RuntimeException(null, new IllegalStateException("inner"))));
        assertEquals("TimeoutException", RetryExecutor.describe(new java.util.concurrent.TimeoutException()));
    }
}
