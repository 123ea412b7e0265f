package com.secretai.sdk.retry;

import com.secretai.sdk.config.RetryConfig;
import com.secretai.sdk.error.NetworkException;
import com.secretai.sdk.error.ResponseException;
import com.secretai.sdk.error.RetryExhaustedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RetryExecutorTest {

    private static final RetryConfig FAST = new RetryConfig(3, Duration.ofMillis(1), 2.0, Duration.ofMillis(5));

    private final List<RetryExecutor> executors = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        executors.forEach(RetryExecutor::close);
    }

    private RetryExecutor executor(RetryConfig config) {
        RetryExecutor executor = RetryExecutor.of(config);
        executors.add(executor);
        return executor;
    }

    private static NetworkException transientFailure() {
        return NetworkException.general("connection reset", "generate", null);
    }

    @Test
    void testSucceedsFirstTime() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor(FAST).execute(() -> {
            calls.incrementAndGet();
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(1, calls.get());
    }

    @Test
    void testSucceedsAfterTwoTransientFailures() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor(FAST).execute("generate", () -> {
            if (calls.incrementAndGet() <= 2) {
                throw transientFailure();
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testSucceedsAfterFailures_Mock() {
        Supplier<String> operation = mock(Supplier.class);
        when(operation.get())
                .thenThrow(transientFailure())
                .thenThrow(NetworkException.timeout(Duration.ofSeconds(1), "chat", null))
                .thenReturn("done");

        assertEquals("done", executor(FAST).execute("chat", operation));
        verify(operation, times(3)).get();
    }

    @Test
    void testExhaustsAfterMaxRetriesPlusOne() {
        RetryConfig config = new RetryConfig(2, Duration.ofMillis(1), 2.0, Duration.ofMillis(5));
        AtomicInteger calls = new AtomicInteger();
        List<NetworkException> thrown = new CopyOnWriteArrayList<>();

        RetryExhaustedException ex = assertThrows(RetryExhaustedException.class,
                () -> executor(config).execute("generate", () -> {
                    calls.incrementAndGet();
                    NetworkException failure = transientFailure();
                    thrown.add(failure);
                    throw failure;
                }));

        assertEquals(3, calls.get());
        assertEquals(3, ex.attempts());
        assertSame(thrown.get(2), ex.lastError());
        assertTrue(ex.getMessage().contains("All 3 retry attempts failed"));
    }

    @Test
    void testZeroRetriesRunsOnce() {
        AtomicInteger calls = new AtomicInteger();

        RetryExhaustedException ex = assertThrows(RetryExhaustedException.class,
                () -> executor(RetryConfig.noRetry()).execute(() -> {
                    calls.incrementAndGet();
                    throw transientFailure();
                }));

        assertEquals(1, calls.get());
        assertEquals(1, ex.attempts());
    }

    @Test
    void testNonRetryableErrorSurfacesImmediately() {
        AtomicInteger calls = new AtomicInteger();
        ResponseException failure = new ResponseException("Received null response", null);

        ResponseException ex = assertThrows(ResponseException.class,
                () -> executor(FAST).execute(() -> {
                    calls.incrementAndGet();
                    throw failure;
                }));

        assertSame(failure, ex);
        assertEquals(1, calls.get());
    }

    @Test
    void testNonRetryableAfterRetryableKeepsOriginalError() {
        AtomicInteger calls = new AtomicInteger();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> executor(FAST).execute(() -> {
                    if (calls.incrementAndGet() == 1) {
                        throw transientFailure();
                    }
                    throw new IllegalArgumentException("bad prompt");
                }));

        assertEquals("bad prompt", ex.getMessage());
        assertEquals(2, calls.get());
    }

    @Test
    void testAllowListRestrictsRetries() {
        RetryExecutor restricted = RetryExecutor.builder()
                .config(FAST)
                .retryOn(NetworkException.class)
                .build();
        executors.add(restricted);
        AtomicInteger calls = new AtomicInteger();

        // Message is transient-looking, but the type is not on the list
        assertThrows(IllegalStateException.class, () -> restricted.execute(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("connection reset");
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void testCustomClassifier() {
        RetryExecutor executor = RetryExecutor.builder()
                .config(FAST)
                .classifier(error -> error instanceof IllegalStateException)
                .build();
        executors.add(executor);
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("busy");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    void testCancelledBeforeFirstAttempt() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        AtomicInteger calls = new AtomicInteger();

        assertThrows(CancellationException.class, () -> executor(FAST).execute("generate", () -> {
            calls.incrementAndGet();
            return "never";
        }, signal));
        assertEquals(0, calls.get());
    }

    @Test
    void testCancelledDuringWait() {
        RetryConfig slow = new RetryConfig(3, Duration.ofSeconds(30), 2.0, Duration.ofSeconds(60));
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        ScheduledExecutorService canceller = Executors.newSingleThreadScheduledExecutor();
        try {
            long start = System.nanoTime();
            assertThrows(CancellationException.class, () -> executor(slow).execute("generate", () -> {
                calls.incrementAndGet();
                canceller.schedule(signal::cancel, 50, TimeUnit.MILLISECONDS);
                throw transientFailure();
            }, signal));

            assertEquals(1, calls.get(), "no attempt may start after cancellation");
            assertFalse(Thread.currentThread().isInterrupted(), "signal interrupt must not leak to the caller");
            assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(10)) < 0,
                    "cancellation must interrupt the backoff wait");
        } finally {
            canceller.shutdownNow();
        }
    }

    @Test
    void testInterruptDuringWaitCancels() {
        RetryConfig slow = new RetryConfig(3, Duration.ofSeconds(30), 2.0, Duration.ofSeconds(60));
        AtomicInteger calls = new AtomicInteger();

        CancellationException ex = assertThrows(CancellationException.class, () -> executor(slow).execute(() -> {
            calls.incrementAndGet();
            Thread.currentThread().interrupt();
            throw transientFailure();
        }));

        assertTrue(Thread.interrupted(), "interrupt flag must be restored");
        assertInstanceOf(NetworkException.class, ex.getCause());
        assertEquals(1, calls.get());
    }

    @Test
    void testListenerSeesEveryStep() {
        List<String> events = new CopyOnWriteArrayList<>();
        RetryListener listener = new RetryListener() {
            @Override
            public void onAttempt(String operation, int index) {
                events.add("attempt:" + index);
            }

            @Override
            public void onRetry(String operation, Attempt attempt) {
                events.add("retry:" + attempt.index() + ":" + attempt.delayBeforeNext().toMillis());
            }

            @Override
            public void onSuccess(String operation, int attempts) {
                events.add("success:" + attempts);
            }
        };
        RetryConfig config = new RetryConfig(3, Duration.ofMillis(2), 2.0, Duration.ofMillis(50));
        RetryExecutor executor = RetryExecutor.builder().config(config).listener(listener).build();
        executors.add(executor);
        AtomicInteger calls = new AtomicInteger();

        executor.execute("chat", () -> {
            if (calls.incrementAndGet() < 3) {
                throw transientFailure();
            }
            return "ok";
        });

        assertEquals(List.of("attempt:0", "retry:0:2", "attempt:1", "retry:1:4", "attempt:2", "success:3"), events);
    }

    @Test
    void testIndependentCallsDoNotShareBudget() throws Exception {
        RetryConfig config = new RetryConfig(2, Duration.ofMillis(1), 1.0, Duration.ofMillis(1));
        RetryExecutor executor = executor(config);
        AtomicInteger calls = new AtomicInteger();
        Runnable exhausting = () -> assertThrows(RetryExhaustedException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw transientFailure();
        }));

        Thread first = new Thread(exhausting);
        Thread second = new Thread(exhausting);
        first.start();
        second.start();
        first.join(5_000);
        second.join(5_000);

        assertEquals(6, calls.get());
    }
}
