package com.secretai.sdk.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot, thread-safe cancellation flag shared between a caller and a retry sequence.
 */
public final class CancellationSignal {
    private static final Logger logger = LoggerFactory.getLogger(CancellationSignal.class);

    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;

    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = List.copyOf(callbacks);
            callbacks.clear();
        }
        latch.countDown();
        toRun.forEach(CancellationSignal::runCallback);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true if the signal was cancelled before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            return cancelled;
        }
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Registers a callback run once on cancellation, immediately if already cancelled.
     *
     * @return handle that removes the callback
     */
    public Runnable onCancel(Runnable callback) {
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (this) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        runCallback(callback);
        return () -> {
        };
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.warn("Cancellation callback failed", e);
        }
    }
}
