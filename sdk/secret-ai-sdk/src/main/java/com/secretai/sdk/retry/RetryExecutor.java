package com.secretai.sdk.retry;

import com.secretai.sdk.config.RetryConfig;
import com.secretai.sdk.error.RetryExhaustedException;
import com.secretai.sdk.observability.ErrorClassifier;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs an operation under a {@link RetryConfig} on top of a resilience4j {@link Retry},
 * retrying failures that the {@link RetryDecisionPolicy} accepts with the waits of a
 * {@link BackoffSchedule}.
 *
 * Two adapters share one retry configuration:
 * - {@link #execute} blocks the calling thread between attempts
 * - {@link #executeAsync} lets resilience4j schedule the next attempt on a single-threaded
 *   scheduler, so no thread is held while a call waits
 *
 * Every call gets its own {@link Retry} instance; an executor can be shared freely.
 * A {@link CancellationSignal} is checked before each attempt and interrupts a blocking
 * wait; cancellation ends the call with {@link CancellationException}.
 */
public class RetryExecutor implements AutoCloseable {
    private static final Logger defaultLogger = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryConfig config;
    private final RetryDecisionPolicy policy;
    private final io.github.resilience4j.retry.RetryConfig retryConfig;
    private final RetryListener listener;
    private final Logger logger;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private RetryExecutor(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config");
        this.policy = builder.policy != null
                ? builder.policy
                : new RetryDecisionPolicy(builder.classifier, builder.retryableTypes);
        this.retryConfig = io.github.resilience4j.retry.RetryConfig.custom()
                .maxAttempts(config.totalAttempts())
                .intervalFunction(builder.backoff.intervalFunction(config))
                .retryOnException(this::isRetryable)
                .build();
        this.listener = builder.listener;
        this.logger = builder.logger;
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = builder.scheduler != null ? builder.scheduler : newScheduler();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RetryExecutor of(RetryConfig config) {
        return builder().config(config).build();
    }

    public RetryConfig config() {
        return config;
    }

    public <T> T execute(Supplier<T> operation) {
        return execute("operation", operation, new CancellationSignal());
    }

    public <T> T execute(String operationName, Supplier<T> operation) {
        return execute(operationName, operation, new CancellationSignal());
    }

    /**
     * Blocking adapter. Runtime failures of the operation are rethrown unchanged when
     * not retryable; errors ({@link Error}) are never caught.
     *
     * @throws RetryExhaustedException after {@code maxRetries + 1} retryable failures
     * @throws CancellationException   if the signal fires or the thread is interrupted
     */
    public <T> T execute(String operationName, Supplier<T> operation, CancellationSignal cancellation) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(cancellation, "cancellation");
        Call call = new Call(operationName);
        Retry retry = newRetry(call);
        Thread caller = Thread.currentThread();
        Runnable unregister = cancellation.onCancel(() -> call.interrupt(caller));

        try {
            T result = retry.executeSupplier(() -> attempt(call, operation, cancellation));
            listener.onSuccess(call.operation, call.attempts());
            return result;
        } catch (Exception e) {
            throw blockingFailure(call, e, cancellation);
        } finally {
            unregister.run();
            if (call.stopInterrupts()) {
                // drop the interrupt raised by the signal, it has been reported as cancellation
                Thread.interrupted();
            }
        }
    }

    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation) {
        return executeAsync("operation", operation, new CancellationSignal());
    }

    public <T> CompletableFuture<T> executeAsync(String operationName,
                                                 Supplier<? extends CompletionStage<T>> operation) {
        return executeAsync(operationName, operation, new CancellationSignal());
    }

    /**
     * Cooperative adapter. The returned future completes with the first successful
     * value, the original non-retryable failure, a {@link RetryExhaustedException},
     * or a {@link CancellationException}. Cancelling the returned future also stops the sequence.
     */
    public <T> CompletableFuture<T> executeAsync(String operationName,
                                                 Supplier<? extends CompletionStage<T>> operation,
                                                 CancellationSignal cancellation) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(cancellation, "cancellation");
        Call call = new Call(operationName);
        CompletableFuture<T> result = new CompletableFuture<>();

        Runnable unregister = cancellation.onCancel(
                () -> result.completeExceptionally(cancelled(call, "after " + call.attempts() + " attempts")));
        result.whenComplete((value, failure) -> unregister.run());
        if (result.isDone()) {
            return result;
        }

        newRetry(call)
                .executeCompletionStage(scheduler, () -> attemptAsync(call, operation, cancellation, result))
                .whenComplete((value, failure) -> {
                    if (failure == null) {
                        if (result.complete(value)) {
                            listener.onSuccess(call.operation, call.attempts());
                        }
                        return;
                    }
                    Throwable error = unwrap(failure);
                    result.completeExceptionally(isRetryable(error)
                            ? new RetryExhaustedException(call.attempts(), error)
                            : error);
                });
        return result;
    }

    private <T> T attempt(Call call, Supplier<T> operation, CancellationSignal cancellation) {
        if (cancellation.isCancelled()) {
            throw cancelled(call, "before attempt " + (call.attempts() + 1));
        }
        listener.onAttempt(call.operation, call.begin());
        return operation.get();
    }

    private <T> CompletionStage<T> attemptAsync(Call call, Supplier<? extends CompletionStage<T>> operation,
                                                CancellationSignal cancellation, CompletableFuture<T> result) {
        if (result.isDone() || cancellation.isCancelled()) {
            return CompletableFuture.failedFuture(cancelled(call, "before attempt " + (call.attempts() + 1)));
        }
        listener.onAttempt(call.operation, call.begin());

        CompletableFuture<T> outcome = new CompletableFuture<>();
        try {
            CompletionStage<T> stage = operation.get();
            if (stage == null) {
                outcome.completeExceptionally(new NullPointerException("operation returned no stage"));
            } else {
                stage.whenComplete((value, failure) -> {
                    if (failure == null) {
                        outcome.complete(value);
                    } else {
                        outcome.completeExceptionally(unwrap(failure));
                    }
                });
            }
        } catch (RuntimeException e) {
            outcome.completeExceptionally(e);
        }
        return outcome;
    }

    /**
     * A retryable failure that leaves resilience4j before the last attempt means its wait was
     * interrupted, either by the signal or by an interrupt of the calling thread.
     */
    private RuntimeException blockingFailure(Call call, Exception error, CancellationSignal cancellation) {
        if (error instanceof CancellationException) {
            return (CancellationException) error;
        }
        boolean interrupted = error instanceof InterruptedException
                || (isRetryable(error) && call.attempts() < config.totalAttempts());
        if (interrupted) {
            CancellationException cancelled;
            if (cancellation.isCancelled()) {
                cancelled = cancelled(call, "while waiting after attempt " + call.attempts());
            } else {
                Thread.currentThread().interrupt();
                cancelled = cancelled(call, "by thread interrupt");
            }
            cancelled.initCause(error);
            return cancelled;
        }
        if (isRetryable(error)) {
            return new RetryExhaustedException(call.attempts(), error);
        }
        return error instanceof RuntimeException ? (RuntimeException) error : new CompletionException(error);
    }

    private Retry newRetry(Call call) {
        Retry retry = Retry.of(call.operation, retryConfig);
        retry.getEventPublisher()
                .onRetry(event -> {
                    Throwable error = event.getLastThrowable();
                    Duration wait = event.getWaitInterval();
                    logger.warn("Attempt {}/{} failed for {}: {}. Retrying in {}ms...",
                            event.getNumberOfRetryAttempts(), config.totalAttempts(), call.operation,
                            error.getMessage(), wait.toMillis());
                    listener.onRetry(call.operation, new Attempt(event.getNumberOfRetryAttempts() - 1, error, wait));
                })
                .onError(event -> {
                    logger.error("All {} attempts failed for {}", config.totalAttempts(), call.operation);
                    listener.onExhausted(call.operation,
                            new Attempt(call.attempts() - 1, event.getLastThrowable(), Duration.ZERO));
                })
                .onIgnoredError(event -> {
                    Throwable error = event.getLastThrowable();
                    if (error instanceof CancellationException) {
                        return;
                    }
                    logger.debug("Non-retryable error in {} on attempt {}/{}: {}",
                            call.operation, call.attempts(), config.totalAttempts(), error.getMessage());
                    listener.onNonRetryable(call.operation, new Attempt(call.attempts() - 1, error, Duration.ZERO));
                });
        return retry;
    }

    private boolean isRetryable(Throwable error) {
        return !(error instanceof CancellationException) && policy.shouldRetry(error);
    }

    private CancellationException cancelled(Call call, String when) {
        logger.info("Retry sequence for {} cancelled {}", call.operation, when);
        return new CancellationException("Retry sequence for " + call.operation + " cancelled " + when);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static ScheduledExecutorService newScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "secret-ai-retry-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    /**
     * Per-call state: the attempt counter and the interrupt raised on the caller by a signal.
     */
    private static final class Call {
        private final String operation;
        private final AtomicInteger attempts = new AtomicInteger();
        private boolean interruptible = true;
        private boolean interrupted;

        Call(String operation) {
            this.operation = operation;
        }

        /** @return zero-based index of the attempt being started */
        int begin() {
            return attempts.getAndIncrement();
        }

        int attempts() {
            return attempts.get();
        }

        synchronized void interrupt(Thread caller) {
            if (interruptible) {
                interrupted = true;
                caller.interrupt();
            }
        }

        synchronized boolean stopInterrupts() {
            interruptible = false;
            return interrupted;
        }
    }

    public static final class Builder {
        private RetryConfig config = RetryConfig.defaults();
        private RetryDecisionPolicy policy;
        private Predicate<Throwable> classifier = new ErrorClassifier()::isRetryable;
        private final List<Class<? extends Throwable>> retryableTypes = new ArrayList<>();
        private BackoffSchedule backoff = new BackoffSchedule();
        private RetryListener listener = RetryListener.NOOP;
        private Logger logger = defaultLogger;
        private ScheduledExecutorService scheduler;

        private Builder() {
        }

        public Builder config(RetryConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Replaces the classifier and allow-list with a prebuilt policy.
         */
        public Builder policy(RetryDecisionPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder classifier(Predicate<Throwable> classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier");
            return this;
        }

        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... types) {
            retryableTypes.addAll(Arrays.asList(types));
            return this;
        }

        public Builder backoff(BackoffSchedule backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff");
            return this;
        }

        public Builder listener(RetryListener listener) {
            this.listener = listener != null ? listener : RetryListener.NOOP;
            return this;
        }

        public Builder logger(Logger logger) {
            this.logger = logger != null ? logger : defaultLogger;
            return this;
        }

        /**
         * Scheduler used by the cooperative adapter. When absent the executor creates
         * and owns a single-threaded daemon scheduler.
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public RetryExecutor build() {
            return new RetryExecutor(this);
        }
    }
}
