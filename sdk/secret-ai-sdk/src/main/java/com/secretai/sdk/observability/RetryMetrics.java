package com.secretai.sdk.observability;

import com.secretai.sdk.retry.Attempt;
import com.secretai.sdk.retry.RetryListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for Secret AI client calls and their retry sequences.
 * Registered as the {@link RetryListener} of the resilient client.
 */
public class RetryMetrics implements RetryListener {
    private final MeterRegistry registry;
    private final ErrorClassifier classifier;
    private final AtomicInteger inflightRequests;

    public RetryMetrics(MeterRegistry registry) {
        this(registry, new ErrorClassifier());
    }

    public RetryMetrics(MeterRegistry registry, ErrorClassifier classifier) {
        this.registry = registry;
        this.classifier = classifier;
        this.inflightRequests = new AtomicInteger(0);

        Gauge.builder("secret_ai_client_inflight", inflightRequests, AtomicInteger::get)
                .description("Number of in-flight Secret AI client calls")
                .register(registry);
    }

    @Override
    public void onAttempt(String operation, int index) {
        Counter.builder("secret_ai_client_attempts_total")
                .description("Transport attempts, retries included")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void onRetry(String operation, Attempt attempt) {
        CallOutcome outcome = classifier.classify(attempt.error());
        Counter.builder("secret_ai_client_retries_total")
                .description("Retries scheduled after a retryable failure")
                .tag("operation", operation)
                .tag("reason", outcome.reason().name())
                .register(registry)
                .increment();
    }

    @Override
    public void onExhausted(String operation, Attempt attempt) {
        Counter.builder("secret_ai_client_retry_exhausted_total")
                .description("Retry sequences that ran out of attempts")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    /**
     * Record a finished client call.
     *
     * @param operation    "generate" or "chat"
     * @param latencyNanos wall time of the whole call, waits included
     * @param error        failure surfaced to the caller, or null for success
     */
    public void recordCall(String operation, long latencyNanos, Throwable error) {
        CallOutcome outcome = classifier.classify(error);

        Counter.builder("secret_ai_client_requests_total")
                .description("Total Secret AI client calls")
                .tag("operation", operation)
                .tags(outcome.tags())
                .register(registry)
                .increment();

        Timer.builder("secret_ai_client_latency")
                .description("Secret AI client call latency")
                .tag("operation", operation)
                .serviceLevelObjectives(
                        Duration.ofMillis(100),
                        Duration.ofMillis(500),
                        Duration.ofSeconds(1),
                        Duration.ofSeconds(5),
                        Duration.ofSeconds(30)
                )
                .register(registry)
                .record(latencyNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementInflight() {
        inflightRequests.incrementAndGet();
    }

    public void decrementInflight() {
        inflightRequests.decrementAndGet();
    }
}
