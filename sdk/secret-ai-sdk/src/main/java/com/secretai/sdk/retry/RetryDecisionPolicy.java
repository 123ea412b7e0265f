package com.secretai.sdk.retry;

import com.secretai.sdk.observability.ErrorClassifier;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Retry Decision Policy: classifier-based retry gating.
 *
 * When an explicit allow-list of exception types is configured it replaces the
 * classifier's judgement for types it does not name: anything outside the list is
 * never retried. Errors inside the list still have to pass the classifier.
 */
public class RetryDecisionPolicy {

    private final Predicate<Throwable> classifier;
    private final List<Class<? extends Throwable>> retryableTypes;

    public RetryDecisionPolicy(ErrorClassifier classifier) {
        this(classifier::isRetryable, List.of());
    }

    public RetryDecisionPolicy(Predicate<Throwable> classifier, List<Class<? extends Throwable>> retryableTypes) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.retryableTypes = List.copyOf(retryableTypes);
    }

    /**
     * Decision flow:
     * 1. No error? NO retry
     * 2. Allow-list present and the error is not one of its types? NO retry
     * 3. Otherwise trust the classifier
     */
    public boolean shouldRetry(Throwable throwable) {
        if (throwable == null) {
            return false;
        }
        if (!retryableTypes.isEmpty() && retryableTypes.stream().noneMatch(type -> type.isInstance(throwable))) {
            return false;
        }
        return classifier.test(throwable);
    }

    public List<Class<? extends Throwable>> retryableTypes() {
        return retryableTypes;
    }
}
