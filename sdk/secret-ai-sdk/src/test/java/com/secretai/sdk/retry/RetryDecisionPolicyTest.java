package com.secretai.sdk.retry;

import com.secretai.sdk.error.ConfigException;
import com.secretai.sdk.error.NetworkException;
import com.secretai.sdk.error.ResponseException;
import com.secretai.sdk.observability.ErrorClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RetryDecisionPolicy.
 *
 * Test matrix:
 * - Network errors (timeout, connection, general) → retry
 * - Response and config errors → NO retry, whatever the message says
 * - Allow-list restricts retries to the named types, classifier still applies
 */
class RetryDecisionPolicyTest {

    private RetryDecisionPolicy policy;

    @BeforeEach
    void setup() {
        ErrorClassifier classifier = new ErrorClassifier();
        policy = new RetryDecisionPolicy(classifier);
    }

    @Test
    void testSuccess_NoRetry() {
        assertFalse(policy.shouldRetry(null), "Success case should not retry");
    }

    @Test
    void testNetworkTimeout_Retryable() {
        NetworkException ex = NetworkException.timeout(Duration.ofSeconds(5), "generate", null);
        assertTrue(policy.shouldRetry(ex), "Timeouts are transient and should be retried");
    }

    @Test
    void testNetworkConnection_Retryable() {
        assertTrue(policy.shouldRetry(NetworkException.connection("http://host", null)));
    }

    @Test
    void testResponseError_NotRetryable() {
        ResponseException ex = new ResponseException("Server returned error: connection pool", null);
        assertFalse(policy.shouldRetry(ex), "A bad payload will not improve on retry");
    }

    @Test
    void testConfigError_NotRetryable() {
        assertFalse(policy.shouldRetry(new ConfigException("Missing API Key")));
    }

    @Test
    void testUnknownException_NotRetryable() {
        assertFalse(policy.shouldRetry(new IllegalStateException("test")),
                "Exceptions without a transient marker default to non-retryable");
    }

    @Test
    void testAllowList_TypeOutsideListNotRetried() {
        RetryDecisionPolicy restricted = new RetryDecisionPolicy(
                new ErrorClassifier()::isRetryable, List.of(ConnectException.class));

        assertFalse(restricted.shouldRetry(NetworkException.general("network down", "chat", null)),
                "Retryable by classifier but not in the allow-list");
        assertTrue(restricted.shouldRetry(new ConnectException("refused")));
    }

    @Test
    void testAllowList_ClassifierStillApplies() {
        RetryDecisionPolicy restricted = new RetryDecisionPolicy(
                new ErrorClassifier()::isRetryable, List.of(RuntimeException.class));

        assertFalse(restricted.shouldRetry(new ResponseException("bad", null)),
                "A listed supertype does not make response errors retryable");
        assertEquals(List.of(RuntimeException.class), restricted.retryableTypes());
    }
}
