package com.secretai.sdk.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.secretai.sdk.config.TimeoutConfig;
import com.secretai.sdk.error.ConfigException;
import com.secretai.sdk.error.NetworkException;
import com.secretai.sdk.error.ResponseException;
import com.secretai.sdk.error.SecretAiException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.client.RestClientResponseException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Translates raw transport failures into the SDK error taxonomy, keeping the original as cause.
 *
 * Mapping:
 * - timeouts anywhere in the cause chain      -> NetworkException TIMEOUT
 * - refused / unresolvable / unroutable host  -> NetworkException CONNECTION
 * - HTTP 401, 403                             -> ConfigException (API key rejected)
 * - HTTP 408, 429, 5xx except 501            -> NetworkException GENERAL
 * - other HTTP errors, undecodable bodies     -> ResponseException
 * - anything else                             -> NetworkException GENERAL
 */
public class TransportErrorMapper {

    private static final int MAX_CAUSE_DEPTH = 16;

    private final String host;
    private final TimeoutConfig timeouts;

    public TransportErrorMapper(String host, TimeoutConfig timeouts) {
        this.host = host;
        this.timeouts = timeouts;
    }

    public SecretAiException map(Throwable error, String operation) {
        if (error instanceof SecretAiException sdkError) {
            return sdkError;
        }

        if (error instanceof RestClientResponseException http) {
            return mapHttpStatus(http, operation);
        }

        Throwable timeout = findCause(error, TimeoutException.class, SocketTimeoutException.class, HttpTimeoutException.class);
        if (timeout != null) {
            boolean connectPhase = timeout instanceof HttpConnectTimeoutException
                    || String.valueOf(timeout.getMessage()).toLowerCase(Locale.ROOT).contains("connect timed out");
            return NetworkException.timeout(
                    connectPhase ? timeouts.connectTimeout() : timeouts.requestTimeout(), operation, error);
        }

        if (findCause(error, ConnectException.class, UnknownHostException.class, NoRouteToHostException.class) != null) {
            return NetworkException.connection(host, error);
        }

        if (findCause(error, HttpMessageNotReadableException.class, JsonProcessingException.class) != null) {
            return new ResponseException("Malformed " + operation + " response body: " + error.getMessage(),
                    null, null, error);
        }

        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return NetworkException.general(capitalize(operation) + " failed: " + detail, operation, error);
    }

    private SecretAiException mapHttpStatus(RestClientResponseException http, String operation) {
        int status = http.getRawStatusCode();
        String body = http.getResponseBodyAsString();
        if (status == 401 || status == 403) {
            return new ConfigException("API key rejected by " + host + " (HTTP " + status + ")", http);
        }
        if (isTransientStatus(status)) {
            return NetworkException.general(
                    "HTTP " + status + " " + http.getStatusText() + " from " + host, operation, http);
        }
        return new ResponseException(
                "HTTP " + status + " " + http.getStatusText() + " for " + operation, body, status, http);
    }

    // 501 means the host will never serve the call
    private static boolean isTransientStatus(int status) {
        return status == 408 || status == 429 || (status >= 500 && status <= 599 && status != 501);
    }

    @SafeVarargs
    private static Throwable findCause(Throwable error, Class<? extends Throwable>... types) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            for (Class<? extends Throwable> type : types) {
                if (type.isInstance(current)) {
                    return current;
                }
            }
            current = current.getCause();
        }
        return null;
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return "Request";
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
