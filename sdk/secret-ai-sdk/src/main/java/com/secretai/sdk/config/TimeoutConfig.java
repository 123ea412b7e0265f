package com.secretai.sdk.config;

import com.secretai.sdk.error.ConfigException;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds of a single transport call. Independent of {@link RetryConfig}.
 */
public record TimeoutConfig(Duration requestTimeout, Duration connectTimeout) {

    public TimeoutConfig {
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new ConfigException("request_timeout must be > 0, got " + requestTimeout);
        }
        if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
            throw new ConfigException("connect_timeout must be > 0, got " + connectTimeout);
        }
    }

    public static TimeoutConfig defaults() {
        return new TimeoutConfig(SdkEnvironment.REQUEST_TIMEOUT_DEFAULT, SdkEnvironment.CONNECT_TIMEOUT_DEFAULT);
    }

    public static TimeoutConfig load(ConfigSource source) {
        return load(null, null, source);
    }

    public static TimeoutConfig load(Duration requestTimeout, Duration connectTimeout, ConfigSource source) {
        Objects.requireNonNull(source, "source");
        Duration request = requestTimeout != null
                ? requestTimeout
                : SdkEnvironment.secondsValue(source, SdkEnvironment.REQUEST_TIMEOUT)
                        .orElse(SdkEnvironment.REQUEST_TIMEOUT_DEFAULT);
        Duration connect = connectTimeout != null
                ? connectTimeout
                : SdkEnvironment.secondsValue(source, SdkEnvironment.CONNECT_TIMEOUT)
                        .orElse(SdkEnvironment.CONNECT_TIMEOUT_DEFAULT);
        return new TimeoutConfig(request, connect);
    }
}
