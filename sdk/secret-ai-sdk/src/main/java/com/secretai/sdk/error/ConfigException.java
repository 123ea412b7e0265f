package com.secretai.sdk.error;

public final class ConfigException extends SecretAiException {

    public ConfigException(String message) {
        this(message, null);
    }

    public ConfigException(String message, Throwable cause) {
        super(ErrorKind.CONFIG, message, cause);
    }

    public static ConfigException missingApiKey(String variable) {
        return new ConfigException("Missing API Key. Environment variable " + variable + " must be set");
    }

    public static ConfigException missingValue(String variable) {
        return new ConfigException("Missing environment variable " + variable + " must be set");
    }
}
