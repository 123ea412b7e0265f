package com.secretai.sdk.validation;

/**
 * Expected top-level structure of a service response.
 */
public enum ResponseShape {
    GENERATE("response"),
    CHAT("message"),
    ANY(null);

    private final String requiredField;

    ResponseShape(String requiredField) {
        this.requiredField = requiredField;
    }

    public String requiredField() {
        return requiredField;
    }
}
