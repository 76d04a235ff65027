package com.llestrade.core.errors;

/**
 * Configuration that can never succeed as-is: unrenderable prompts, missing required
 * placeholders, unknown providers, missing credentials.
 */
public class FatalConfigurationException extends AnalysisException {

    public FatalConfigurationException(String message) {
        super(message);
    }

    public FatalConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
