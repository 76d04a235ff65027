package com.llestrade.core.errors;

/**
 * A provider rejected the request or answered with something unusable. Not retried.
 */
public class ProviderException extends AnalysisException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
