package com.llestrade.core.errors;

/**
 * A provider failure worth retrying: rate limits, 5xx responses, timeouts, dropped connections.
 */
public class TransientProviderException extends AnalysisException {

    private final int statusCode;

    public TransientProviderException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public TransientProviderException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status, or -1 when the failure happened below HTTP. */
    public int getStatusCode() {
        return statusCode;
    }
}
