package com.llestrade.core.errors;

/**
 * Base type for every failure raised by the analysis engine.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
