package com.llestrade.core.errors;

/**
 * Thrown at a work-unit boundary once cancellation of the owning job has been observed.
 */
public class CancellationRequestedException extends AnalysisException {

    public CancellationRequestedException(String message) {
        super(message);
    }
}
