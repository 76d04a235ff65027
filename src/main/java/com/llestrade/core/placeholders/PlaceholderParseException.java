package com.llestrade.core.placeholders;

import com.llestrade.core.errors.AnalysisException;

/**
 * A placeholder list contains an invalid entry.
 */
public class PlaceholderParseException extends AnalysisException {

    public PlaceholderParseException(String message) {
        super(message);
    }

    public PlaceholderParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
