package com.llestrade.core.conversion;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns a source file (PDF, DOCX, ...) into markdown text. Implementations are external
 * collaborators registered as beans.
 */
public interface DocumentConverter {

    boolean supports(Path source);

    String convert(Path source) throws IOException;

    /** Recorded in the front matter of converted documents. */
    default String name() {
        return getClass().getSimpleName();
    }
}
