package com.llestrade.core.errors;

/**
 * Map analysis of one document failed. The chunk index is 0 when the failure is not tied to a chunk.
 */
public class DocumentAnalysisException extends AnalysisException {

    private final String document;
    private final int chunkIndex;

    public DocumentAnalysisException(String document, int chunkIndex, Throwable cause) {
        super(describe(document, chunkIndex) + ": " + cause.getMessage(), cause);
        this.document = document;
        this.chunkIndex = chunkIndex;
    }

    public String getDocument() {
        return document;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    private static String describe(String document, int chunkIndex) {
        return chunkIndex > 0
                ? "Analysis of " + document + " failed at chunk " + chunkIndex
                : "Analysis of " + document + " failed";
    }
}
