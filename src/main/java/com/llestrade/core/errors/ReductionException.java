package com.llestrade.core.errors;

/**
 * A batch call failed during hierarchical reduction.
 */
public class ReductionException extends AnalysisException {

    private final int level;
    private final int batchIndex;

    public ReductionException(int level, int batchIndex, int batchCount, Throwable cause) {
        super("Hierarchical reduction failed at level " + level + ", batch " + batchIndex
                + "/" + batchCount + ": " + cause.getMessage(), cause);
        this.level = level;
        this.batchIndex = batchIndex;
    }

    public int getLevel() {
        return level;
    }

    public int getBatchIndex() {
        return batchIndex;
    }
}
