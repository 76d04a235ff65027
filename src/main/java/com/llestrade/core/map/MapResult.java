package com.llestrade.core.map;

import java.nio.file.Path;

public record MapResult(Outcome outcome, Path outputPath, int chunkCount, int invocations) {

    public enum Outcome {
        /** Manifest matched; nothing was called or written. */
        SKIPPED,
        WRITTEN
    }

    public static MapResult skipped(Path outputPath) {
        return new MapResult(Outcome.SKIPPED, outputPath, 0, 0);
    }
}
