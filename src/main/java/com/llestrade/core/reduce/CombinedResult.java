package com.llestrade.core.reduce;

import java.nio.file.Path;

/**
 * @param skipped     true when the latest artifact was still current
 * @param outputPath  the artifact written, or the current one when skipped
 * @param inputCount  inputs merged
 * @param levels      reduction levels used
 * @param invocations provider calls made
 */
public record CombinedResult(boolean skipped, Path outputPath, int inputCount, int levels, int invocations) {}
