package com.llestrade.core.tracker;

import java.nio.file.Path;

/**
 * What a manifest says about one source: the hash it was processed at and where the output went.
 */
public record TrackedOutput(String sourceHash, Path outputPath) {}
