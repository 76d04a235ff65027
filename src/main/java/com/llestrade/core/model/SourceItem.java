package com.llestrade.core.model;

import java.nio.file.Path;

/**
 * A file found by a directory scan.
 */
public record SourceItem(String relativePath, Path path, String contentHash, long modifiedMillis) {}
