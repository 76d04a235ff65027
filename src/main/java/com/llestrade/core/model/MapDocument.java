package com.llestrade.core.model;

import java.nio.file.Path;

/**
 * A converted document selected by a per-document group and where its analysis goes.
 */
public record MapDocument(Path sourcePath, String relativePath, Path outputPath) {}
