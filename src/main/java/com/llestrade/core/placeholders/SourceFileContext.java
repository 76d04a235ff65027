package com.llestrade.core.placeholders;

import java.nio.file.Path;

/**
 * A converted or map-output file exposed to prompts through the source placeholders.
 */
public record SourceFileContext(Path absolutePath, String relativePath) {

    public String filename() {
        return absolutePath.getFileName().toString();
    }

    public String absolutePathText() {
        return absolutePath.toString().replace('\\', '/');
    }
}
