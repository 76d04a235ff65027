package com.llestrade.core.model;

import java.time.Instant;

/**
 * Sidecar record written next to every map output.
 *
 * @param sourcePath  document path relative to {@code converted_documents/}
 * @param sourceHash  SHA-256 of the document text at processing time
 * @param promptHash  hash of the prompt configuration used
 * @param outputPath  absolute path of the output file
 * @param provider    provider that produced the output
 * @param model       model that produced the output
 * @param chunkCount  number of chunks the document was split into (1 when unchunked)
 * @param timestamp   when the output was written
 */
public record AnalysisManifestEntry(
    String sourcePath,
    String sourceHash,
    String promptHash,
    String outputPath,
    String provider,
    String model,
    int chunkCount,
    Instant timestamp
) {

    /** Reusable only while both hashes are exactly the current ones. */
    public boolean matches(String currentSourceHash, String currentPromptHash) {
        return sourceHash != null && sourceHash.equals(currentSourceHash)
                && promptHash != null && promptHash.equals(currentPromptHash);
    }
}
