package com.llestrade.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Manifest of one produced combined analysis. Artifacts are immutable once written; a re-run
 * produces a new timestamped artifact.
 */
public record CombinedArtifact(
    String groupId,
    String outputPath,
    Instant createdAt,
    String promptHash,
    String provider,
    String model,
    List<CombinedInput> inputs,
    int levels,
    int invocations
) {

    public CombinedArtifact {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }
}
