package com.llestrade.core.map;

import com.llestrade.core.model.AnalysisGroup;
import com.llestrade.core.model.MapDocument;
import com.llestrade.core.model.Project;

import java.util.Map;

/**
 * One document of a per-document group.
 *
 * @param project              owning project
 * @param group                the group being run
 * @param document             source and output paths
 * @param runValues            per-run placeholder overrides
 * @param force                reprocess even when the manifest matches
 * @param allowMissingRequired run even when required placeholders have no value
 */
public record MapRequest(
    Project project,
    AnalysisGroup group,
    MapDocument document,
    Map<String, String> runValues,
    boolean force,
    boolean allowMissingRequired
) {

    public MapRequest {
        runValues = runValues == null ? Map.of() : Map.copyOf(runValues);
    }
}
