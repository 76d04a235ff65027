package com.llestrade.core.reduce;

import com.llestrade.core.model.AnalysisGroup;
import com.llestrade.core.model.Project;

import java.util.Map;

public record CombinedRequest(
    Project project,
    AnalysisGroup group,
    Map<String, String> runValues,
    boolean force,
    boolean allowMissingRequired
) {

    public CombinedRequest {
        runValues = runValues == null ? Map.of() : Map.copyOf(runValues);
    }
}
