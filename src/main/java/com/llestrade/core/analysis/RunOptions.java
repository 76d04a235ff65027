package com.llestrade.core.analysis;

import java.util.Map;

/**
 * Per-run switches for a map or reduce submission.
 *
 * @param force                reprocess even when manifests say the output is current
 * @param allowMissingRequired run even when required placeholders have no value
 * @param dynamicOverrides     placeholder values that apply to this run only
 */
public record RunOptions(boolean force, boolean allowMissingRequired, Map<String, String> dynamicOverrides) {

    public RunOptions {
        dynamicOverrides = dynamicOverrides == null ? Map.of() : Map.copyOf(dynamicOverrides);
    }

    public static RunOptions defaults() {
        return new RunOptions(false, false, Map.of());
    }

    public RunOptions withForce(boolean force) {
        return new RunOptions(force, allowMissingRequired, dynamicOverrides);
    }
}
