package com.llestrade.core.model;

import java.util.List;

/**
 * "done of total" for one pipeline stage.
 */
public record Coverage(int total, int done, int pending, List<String> pendingPaths) {

    public Coverage {
        pendingPaths = pendingPaths == null ? List.of() : List.copyOf(pendingPaths);
    }

    public static Coverage empty() {
        return new Coverage(0, 0, 0, List.of());
    }

    public boolean isComplete() {
        return pending == 0;
    }
}
