package com.llestrade.core.placeholders;

public enum PlaceholderScope {
    /** Filled by the engine; never overridden. */
    SYSTEM,
    /** Supplied by the project or a run. */
    EDITABLE
}
