package com.llestrade.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Order in which combined inputs are presented to the reducer.
 */
public enum CombineOrder {
    @JsonProperty("path") PATH,
    @JsonProperty("mtime") MTIME
}
