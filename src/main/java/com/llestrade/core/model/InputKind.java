package com.llestrade.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where a combined input comes from.
 */
public enum InputKind {
    @JsonProperty("converted") CONVERTED,
    @JsonProperty("map") MAP
}
