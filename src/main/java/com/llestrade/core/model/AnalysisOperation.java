package com.llestrade.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AnalysisOperation {
    @JsonProperty("per_document") PER_DOCUMENT,
    @JsonProperty("combined") COMBINED
}
