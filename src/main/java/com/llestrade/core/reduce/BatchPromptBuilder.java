package com.llestrade.core.reduce;

import java.util.List;

/**
 * Builds the user prompt that merges a batch of texts.
 */
@FunctionalInterface
public interface BatchPromptBuilder {

    String build(List<String> batch);
}
