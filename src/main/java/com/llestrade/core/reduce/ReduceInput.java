package com.llestrade.core.reduce;

import com.llestrade.core.model.InputKind;

import java.nio.file.Path;

/**
 * A file currently selected as input of a combined group.
 *
 * @param key  {@code converted/<rel>} or {@code map/<slug>/<rel>}
 * @param kind converted document or map output
 * @param path absolute path
 */
public record ReduceInput(String key, InputKind kind, Path path) {}
