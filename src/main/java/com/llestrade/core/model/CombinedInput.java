package com.llestrade.core.model;

/**
 * One input of a combined analysis as captured when the artifact was produced.
 *
 * @param key          stable key, {@code converted/<rel>} or {@code map/<slug>/<rel>}
 * @param kind         converted document or map output
 * @param path         absolute path at merge time
 * @param hash         SHA-256 of the file bytes at merge time
 * @param mtimeMillis  modification time at merge time
 */
public record CombinedInput(
    String key,
    InputKind kind,
    String path,
    String hash,
    long mtimeMillis
) {}
