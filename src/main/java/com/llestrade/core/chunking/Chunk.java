package com.llestrade.core.chunking;

/**
 * @param index  1-based position
 * @param text   chunk text
 * @param tokens token count of {@code text} under the target model
 */
public record Chunk(int index, String text, int tokens) {}
