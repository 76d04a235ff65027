package com.llestrade.core.reduce;

/**
 * @param text        the combined text
 * @param invocations provider calls made
 * @param levels      1 for a single pass, plus one per batching level
 */
public record ReductionResult(String text, int invocations, int levels) {}
