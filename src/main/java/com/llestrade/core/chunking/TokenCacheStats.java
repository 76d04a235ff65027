package com.llestrade.core.chunking;

public record TokenCacheStats(long hits, long misses, long size) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
