package com.llestrade.core.conversion;

import java.util.List;

/**
 * @param converted   sources written this run
 * @param skipped     sources whose manifest record still matched
 * @param unsupported sources no converter accepts
 * @param failed      relative paths of sources whose conversion threw
 */
public record ConversionResult(int converted, int skipped, int unsupported, List<String> failed) {

    public ConversionResult {
        failed = List.copyOf(failed);
    }
}
