package com.llestrade.core.markdown;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An input that contributed to a generated document.
 *
 * @param path     absolute path
 * @param relative project-relative path or input key
 * @param kind     e.g. {@code source}, {@code converted}, {@code map}
 * @param checksum SHA-256 of the bytes that were used
 */
public record SourceReference(String path, String relative, String kind, String checksum) {

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("path", path);
        map.put("relative", relative);
        map.put("kind", kind);
        map.put("checksum", checksum);
        return map;
    }
}
