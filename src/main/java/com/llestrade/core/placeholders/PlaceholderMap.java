package com.llestrade.core.placeholders;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable placeholder substitution map.
 */
public final class PlaceholderMap {

    private final Map<String, PlaceholderEntry> entries;

    PlaceholderMap(Map<String, PlaceholderEntry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static PlaceholderMap empty() {
        return new PlaceholderMap(Map.of());
    }

    public Optional<PlaceholderEntry> entry(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /** Value for {@code key}, or an empty string when absent. */
    public String get(String key) {
        PlaceholderEntry entry = entries.get(key);
        return entry == null || entry.value() == null ? "" : entry.value();
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public List<PlaceholderEntry> entries() {
        return List.copyOf(entries.values());
    }

    /** Plain key to value view, in insertion order. */
    public Map<String, String> values() {
        Map<String, String> values = new LinkedHashMap<>();
        entries.forEach((key, entry) -> values.put(key, entry.value() == null ? "" : entry.value()));
        return values;
    }

    public int size() {
        return entries.size();
    }
}
