package com.llestrade.core.placeholders;

public record PlaceholderEntry(String key, String value, PlaceholderScope scope) {

    public boolean isBlank() {
        return value == null || value.isBlank();
    }
}
