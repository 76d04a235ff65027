package com.llestrade.core.placeholders;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of checking a {@link PlaceholderMap} against the keys a prompt uses.
 */
public record PlaceholderValidation(SortedSet<String> missingRequired, SortedSet<String> missingOptional) {

    public PlaceholderValidation {
        missingRequired = Collections.unmodifiableSortedSet(new TreeSet<>(missingRequired));
        missingOptional = Collections.unmodifiableSortedSet(new TreeSet<>(missingOptional));
    }

    public static PlaceholderValidation ok() {
        return new PlaceholderValidation(new TreeSet<>(), new TreeSet<>());
    }

    public boolean isBlocking() {
        return !missingRequired.isEmpty();
    }

    public String describe() {
        if (missingRequired.isEmpty() && missingOptional.isEmpty()) {
            return "all placeholders supplied";
        }
        StringBuilder sb = new StringBuilder();
        if (!missingRequired.isEmpty()) {
            sb.append("missing required placeholders: ").append(String.join(", ", missingRequired));
        }
        if (!missingOptional.isEmpty()) {
            if (!sb.isEmpty()) {
                sb.append("; ");
            }
            sb.append("missing optional placeholders: ").append(String.join(", ", missingOptional));
        }
        return sb.toString();
    }
}
