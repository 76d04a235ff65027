package com.llestrade.core.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A case project on disk together with its editable placeholder values.
 *
 * @param name              display name, exposed as {@code {project_name}}
 * @param root              project directory
 * @param placeholderValues project-level placeholder values in declaration order
 */
public record Project(String name, Path root, Map<String, String> placeholderValues) {

    public Project {
        placeholderValues = placeholderValues == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(placeholderValues));
    }

    public Project(String name, Path root) {
        this(name, root, Map.of());
    }
}
