package com.llestrade.core.placeholders;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses placeholder sets written as markdown lists, one snake_case key per line.
 * Headings and blank lines are ignored; defaults ({@code key: value}) are rejected.
 */
public final class PlaceholderParser {

    private static final Pattern BULLET_PREFIX = Pattern.compile("^\\s*(?:[-*+]|\\d+[.)])\\s*");
    private static final Pattern SNAKE_CASE = Pattern.compile("^[a-z][a-z0-9_]*$");

    private PlaceholderParser() {}

    public static List<String> parse(String markdown) {
        List<String> keys = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String rawLine : markdown.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            line = BULLET_PREFIX.matcher(line).replaceFirst("").strip();
            if (line.isEmpty()) {
                continue;
            }
            if (line.contains(":")) {
                throw new PlaceholderParseException(
                        "Invalid placeholder entry '" + rawLine + "': default values are not supported.");
            }
            if (!SNAKE_CASE.matcher(line).matches()) {
                throw new PlaceholderParseException(
                        "Invalid placeholder key '" + line + "'. Keys must be snake_case.");
            }
            if (!seen.add(line)) {
                throw new PlaceholderParseException("Duplicate placeholder key '" + line + "'.");
            }
            keys.add(line);
        }
        return keys;
    }

    public static List<String> parse(Path file) {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new PlaceholderParseException("Failed to read placeholder file '" + file + "': " + e.getMessage(), e);
        }
    }
}
