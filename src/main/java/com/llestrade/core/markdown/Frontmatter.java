package com.llestrade.core.markdown;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the YAML front matter block that records where a markdown output came from.
 * <p>
 * The block is written as {@code ---}, the YAML, {@code ---}, one blank line, then the body.
 * Null values, blank strings and empty lists or maps are dropped before writing.
 */
public final class Frontmatter {

    private static final Logger log = LoggerFactory.getLogger(Frontmatter.class);

    private static final Pattern OPENING = Pattern.compile("\\A\\uFEFF?---[ \\t]*\\r?\\n");
    private static final Pattern CLOSING = Pattern.compile("(?m)^---[ \\t]*\\r?$");
    private static final Pattern LEADING_BREAKS = Pattern.compile("\\A\\r?\\n(\\r?\\n)?");

    private static final ObjectMapper YAML = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
            .build());
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /** Markdown split into its front matter and the text below it. */
    public record Document(Map<String, Object> metadata, String body) {}

    private Frontmatter() {}

    public static Document parse(String content) {
        Matcher opening = OPENING.matcher(content);
        if (!opening.find()) {
            return new Document(Map.of(), content);
        }
        Matcher closing = CLOSING.matcher(content);
        if (!closing.find(opening.end())) {
            return new Document(Map.of(), content);
        }
        String yaml = content.substring(opening.end(), closing.start());
        String body = LEADING_BREAKS.matcher(content.substring(closing.end())).replaceFirst("");
        if (yaml.isBlank()) {
            return new Document(Map.of(), body);
        }
        try {
            Map<String, Object> metadata = YAML.readValue(yaml, MAP_TYPE);
            return new Document(metadata != null ? metadata : Map.of(), body);
        } catch (JsonProcessingException e) {
            log.warn("Front matter is not valid YAML, treating it as text: {}", e.getOriginalMessage());
            return new Document(Map.of(), content);
        }
    }

    /** The text below the front matter, or the whole content when there is none. */
    public static String body(String content) {
        return parse(content).body();
    }

    /**
     * Writes {@code metadata} over any front matter already on {@code content}; new keys win.
     */
    public static String apply(String content, Map<String, Object> metadata) {
        Document existing = parse(content);
        Map<String, Object> merged = new LinkedHashMap<>(existing.metadata());
        merged.putAll(metadata);
        Object pruned = prune(merged);
        if (pruned == null) {
            return existing.body();
        }
        try {
            return "---\n" + YAML.writeValueAsString(pruned) + "---\n\n" + existing.body();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot write front matter: " + e.getOriginalMessage(), e);
        }
    }

    /** Keys every generated document carries: project, creation time, generator and inputs. */
    public static Map<String, Object> provenance(Path projectRoot, String generator, Instant createdAt,
                                                 List<SourceReference> sources) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("project_path", projectRoot.toAbsolutePath().normalize().toString());
        metadata.put("created_at", createdAt.toString());
        metadata.put("generator", generator);
        metadata.put("sources", sources.stream().map(SourceReference::toMap).toList());
        return metadata;
    }

    private static Object prune(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> kept = new LinkedHashMap<>();
            map.forEach((key, child) -> {
                Object prunedChild = prune(child);
                if (prunedChild != null) {
                    kept.put(String.valueOf(key), prunedChild);
                }
            });
            return kept.isEmpty() ? null : kept;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> kept = new ArrayList<>();
            for (Object child : collection) {
                Object prunedChild = prune(child);
                if (prunedChild != null) {
                    kept.add(prunedChild);
                }
            }
            return kept.isEmpty() ? null : kept;
        }
        if (value instanceof String text && text.isBlank()) {
            return null;
        }
        return value;
    }
}
