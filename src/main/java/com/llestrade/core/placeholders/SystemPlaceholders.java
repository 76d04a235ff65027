package com.llestrade.core.placeholders;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Values the engine computes for every run. These keys are reserved: projects and
 * per-run overrides may not redefine them.
 */
public final class SystemPlaceholders {

    public static final List<String> KEYS = List.of(
            "project_name",
            "timestamp",
            "source_pdf_filename",
            "source_pdf_relative_path",
            "source_pdf_absolute_path",
            "reduce_source_list",
            "reduce_source_table",
            "reduce_source_count"
    );

    /** Filled by the renderer itself for each prompt; also reserved. */
    public static final Set<String> RUNTIME_KEYS = Set.of(
            "document_content",
            "document_name",
            "chunk_index",
            "chunk_total",
            "chunk_summaries"
    );

    private SystemPlaceholders() {}

    public static boolean isReserved(String key) {
        return KEYS.contains(key) || RUNTIME_KEYS.contains(key);
    }

    /**
     * Execution context the system values are computed from.
     *
     * @param projectName   project display name
     * @param timestamp     run timestamp
     * @param source        the document being mapped, or null
     * @param reduceSources inputs of a combined run, empty otherwise
     */
    public record Context(String projectName, Instant timestamp, SourceFileContext source,
                          List<SourceFileContext> reduceSources) {

        public Context {
            timestamp = timestamp == null ? Instant.now() : timestamp;
            reduceSources = reduceSources == null ? List.of() : List.copyOf(reduceSources);
        }

        public static Context forProject(String projectName) {
            return new Context(projectName, Instant.now(), null, List.of());
        }

        public static Context forDocument(String projectName, SourceFileContext source) {
            return new Context(projectName, Instant.now(), source, List.of());
        }

        public static Context forReduce(String projectName, List<SourceFileContext> sources) {
            return new Context(projectName, Instant.now(), null, sources);
        }
    }

    public static Map<String, String> values(Context context) {
        Map<String, String> values = new LinkedHashMap<>();
        SourceFileContext source = context.source();
        values.put("project_name", context.projectName() == null ? "" : context.projectName());
        values.put("timestamp", DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(context.timestamp().atOffset(ZoneOffset.UTC)));
        values.put("source_pdf_filename", source == null ? "" : source.filename());
        values.put("source_pdf_relative_path", source == null ? "" : source.relativePath());
        values.put("source_pdf_absolute_path", source == null ? "" : source.absolutePathText());
        values.putAll(reduceValues(context.reduceSources()));
        return values;
    }

    private static Map<String, String> reduceValues(List<SourceFileContext> sources) {
        Map<String, String> values = new LinkedHashMap<>();
        if (sources.isEmpty()) {
            values.put("reduce_source_list", "");
            values.put("reduce_source_table", "");
            values.put("reduce_source_count", "");
            return values;
        }
        values.put("reduce_source_list", sources.stream()
                .map(s -> "- " + s.relativePath())
                .collect(Collectors.joining("\n")));
        StringBuilder table = new StringBuilder("| Filename | Relative Path | Absolute Path |\n| --- | --- | --- |");
        for (SourceFileContext s : sources) {
            table.append("\n| ").append(s.filename())
                 .append(" | ").append(s.relativePath())
                 .append(" | ").append(s.absolutePathText()).append(" |");
        }
        values.put("reduce_source_table", table.toString());
        values.put("reduce_source_count", String.valueOf(sources.size()));
        return values;
    }
}
