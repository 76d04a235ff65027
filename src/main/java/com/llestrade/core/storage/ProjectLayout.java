package com.llestrade.core.storage;

import com.llestrade.core.model.AnalysisGroup;
import com.llestrade.core.model.MapDocument;
import com.llestrade.core.model.Project;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Resolves the well-known directories of a project:
 * <pre>
 * sources/                                  raw inputs
 * converted_documents/                      converted text + .conversion_manifest.json
 * bulk_analysis/&lt;slug&gt;/config.json          group definition
 * bulk_analysis/&lt;slug&gt;/outputs/...           map outputs with .manifest.json sidecars
 * bulk_analysis/&lt;slug&gt;/reduce/...            combined artifacts with sidecars
 * </pre>
 */
public final class ProjectLayout {

    public static final String SOURCES_DIR = "sources";
    public static final String CONVERTED_DIR = "converted_documents";
    public static final String BULK_ANALYSIS_DIR = "bulk_analysis";
    public static final String CONVERSION_MANIFEST = ".conversion_manifest.json";
    public static final String MANIFEST_SUFFIX = ".manifest.json";
    public static final String ANALYSIS_SUFFIX = "_analysis.md";

    private final Path root;

    public ProjectLayout(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public static ProjectLayout of(Project project) {
        return new ProjectLayout(project.root());
    }

    public Path root() { return root; }

    public Path sourcesDir() { return root.resolve(SOURCES_DIR); }

    public Path convertedDir() { return root.resolve(CONVERTED_DIR); }

    public Path conversionManifest() { return convertedDir().resolve(CONVERSION_MANIFEST); }

    public Path bulkAnalysisDir() { return root.resolve(BULK_ANALYSIS_DIR); }

    public Path groupDir(String folderName) { return bulkAnalysisDir().resolve(folderName); }

    public Path groupConfig(String folderName) { return groupDir(folderName).resolve("config.json"); }

    public Path outputsDir(String folderName) { return groupDir(folderName).resolve("outputs"); }

    public Path reduceDir(String folderName) { return groupDir(folderName).resolve("reduce"); }

    /** {@code outputs/<rel without extension>_analysis.md} */
    public Path mapOutputPath(String folderName, String relativePath) {
        return outputsDir(folderName).resolve(stripExtension(relativePath) + ANALYSIS_SUFFIX);
    }

    /** Sidecar next to an output: {@code report.md -> report.manifest.json}. */
    public static Path manifestFor(Path output) {
        String name = output.getFileName().toString();
        return output.resolveSibling(stripExtension(name) + MANIFEST_SUFFIX);
    }

    public String relativize(Path base, Path file) {
        return base.relativize(file).toString().replace('\\', '/');
    }

    /**
     * Documents selected by a per-document group: explicit files plus every text document under
     * the selected folders, de-duplicated and sorted by relative path.
     */
    public List<MapDocument> mapDocuments(AnalysisGroup group) throws IOException {
        Path converted = convertedDir();
        Map<String, Path> selected = new LinkedHashMap<>();
        for (String file : group.getFiles()) {
            Path path = resolveInside(converted, file);
            if (Files.isRegularFile(path) && isTextDocument(path)) {
                selected.putIfAbsent(relativize(converted, path), path);
            }
        }
        for (String dir : group.getDirectories()) {
            Path base = resolveInside(converted, dir);
            for (Path path : listTextDocuments(base)) {
                selected.putIfAbsent(relativize(converted, path), path);
            }
        }
        List<MapDocument> documents = new ArrayList<>();
        selected.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> documents.add(new MapDocument(
                        e.getValue(), e.getKey(), mapOutputPath(group.folderName(), e.getKey()))));
        return documents;
    }

    /** Regular {@code .md}/{@code .txt} files under {@code dir}, excluding hidden files and sidecars. */
    public List<Path> listTextDocuments(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.walk(dir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(ProjectLayout::isTextDocument)
                    .sorted()
                    .toList();
        }
    }

    public static boolean isTextDocument(Path path) {
        String name = path.getFileName().toString();
        String lower = name.toLowerCase(Locale.ROOT);
        return !name.startsWith(".")
                && !lower.endsWith(MANIFEST_SUFFIX)
                && (lower.endsWith(".md") || lower.endsWith(".txt"));
    }

    /**
     * Resolves a user-supplied relative path and rejects anything escaping {@code base}.
     */
    public Path resolveInside(Path base, String relative) {
        Path resolved = base.resolve(relative).normalize();
        if (!resolved.startsWith(base)) {
            throw new IllegalArgumentException("Path escapes " + base + ": " + relative);
        }
        return resolved;
    }

    static String stripExtension(String path) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        return dot > slash + 1 ? path.substring(0, dot) : path;
    }
}
