package com.llestrade.core.reduce;

import com.llestrade.core.model.AnalysisGroup;
import com.llestrade.core.model.CombineOrder;
import com.llestrade.core.model.InputKind;
import com.llestrade.core.model.Project;
import com.llestrade.core.storage.ProjectLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands a combined group's selection (converted files and folders, whole map groups, map
 * files and map folders) into the ordered list of files to merge. Duplicates are dropped by
 * absolute path, first occurrence wins.
 */
@Component
public class CombinedInputResolver {

    private static final Logger log = LoggerFactory.getLogger(CombinedInputResolver.class);

    public List<ReduceInput> resolve(Project project, AnalysisGroup group) throws IOException {
        ProjectLayout layout = ProjectLayout.of(project);
        Path converted = layout.convertedDir();
        List<ReduceInput> items = new ArrayList<>();

        for (String rel : group.getCombineConvertedFiles()) {
            String clean = trimSlashes(rel);
            if (clean.isEmpty()) {
                continue;
            }
            addIfPresent(items, InputKind.CONVERTED, "converted/" + clean, layout.resolveInside(converted, clean));
        }
        for (String relDir : group.getCombineConvertedDirectories()) {
            Path base = layout.resolveInside(converted, trimSlashes(relDir));
            for (Path file : layout.listTextDocuments(base)) {
                items.add(new ReduceInput("converted/" + layout.relativize(converted, file), InputKind.CONVERTED, file));
            }
        }

        for (String slug : group.getCombineMapGroups()) {
            String clean = slug.strip();
            if (clean.isEmpty()) {
                continue;
            }
            addMapOutputsUnder(items, layout, clean, "");
        }
        for (String relDir : group.getCombineMapDirectories()) {
            String[] parts = trimSlashes(relDir).split("/", 2);
            if (parts.length == 2 && !parts[0].isBlank()) {
                addMapOutputsUnder(items, layout, parts[0].strip(), parts[1]);
            }
        }
        for (String rel : group.getCombineMapFiles()) {
            String[] parts = trimSlashes(rel).split("/", 2);
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                continue;
            }
            Path outputs = layout.outputsDir(parts[0].strip());
            addIfPresent(items, InputKind.MAP, "map/" + parts[0].strip() + "/" + parts[1],
                    layout.resolveInside(outputs, parts[1]));
        }

        List<ReduceInput> deduped = new ArrayList<>();
        Set<Path> seen = new HashSet<>();
        for (ReduceInput item : items) {
            if (seen.add(item.path().toAbsolutePath().normalize())) {
                deduped.add(item);
            }
        }
        if (group.getCombineOrder() == CombineOrder.MTIME) {
            deduped.sort(Comparator.comparingLong(CombinedInputResolver::mtime).thenComparing(ReduceInput::key));
        } else {
            deduped.sort(Comparator.comparing(ReduceInput::key));
        }
        return deduped;
    }

    private void addMapOutputsUnder(List<ReduceInput> items, ProjectLayout layout, String slug, String relDir)
            throws IOException {
        Path outputs = layout.outputsDir(slug);
        Path base = relDir.isBlank() ? outputs : layout.resolveInside(outputs, trimSlashes(relDir));
        for (Path file : layout.listTextDocuments(base)) {
            items.add(new ReduceInput("map/" + slug + "/" + layout.relativize(outputs, file), InputKind.MAP, file));
        }
    }

    private static void addIfPresent(List<ReduceInput> items, InputKind kind, String key, Path path) {
        if (Files.isRegularFile(path)) {
            items.add(new ReduceInput(key, kind, path));
        } else {
            log.warn("Selected input {} does not exist; skipping", path);
        }
    }

    private static long mtime(ReduceInput input) {
        try {
            return Files.getLastModifiedTime(input.path()).toMillis();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String trimSlashes(String value) {
        return value == null ? "" : value.strip().replaceAll("^/+|/+$", "");
    }
}
