package com.llestrade.core.storage;

import com.llestrade.core.model.AnalysisGroup;
import com.llestrade.core.model.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Loads, saves and deletes analysis groups under {@code bulk_analysis/<slug>/config.json}.
 */
@Component
public class AnalysisGroupStore {

    private static final Logger log = LoggerFactory.getLogger(AnalysisGroupStore.class);

    public List<AnalysisGroup> list(Project project) throws IOException {
        ProjectLayout layout = ProjectLayout.of(project);
        Path root = layout.bulkAnalysisDir();
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<AnalysisGroup> groups = new ArrayList<>();
        try (Stream<Path> children = Files.list(root)) {
            for (Path child : children.filter(Files::isDirectory).sorted().toList()) {
                load(child).ifPresent(groups::add);
            }
        }
        groups.sort(Comparator.comparing(AnalysisGroup::getName, String.CASE_INSENSITIVE_ORDER));
        return groups;
    }

    public Optional<AnalysisGroup> find(Project project, String slug) {
        return load(ProjectLayout.of(project).groupDir(slug));
    }

    /**
     * Persists a group, assigning a unique slug on first save.
     */
    public AnalysisGroup save(Project project, AnalysisGroup group) throws IOException {
        ProjectLayout layout = ProjectLayout.of(project);
        if (group.getSlug() == null || group.getSlug().isBlank()) {
            group.setSlug(uniqueSlug(layout.bulkAnalysisDir(), slugify(group.getName())));
        }
        group.setVersion(AnalysisGroup.CURRENT_VERSION);
        group.touch();
        if (group.getCreatedAt() == null) {
            group.setCreatedAt(group.getUpdatedAt());
        }
        JsonFiles.write(layout.groupConfig(group.getSlug()), group);
        log.info("Saved analysis group '{}' as {}", group.getName(), group.getSlug());
        return group;
    }

    /** Removes the group directory, including its outputs. */
    public void delete(Project project, AnalysisGroup group) throws IOException {
        if (group.getSlug() == null || group.getSlug().isBlank()) {
            return;
        }
        Path dir = ProjectLayout.of(project).groupDir(group.getSlug());
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
        log.info("Deleted analysis group {}", group.getSlug());
    }

    public static String slugify(String name) {
        String slug = name == null ? "" : name.strip().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? "group" : slug;
    }

    static String uniqueSlug(Path root, String candidate) {
        String slug = candidate;
        int index = 2;
        while (Files.exists(root.resolve(slug))) {
            slug = candidate + "-" + index++;
        }
        return slug;
    }

    private Optional<AnalysisGroup> load(Path groupDir) {
        Path config = groupDir.resolve("config.json");
        if (!Files.isRegularFile(config)) {
            return Optional.empty();
        }
        try {
            AnalysisGroup group = JsonFiles.read(config, AnalysisGroup.class);
            if (!AnalysisGroup.CURRENT_VERSION.equals(group.getVersion())) {
                log.warn("Skipping analysis group at {}: unsupported version {} (expected {})",
                        config, group.getVersion(), AnalysisGroup.CURRENT_VERSION);
                return Optional.empty();
            }
            if (group.getSlug() == null || group.getSlug().isBlank()) {
                group.setSlug(groupDir.getFileName().toString());
            }
            return Optional.of(group);
        } catch (IOException e) {
            log.warn("Failed to load analysis group from {}: {}", config, e.getMessage());
            return Optional.empty();
        }
    }
}
