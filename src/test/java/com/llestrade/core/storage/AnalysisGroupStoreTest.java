package com.llestrade.core.storage;

import com.llestrade.core.model.AnalysisGroup;
import com.llestrade.core.model.AnalysisOperation;
import com.llestrade.core.model.CombineOrder;
import com.llestrade.core.model.Project;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisGroupStoreTest {

    @TempDir
    Path root;

    private AnalysisGroupStore store;
    private Project project;

    @BeforeEach
    void setUp() {
        store = new AnalysisGroupStore();
        project = new Project("Case", root);
    }

    @Nested
    @DisplayName("slugs")
    class Slugs {

        @Test
        @DisplayName("slugify lowercases and collapses punctuation")
        void slugify() {
            assertEquals("medical-records-2024", AnalysisGroupStore.slugify("  Medical Records (2024) "));
            assertEquals("group", AnalysisGroupStore.slugify("!!!"));
            assertEquals("group", AnalysisGroupStore.slugify(null));
        }

        @Test
        @DisplayName("saving two groups with the same name gives distinct slugs")
        void uniqueSlugs() throws IOException {
            AnalysisGroup first = store.save(project, AnalysisGroup.create("Summaries", AnalysisOperation.PER_DOCUMENT));
            AnalysisGroup second = store.save(project, AnalysisGroup.create("Summaries", AnalysisOperation.PER_DOCUMENT));

            assertEquals("summaries", first.getSlug());
            assertEquals("summaries-2", second.getSlug());
        }
    }

    @Test
    @DisplayName("saved groups load back with their settings")
    void roundTrip() throws IOException {
        AnalysisGroup group = AnalysisGroup.create("Timeline", AnalysisOperation.COMBINED);
        group.setCombineMapGroups(List.of("summaries"));
        group.setCombineOrder(CombineOrder.MTIME);
        group.setProviderId("gemini");
        group.setModelContextWindow(64_000);
        group.setPlaceholderRequirements(Map.of("client", true));
        store.save(project, group);

        AnalysisGroup loaded = store.find(project, "timeline").orElseThrow();

        assertEquals(group.getId(), loaded.getId());
        assertTrue(loaded.isCombined());
        assertEquals(List.of("summaries"), loaded.getCombineMapGroups());
        assertEquals(CombineOrder.MTIME, loaded.getCombineOrder());
        assertEquals(64_000, loaded.getModelContextWindow());
        assertEquals(Map.of("client", true), loaded.getPlaceholderRequirements());
        assertNotNull(loaded.getCreatedAt());
    }

    @Test
    @DisplayName("config.json uses snake_case keys")
    void snakeCase() throws IOException {
        AnalysisGroup group = store.save(project, AnalysisGroup.create("Summaries", AnalysisOperation.PER_DOCUMENT));

        String json = Files.readString(ProjectLayout.of(project).groupConfig(group.getSlug()));

        assertTrue(json.contains("\"provider_id\""));
        assertTrue(json.contains("\"placeholder_requirements\""));
        assertTrue(json.contains("\"per_document\""));
        assertFalse(json.contains("\"providerId\""));
    }

    @Test
    @DisplayName("list sorts by name and skips unsupported versions")
    void listSkipsOldVersions() throws IOException {
        store.save(project, AnalysisGroup.create("beta", AnalysisOperation.PER_DOCUMENT));
        store.save(project, AnalysisGroup.create("Alpha", AnalysisOperation.PER_DOCUMENT));
        Path legacy = ProjectLayout.of(project).groupConfig("legacy");
        Files.createDirectories(legacy.getParent());
        Files.writeString(legacy, "{\"id\":\"x\",\"name\":\"Legacy\",\"version\":\"1\"}");

        List<AnalysisGroup> groups = store.list(project);

        assertEquals(List.of("Alpha", "beta"), groups.stream().map(AnalysisGroup::getName).toList());
    }

    @Test
    @DisplayName("a corrupt config is skipped")
    void corruptConfig() throws IOException {
        Path config = ProjectLayout.of(project).groupConfig("broken");
        Files.createDirectories(config.getParent());
        Files.writeString(config, "{ not json");

        assertTrue(store.list(project).isEmpty());
    }

    @Test
    @DisplayName("delete removes the group directory with its outputs")
    void delete() throws IOException {
        AnalysisGroup group = store.save(project, AnalysisGroup.create("Summaries", AnalysisOperation.PER_DOCUMENT));
        Path output = ProjectLayout.of(project).mapOutputPath(group.getSlug(), "a.md");
        Files.createDirectories(output.getParent());
        Files.writeString(output, "analysis");

        store.delete(project, group);

        assertFalse(Files.exists(ProjectLayout.of(project).groupDir(group.getSlug())));
        assertTrue(store.find(project, group.getSlug()).isEmpty());
    }
}
