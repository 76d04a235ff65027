package com.llestrade.core.prompt;

import com.llestrade.core.errors.FatalConfigurationException;
import com.llestrade.core.model.AnalysisGroup;
import com.llestrade.core.model.AnalysisOperation;
import com.llestrade.core.model.Project;
import com.llestrade.core.placeholders.PlaceholderMap;
import com.llestrade.core.placeholders.PlaceholderResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PromptRendererTest {

    @TempDir
    Path root;

    private PromptRenderer renderer;
    private Project project;
    private AnalysisGroup group;

    @BeforeEach
    void setUp() {
        renderer = new PromptRenderer();
        project = new Project("Case", root, Map.of("client", "ACME"));
        group = AnalysisGroup.create("Summaries", AnalysisOperation.PER_DOCUMENT);
    }

    private PlaceholderMap placeholders() {
        return new PlaceholderResolver().resolve(project, Map.of());
    }

    @Nested
    @DisplayName("load")
    class Load {

        @Test
        @DisplayName("falls back to the default templates")
        void defaults() {
            PromptBundle bundle = renderer.load(project, group);

            assertEquals(DefaultPrompts.SYSTEM, bundle.systemTemplate());
            assertEquals(DefaultPrompts.USER, bundle.userTemplate());
            assertEquals("default", bundle.userSource());
        }

        @Test
        @DisplayName("combined groups default to the combined user template")
        void combinedDefault() {
            AnalysisGroup combined = AnalysisGroup.create("All", AnalysisOperation.COMBINED);

            assertEquals(DefaultPrompts.COMBINED_USER, renderer.load(project, combined).userTemplate());
        }

        @Test
        @DisplayName("reads prompt files relative to the project root")
        void relativePaths() throws Exception {
            Files.createDirectories(root.resolve("prompts"));
            Files.writeString(root.resolve("prompts/system.md"), "System for {client}");
            Files.writeString(root.resolve("prompts/user.md"), "Read {document_content}");
            group.setSystemPromptPath("prompts/system.md");
            group.setUserPromptPath("prompts/user.md");

            PromptBundle bundle = renderer.load(project, group);

            assertEquals("System for {client}", bundle.systemTemplate());
            assertEquals("prompts/user.md", bundle.userSource());
        }

        @Test
        @DisplayName("a missing prompt file is a configuration error")
        void missingFile() {
            group.setUserPromptPath("prompts/absent.md");

            assertThrows(FatalConfigurationException.class, () -> renderer.load(project, group));
        }

        @Test
        @DisplayName("a user template without document_content is rejected")
        void requiresDocumentContent() throws Exception {
            Files.writeString(root.resolve("user.md"), "No content token here");
            group.setUserPromptPath("user.md");

            var error = assertThrows(FatalConfigurationException.class, () -> renderer.load(project, group));
            assertTrue(error.getMessage().contains("{document_content}"));
        }
    }

    @Nested
    @DisplayName("render")
    class Render {

        @Test
        @DisplayName("substitutes known keys and leaves unknown ones")
        void substitutes() {
            String out = renderer.render("{client} vs {unknown_key}", Map.of("client", "ACME"));

            assertEquals("ACME vs {unknown_key}", out);
        }

        @Test
        @DisplayName("values containing dollar signs and braces are inserted literally")
        void literalValues() {
            String out = renderer.render("Fee: {fee}", Map.of("fee", "$100 {x}"));

            assertEquals("Fee: $100 {x}", out);
        }

        @Test
        @DisplayName("usedPlaceholders excludes runtime keys")
        void usedPlaceholders() {
            PromptBundle bundle = new PromptBundle("{project_name} {client}", "{document_content} {court}",
                    "default", "default");

            assertEquals(Set.of("project_name", "client", "court"), renderer.usedPlaceholders(bundle));
        }

        @Test
        @DisplayName("chunk prompts carry the chunk position prefix")
        void chunkPrefix() {
            PromptBundle bundle = renderer.load(project, group);

            String prompt = renderer.renderChunk(bundle, placeholders(), "report.md", "BODY", 2, 5);

            assertTrue(prompt.startsWith("You are analysing chunk 2 of 5 from report.md.\n\n"));
            assertTrue(prompt.contains("BODY"));
        }

        @Test
        @DisplayName("chunk merge joins non-empty partials with the separator")
        void chunkMerge() {
            String prompt = renderer.renderChunkMerge(List.of(" first ", "", "second"), "report.md", placeholders());

            assertTrue(prompt.contains("partial results of document: report.md"));
            assertTrue(prompt.contains("first" + DefaultPrompts.CHUNK_SEPARATOR + "second"));
        }
    }

    @Nested
    @DisplayName("promptHash")
    class PromptHash {

        private String hash(Map<String, String> projectValues, Map<String, String> runValues, double temperature) {
            PromptBundle bundle = renderer.load(project, group);
            return renderer.promptHash(bundle, group, "anthropic", "claude", temperature, projectValues, runValues);
        }

        @Test
        @DisplayName("is stable for identical inputs")
        void stable() {
            assertEquals(hash(Map.of("a", "1"), Map.of(), 0.1), hash(Map.of("a", "1"), Map.of(), 0.1));
        }

        @Test
        @DisplayName("changes with project values, run values and temperature")
        void sensitive() {
            String base = hash(Map.of("a", "1"), Map.of(), 0.1);

            assertNotEquals(base, hash(Map.of("a", "2"), Map.of(), 0.1));
            assertNotEquals(base, hash(Map.of("a", "1"), Map.of("b", "x"), 0.1));
            assertNotEquals(base, hash(Map.of("a", "1"), Map.of(), 1.0));
        }

        @Test
        @DisplayName("changes when the template changes")
        void templateChange() throws Exception {
            String before = hash(Map.of(), Map.of(), 0.1);
            Files.writeString(root.resolve("user.md"), "Different {document_content}");
            group.setUserPromptPath("user.md");

            assertNotEquals(before, hash(Map.of(), Map.of(), 0.1));
        }
    }
}
