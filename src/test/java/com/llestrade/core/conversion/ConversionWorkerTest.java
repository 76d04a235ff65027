package com.llestrade.core.conversion;

import com.llestrade.core.coordinator.RecordingJobContext;
import com.llestrade.core.errors.AnalysisException;
import com.llestrade.core.errors.CancellationRequestedException;
import com.llestrade.core.markdown.Frontmatter;
import com.llestrade.core.metrics.AnalysisMetrics;
import com.llestrade.core.model.ConversionManifest;
import com.llestrade.core.model.Project;
import com.llestrade.core.storage.ContentHasher;
import com.llestrade.core.storage.ManifestStore;
import com.llestrade.core.storage.PathLocks;
import com.llestrade.core.storage.ProjectLayout;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConversionWorkerTest {

    @TempDir
    Path root;

    private Project project;
    private ProjectLayout layout;
    private ManifestStore manifestStore;

    @BeforeEach
    void setUp() throws IOException {
        project = new Project("Case", root);
        layout = ProjectLayout.of(project);
        manifestStore = new ManifestStore();
        write("notes.txt", "plain notes");
        write("medical/summary.md", "# Summary");
    }

    private void write(String relative, String text) throws IOException {
        Path file = layout.sourcesDir().resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, text);
    }

    private ConversionWorker worker(DocumentConverter... extra) {
        List<DocumentConverter> converters = new ArrayList<>(List.of(extra));
        converters.add(new PlainTextConverter());
        return new ConversionWorker(converters, manifestStore, new PathLocks(),
                new AnalysisMetrics(new SimpleMeterRegistry()));
    }

    private Frontmatter.Document converted(String relative) throws IOException {
        return Frontmatter.parse(Files.readString(layout.convertedDir().resolve(relative)));
    }

    @Test
    @DisplayName("markdown names replace the extension except for text sources")
    void markdownName() {
        assertEquals("a/report.md", ConversionWorker.markdownName("a/report.pdf"));
        assertEquals("notes.txt", ConversionWorker.markdownName("notes.txt"));
        assertEquals("v1.2/README.md", ConversionWorker.markdownName("v1.2/README"));
    }

    @Nested
    @DisplayName("conversion")
    class Conversion {

        @Test
        @DisplayName("converts supported files and records them in the manifest")
        void converts() throws IOException {
            write("scan.pdf", "%PDF");

            ConversionResult result = worker().process(project, false, new RecordingJobContext());

            assertEquals(2, result.converted());
            assertEquals(1, result.unsupported());
            assertEquals("plain notes", converted("notes.txt").body());
            assertEquals("# Summary", converted("medical/summary.md").body());
            ConversionManifest manifest = manifestStore.readConversionManifest(layout.conversionManifest());
            assertEquals("converted_documents/medical/summary.md",
                    manifest.get("medical/summary.md").orElseThrow().outputPath());
        }

        @Test
        @DisplayName("converted documents carry their source in front matter")
        void frontMatter() throws IOException {
            write("letters/intake.md", "---\ntitle: Intake letter\n---\n\nDear Sir");

            worker().process(project, false, new RecordingJobContext());

            Frontmatter.Document notes = converted("notes.txt");
            assertEquals("conversion", notes.metadata().get("generator"));
            assertEquals("plain-text", notes.metadata().get("converter"));
            assertEquals("txt", notes.metadata().get("source_format"));
            assertNotNull(notes.metadata().get("created_at"));
            List<?> sources = (List<?>) notes.metadata().get("sources");
            Map<?, ?> source = (Map<?, ?>) sources.get(0);
            assertEquals("sources/notes.txt", source.get("relative"));
            assertEquals("source", source.get("kind"));
            assertEquals(ContentHasher.sha256("plain notes"), source.get("checksum"));

            Frontmatter.Document letter = converted("letters/intake.md");
            assertEquals("Intake letter", letter.metadata().get("title"));
            assertEquals("md", letter.metadata().get("source_format"));
            assertEquals("Dear Sir", letter.body());
        }

        @Test
        @DisplayName("unchanged sources are skipped on the next run")
        void skipsUnchanged() throws IOException {
            worker().process(project, false, new RecordingJobContext());

            ConversionResult again = worker().process(project, false, new RecordingJobContext());

            assertEquals(0, again.converted());
            assertEquals(2, again.skipped());
        }

        @Test
        @DisplayName("an edited source is converted again")
        void reconvertsChanged() throws IOException {
            worker().process(project, false, new RecordingJobContext());
            write("notes.txt", "edited notes");

            ConversionResult again = worker().process(project, false, new RecordingJobContext());

            assertEquals(1, again.converted());
            assertEquals("edited notes", converted("notes.txt").body());
        }

        @Test
        @DisplayName("force converts everything")
        void force() throws IOException {
            worker().process(project, false, new RecordingJobContext());

            assertEquals(2, worker().process(project, true, new RecordingJobContext()).converted());
        }

        @Test
        @DisplayName("a missing sources folder converts nothing")
        void noSources() throws IOException {
            Project empty = new Project("Empty", root.resolve("elsewhere"));

            assertEquals(0, worker().process(empty, false, new RecordingJobContext()).converted());
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a failing file does not stop the others but fails the job")
        void partialFailure() throws IOException {
            write("broken.pdf", "%PDF");
            DocumentConverter pdf = mock(DocumentConverter.class);
            when(pdf.supports(any())).thenAnswer(inv -> inv.getArgument(0, Path.class).toString().endsWith(".pdf"));
            when(pdf.convert(any())).thenThrow(new IOException("encrypted"));
            RecordingJobContext context = new RecordingJobContext();

            var error = assertThrows(AnalysisException.class, () -> worker(pdf).process(project, false, context));

            assertTrue(error.getMessage().contains("broken.pdf"));
            assertTrue(Files.exists(layout.convertedDir().resolve("notes.txt")));
            assertTrue(context.logMessages().stream().anyMatch(m -> m.contains("encrypted")));
        }

        @Test
        @DisplayName("cancellation stops before the next file")
        void cancelled() {
            RecordingJobContext context = new RecordingJobContext();
            context.cancel();

            assertThrows(CancellationRequestedException.class, () -> worker().process(project, false, context));
            assertFalse(Files.exists(layout.convertedDir()));
        }
    }
}
