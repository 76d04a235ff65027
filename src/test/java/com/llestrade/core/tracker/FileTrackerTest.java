package com.llestrade.core.tracker;

import com.llestrade.core.model.AnalysisGroup;
import com.llestrade.core.model.AnalysisManifestEntry;
import com.llestrade.core.model.AnalysisOperation;
import com.llestrade.core.model.CombinedArtifact;
import com.llestrade.core.model.CombinedInput;
import com.llestrade.core.model.ConversionManifest;
import com.llestrade.core.model.ConversionRecord;
import com.llestrade.core.model.Coverage;
import com.llestrade.core.model.MapDocument;
import com.llestrade.core.model.Project;
import com.llestrade.core.reduce.CombinedInputResolver;
import com.llestrade.core.reduce.ReduceInput;
import com.llestrade.core.storage.ContentHasher;
import com.llestrade.core.storage.ManifestStore;
import com.llestrade.core.storage.ProjectLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileTrackerTest {

    @TempDir
    Path root;

    private ManifestStore manifestStore;
    private CombinedInputResolver inputResolver;
    private FileTracker tracker;
    private Project project;
    private ProjectLayout layout;

    @BeforeEach
    void setUp() {
        manifestStore = new ManifestStore();
        inputResolver = new CombinedInputResolver();
        tracker = new FileTracker(manifestStore, inputResolver);
        project = new Project("Case", root);
        layout = ProjectLayout.of(project);
    }

    private Path write(String relative, String text) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, text);
        return file;
    }

    @Nested
    @DisplayName("scan")
    class Scan {

        @Test
        @DisplayName("a file counts as done only when the hash matches and the output exists")
        void reconciles() throws IOException {
            Path dir = root.resolve("in");
            Path a = write("in/a.txt", "alpha");
            write("in/b.txt", "beta");
            write("in/.hidden", "skip me");
            Path out = write("out/a.md", "done");

            Coverage coverage = tracker.scan(dir, Map.of(
                    "a.txt", new TrackedOutput(ContentHasher.sha256(a), out),
                    "b.txt", new TrackedOutput("stale-hash", out)));

            assertEquals(2, coverage.total());
            assertEquals(1, coverage.done());
            assertEquals(List.of("b.txt"), coverage.pendingPaths());
            assertFalse(coverage.isComplete());
        }

        @Test
        @DisplayName("a missing directory is empty coverage")
        void missingDirectory() throws IOException {
            Coverage coverage = tracker.scan(root.resolve("nope"), Map.of());

            assertEquals(0, coverage.total());
            assertTrue(coverage.isComplete());
        }
    }

    @Test
    @DisplayName("conversion coverage reads the conversion manifest")
    void conversionCoverage() throws IOException {
        Path source = write("sources/report.pdf", "%PDF fake");
        write("sources/notes.txt", "notes");
        write("converted_documents/report.md", "converted");
        ConversionManifest manifest = new ConversionManifest();
        manifest.put("report.pdf", new ConversionRecord("converted_documents/report.md",
                ContentHasher.sha256(source), Instant.now()));
        manifestStore.writeConversionManifest(layout.conversionManifest(), manifest);

        Coverage coverage = tracker.conversionCoverage(project);

        assertEquals(2, coverage.total());
        assertEquals(1, coverage.done());
        assertEquals(List.of("notes.txt"), coverage.pendingPaths());
    }

    @Test
    @DisplayName("map coverage counts documents whose sidecar matches")
    void mapCoverage() throws IOException {
        write("converted_documents/a.md", "alpha");
        write("converted_documents/b.md", "beta");
        AnalysisGroup group = AnalysisGroup.create("Summaries", AnalysisOperation.PER_DOCUMENT);
        group.setSlug("summaries");
        group.setDirectories(List.of(""));
        MapDocument a = layout.mapDocuments(group).get(0);
        Files.createDirectories(a.outputPath().getParent());
        Files.writeString(a.outputPath(), "analysis");
        manifestStore.writeEntry(ProjectLayout.manifestFor(a.outputPath()), new AnalysisManifestEntry("a.md",
                ContentHasher.sha256(a.sourcePath()), "p", a.outputPath().toString(), "anthropic", "m", 1,
                Instant.now()));

        Coverage coverage = tracker.mapCoverage(project, group);

        assertEquals(2, coverage.total());
        assertEquals(1, coverage.done());
        assertEquals(List.of("b.md"), coverage.pendingPaths());
    }

    @Nested
    @DisplayName("combined staleness")
    class Staleness {

        private AnalysisGroup group;

        @BeforeEach
        void setUpGroup() throws IOException {
            write("converted_documents/a.md", "alpha");
            write("converted_documents/b.md", "beta");
            group = AnalysisGroup.create("Overview", AnalysisOperation.COMBINED);
            group.setSlug("overview");
            group.setCombineConvertedDirectories(List.of(""));
        }

        private CombinedArtifact recordArtifact() throws IOException {
            List<CombinedInput> inputs = new ArrayList<>();
            for (ReduceInput input : inputResolver.resolve(project, group)) {
                inputs.add(new CombinedInput(input.key(), input.kind(), input.path().toString(),
                        ContentHasher.sha256(input.path()), Files.getLastModifiedTime(input.path()).toMillis()));
            }
            Path output = write("bulk_analysis/overview/reduce/combined_20250101-0000.md", "combined");
            CombinedArtifact artifact = new CombinedArtifact(group.getId(), output.toString(), Instant.now(), "p",
                    "anthropic", "m", inputs, 1, 1);
            manifestStore.writeCombined(ProjectLayout.manifestFor(output), artifact);
            return artifact;
        }

        @Test
        @DisplayName("is stale before any artifact exists")
        void noArtifact() throws IOException {
            assertTrue(tracker.isStale(project, group));
        }

        @Test
        @DisplayName("is current right after the artifact is written")
        void current() throws IOException {
            recordArtifact();

            assertFalse(tracker.isStale(project, group));
        }

        @Test
        @DisplayName("touching an input makes it stale")
        void touched() throws IOException {
            recordArtifact();
            Path a = root.resolve("converted_documents/a.md");
            Files.setLastModifiedTime(a, FileTime.fromMillis(Files.getLastModifiedTime(a).toMillis() + 5_000));

            assertTrue(tracker.isStale(project, group));
        }

        @Test
        @DisplayName("removing an input from the selection makes it stale")
        void removedFromSelection() throws IOException {
            recordArtifact();
            group.setCombineConvertedDirectories(List.of());
            group.setCombineConvertedFiles(List.of("a.md"));

            assertTrue(tracker.isStale(project, group));
        }

        @Test
        @DisplayName("adding a file to a selected folder makes it stale")
        void newFile() throws IOException {
            recordArtifact();
            write("converted_documents/c.md", "gamma");

            assertTrue(tracker.isStale(project, group));
        }
    }
}
