package com.llestrade.core.tracker;

import com.llestrade.core.model.AnalysisGroup;
import com.llestrade.core.model.CombinedArtifact;
import com.llestrade.core.model.CombinedInput;
import com.llestrade.core.model.ConversionManifest;
import com.llestrade.core.model.Coverage;
import com.llestrade.core.model.MapDocument;
import com.llestrade.core.model.Project;
import com.llestrade.core.model.SourceItem;
import com.llestrade.core.reduce.CombinedInputResolver;
import com.llestrade.core.reduce.ReduceInput;
import com.llestrade.core.storage.ContentHasher;
import com.llestrade.core.storage.ManifestStore;
import com.llestrade.core.storage.ProjectLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reconciles what is on disk with what the manifests say was processed. Read-only.
 * <p>
 * Totals are always recomputed from the current directory listing, so deleting or adding
 * files is reflected on the next scan.
 */
@Service
public class FileTracker {

    private static final Logger log = LoggerFactory.getLogger(FileTracker.class);

    private final ManifestStore manifestStore;
    private final CombinedInputResolver inputResolver;

    public FileTracker(ManifestStore manifestStore, CombinedInputResolver inputResolver) {
        this.manifestStore = manifestStore;
        this.inputResolver = inputResolver;
    }

    /**
     * Scans every regular, non-hidden file under {@code root} against {@code manifests}
     * (keyed by path relative to {@code root}).
     */
    public Coverage scan(Path root, Map<String, TrackedOutput> manifests) throws IOException {
        return reconcile(listSources(root), manifests);
    }

    public Coverage conversionCoverage(Project project) throws IOException {
        ProjectLayout layout = ProjectLayout.of(project);
        ConversionManifest manifest = manifestStore.readConversionManifest(layout.conversionManifest());
        Map<String, TrackedOutput> tracked = new HashMap<>();
        manifest.getFiles().forEach((rel, record) ->
                tracked.put(rel, new TrackedOutput(record.sourceHash(), layout.root().resolve(record.outputPath()))));
        return scan(layout.sourcesDir(), tracked);
    }

    public Coverage mapCoverage(Project project, AnalysisGroup group) throws IOException {
        ProjectLayout layout = ProjectLayout.of(project);
        List<SourceItem> items = new ArrayList<>();
        Map<String, TrackedOutput> tracked = new HashMap<>();
        for (MapDocument document : layout.mapDocuments(group)) {
            items.add(toSourceItem(document.relativePath(), document.sourcePath()));
            manifestStore.readEntry(ProjectLayout.manifestFor(document.outputPath()))
                    .ifPresent(entry -> tracked.put(document.relativePath(),
                            new TrackedOutput(entry.sourceHash(), document.outputPath())));
        }
        return reconcile(items, tracked);
    }

    /**
     * True when the group's latest combined artifact no longer reflects its inputs, or when
     * no artifact has been produced yet.
     */
    public boolean isStale(Project project, AnalysisGroup group) throws IOException {
        Optional<CombinedArtifact> latest = manifestStore.latestCombined(
                ProjectLayout.of(project).reduceDir(group.folderName()));
        if (latest.isEmpty()) {
            return true;
        }
        return isStale(latest.get(), inputResolver.resolve(project, group));
    }

    public boolean isStale(CombinedArtifact artifact, List<ReduceInput> currentInputs) throws IOException {
        Set<String> recordedKeys = artifact.inputs().stream().map(CombinedInput::key).collect(Collectors.toSet());
        Set<String> currentKeys = currentInputs.stream().map(ReduceInput::key).collect(Collectors.toSet());
        if (!recordedKeys.equals(currentKeys)) {
            log.debug("Combined artifact {} is stale: input selection changed", artifact.outputPath());
            return true;
        }
        for (CombinedInput input : artifact.inputs()) {
            Path path = Path.of(input.path());
            if (!Files.isRegularFile(path)) {
                log.debug("Combined artifact {} is stale: {} is missing", artifact.outputPath(), input.key());
                return true;
            }
            if (Files.getLastModifiedTime(path).toMillis() != input.mtimeMillis()
                    || !ContentHasher.sha256(path).equals(input.hash())) {
                log.debug("Combined artifact {} is stale: {} changed", artifact.outputPath(), input.key());
                return true;
            }
        }
        return false;
    }

    private Coverage reconcile(List<SourceItem> items, Map<String, TrackedOutput> manifests) {
        int done = 0;
        List<String> pending = new ArrayList<>();
        for (SourceItem item : items) {
            TrackedOutput output = manifests.get(item.relativePath());
            if (output != null && output.sourceHash() != null
                    && output.sourceHash().equals(item.contentHash())
                    && Files.exists(output.outputPath())) {
                done++;
            } else {
                pending.add(item.relativePath());
            }
        }
        return new Coverage(items.size(), done, pending.size(), pending);
    }

    private List<SourceItem> listSources(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<SourceItem> items = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(root)) {
            for (Path path : stream.filter(Files::isRegularFile).sorted().toList()) {
                if (path.getFileName().toString().startsWith(".")) {
                    continue;
                }
                items.add(toSourceItem(root.relativize(path).toString().replace('\\', '/'), path));
            }
        }
        return items;
    }

    private static SourceItem toSourceItem(String relativePath, Path path) throws IOException {
        return new SourceItem(relativePath, path, ContentHasher.sha256(path),
                Files.getLastModifiedTime(path).toMillis());
    }
}
