package com.llestrade.core.storage;

import com.llestrade.core.model.AnalysisManifestEntry;
import com.llestrade.core.model.CombinedArtifact;
import com.llestrade.core.model.ConversionManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads and writes the JSON manifests that drive skip-if-unchanged decisions.
 * <p>
 * A missing or unreadable manifest is treated as "not processed": the work is redone and the
 * manifest rewritten. Writes are atomic.
 */
@Component
public class ManifestStore {

    private static final Logger log = LoggerFactory.getLogger(ManifestStore.class);

    public Optional<AnalysisManifestEntry> readEntry(Path manifestPath) {
        return readQuietly(manifestPath, AnalysisManifestEntry.class);
    }

    public void writeEntry(Path manifestPath, AnalysisManifestEntry entry) throws IOException {
        JsonFiles.write(manifestPath, entry);
    }

    public ConversionManifest readConversionManifest(Path manifestPath) {
        return readQuietly(manifestPath, ConversionManifest.class).orElseGet(ConversionManifest::new);
    }

    public void writeConversionManifest(Path manifestPath, ConversionManifest manifest) throws IOException {
        JsonFiles.write(manifestPath, manifest);
    }

    public Optional<CombinedArtifact> readCombined(Path manifestPath) {
        return readQuietly(manifestPath, CombinedArtifact.class);
    }

    public void writeCombined(Path manifestPath, CombinedArtifact artifact) throws IOException {
        JsonFiles.write(manifestPath, artifact);
    }

    /**
     * All combined artifacts recorded under a group's reduce directory, newest first.
     */
    public List<CombinedArtifact> listCombined(Path reduceDir) throws IOException {
        if (!Files.isDirectory(reduceDir)) {
            return List.of();
        }
        List<CombinedArtifact> artifacts = new ArrayList<>();
        try (Stream<Path> stream = Files.list(reduceDir)) {
            stream.filter(p -> p.getFileName().toString().endsWith(ProjectLayout.MANIFEST_SUFFIX))
                  .sorted()
                  .forEach(p -> readCombined(p).ifPresent(artifacts::add));
        }
        artifacts.sort(Comparator.comparing(CombinedArtifact::createdAt,
                Comparator.nullsFirst(Comparator.naturalOrder())).reversed());
        return artifacts;
    }

    public Optional<CombinedArtifact> latestCombined(Path reduceDir) throws IOException {
        return listCombined(reduceDir).stream().findFirst();
    }

    private <T> Optional<T> readQuietly(Path manifestPath, Class<T> type) {
        if (!Files.isRegularFile(manifestPath)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(JsonFiles.read(manifestPath, type));
        } catch (IOException e) {
            log.warn("Ignoring unreadable manifest {}: {}", manifestPath, e.getMessage());
            return Optional.empty();
        }
    }
}
