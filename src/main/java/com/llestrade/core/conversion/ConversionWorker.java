package com.llestrade.core.conversion;

import com.llestrade.core.coordinator.JobContext;
import com.llestrade.core.errors.AnalysisException;
import com.llestrade.core.errors.CancellationRequestedException;
import com.llestrade.core.logging.MdcContext;
import com.llestrade.core.markdown.Frontmatter;
import com.llestrade.core.markdown.SourceReference;
import com.llestrade.core.metrics.AnalysisMetrics;
import com.llestrade.core.model.ConversionManifest;
import com.llestrade.core.model.ConversionRecord;
import com.llestrade.core.model.Project;
import com.llestrade.core.storage.ContentHasher;
import com.llestrade.core.storage.JsonFiles;
import com.llestrade.core.storage.ManifestStore;
import com.llestrade.core.storage.PathLocks;
import com.llestrade.core.storage.ProjectLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Converts new or changed files under {@code sources/} into {@code converted_documents/} and
 * records each conversion in the conversion manifest. A file that fails is reported and the
 * rest continue; the job fails at the end if any file failed.
 */
@Service
public class ConversionWorker {

    private static final Logger log = LoggerFactory.getLogger(ConversionWorker.class);

    private final List<DocumentConverter> converters;
    private final ManifestStore manifestStore;
    private final PathLocks pathLocks;
    private final AnalysisMetrics metrics;

    public ConversionWorker(List<DocumentConverter> converters, ManifestStore manifestStore,
                            PathLocks pathLocks, AnalysisMetrics metrics) {
        this.converters = List.copyOf(converters);
        this.manifestStore = manifestStore;
        this.pathLocks = pathLocks;
        this.metrics = metrics;
    }

    public ConversionResult process(Project project, boolean force, JobContext context) throws IOException {
        ProjectLayout layout = ProjectLayout.of(project);
        Path sources = layout.sourcesDir();
        if (!Files.isDirectory(sources)) {
            log.info("No sources directory at {}", sources);
            return new ConversionResult(0, 0, 0, List.of());
        }
        List<Path> files;
        try (Stream<Path> stream = Files.walk(sources)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .sorted()
                    .toList();
        }

        int converted = 0;
        int skipped = 0;
        int unsupported = 0;
        List<String> failed = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            context.throwIfCancellationRequested();
            Path source = files.get(i);
            String relative = layout.relativize(sources, source);
            context.progress("Converting " + (i + 1) + "/" + files.size() + ": " + relative);
            MdcContext.setDocument(relative);
            try {
                Optional<DocumentConverter> converter = converters.stream().filter(c -> c.supports(source)).findFirst();
                if (converter.isEmpty()) {
                    log.debug("No converter for {}", relative);
                    unsupported++;
                    continue;
                }
                String sourceHash = ContentHasher.sha256(source);
                Path output = layout.convertedDir().resolve(markdownName(relative));
                ConversionManifest manifest = manifestStore.readConversionManifest(layout.conversionManifest());
                Optional<ConversionRecord> record = manifest.get(relative);
                if (!force && record.isPresent() && sourceHash.equals(record.get().sourceHash())
                        && Files.exists(layout.root().resolve(record.get().outputPath()))) {
                    skipped++;
                    if (metrics != null) {
                        metrics.incrementSkipped("convert");
                    }
                    continue;
                }
                String text = Frontmatter.apply(converter.get().convert(source),
                        metadata(layout, source, relative, sourceHash, converter.get()));
                pathLocks.withLock(output, () -> {
                    JsonFiles.writeAtomic(output, text);
                    return null;
                });
                pathLocks.withLock(layout.conversionManifest(), () -> {
                    ConversionManifest latest = manifestStore.readConversionManifest(layout.conversionManifest());
                    latest.put(relative, new ConversionRecord(layout.relativize(layout.root(), output), sourceHash,
                            Instant.now()));
                    manifestStore.writeConversionManifest(layout.conversionManifest(), latest);
                    return null;
                });
                converted++;
            } catch (CancellationRequestedException e) {
                throw e;
            } catch (IOException | RuntimeException e) {
                log.warn("Conversion of {} failed: {}", relative, e.getMessage(), e);
                context.log("Conversion failed for " + relative + ": " + e.getMessage());
                failed.add(relative);
            } finally {
                MdcContext.clearDocument();
            }
        }
        log.info("Conversion finished: {} converted, {} unchanged, {} unsupported, {} failed",
                converted, skipped, unsupported, failed.size());
        if (!failed.isEmpty()) {
            throw new AnalysisException(failed.size() + " of " + files.size() + " conversions failed: "
                    + String.join(", ", failed));
        }
        return new ConversionResult(converted, skipped, unsupported, failed);
    }

    private static Map<String, Object> metadata(ProjectLayout layout, Path source, String relative,
                                                String sourceHash, DocumentConverter converter) {
        Map<String, Object> metadata = Frontmatter.provenance(layout.root(), "conversion", Instant.now(),
                List.of(new SourceReference(source.toAbsolutePath().toString(),
                        layout.relativize(layout.root(), source), "source", sourceHash)));
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        metadata.put("source_format", dot > 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : null);
        metadata.put("converter", converter.name());
        return metadata;
    }

    /** {@code a/b.pdf -> a/b.md}; text sources keep their name. */
    static String markdownName(String relative) {
        String lower = relative.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".md") || lower.endsWith(".txt")) {
            return relative;
        }
        int slash = relative.lastIndexOf('/');
        int dot = relative.lastIndexOf('.');
        return (dot > slash + 1 ? relative.substring(0, dot) : relative) + ".md";
    }
}
