package com.llestrade.core.reduce;

import com.llestrade.core.config.EngineProperties;
import com.llestrade.core.coordinator.JobContext;
import com.llestrade.core.errors.FatalConfigurationException;
import com.llestrade.core.llm.ModelSelection;
import com.llestrade.core.llm.ProviderRegistry;
import com.llestrade.core.markdown.Frontmatter;
import com.llestrade.core.markdown.SourceReference;
import com.llestrade.core.metrics.AnalysisMetrics;
import com.llestrade.core.model.AnalysisGroup;
import com.llestrade.core.model.CombinedArtifact;
import com.llestrade.core.model.CombinedInput;
import com.llestrade.core.model.Project;
import com.llestrade.core.placeholders.PlaceholderMap;
import com.llestrade.core.placeholders.PlaceholderResolver;
import com.llestrade.core.placeholders.PlaceholderValidation;
import com.llestrade.core.placeholders.SourceFileContext;
import com.llestrade.core.placeholders.SystemPlaceholders;
import com.llestrade.core.prompt.PromptBundle;
import com.llestrade.core.prompt.PromptRenderer;
import com.llestrade.core.storage.ContentHasher;
import com.llestrade.core.storage.JsonFiles;
import com.llestrade.core.storage.ManifestStore;
import com.llestrade.core.storage.PathLocks;
import com.llestrade.core.storage.ProjectLayout;
import com.llestrade.core.tracker.FileTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Produces a combined artifact for a COMBINED group: resolves the inputs, wraps each in section
 * markers, reduces them under the merge budget and writes the artifact with a manifest that
 * records every input's hash and modification time.
 * <p>
 * Artifacts are never overwritten; each run writes a new timestamped file.
 */
@Service
public class CombinedAnalysisWorker {

    private static final Logger log = LoggerFactory.getLogger(CombinedAnalysisWorker.class);

    static final DateTimeFormatter OUTPUT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmm");

    private final CombinedInputResolver inputResolver;
    private final FileTracker fileTracker;
    private final PromptRenderer promptRenderer;
    private final PlaceholderResolver placeholderResolver;
    private final HierarchicalReducer reducer;
    private final ProviderRegistry providerRegistry;
    private final ManifestStore manifestStore;
    private final PathLocks pathLocks;
    private final EngineProperties properties;
    private final AnalysisMetrics metrics;

    public CombinedAnalysisWorker(CombinedInputResolver inputResolver, FileTracker fileTracker,
                                  PromptRenderer promptRenderer, PlaceholderResolver placeholderResolver,
                                  HierarchicalReducer reducer, ProviderRegistry providerRegistry,
                                  ManifestStore manifestStore, PathLocks pathLocks,
                                  EngineProperties properties, AnalysisMetrics metrics) {
        this.inputResolver = inputResolver;
        this.fileTracker = fileTracker;
        this.promptRenderer = promptRenderer;
        this.placeholderResolver = placeholderResolver;
        this.reducer = reducer;
        this.providerRegistry = providerRegistry;
        this.manifestStore = manifestStore;
        this.pathLocks = pathLocks;
        this.properties = properties;
        this.metrics = metrics;
    }

    public CombinedResult process(CombinedRequest request, JobContext context) throws IOException {
        Project project = request.project();
        AnalysisGroup group = request.group();
        ProjectLayout layout = ProjectLayout.of(project);
        Path reduceDir = layout.reduceDir(group.folderName());

        List<ReduceInput> inputs = inputResolver.resolve(project, group);
        if (inputs.isEmpty()) {
            throw new FatalConfigurationException("No inputs selected for combined analysis '" + group.getName() + "'");
        }
        context.progress("Resolved " + inputs.size() + " inputs");

        PromptBundle bundle = promptRenderer.load(project, group);
        ModelSelection selection = ModelSelection.forGroup(group, providerRegistry, properties);
        String promptHash = promptRenderer.promptHash(bundle, group, selection.providerId(), selection.model(),
                selection.temperature(), project.placeholderValues(), request.runValues());

        if (!request.force()) {
            Optional<CombinedArtifact> latest = manifestStore.latestCombined(reduceDir);
            if (latest.isPresent()
                    && promptHash.equals(latest.get().promptHash())
                    && Files.exists(Path.of(latest.get().outputPath()))
                    && !fileTracker.isStale(latest.get(), inputs)) {
                log.info("Combined analysis for {} is current; skipping", group.getName());
                context.log("Skipped combined analysis (inputs unchanged)");
                if (metrics != null) {
                    metrics.incrementSkipped("reduce");
                }
                return new CombinedResult(true, Path.of(latest.get().outputPath()), inputs.size(), 0, 0);
            }
        }

        List<SourceFileContext> sources = inputs.stream()
                .map(input -> new SourceFileContext(input.path(), input.key()))
                .toList();
        PlaceholderMap placeholders = placeholderResolver.resolve(project,
                SystemPlaceholders.Context.forReduce(project.name(), sources), request.runValues());
        PlaceholderValidation validation = placeholderResolver.validate(placeholders,
                promptRenderer.usedPlaceholders(bundle), group.getPlaceholderRequirements());
        if (validation.isBlocking() && !request.allowMissingRequired()) {
            throw new FatalConfigurationException("Cannot run combined analysis '" + group.getName() + "': "
                    + validation.describe());
        }

        List<String> sections = new ArrayList<>(inputs.size());
        List<CombinedInput> recorded = new ArrayList<>(inputs.size());
        for (ReduceInput input : inputs) {
            context.throwIfCancellationRequested();
            // mtime first: an edit after this point changes it and marks the artifact stale
            long mtime = Files.getLastModifiedTime(input.path()).toMillis();
            byte[] bytes = Files.readAllBytes(input.path());
            recorded.add(new CombinedInput(input.key(), input.kind(), input.path().toString(),
                    ContentHasher.sha256(bytes), mtime));
            sections.add(section(input.key(), Frontmatter.body(new String(bytes, StandardCharsets.UTF_8))));
        }

        String systemPrompt = promptRenderer.renderSystem(bundle, placeholders);
        String documentName = group.getName();
        context.progress("Combining " + sections.size() + " inputs");
        ReductionResult result = reducer.reduce(new ReductionRequest(sections, systemPrompt,
                batch -> promptRenderer.renderUser(bundle, placeholders, documentName, String.join("", batch)),
                selection.target(), selection.temperature(), properties.getMaxOutputTokens(), context));

        context.throwIfCancellationRequested();
        Instant now = Instant.now();
        Path output = pathLocks.withLock(reduceDir, () -> {
            Path target = uniqueOutputPath(reduceDir, group, now);
            JsonFiles.writeAtomic(target, Frontmatter.apply(result.text(), metadata(project, group, bundle,
                    selection, promptHash, recorded, placeholders, result, now)));
            manifestStore.writeCombined(ProjectLayout.manifestFor(target), new CombinedArtifact(group.getId(),
                    target.toString(), now, promptHash, selection.providerId(), selection.model(), recorded,
                    result.levels(), result.invocations()));
            return target;
        });
        if (metrics != null) {
            metrics.recordReduction(result.levels(), result.invocations());
        }
        log.info("Wrote combined analysis {} from {} inputs ({} levels, {} calls)", output, inputs.size(),
                result.levels(), result.invocations());
        return new CombinedResult(false, output, inputs.size(), result.levels(), result.invocations());
    }

    private static Map<String, Object> metadata(Project project, AnalysisGroup group, PromptBundle bundle,
                                                ModelSelection selection, String promptHash,
                                                List<CombinedInput> inputs, PlaceholderMap placeholders,
                                                ReductionResult result, Instant createdAt) {
        List<SourceReference> sources = inputs.stream()
                .map(input -> new SourceReference(input.path(), input.key(),
                        input.kind().name().toLowerCase(Locale.ROOT), input.hash()))
                .toList();
        Map<String, Object> metadata = Frontmatter.provenance(project.root(), "combined_analysis", createdAt, sources);
        metadata.put("prompts", List.of(
                promptReference(bundle.systemSource(), "system"),
                promptReference(bundle.userSource(), "user")));
        metadata.put("group_id", group.getId());
        metadata.put("group_name", group.getName());
        metadata.put("group_operation", group.getOperation().name().toLowerCase(Locale.ROOT));
        metadata.put("prompt_hash", promptHash);
        metadata.put("provider_id", selection.providerId());
        metadata.put("model", selection.model());
        metadata.put("input_count", inputs.size());
        metadata.put("reduction_levels", result.levels());
        metadata.put("invocations", result.invocations());
        metadata.put("placeholders", new TreeMap<>(placeholders.values()));
        return metadata;
    }

    private static Map<String, Object> promptReference(String source, String role) {
        Map<String, Object> reference = new LinkedHashMap<>();
        reference.put("default".equals(source) ? "id" : "path", source);
        reference.put("role", role);
        return reference;
    }

    static String section(String key, String text) {
        return "<!--- section-begin: " + key + " --->\n" + text.strip() + "\n<!--- section-end --->\n\n";
    }

    private Path uniqueOutputPath(Path reduceDir, AnalysisGroup group, Instant now) {
        String template = group.getCombineOutputTemplate() == null || group.getCombineOutputTemplate().isBlank()
                ? AnalysisGroup.DEFAULT_OUTPUT_TEMPLATE
                : group.getCombineOutputTemplate();
        Map<String, String> values = new LinkedHashMap<>();
        values.put("timestamp", OUTPUT_TIMESTAMP.format(now.atZone(ZoneId.systemDefault())));
        values.put("group_slug", group.folderName());
        String name = promptRenderer.render(template, values);
        if (!name.toLowerCase().endsWith(".md")) {
            name = name + ".md";
        }
        Path candidate = reduceDir.resolve(name);
        String stem = name.substring(0, name.length() - 3);
        for (int i = 2; Files.exists(candidate); i++) {
            candidate = reduceDir.resolve(stem + "-" + i + ".md");
        }
        return candidate;
    }
}
