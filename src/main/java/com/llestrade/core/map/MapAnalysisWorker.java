package com.llestrade.core.map;

import com.llestrade.core.chunking.Chunk;
import com.llestrade.core.chunking.ChunkingEngine;
import com.llestrade.core.chunking.ModelTarget;
import com.llestrade.core.config.EngineProperties;
import com.llestrade.core.coordinator.JobContext;
import com.llestrade.core.errors.BudgetExceededException;
import com.llestrade.core.errors.CancellationRequestedException;
import com.llestrade.core.errors.DocumentAnalysisException;
import com.llestrade.core.errors.FatalConfigurationException;
import com.llestrade.core.llm.ModelSelection;
import com.llestrade.core.llm.ProviderRegistry;
import com.llestrade.core.logging.MdcContext;
import com.llestrade.core.markdown.Frontmatter;
import com.llestrade.core.metrics.AnalysisMetrics;
import com.llestrade.core.model.AnalysisGroup;
import com.llestrade.core.model.AnalysisManifestEntry;
import com.llestrade.core.model.MapDocument;
import com.llestrade.core.model.Project;
import com.llestrade.core.placeholders.PlaceholderMap;
import com.llestrade.core.placeholders.PlaceholderResolver;
import com.llestrade.core.placeholders.PlaceholderValidation;
import com.llestrade.core.placeholders.SourceFileContext;
import com.llestrade.core.placeholders.SystemPlaceholders;
import com.llestrade.core.prompt.PromptBundle;
import com.llestrade.core.prompt.PromptRenderer;
import com.llestrade.core.reduce.HierarchicalReducer;
import com.llestrade.core.reduce.ReductionRequest;
import com.llestrade.core.reduce.ReductionResult;
import com.llestrade.core.storage.ContentHasher;
import com.llestrade.core.storage.JsonFiles;
import com.llestrade.core.storage.ManifestStore;
import com.llestrade.core.storage.PathLocks;
import com.llestrade.core.storage.ProjectLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns one converted document into one analysis output.
 * <p>
 * Work is skipped when the sidecar manifest still records the current source and prompt
 * hashes and the output exists. Documents whose prompt exceeds the chunk budget are split,
 * analysed chunk by chunk, and the chunk outputs merged by the {@link HierarchicalReducer}.
 */
@Service
public class MapAnalysisWorker {

    private static final Logger log = LoggerFactory.getLogger(MapAnalysisWorker.class);

    /** Document text must keep at least 1/MIN_CONTENT_SHARE of the chunk budget after template overhead. */
    private static final int MIN_CONTENT_SHARE = 10;

    private final PromptRenderer promptRenderer;
    private final PlaceholderResolver placeholderResolver;
    private final ChunkingEngine chunkingEngine;
    private final HierarchicalReducer reducer;
    private final ProviderRegistry providerRegistry;
    private final ManifestStore manifestStore;
    private final PathLocks pathLocks;
    private final EngineProperties properties;
    private final AnalysisMetrics metrics;

    public MapAnalysisWorker(PromptRenderer promptRenderer, PlaceholderResolver placeholderResolver,
                             ChunkingEngine chunkingEngine, HierarchicalReducer reducer,
                             ProviderRegistry providerRegistry, ManifestStore manifestStore,
                             PathLocks pathLocks, EngineProperties properties, AnalysisMetrics metrics) {
        this.promptRenderer = promptRenderer;
        this.placeholderResolver = placeholderResolver;
        this.chunkingEngine = chunkingEngine;
        this.reducer = reducer;
        this.providerRegistry = providerRegistry;
        this.manifestStore = manifestStore;
        this.pathLocks = pathLocks;
        this.properties = properties;
        this.metrics = metrics;
    }

    public MapResult process(MapRequest request, JobContext context) throws IOException {
        MapDocument document = request.document();
        Project project = request.project();
        AnalysisGroup group = request.group();
        MdcContext.setDocument(document.relativePath());
        try {
            context.throwIfCancellationRequested();
            PromptBundle bundle = promptRenderer.load(project, group);
            ModelSelection selection = ModelSelection.forGroup(group, providerRegistry, properties);
            String sourceHash = ContentHasher.sha256(document.sourcePath());
            String promptHash = promptRenderer.promptHash(bundle, group, selection.providerId(), selection.model(),
                    selection.temperature(), project.placeholderValues(), request.runValues());
            Path manifestPath = ProjectLayout.manifestFor(document.outputPath());

            if (!request.force() && isUpToDate(manifestPath, document.outputPath(), sourceHash, promptHash)) {
                log.info("Skipping {}: unchanged since last run", document.relativePath());
                context.log("Skipped " + document.relativePath() + " (unchanged)");
                if (metrics != null) {
                    metrics.incrementSkipped("map");
                }
                return MapResult.skipped(document.outputPath());
            }

            SourceFileContext source = new SourceFileContext(document.sourcePath(), document.relativePath());
            PlaceholderMap placeholders = placeholderResolver.resolve(project,
                    SystemPlaceholders.Context.forDocument(project.name(), source), request.runValues());
            PlaceholderValidation validation = placeholderResolver.validate(placeholders,
                    promptRenderer.usedPlaceholders(bundle), group.getPlaceholderRequirements());
            if (validation.isBlocking() && !request.allowMissingRequired()) {
                throw new FatalConfigurationException("Cannot analyse " + document.relativePath() + ": "
                        + validation.describe());
            }
            if (!validation.missingOptional().isEmpty()) {
                log.info("Optional placeholders without values: {}", validation.missingOptional());
            }

            String content = Frontmatter.body(Files.readString(document.sourcePath(), StandardCharsets.UTF_8));
            String documentName = document.sourcePath().getFileName().toString();
            String systemPrompt = promptRenderer.renderSystem(bundle, placeholders);
            Analysis analysis = analyse(request, bundle, placeholders, selection, systemPrompt, documentName,
                    content, context);

            // a result that lands after cancellation is discarded
            context.throwIfCancellationRequested();
            AnalysisManifestEntry entry = new AnalysisManifestEntry(document.relativePath(), sourceHash, promptHash,
                    document.outputPath().toString(), selection.providerId(), selection.model(),
                    analysis.chunkCount(), Instant.now());
            pathLocks.withLock(document.outputPath(), () -> {
                JsonFiles.writeAtomic(document.outputPath(), analysis.text());
                manifestStore.writeEntry(manifestPath, entry);
                return null;
            });
            log.info("Wrote {} ({} chunks, {} calls)", document.outputPath(), analysis.chunkCount(),
                    analysis.invocations());
            return new MapResult(MapResult.Outcome.WRITTEN, document.outputPath(), analysis.chunkCount(),
                    analysis.invocations());
        } finally {
            MdcContext.clearDocument();
        }
    }

    private boolean isUpToDate(Path manifestPath, Path outputPath, String sourceHash, String promptHash) {
        Optional<AnalysisManifestEntry> entry = manifestStore.readEntry(manifestPath);
        return entry.isPresent() && entry.get().matches(sourceHash, promptHash) && Files.exists(outputPath);
    }

    private record Analysis(String text, int chunkCount, int invocations) {}

    private Analysis analyse(MapRequest request, PromptBundle bundle, PlaceholderMap placeholders,
                             ModelSelection selection, String systemPrompt, String documentName,
                             String content, JobContext context) {
        ModelTarget target = selection.target();
        String relativePath = request.document().relativePath();
        int budget = chunkingEngine.tokenBudget(target, properties.getChunkUtilization());
        String fullPrompt = promptRenderer.renderUser(bundle, placeholders, documentName, content);
        int promptTokens = chunkingEngine.countTokens(target, systemPrompt) + chunkingEngine.countTokens(target, fullPrompt);

        if (promptTokens <= budget) {
            context.progress("Analysing " + relativePath);
            String text = call(selection, systemPrompt, fullPrompt, relativePath, 0);
            return new Analysis(text, 1, 1);
        }

        // room left for document text once the system prompt and template are accounted for
        int overhead = chunkingEngine.countTokens(target, systemPrompt)
                + chunkingEngine.countTokens(target, promptRenderer.renderChunk(bundle, placeholders, documentName, "", 999, 999));
        int contentBudget = budget - overhead;
        if (contentBudget < budget / MIN_CONTENT_SHARE) {
            throw new BudgetExceededException("Prompt templates for " + relativePath
                    + " leave too little room for document text", overhead, budget);
        }
        List<Chunk> chunks = chunkingEngine.chunkToBudget(content, target, contentBudget);
        log.info("{} needs {} tokens (budget {}); splitting into {} chunks", relativePath, promptTokens, budget,
                chunks.size());

        List<String> outputs = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            context.throwIfCancellationRequested();
            context.progress("Analysing " + relativePath + " chunk " + chunk.index() + "/" + chunks.size());
            String prompt = promptRenderer.renderChunk(bundle, placeholders, documentName, chunk.text(),
                    chunk.index(), chunks.size());
            outputs.add(call(selection, systemPrompt, prompt, relativePath, chunk.index()));
        }
        if (outputs.size() == 1) {
            return new Analysis(outputs.get(0), 1, 1);
        }

        context.progress("Combining " + outputs.size() + " chunk results for " + relativePath);
        try {
            ReductionResult merged = reducer.reduce(new ReductionRequest(outputs, systemPrompt,
                    batch -> promptRenderer.renderChunkMerge(batch, documentName, placeholders),
                    target, selection.temperature(), properties.getMaxOutputTokens(), context));
            return new Analysis(merged.text(), chunks.size(), chunks.size() + merged.invocations());
        } catch (CancellationRequestedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DocumentAnalysisException(relativePath, 0, e);
        }
    }

    private String call(ModelSelection selection, String systemPrompt, String userPrompt,
                        String relativePath, int chunkIndex) {
        try {
            return selection.target().provider().generate(systemPrompt, userPrompt, selection.model(),
                    selection.temperature(), properties.getMaxOutputTokens());
        } catch (CancellationRequestedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DocumentAnalysisException(relativePath, chunkIndex, e);
        }
    }
}
