package com.llestrade.core.analysis;

import com.llestrade.core.conversion.ConversionWorker;
import com.llestrade.core.coordinator.JobHandle;
import com.llestrade.core.coordinator.JobRequest;
import com.llestrade.core.coordinator.WorkerCoordinator;
import com.llestrade.core.errors.FatalConfigurationException;
import com.llestrade.core.map.MapAnalysisWorker;
import com.llestrade.core.map.MapRequest;
import com.llestrade.core.model.AnalysisGroup;
import com.llestrade.core.model.Coverage;
import com.llestrade.core.model.JobKind;
import com.llestrade.core.model.MapDocument;
import com.llestrade.core.model.Project;
import com.llestrade.core.placeholders.PlaceholderMap;
import com.llestrade.core.placeholders.PlaceholderResolver;
import com.llestrade.core.placeholders.PlaceholderValidation;
import com.llestrade.core.prompt.PromptBundle;
import com.llestrade.core.prompt.PromptRenderer;
import com.llestrade.core.reduce.CombinedAnalysisWorker;
import com.llestrade.core.reduce.CombinedRequest;
import com.llestrade.core.storage.ProjectLayout;
import com.llestrade.core.tracker.FileTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for callers: validates a group run up front, then turns it into coordinator jobs.
 * A per-document group becomes one MAP job per document; a combined group becomes one REDUCE job.
 */
@Service
public class BulkAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(BulkAnalysisService.class);

    private final WorkerCoordinator coordinator;
    private final MapAnalysisWorker mapWorker;
    private final CombinedAnalysisWorker combinedWorker;
    private final ConversionWorker conversionWorker;
    private final PromptRenderer promptRenderer;
    private final PlaceholderResolver placeholderResolver;
    private final FileTracker fileTracker;

    public BulkAnalysisService(WorkerCoordinator coordinator, MapAnalysisWorker mapWorker,
                               CombinedAnalysisWorker combinedWorker, ConversionWorker conversionWorker,
                               PromptRenderer promptRenderer, PlaceholderResolver placeholderResolver,
                               FileTracker fileTracker) {
        this.coordinator = coordinator;
        this.mapWorker = mapWorker;
        this.combinedWorker = combinedWorker;
        this.conversionWorker = conversionWorker;
        this.promptRenderer = promptRenderer;
        this.placeholderResolver = placeholderResolver;
        this.fileTracker = fileTracker;
    }

    /** Checks the group's placeholders against the project and overrides without running anything. */
    public PlaceholderValidation validate(Project project, AnalysisGroup group, RunOptions options) {
        PromptBundle bundle = promptRenderer.load(project, group);
        PlaceholderMap placeholders = placeholderResolver.resolve(project, options.dynamicOverrides());
        return placeholderResolver.validate(placeholders, promptRenderer.usedPlaceholders(bundle),
                group.getPlaceholderRequirements());
    }

    public List<JobHandle> submitMap(Project project, AnalysisGroup group, RunOptions options) throws IOException {
        if (group.isCombined()) {
            throw new FatalConfigurationException("Group '" + group.getName() + "' is a combined group; submit a reduce");
        }
        requireRunnable(project, group, options);
        List<MapDocument> documents = ProjectLayout.of(project).mapDocuments(group);
        if (documents.isEmpty()) {
            log.info("Group {} selects no documents", group.getSlug());
            return List.of();
        }
        List<JobHandle> handles = new ArrayList<>(documents.size());
        for (MapDocument document : documents) {
            MapRequest request = new MapRequest(project, group, document, options.dynamicOverrides(),
                    options.force(), options.allowMissingRequired());
            handles.add(coordinator.submit(new JobRequest(JobKind.MAP, group.getId(),
                    document.outputPath().toString(), context -> mapWorker.process(request, context))));
        }
        log.info("Submitted {} map jobs for group {}", handles.size(), group.getSlug());
        return handles;
    }

    public JobHandle submitReduce(Project project, AnalysisGroup group, RunOptions options) {
        if (!group.isCombined()) {
            throw new FatalConfigurationException("Group '" + group.getName() + "' is a per-document group; submit a map");
        }
        requireRunnable(project, group, options);
        CombinedRequest request = new CombinedRequest(project, group, options.dynamicOverrides(), options.force(),
                options.allowMissingRequired());
        return coordinator.submit(new JobRequest(JobKind.REDUCE, group.getId(), "reduce:" + group.getSlug(),
                context -> combinedWorker.process(request, context)));
    }

    /** Submits the group the way its operation asks for. */
    public List<JobHandle> submit(Project project, AnalysisGroup group, RunOptions options) throws IOException {
        if (group.isCombined()) {
            return List.of(submitReduce(project, group, options));
        }
        return submitMap(project, group, options);
    }

    public JobHandle submitConversion(Project project, boolean force) {
        return coordinator.submit(new JobRequest(JobKind.CONVERT, null, "conversion:" + project.root(),
                context -> conversionWorker.process(project, force, context)));
    }

    public int cancelGroup(AnalysisGroup group) {
        return coordinator.cancelGroup(group.getId());
    }

    public Coverage conversionCoverage(Project project) throws IOException {
        return fileTracker.conversionCoverage(project);
    }

    public Coverage mapCoverage(Project project, AnalysisGroup group) throws IOException {
        return fileTracker.mapCoverage(project, group);
    }

    public boolean isCombinedStale(Project project, AnalysisGroup group) throws IOException {
        return fileTracker.isStale(project, group);
    }

    private void requireRunnable(Project project, AnalysisGroup group, RunOptions options) {
        PlaceholderValidation validation = validate(project, group, options);
        if (validation.isBlocking() && !options.allowMissingRequired()) {
            throw new FatalConfigurationException("Group '" + group.getName() + "' cannot run: "
                    + validation.describe());
        }
    }
}
