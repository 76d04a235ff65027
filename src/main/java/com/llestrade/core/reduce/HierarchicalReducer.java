package com.llestrade.core.reduce;

import com.llestrade.core.chunking.ChunkingEngine;
import com.llestrade.core.chunking.ModelTarget;
import com.llestrade.core.config.EngineProperties;
import com.llestrade.core.errors.BudgetExceededException;
import com.llestrade.core.errors.CancellationRequestedException;
import com.llestrade.core.errors.ReductionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines many texts into one under the merge budget ({@code mergeUtilization * contextWindow}).
 * <p>
 * When the whole set fits, one call is made. Otherwise texts are packed greedily, in order,
 * into batches that each fit; every batch is merged by one call and the outputs form the next
 * level. This repeats until a single pass fits.
 */
@Service
public class HierarchicalReducer {

    private static final Logger log = LoggerFactory.getLogger(HierarchicalReducer.class);

    private final ChunkingEngine chunkingEngine;
    private final double mergeUtilization;
    private final int maxLevels;

    public HierarchicalReducer(ChunkingEngine chunkingEngine, EngineProperties properties) {
        this(chunkingEngine, properties.getMergeUtilization(), properties.getMaxReductionLevels());
    }

    HierarchicalReducer(ChunkingEngine chunkingEngine, double mergeUtilization, int maxLevels) {
        this.chunkingEngine = chunkingEngine;
        this.mergeUtilization = mergeUtilization;
        this.maxLevels = maxLevels;
    }

    public int budget(ModelTarget target) {
        return chunkingEngine.tokenBudget(target, mergeUtilization);
    }

    public ReductionResult reduce(ReductionRequest request) {
        if (request.items().isEmpty()) {
            throw new IllegalArgumentException("Nothing to reduce");
        }
        ModelTarget target = request.target();
        int budget = budget(target);
        List<String> current = request.items();
        int invocations = 0;
        int level = 0;

        while (true) {
            request.cancellation().throwIfCancellationRequested();
            String prompt = request.promptBuilder().build(current);
            int tokens = promptTokens(request, prompt);
            if (tokens <= budget) {
                log.info("Reducing {} texts in a single pass ({} tokens, budget {})", current.size(), tokens, budget);
                String text = invoke(request, prompt);
                return new ReductionResult(text, invocations + 1, level + 1);
            }

            level++;
            if (level > maxLevels) {
                throw new BudgetExceededException(
                        "Reduction did not converge within " + maxLevels + " levels", tokens, budget);
            }
            List<List<String>> batches = batch(request, current, budget);
            if (batches.size() >= current.size()) {
                throw new BudgetExceededException(
                        "Reduction level " + level + " cannot combine any of its " + current.size() + " inputs",
                        tokens, budget);
            }
            log.info("Reduction level {}: {} texts in {} batches ({} tokens, budget {})",
                    level, current.size(), batches.size(), tokens, budget);

            List<String> next = new ArrayList<>(batches.size());
            for (int i = 0; i < batches.size(); i++) {
                request.cancellation().throwIfCancellationRequested();
                try {
                    next.add(invoke(request, request.promptBuilder().build(batches.get(i))));
                } catch (CancellationRequestedException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new ReductionException(level, i + 1, batches.size(), e);
                }
                invocations++;
            }
            current = next;
        }
    }

    /**
     * Greedy, order-preserving packing; a batch closes when the next text would push it over budget.
     */
    List<List<String>> batch(ReductionRequest request, List<String> items, int budget) {
        List<List<String>> batches = new ArrayList<>();
        List<String> currentBatch = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            String item = items.get(i);
            int alone = promptTokens(request, request.promptBuilder().build(List.of(item)));
            if (alone > budget) {
                throw new BudgetExceededException("Input " + (i + 1) + " of " + items.size()
                        + " does not fit the merge budget on its own", alone, budget);
            }
            List<String> candidate = new ArrayList<>(currentBatch);
            candidate.add(item);
            if (!currentBatch.isEmpty()
                    && promptTokens(request, request.promptBuilder().build(candidate)) > budget) {
                batches.add(currentBatch);
                currentBatch = new ArrayList<>();
                currentBatch.add(item);
            } else {
                currentBatch = candidate;
            }
        }
        if (!currentBatch.isEmpty()) {
            batches.add(currentBatch);
        }
        return batches;
    }

    private int promptTokens(ReductionRequest request, String userPrompt) {
        ModelTarget target = request.target();
        return chunkingEngine.countTokens(target, request.systemPrompt())
                + chunkingEngine.countTokens(target, userPrompt);
    }

    private String invoke(ReductionRequest request, String userPrompt) {
        ModelTarget target = request.target();
        String text = target.provider().generate(request.systemPrompt(), userPrompt, target.model(),
                request.temperature(), request.maxOutputTokens());
        // a response that lands after cancellation is dropped
        request.cancellation().throwIfCancellationRequested();
        return text;
    }
}
