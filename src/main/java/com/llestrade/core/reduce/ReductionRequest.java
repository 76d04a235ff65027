package com.llestrade.core.reduce;

import com.llestrade.core.chunking.ModelTarget;
import com.llestrade.core.coordinator.CancellationToken;

import java.util.List;

/**
 * @param items           texts to combine, in presentation order
 * @param systemPrompt    system prompt sent with every call
 * @param promptBuilder   builds the user prompt for a list of texts
 * @param target          provider and model; the provider also generates
 * @param temperature     sampling temperature
 * @param maxOutputTokens output cap per call
 * @param cancellation    polled before every call
 */
public record ReductionRequest(
    List<String> items,
    String systemPrompt,
    BatchPromptBuilder promptBuilder,
    ModelTarget target,
    double temperature,
    int maxOutputTokens,
    CancellationToken cancellation
) {

    public ReductionRequest {
        items = List.copyOf(items);
        cancellation = cancellation == null ? CancellationToken.NONE : cancellation;
    }
}
