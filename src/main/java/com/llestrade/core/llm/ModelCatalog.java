package com.llestrade.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class ModelCatalog {

    private static final Logger log = LoggerFactory.getLogger(ModelCatalog.class);

    private static final Set<String> WARNED_UNKNOWN = ConcurrentHashMap.newKeySet();

    public record ModelInfo(
            String id,
            String name,
            String provider,
            int contextWindow,
            String description
    ) {}

    public static final List<ModelInfo> ANTHROPIC_MODELS = List.of(
            new ModelInfo("claude-sonnet-4-5", "Claude Sonnet 4.5", "anthropic", 200_000,
                    "Default for bulk analysis"),
            new ModelInfo("claude-sonnet-4", "Claude Sonnet 4", "anthropic", 200_000,
                    "Balanced quality and speed"),
            new ModelInfo("claude-opus-4-1", "Claude Opus 4.1", "anthropic", 200_000,
                    "Most capable, slowest"),
            new ModelInfo("claude-3-7-sonnet", "Claude 3.7 Sonnet", "anthropic", 200_000,
                    "Extended thinking capable"),
            new ModelInfo("claude-3-5-haiku", "Claude 3.5 Haiku", "anthropic", 200_000,
                    "Fastest, most cost-effective")
    );

    public static final List<ModelInfo> AZURE_OPENAI_MODELS = List.of(
            new ModelInfo("gpt-4.1", "GPT-4.1", "azure_openai", 1_000_000, "Long-context deployment"),
            new ModelInfo("gpt-4o", "GPT-4o", "azure_openai", 128_000, "General purpose deployment"),
            new ModelInfo("o3-mini", "o3-mini", "azure_openai", 200_000, "Reasoning deployment")
    );

    public static final List<ModelInfo> GEMINI_MODELS = List.of(
            new ModelInfo("gemini-2.5-pro", "Gemini 2.5 Pro", "gemini", 1_000_000,
                    "Most capable Gemini model with thinking"),
            new ModelInfo("gemini-2.5-flash", "Gemini 2.5 Flash", "gemini", 1_000_000,
                    "Fast and affordable with thinking"),
            new ModelInfo("gemini-2.0-flash", "Gemini 2.0 Flash", "gemini", 1_000_000,
                    "Previous gen fast model")
    );

    public static final List<ModelInfo> OPENAI_MODELS = List.of(
            new ModelInfo("gpt-4o", "GPT-4o", "openai", 128_000, "Best overall value"),
            new ModelInfo("gpt-4o-mini", "GPT-4o Mini", "openai", 128_000, "Fast and affordable"),
            new ModelInfo("o3-mini", "o3-mini", "openai", 200_000, "Efficient reasoning model")
    );

    public static final Map<String, List<ModelInfo>> ALL_MODELS = Map.of(
            "anthropic", ANTHROPIC_MODELS,
            "azure_openai", AZURE_OPENAI_MODELS,
            "gemini", GEMINI_MODELS,
            "openai", OPENAI_MODELS
    );

    public static ModelInfo findModel(String provider, String modelId) {
        List<ModelInfo> models = ALL_MODELS.get(provider);
        if (models == null || modelId == null) return null;
        return models.stream()
                .filter(m -> m.id().equals(modelId))
                .findFirst()
                .orElseGet(() -> models.stream()
                        // dated ids such as claude-sonnet-4-20250514 resolve to their family
                        .filter(m -> modelId.startsWith(m.id()))
                        .findFirst()
                        .orElse(null));
    }

    /**
     * Context window for a model, falling back to {@code defaultWindow} (logged once per model)
     * when the model is unknown.
     */
    public static int contextWindow(String provider, String modelId, int defaultWindow) {
        ModelInfo info = findModel(provider, modelId);
        if (info != null) {
            return info.contextWindow();
        }
        if (WARNED_UNKNOWN.add(provider + ":" + modelId)) {
            log.warn("Unknown model '{}' for provider {}; assuming a {}-token context window",
                    modelId, provider, defaultWindow);
        }
        return defaultWindow;
    }

    public static String getDefaultModel(String provider) {
        return switch (provider) {
            case "anthropic" -> "claude-sonnet-4-5";
            case "azure_openai" -> "gpt-4.1";
            case "gemini" -> "gemini-2.5-pro";
            case "openai" -> "gpt-4o";
            default -> null;
        };
    }
}
