package com.llestrade.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Global engine settings bound from {@code llestrade.engine.*}.
 */
@Component
@ConfigurationProperties(prefix = "llestrade.engine")
public class EngineProperties {

    private int maxConcurrency = 3;
    private double chunkUtilization = 0.5;
    private double mergeUtilization = 0.65;
    private double defaultTemperature = 0.1;
    private double reasoningTemperature = 1.0;
    private int maxOutputTokens = 32_000;
    private int maxReductionLevels = 8;
    private int defaultContextWindow = 30_000;
    private String defaultProvider = "anthropic";

    /** Providers tried in order after the primary gives up, as {@code provider} or {@code provider:model}. */
    private List<String> fallbackProviders = new ArrayList<>();

    private Retry retry = new Retry();

    public int getMaxConcurrency() { return maxConcurrency; }
    public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

    public double getChunkUtilization() { return chunkUtilization; }
    public void setChunkUtilization(double chunkUtilization) { this.chunkUtilization = chunkUtilization; }

    public double getMergeUtilization() { return mergeUtilization; }
    public void setMergeUtilization(double mergeUtilization) { this.mergeUtilization = mergeUtilization; }

    public double getDefaultTemperature() { return defaultTemperature; }
    public void setDefaultTemperature(double defaultTemperature) { this.defaultTemperature = defaultTemperature; }

    public double getReasoningTemperature() { return reasoningTemperature; }
    public void setReasoningTemperature(double reasoningTemperature) { this.reasoningTemperature = reasoningTemperature; }

    public int getMaxOutputTokens() { return maxOutputTokens; }
    public void setMaxOutputTokens(int maxOutputTokens) { this.maxOutputTokens = maxOutputTokens; }

    public int getMaxReductionLevels() { return maxReductionLevels; }
    public void setMaxReductionLevels(int maxReductionLevels) { this.maxReductionLevels = maxReductionLevels; }

    public int getDefaultContextWindow() { return defaultContextWindow; }
    public void setDefaultContextWindow(int defaultContextWindow) { this.defaultContextWindow = defaultContextWindow; }

    public String getDefaultProvider() { return defaultProvider; }
    public void setDefaultProvider(String defaultProvider) { this.defaultProvider = defaultProvider; }

    public List<String> getFallbackProviders() { return fallbackProviders; }
    public void setFallbackProviders(List<String> fallbackProviders) { this.fallbackProviders = fallbackProviders; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    /**
     * Temperature for a run: reasoning models asked to reason get the reasoning temperature.
     */
    public double temperatureFor(String model, boolean useReasoning) {
        if (useReasoning && model != null) {
            String lower = model.toLowerCase();
            if (lower.contains("think") || lower.contains("reason")) {
                return reasoningTemperature;
            }
        }
        return defaultTemperature;
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long initialBackoffMs = 500;
        private double multiplier = 2.0;
        private long maxBackoffMs = 8_000;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }
    }
}
