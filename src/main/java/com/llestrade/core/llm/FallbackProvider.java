package com.llestrade.core.llm;

import com.llestrade.core.errors.CancellationRequestedException;
import com.llestrade.core.errors.TransientProviderException;
import com.llestrade.core.metrics.AnalysisMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Retries transient failures with backoff, then moves on to the next provider in the chain.
 * Non-transient failures propagate immediately. Token counting and context windows always
 * come from the primary provider.
 */
public class FallbackProvider implements Provider {

    private static final Logger log = LoggerFactory.getLogger(FallbackProvider.class);

    /**
     * One link of the chain.
     *
     * @param provider the backend
     * @param model    model to use on this backend, or null to keep the requested one
     */
    public record Target(Provider provider, String model) {}

    private final List<Target> chain;
    private final RetryPolicy retryPolicy;
    private final BackoffSleeper sleeper;
    private final AnalysisMetrics metrics;

    public FallbackProvider(List<Target> chain, RetryPolicy retryPolicy, BackoffSleeper sleeper,
                            AnalysisMetrics metrics) {
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("Fallback chain needs at least one provider");
        }
        this.chain = List.copyOf(chain);
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    public Provider primary() {
        return chain.get(0).provider();
    }

    @Override
    public String name() {
        return primary().name();
    }

    @Override
    public String generate(String systemPrompt, String userPrompt, String model, double temperature, int maxTokens) {
        TransientProviderException last = null;
        for (Target target : chain) {
            Provider provider = target.provider();
            String effectiveModel = target.model() != null ? target.model() : model;
            for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
                long start = System.currentTimeMillis();
                try {
                    String text = provider.generate(systemPrompt, userPrompt, effectiveModel, temperature, maxTokens);
                    recordCall(provider, start, true);
                    return text;
                } catch (TransientProviderException e) {
                    recordCall(provider, start, false);
                    last = e;
                    if (attempt < retryPolicy.maxAttempts()) {
                        Duration delay = retryPolicy.backoffAfter(attempt);
                        log.warn("{} attempt {}/{} failed: {}; retrying in {} ms", provider.name(), attempt,
                                retryPolicy.maxAttempts(), e.getMessage(), delay.toMillis());
                        pause(delay);
                    }
                } catch (RuntimeException e) {
                    recordCall(provider, start, false);
                    throw e;
                }
            }
            log.warn("{} gave up after {} attempts", provider.name(), retryPolicy.maxAttempts());
        }
        throw new TransientProviderException(
                "All providers failed; last error: " + (last != null ? last.getMessage() : "none"),
                last != null ? last.getStatusCode() : -1, last);
    }

    @Override
    public int countTokens(String text, String model) {
        return primary().countTokens(text, model);
    }

    @Override
    public int contextWindow(String model) {
        return primary().contextWindow(model);
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationRequestedException("Interrupted while waiting to retry");
        }
    }

    private void recordCall(Provider provider, long start, boolean success) {
        if (metrics != null) {
            metrics.recordProviderCall(provider.name(), System.currentTimeMillis() - start, success);
        }
    }
}
