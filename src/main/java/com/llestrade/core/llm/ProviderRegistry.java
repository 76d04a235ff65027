package com.llestrade.core.llm;

import com.llestrade.core.config.EngineProperties;
import com.llestrade.core.errors.FatalConfigurationException;
import com.llestrade.core.metrics.AnalysisMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Looks providers up by id and wraps them in the configured retry and fallback chain.
 */
@Component
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private static final Map<String, String> ALIASES = Map.of(
            "azure", AzureOpenAiProvider.NAME,
            "google", GeminiProvider.NAME,
            "claude", AnthropicProvider.NAME
    );

    private final Map<String, Provider> providers = new LinkedHashMap<>();
    private final EngineProperties properties;
    private final AnalysisMetrics metrics;
    private final BackoffSleeper sleeper;

    @Autowired
    public ProviderRegistry(List<Provider> providers, EngineProperties properties, AnalysisMetrics metrics) {
        this(providers, properties, metrics, BackoffSleeper.THREAD_SLEEP);
    }

    ProviderRegistry(List<Provider> providers, EngineProperties properties, AnalysisMetrics metrics,
                     BackoffSleeper sleeper) {
        for (Provider provider : providers) {
            this.providers.put(provider.name(), provider);
        }
        this.properties = properties;
        this.metrics = metrics;
        this.sleeper = sleeper;
        log.info("Registered providers: {}", this.providers.keySet());
    }

    public Set<String> providerIds() {
        return providers.keySet();
    }

    /**
     * The bare provider for {@code providerId}.
     *
     * @throws FatalConfigurationException when no such provider is registered
     */
    public Provider get(String providerId) {
        String id = canonicalId(providerId);
        Provider provider = providers.get(id);
        if (provider == null) {
            throw new FatalConfigurationException(
                    "Unknown provider '" + providerId + "' (registered: " + providers.keySet() + ")");
        }
        return provider;
    }

    /**
     * The provider for {@code providerId} with retries and the configured fallbacks behind it.
     */
    public FallbackProvider resolve(String providerId) {
        Provider primary = get(providerId);
        List<FallbackProvider.Target> chain = new ArrayList<>();
        chain.add(new FallbackProvider.Target(primary, null));
        for (String fallback : properties.getFallbackProviders()) {
            String[] parts = fallback.split(":", 2);
            String id = canonicalId(parts[0]);
            if (id.equals(primary.name()) || !providers.containsKey(id)) {
                continue;
            }
            String model = parts.length > 1 && !parts[1].isBlank() ? parts[1].strip() : ModelCatalog.getDefaultModel(id);
            chain.add(new FallbackProvider.Target(providers.get(id), model));
        }
        return new FallbackProvider(chain, RetryPolicy.from(properties.getRetry()), sleeper, metrics);
    }

    private static String canonicalId(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            throw new FatalConfigurationException("No provider configured");
        }
        String id = providerId.strip().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(id, id);
    }
}
