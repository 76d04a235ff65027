package com.llestrade.core.llm;

import com.llestrade.core.chunking.ModelTarget;
import com.llestrade.core.config.EngineProperties;
import com.llestrade.core.errors.FatalConfigurationException;
import com.llestrade.core.model.AnalysisGroup;

/**
 * Provider, model and sampling settings a group runs with.
 *
 * @param providerId  canonical provider id
 * @param model       model id
 * @param temperature sampling temperature
 * @param target      model target whose provider carries retries and fallbacks
 */
public record ModelSelection(String providerId, String model, double temperature, ModelTarget target) {

    public static ModelSelection forGroup(AnalysisGroup group, ProviderRegistry registry, EngineProperties properties) {
        String requested = group.getProviderId() == null || group.getProviderId().isBlank()
                ? properties.getDefaultProvider()
                : group.getProviderId();
        FallbackProvider provider = registry.resolve(requested);
        String providerId = provider.name();
        String model = group.getModel() == null || group.getModel().isBlank()
                ? ModelCatalog.getDefaultModel(providerId)
                : group.getModel();
        if (model == null) {
            throw new FatalConfigurationException("No model configured for provider " + providerId);
        }
        double temperature = properties.temperatureFor(model, group.isUseReasoning());
        return new ModelSelection(providerId, model, temperature,
                new ModelTarget(provider, model, group.getModelContextWindow()));
    }
}
