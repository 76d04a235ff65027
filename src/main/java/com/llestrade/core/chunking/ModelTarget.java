package com.llestrade.core.chunking;

import com.llestrade.core.llm.Provider;

/**
 * The provider and model a text is being sized for.
 *
 * @param provider              the provider that counts tokens and reports the window
 * @param model                 model id
 * @param contextWindowOverride per-group override, or null
 */
public record ModelTarget(Provider provider, String model, Integer contextWindowOverride) {

    public ModelTarget(Provider provider, String model) {
        this(provider, model, null);
    }

    public int contextWindow() {
        if (contextWindowOverride != null && contextWindowOverride > 0) {
            return contextWindowOverride;
        }
        return provider.contextWindow(model);
    }
}
