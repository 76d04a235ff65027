package com.llestrade.core.llm;

/**
 * A language model backend.
 * <p>
 * {@link #generate} throws {@link com.llestrade.core.errors.TransientProviderException} for
 * failures worth retrying and {@link com.llestrade.core.errors.FatalConfigurationException} or
 * {@link com.llestrade.core.errors.ProviderException} for those that are not.
 */
public interface Provider {

    /** Registry id, e.g. {@code anthropic}. */
    String name();

    String generate(String systemPrompt, String userPrompt, String model, double temperature, int maxTokens);

    /** Deterministic token count for {@code text} under {@code model}. */
    int countTokens(String text, String model);

    int contextWindow(String model);
}
