package com.llestrade.core.llm;

import com.llestrade.core.errors.ProviderException;
import com.llestrade.core.errors.TransientProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;

/**
 * OpenAI through Spring AI's {@link ChatClient}; the model configured per group overrides the
 * starter's default model.
 */
public class ChatClientProvider implements Provider {

    private static final Logger log = LoggerFactory.getLogger(ChatClientProvider.class);

    public static final String NAME = "openai";

    private final ChatClient chatClient;
    private final int defaultContextWindow;

    public ChatClientProvider(ChatClient.Builder builder, int defaultContextWindow) {
        this.chatClient = builder.build();
        this.defaultContextWindow = defaultContextWindow;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String generate(String systemPrompt, String userPrompt, String model, double temperature, int maxTokens) {
        ChatOptions options = ChatOptions.builder()
                .model(model == null || model.isBlank() ? null : model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
        String response;
        try {
            var request = chatClient.prompt().user(userPrompt).options(options);
            if (systemPrompt != null && !systemPrompt.isBlank()) {
                request = request.system(systemPrompt);
            }
            response = request.call().content();
        } catch (TransientAiException | ResourceAccessException e) {
            throw new TransientProviderException("openai request failed: " + e.getMessage(), e);
        } catch (NonTransientAiException e) {
            throw new ProviderException("openai request failed: " + e.getMessage(), e);
        }
        if (response == null || response.isBlank()) {
            throw new ProviderException("openai returned an empty response for model " + model);
        }
        log.debug("openai responded with {} chars", response.length());
        return response;
    }

    @Override
    public int countTokens(String text, String model) {
        return TokenEstimates.estimate(text);
    }

    @Override
    public int contextWindow(String model) {
        return ModelCatalog.contextWindow(NAME, model, defaultContextWindow);
    }
}
