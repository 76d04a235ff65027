package com.llestrade.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llestrade.core.errors.FatalConfigurationException;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

/**
 * Anthropic Messages API ({@code /v1/messages}).
 */
public class AnthropicProvider extends AbstractHttpProvider {

    public static final String NAME = "anthropic";
    private static final String API_VERSION = "2023-06-01";

    private final LlmProperties properties;

    public AnthropicProvider(ObjectMapper mapper, HttpClient httpClient, LlmProperties properties,
                             int defaultContextWindow) {
        super(mapper, httpClient, Duration.ofSeconds(properties.getRequestTimeoutSeconds()), defaultContextWindow);
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String generate(String systemPrompt, String userPrompt, String model, double temperature, int maxTokens) {
        if (!properties.hasAnthropicKey()) {
            throw new FatalConfigurationException("Anthropic API key is not configured (llestrade.llm.anthropic-api-key)");
        }
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", model);
        payload.put("max_tokens", maxTokens);
        payload.put("temperature", temperature);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            payload.put("system", systemPrompt);
        }
        ArrayNode messages = payload.putArray("messages");
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        user.put("content", userPrompt);

        String url = normalizeBaseUrl(properties.getAnthropicBaseUrl(), "https://api.anthropic.com") + "/v1/messages";
        JsonNode response = sendJsonPost(url, payload, Map.of(
                "x-api-key", properties.getAnthropicApiKey(),
                "anthropic-version", API_VERSION));

        StringBuilder text = new StringBuilder();
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText("text"))) {
                text.append(block.path("text").asText(""));
            }
        }
        return requireText(text.toString());
    }
}
