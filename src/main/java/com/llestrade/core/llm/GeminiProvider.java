package com.llestrade.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llestrade.core.errors.FatalConfigurationException;

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Google Gemini {@code generateContent}.
 */
public class GeminiProvider extends AbstractHttpProvider {

    public static final String NAME = "gemini";

    private final LlmProperties properties;

    public GeminiProvider(ObjectMapper mapper, HttpClient httpClient, LlmProperties properties,
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
        if (!properties.hasGoogleKey()) {
            throw new FatalConfigurationException("Google API key is not configured (llestrade.llm.google-api-key)");
        }
        ObjectNode payload = mapper.createObjectNode();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            payload.putObject("systemInstruction").putArray("parts").addObject().put("text", systemPrompt);
        }
        ObjectNode content = payload.putArray("contents").addObject();
        content.put("role", "user");
        content.putArray("parts").addObject().put("text", userPrompt);
        ObjectNode config = payload.putObject("generationConfig");
        config.put("temperature", temperature);
        config.put("maxOutputTokens", maxTokens);

        String url = normalizeBaseUrl(properties.getGoogleBaseUrl(), "https://generativelanguage.googleapis.com")
                + "/v1beta/models/" + URLEncoder.encode(model, StandardCharsets.UTF_8)
                + ":generateContent?key=" + URLEncoder.encode(properties.getGoogleApiKey(), StandardCharsets.UTF_8);
        JsonNode response = sendJsonPost(url, payload, Map.of());

        StringBuilder text = new StringBuilder();
        for (JsonNode part : response.path("candidates").path(0).path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }
        return requireText(text.toString());
    }
}
