package com.llestrade.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llestrade.core.errors.FatalConfigurationException;

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Azure OpenAI chat completions. The model name is the deployment name.
 */
public class AzureOpenAiProvider extends AbstractHttpProvider {

    public static final String NAME = "azure_openai";

    private final LlmProperties properties;

    public AzureOpenAiProvider(ObjectMapper mapper, HttpClient httpClient, LlmProperties properties,
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
        if (!properties.hasAzureCredentials()) {
            throw new FatalConfigurationException(
                    "Azure OpenAI endpoint and key are not configured (llestrade.llm.azure-endpoint/azure-api-key)");
        }
        if (model == null || model.isBlank()) {
            throw new FatalConfigurationException("Azure OpenAI requires a deployment name as the model");
        }
        ObjectNode payload = mapper.createObjectNode();
        ArrayNode messages = payload.putArray("messages");
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            ObjectNode system = messages.addObject();
            system.put("role", "system");
            system.put("content", systemPrompt);
        }
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        user.put("content", userPrompt);
        payload.put("temperature", temperature);
        payload.put("max_tokens", maxTokens);

        String url = normalizeBaseUrl(properties.getAzureEndpoint(), "")
                + "/openai/deployments/" + URLEncoder.encode(model, StandardCharsets.UTF_8)
                + "/chat/completions?api-version=" + URLEncoder.encode(properties.getAzureApiVersion(), StandardCharsets.UTF_8);
        JsonNode response = sendJsonPost(url, payload, Map.of("api-key", properties.getAzureApiKey()));
        return requireText(response.path("choices").path(0).path("message").path("content").asText(null));
    }
}
