package com.llestrade.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llestrade.core.errors.CancellationRequestedException;
import com.llestrade.core.errors.FatalConfigurationException;
import com.llestrade.core.errors.ProviderException;
import com.llestrade.core.errors.TransientProviderException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Shared HTTP + JSON plumbing for providers that talk to a vendor REST API directly.
 * Status codes are mapped onto the engine's error taxonomy; retrying is left to
 * {@link FallbackProvider}.
 */
public abstract class AbstractHttpProvider implements Provider {

    protected final ObjectMapper mapper;
    protected final HttpClient httpClient;
    protected final Duration requestTimeout;
    private final int defaultContextWindow;

    protected AbstractHttpProvider(ObjectMapper mapper, HttpClient httpClient,
                                   Duration requestTimeout, int defaultContextWindow) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.defaultContextWindow = defaultContextWindow;
    }

    @Override
    public int countTokens(String text, String model) {
        return TokenEstimates.estimate(text);
    }

    @Override
    public int contextWindow(String model) {
        return ModelCatalog.contextWindow(name(), model, defaultContextWindow);
    }

    protected JsonNode sendJsonPost(String url, JsonNode payload, Map<String, String> headers) {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));
        } catch (IOException e) {
            throw new ProviderException(name() + " request could not be serialised", e);
        }
        headers.forEach(builder::header);

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            // timeouts, resets and EOFs are all worth another attempt
            throw new TransientProviderException(name() + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationRequestedException(name() + " request interrupted");
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new TransientProviderException(
                    name() + " request failed (" + status + "): " + abbreviate(response.body()), status);
        }
        if (status == 401 || status == 403) {
            throw new FatalConfigurationException(
                    name() + " rejected the configured credentials (" + status + ")");
        }
        if (status < 200 || status >= 300) {
            throw new ProviderException(name() + " request failed (" + status + "): " + abbreviate(response.body()));
        }
        try {
            return mapper.readTree(response.body());
        } catch (IOException e) {
            throw new ProviderException(name() + " returned malformed JSON", e);
        }
    }

    protected String requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new ProviderException(name() + " returned an empty response");
        }
        return text;
    }

    protected static String normalizeBaseUrl(String baseUrl, String fallback) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? fallback : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
