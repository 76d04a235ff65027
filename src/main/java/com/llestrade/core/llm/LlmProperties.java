package com.llestrade.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Credentials and endpoints for the HTTP providers. OpenAI is configured through
 * {@code spring.ai.openai.*} instead.
 */
@Component
@ConfigurationProperties(prefix = "llestrade.llm")
public class LlmProperties {

    private String anthropicApiKey = "";
    private String anthropicBaseUrl = "https://api.anthropic.com";
    private String azureEndpoint = "";
    private String azureApiKey = "";
    private String azureApiVersion = "2024-10-21";
    private String googleApiKey = "";
    private String googleBaseUrl = "https://generativelanguage.googleapis.com";
    private int requestTimeoutSeconds = 300;

    public String getAnthropicApiKey() {
        return anthropicApiKey;
    }

    public void setAnthropicApiKey(String anthropicApiKey) {
        this.anthropicApiKey = anthropicApiKey;
    }

    public String getAnthropicBaseUrl() {
        return anthropicBaseUrl;
    }

    public void setAnthropicBaseUrl(String anthropicBaseUrl) {
        this.anthropicBaseUrl = anthropicBaseUrl;
    }

    public String getAzureEndpoint() {
        return azureEndpoint;
    }

    public void setAzureEndpoint(String azureEndpoint) {
        this.azureEndpoint = azureEndpoint;
    }

    public String getAzureApiKey() {
        return azureApiKey;
    }

    public void setAzureApiKey(String azureApiKey) {
        this.azureApiKey = azureApiKey;
    }

    public String getAzureApiVersion() {
        return azureApiVersion;
    }

    public void setAzureApiVersion(String azureApiVersion) {
        this.azureApiVersion = azureApiVersion;
    }

    public String getGoogleApiKey() {
        return googleApiKey;
    }

    public void setGoogleApiKey(String googleApiKey) {
        this.googleApiKey = googleApiKey;
    }

    public String getGoogleBaseUrl() {
        return googleBaseUrl;
    }

    public void setGoogleBaseUrl(String googleBaseUrl) {
        this.googleBaseUrl = googleBaseUrl;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public boolean hasAnthropicKey() {
        return anthropicApiKey != null && !anthropicApiKey.isBlank();
    }

    public boolean hasAzureCredentials() {
        return azureApiKey != null && !azureApiKey.isBlank()
                && azureEndpoint != null && !azureEndpoint.isBlank();
    }

    public boolean hasGoogleKey() {
        return googleApiKey != null && !googleApiKey.isBlank();
    }
}
