package com.llestrade.core.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llestrade.core.config.EngineProperties;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Registers the built-in providers. OpenAI goes through the Spring AI starter; the others call
 * their vendor APIs with the JDK HTTP client.
 */
@Configuration
public class ProviderConfig {

    @Bean
    public HttpClient providerHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public AnthropicProvider anthropicProvider(ObjectMapper mapper, HttpClient providerHttpClient,
                                               LlmProperties llmProperties, EngineProperties engineProperties) {
        return new AnthropicProvider(mapper, providerHttpClient, llmProperties, engineProperties.getDefaultContextWindow());
    }

    @Bean
    public AzureOpenAiProvider azureOpenAiProvider(ObjectMapper mapper, HttpClient providerHttpClient,
                                                   LlmProperties llmProperties, EngineProperties engineProperties) {
        return new AzureOpenAiProvider(mapper, providerHttpClient, llmProperties, engineProperties.getDefaultContextWindow());
    }

    @Bean
    public GeminiProvider geminiProvider(ObjectMapper mapper, HttpClient providerHttpClient,
                                         LlmProperties llmProperties, EngineProperties engineProperties) {
        return new GeminiProvider(mapper, providerHttpClient, llmProperties, engineProperties.getDefaultContextWindow());
    }

    @Bean
    public ChatClientProvider chatClientProvider(ChatClient.Builder builder, EngineProperties engineProperties) {
        return new ChatClientProvider(builder, engineProperties.getDefaultContextWindow());
    }
}
