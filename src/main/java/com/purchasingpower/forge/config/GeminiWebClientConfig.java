package com.purchasingpower.forge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Shared WebClient for the Gemini generation and embedding endpoints.
 */
@Configuration
public class GeminiWebClientConfig {

    @Bean
    public WebClient geminiWebClient(WebClient.Builder builder, GeminiConfig geminiConfig) {
        // API key goes in a header so it never shows up in URLs or access logs
        return builder
                .baseUrl(geminiConfig.getBaseUrl())
                .defaultHeader("x-goog-api-key", geminiConfig.getApiKey() == null ? "" : geminiConfig.getApiKey())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build())
                .build();
    }
}
