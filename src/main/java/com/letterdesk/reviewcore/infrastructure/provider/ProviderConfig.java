package com.letterdesk.reviewcore.infrastructure.provider;

import com.letterdesk.reviewcore.domain.generation.BackoffPolicy;

import java.time.Duration;

/**
 * Provider settings resolved once at startup and injected into the provider clients.
 */
public record ProviderConfig(Primary primary, Fallback fallback, BackoffPolicy backoff, int minContentLength) {

    public record Primary(String url, String authToken, String source, Duration overallTimeout) {

        public boolean isConfigured() {
            return url != null && !url.isBlank();
        }
    }

    public record Fallback(String baseUrl, String apiKey, String model, double temperature, int maxTokens) {

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank() && apiKey != null && !apiKey.isBlank();
        }
    }
}
