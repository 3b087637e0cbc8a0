package com.letterdesk.reviewcore.config;

import com.letterdesk.reviewcore.domain.generation.BackoffPolicy;
import com.letterdesk.reviewcore.domain.generation.Sleeper;
import com.letterdesk.reviewcore.domain.ports.GenerationProvider;
import com.letterdesk.reviewcore.infrastructure.provider.FallbackCompletionProvider;
import com.letterdesk.reviewcore.infrastructure.provider.PrimaryWebhookProvider;
import com.letterdesk.reviewcore.infrastructure.provider.ProviderConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class GenerationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }

    @Bean
    public ProviderConfig providerConfig(AppProperties properties) {
        AppProperties.Providers p = properties.getProviders();
        AppProperties.Primary primary = p.getPrimary();
        AppProperties.Fallback fallback = p.getFallback();
        AppProperties.Retry retry = p.getRetry();
        return new ProviderConfig(
                new ProviderConfig.Primary(primary.getUrl(), primary.getAuthToken(), primary.getSource(), primary.getOverallTimeout()),
                new ProviderConfig.Fallback(fallback.getBaseUrl(), fallback.getApiKey(), fallback.getModel(),
                        fallback.getTemperature(), fallback.getMaxTokens()),
                new BackoffPolicy(retry.getMaxRetries(), retry.getBaseDelay(), retry.getMaxJitter()),
                p.getMinContentLength());
    }

    @Bean
    public GenerationProvider primaryGenerationProvider(ProviderConfig config, Sleeper sleeper, Clock clock,
                                                        AppProperties properties) {
        AppProperties.Primary primary = properties.getProviders().getPrimary();
        return new PrimaryWebhookProvider(
                timedBuilder(primary.getConnectTimeout(), primary.getReadTimeout()), config, sleeper, clock);
    }

    @Bean
    public GenerationProvider fallbackGenerationProvider(ProviderConfig config, AppProperties properties) {
        AppProperties.Fallback fallback = properties.getProviders().getFallback();
        return new FallbackCompletionProvider(
                timedBuilder(fallback.getConnectTimeout(), fallback.getReadTimeout()), config);
    }

    private static RestClient.Builder timedBuilder(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        return RestClient.builder().requestFactory(factory);
    }
}
