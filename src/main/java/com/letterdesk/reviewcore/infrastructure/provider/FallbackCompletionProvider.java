package com.letterdesk.reviewcore.infrastructure.provider;

import com.letterdesk.reviewcore.domain.generation.FailureClass;
import com.letterdesk.reviewcore.domain.generation.GenerationRequest;
import com.letterdesk.reviewcore.domain.generation.ImprovementRequest;
import com.letterdesk.reviewcore.domain.generation.ProviderResponse;
import com.letterdesk.reviewcore.domain.ports.GenerationProvider;
import com.letterdesk.reviewcore.exception.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * Single-shot chat completion against an OpenAI-compatible endpoint. No jurisdiction research.
 */
public class FallbackCompletionProvider implements GenerationProvider {

    private static final Logger log = LoggerFactory.getLogger(FallbackCompletionProvider.class);

    public static final String ID = "fallback";

    private final RestClient restClient;
    private final ProviderConfig.Fallback settings;

    public FallbackCompletionProvider(RestClient.Builder builder, ProviderConfig config) {
        this.settings = config.fallback();
        this.restClient = builder
                .baseUrl(settings.baseUrl() == null ? "" : settings.baseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        log.info("Fallback provider initialized (configured={}, model={})", settings.isConfigured(), settings.model());
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean isConfigured() {
        return settings.isConfigured();
    }

    @Override
    public ProviderResponse generate(GenerationRequest request) {
        if (!isConfigured()) {
            throw new ProviderException(ID, FailureClass.NOT_CONFIGURED, "Fallback provider API key is not configured");
        }

        log.info("Calling fallback provider for letter {} with model {}", request.letterId(), settings.model());
        String content = complete(LetterPromptBuilder.SYSTEM_PROMPT,
                LetterPromptBuilder.userPrompt(request.letterType(), request.intakeData()));
        log.info("Fallback provider drafted letter {} ({} chars)", request.letterId(), content.length());
        return new ProviderResponse(content, false, null);
    }

    @Override
    public ProviderResponse improve(ImprovementRequest request) {
        if (!isConfigured()) {
            throw new ProviderException(ID, FailureClass.NOT_CONFIGURED, "Fallback provider API key is not configured");
        }
        log.info("Asking fallback provider to improve letter {}", request.letterId());
        String content = complete(LetterPromptBuilder.IMPROVEMENT_SYSTEM_PROMPT,
                LetterPromptBuilder.improvementPrompt(request.letterType(), request.originalContent(), request.notes()));
        log.info("Fallback provider improved letter {} ({} chars)", request.letterId(), content.length());
        return new ProviderResponse(content, false, null);
    }

    private String complete(String systemPrompt, String userPrompt) {
        ChatCompletionRequest body = new ChatCompletionRequest(
                settings.model(),
                List.of(
                        new ChatCompletionRequest.Message("system", systemPrompt),
                        new ChatCompletionRequest.Message("user", userPrompt)),
                settings.temperature(),
                settings.maxTokens());

        ChatCompletionResponse response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.apiKey())
                    .body(body)
                    .retrieve()
                    .body(ChatCompletionResponse.class);
        } catch (RestClientException e) {
            throw ProviderErrors.classify(ID, e);
        }
        return ProviderErrors.requireNonBlank(ID, response == null ? null : response.firstContent());
    }
}