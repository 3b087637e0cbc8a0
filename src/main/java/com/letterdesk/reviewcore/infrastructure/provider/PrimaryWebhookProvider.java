package com.letterdesk.reviewcore.infrastructure.provider;

import com.letterdesk.reviewcore.domain.LetterTypes;
import com.letterdesk.reviewcore.domain.generation.BackoffPolicy;
import com.letterdesk.reviewcore.domain.generation.FailureClass;
import com.letterdesk.reviewcore.domain.generation.GenerationRequest;
import com.letterdesk.reviewcore.domain.generation.ProviderResponse;
import com.letterdesk.reviewcore.domain.generation.Sleeper;
import com.letterdesk.reviewcore.domain.ports.GenerationProvider;
import com.letterdesk.reviewcore.exception.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Research-augmented drafting workflow reached through a webhook. The workflow looks up statutes
 * for the jurisdiction before drafting, which makes it slow; server errors are retried with backoff.
 */
public class PrimaryWebhookProvider implements GenerationProvider {

    private static final Logger log = LoggerFactory.getLogger(PrimaryWebhookProvider.class);

    public static final String ID = "primary";

    private final RestClient restClient;
    private final ProviderConfig.Primary settings;
    private final BackoffPolicy backoff;
    private final int minContentLength;
    private final Sleeper sleeper;
    private final Clock clock;

    public PrimaryWebhookProvider(RestClient.Builder builder, ProviderConfig config, Sleeper sleeper, Clock clock) {
        this.settings = config.primary();
        this.backoff = config.backoff();
        this.minContentLength = config.minContentLength();
        this.sleeper = sleeper;
        this.clock = clock;
        this.restClient = builder
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("X-Webhook-Source", settings.source())
                .build();
        log.info("Primary provider initialized (configured={}, {})", settings.isConfigured(), backoff);
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
            throw new ProviderException(ID, FailureClass.NOT_CONFIGURED, "Primary provider URL is not configured");
        }

        Instant deadline = clock.instant().plus(settings.overallTimeout());
        Map<String, Object> payload = buildPayload(request);

        for (int attempt = 1; ; attempt++) {
            try {
                return attempt(request, payload, attempt);
            } catch (ProviderException e) {
                if (!e.getFailureClass().isRetryable() || !backoff.canRetry(attempt)) {
                    log.warn("Primary provider gave up on letter {} after {} attempt(s): {} - {}",
                            request.letterId(), attempt, e.getFailureClass(), e.getMessage());
                    throw e;
                }
                Duration delay = backoff.delayBeforeRetry(attempt);
                if (clock.instant().plus(delay).isAfter(deadline)) {
                    throw new ProviderException(ID, FailureClass.TIMEOUT,
                            "Primary provider deadline of " + settings.overallTimeout() + " exhausted", e);
                }
                log.warn("Primary provider attempt {}/{} for letter {} failed ({}), retrying in {} ms",
                        attempt, backoff.maxAttempts(), request.letterId(), e.getFailureClass(), delay.toMillis());
                pause(delay, e);
            }
        }
    }

    private ProviderResponse attempt(GenerationRequest request, Map<String, Object> payload, int attempt) {
        log.info("Calling primary provider for letter {} (attempt {}/{})", request.letterId(), attempt, backoff.maxAttempts());
        PrimaryWebhookResponse response;
        try {
            response = restClient.post()
                    .uri(settings.url())
                    .header("X-Letter-Id", request.letterId().toString())
                    .headers(h -> {
                        if (settings.authToken() != null && !settings.authToken().isBlank()) {
                            h.setBearerAuth(settings.authToken());
                        }
                    })
                    .body(payload)
                    .retrieve()
                    .body(PrimaryWebhookResponse.class);
        } catch (RestClientException e) {
            throw ProviderErrors.classify(ID, e);
        }

        if (response == null) {
            throw new ProviderException(ID, FailureClass.EMPTY_CONTENT, "Primary provider returned no body");
        }
        if (Boolean.FALSE.equals(response.success())) {
            throw new ProviderException(ID, FailureClass.REJECTED,
                    "Primary provider reported failure: " + (response.error() != null ? response.error() : "unknown"));
        }

        String content = ProviderErrors.requireContent(ID, response.text(), minContentLength);
        boolean researched = Boolean.TRUE.equals(response.researchApplied());
        log.info("Primary provider drafted letter {} ({} chars, research={}, jurisdiction={})",
                request.letterId(), content.length(), researched, response.jurisdiction());
        return new ProviderResponse(content, researched, response.jurisdiction());
    }

    private Map<String, Object> buildPayload(GenerationRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("letterType", request.letterType());
        payload.put("letterTypeName", LetterTypes.displayName(request.letterType()).orElse(request.letterType()));
        payload.put("letterId", request.letterId().toString());
        payload.put("userId", request.userId().toString());
        payload.put("intakeData", request.intakeData().asMap());
        payload.put("jurisdiction", request.intakeData().jurisdiction());
        payload.put("timestamp", OffsetDateTime.now(clock).toString());
        payload.put("source", settings.source());
        return payload;
    }

    private void pause(Duration delay, ProviderException lastFailure) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ID, FailureClass.TIMEOUT, "Primary provider retry interrupted", lastFailure);
        }
    }
}
