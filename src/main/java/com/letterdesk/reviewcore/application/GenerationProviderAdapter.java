package com.letterdesk.reviewcore.application;

import com.letterdesk.reviewcore.domain.generation.FailureClass;
import com.letterdesk.reviewcore.domain.generation.GenerationMethod;
import com.letterdesk.reviewcore.domain.generation.GenerationRequest;
import com.letterdesk.reviewcore.domain.generation.GenerationResult;
import com.letterdesk.reviewcore.domain.generation.ImprovementRequest;
import com.letterdesk.reviewcore.domain.ports.GenerationProvider;
import com.letterdesk.reviewcore.exception.ProviderException;
import com.letterdesk.reviewcore.exception.ProviderUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Tries the research-augmented primary provider and falls back to plain completion once.
 * Draft improvements always go to the completion provider.
 */
@Service
public class GenerationProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(GenerationProviderAdapter.class);

    private final GenerationProvider primary;
    private final GenerationProvider fallback;

    public GenerationProviderAdapter(@Qualifier("primaryGenerationProvider") GenerationProvider primary,
                                     @Qualifier("fallbackGenerationProvider") GenerationProvider fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    public GenerationResult generate(GenerationRequest request) {
        ProviderException primaryFailure;
        if (primary.isConfigured()) {
            try {
                return GenerationResult.of(primary.generate(request), GenerationMethod.PRIMARY);
            } catch (ProviderException e) {
                primaryFailure = e;
            } catch (RuntimeException e) {
                primaryFailure = new ProviderException(primary.id(), FailureClass.TRANSPORT_ERROR, e.getMessage(), e);
            }
            log.warn("Primary generation failed for letter {} ({}: {}), using fallback",
                    request.letterId(), primaryFailure.getFailureClass(), primaryFailure.getMessage());
        } else {
            primaryFailure = new ProviderException(primary.id(), FailureClass.NOT_CONFIGURED, "Primary provider not configured");
            log.info("Primary provider not configured, using fallback for letter {}", request.letterId());
        }

        if (!fallback.isConfigured()) {
            ProviderException missing = new ProviderException(fallback.id(), FailureClass.NOT_CONFIGURED,
                    "Fallback provider not configured");
            log.error("No generation provider available for letter {}", request.letterId());
            throw new ProviderUnavailableException(primaryFailure, missing);
        }

        try {
            return GenerationResult.of(fallback.generate(request), GenerationMethod.FALLBACK);
        } catch (ProviderException e) {
            log.error("Fallback generation failed for letter {} ({}: {})",
                    request.letterId(), e.getFailureClass(), e.getMessage());
            throw new ProviderUnavailableException(primaryFailure, e);
        } catch (RuntimeException e) {
            throw new ProviderUnavailableException(primaryFailure,
                    new ProviderException(fallback.id(), FailureClass.TRANSPORT_ERROR, e.getMessage(), e));
        }
    }

    /**
     * @return the revised letter text
     * @throws ProviderException the completion provider is missing or could not revise the draft
     */
    public String improve(ImprovementRequest request) {
        if (!fallback.isConfigured()) {
            throw new ProviderException(fallback.id(), FailureClass.NOT_CONFIGURED, "Fallback provider not configured");
        }
        try {
            return fallback.improve(request).content();
        } catch (ProviderException e) {
            log.error("Improvement failed for letter {} ({}: {})", request.letterId(), e.getFailureClass(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Improvement failed for letter {}: {}", request.letterId(), e.getMessage(), e);
            throw new ProviderException(fallback.id(), FailureClass.TRANSPORT_ERROR, e.getMessage(), e);
        }
    }
}
