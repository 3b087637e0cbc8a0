package com.letterdesk.reviewcore.domain.ports;

import com.letterdesk.reviewcore.domain.generation.FailureClass;
import com.letterdesk.reviewcore.domain.generation.GenerationRequest;
import com.letterdesk.reviewcore.domain.generation.ImprovementRequest;
import com.letterdesk.reviewcore.domain.generation.ProviderResponse;
import com.letterdesk.reviewcore.exception.ProviderException;

/**
 * A backend that turns intake facts into letter text.
 */
public interface GenerationProvider {

    String id();

    boolean isConfigured();

    ProviderResponse generate(GenerationRequest request) throws ProviderException;

    /**
     * Rewrites an existing draft following the reviewer's notes. Providers that only draft from intake
     * facts keep this default.
     */
    default ProviderResponse improve(ImprovementRequest request) throws ProviderException {
        throw new ProviderException(id(), FailureClass.NOT_CONFIGURED, id() + " provider cannot revise letters");
    }
}
