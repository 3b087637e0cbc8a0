package com.letterdesk.reviewcore.infrastructure.provider;

import com.letterdesk.reviewcore.domain.generation.FailureClass;
import com.letterdesk.reviewcore.exception.ProviderException;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * Maps HTTP client failures onto provider failure classes.
 */
final class ProviderErrors {

    private ProviderErrors() {
    }

    static ProviderException classify(String providerId, RestClientException e) {
        if (e instanceof RestClientResponseException re) {
            HttpStatusCode status = re.getStatusCode();
            int code = status.value();
            if (code == 401 || code == 403) {
                return new ProviderException(providerId, FailureClass.AUTH_FAILURE,
                        providerId + " provider authentication failed (HTTP " + code + ")", e);
            }
            if (code == 404) {
                return new ProviderException(providerId, FailureClass.NOT_CONFIGURED,
                        providerId + " provider endpoint not found (HTTP 404)", e);
            }
            if (code == 429 || status.is5xxServerError()) {
                return new ProviderException(providerId, FailureClass.SERVER_ERROR,
                        providerId + " provider unavailable (HTTP " + code + ")", e);
            }
            return new ProviderException(providerId, FailureClass.CLIENT_ERROR,
                    providerId + " provider rejected the request (HTTP " + code + ")", e);
        }
        if (e instanceof ResourceAccessException && isTimeout(e)) {
            return new ProviderException(providerId, FailureClass.TIMEOUT,
                    providerId + " provider timed out", e);
        }
        return new ProviderException(providerId, FailureClass.TRANSPORT_ERROR,
                providerId + " provider call failed: " + e.getMessage(), e);
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }

    static String requireNonBlank(String providerId, String content) {
        if (content == null || content.isBlank()) {
            throw new ProviderException(providerId, FailureClass.EMPTY_CONTENT, "AI returned empty content");
        }
        return content.trim();
    }

    static String requireContent(String providerId, String content, int minLength) {
        String trimmed = requireNonBlank(providerId, content);
        if (trimmed.length() < minLength) {
            throw new ProviderException(providerId, FailureClass.EMPTY_CONTENT,
                    providerId + " provider returned " + trimmed.length() + " characters, minimum is " + minLength);
        }
        return trimmed;
    }
}
