package com.letterdesk.reviewcore.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.letterdesk.reviewcore.exception.ClaimConflictException;
import com.letterdesk.reviewcore.exception.GenerationFailedException;
import com.letterdesk.reviewcore.exception.InvalidTransitionException;
import com.letterdesk.reviewcore.exception.LetterNotFoundException;
import com.letterdesk.reviewcore.exception.LetterWorkflowException;
import com.letterdesk.reviewcore.exception.PermissionDeniedException;
import com.letterdesk.reviewcore.exception.PersistenceException;
import com.letterdesk.reviewcore.exception.ProviderException;
import com.letterdesk.reviewcore.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Maps workflow exceptions to HTTP responses. Provider and database details are logged, never returned.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    ResponseEntity<ApiError> handleValidation(ValidationException ex) {
        log.info("Validation failed: {}", ex.getErrors());
        return respond(HttpStatus.BAD_REQUEST, "Validation failed", ex.getMessage(), ex.getErrors(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        List<String> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .toList();
        return respond(HttpStatus.BAD_REQUEST, "Validation failed", String.join("; ", errors), errors, null);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> handleUnreadable(Exception ex) {
        log.info("Malformed request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request", "Request could not be read", null, null);
    }

    @ExceptionHandler(AuthenticationCredentialsNotFoundException.class)
    ResponseEntity<ApiError> handleUnauthenticated(AuthenticationCredentialsNotFoundException ex) {
        return respond(HttpStatus.UNAUTHORIZED, "Unauthorized", "Valid Bearer token required", null, null);
    }

    @ExceptionHandler(PermissionDeniedException.class)
    ResponseEntity<ApiError> handlePermission(PermissionDeniedException ex) {
        log.warn("Permission denied: {}", ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Forbidden", ex.getMessage(), null, null);
    }

    @ExceptionHandler(LetterNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(LetterNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "Not found", ex.getMessage(), null, null);
    }

    @ExceptionHandler(ClaimConflictException.class)
    ResponseEntity<ApiError> handleClaimConflict(ClaimConflictException ex) {
        log.info("Claim conflict on letter {}: {}", ex.getLetterId(), ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Claim conflict", ex.getMessage(), null, null);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    ResponseEntity<ApiError> handleInvalidTransition(InvalidTransitionException ex) {
        log.info("Invalid transition: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Status conflict", ex.getMessage(), null, null);
    }

    @ExceptionHandler(GenerationFailedException.class)
    ResponseEntity<ApiError> handleGenerationFailed(GenerationFailedException ex) {
        log.error("Generation failed for letter {} (refunded={})", ex.getLetterId(), ex.isCreditRefunded(), ex.getCause());
        return respond(HttpStatus.BAD_GATEWAY, "Generation failed", ex.getMessage(), null,
                Map.of("letterId", ex.getLetterId(), "creditRefunded", ex.isCreditRefunded()));
    }

    @ExceptionHandler(ProviderException.class)
    ResponseEntity<ApiError> handleProvider(ProviderException ex) {
        log.error("Provider {} failed ({}): {}", ex.getProviderId(), ex.getFailureClass(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "Provider unavailable",
                "The drafting service could not complete the request. Please try again later.", null,
                Map.of("failure", ex.getFailureClass().name()));
    }

    @ExceptionHandler(PersistenceException.class)
    ResponseEntity<ApiError> handlePersistence(PersistenceException ex) {
        log.error("Persistence failure: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Persistence failure",
                "The request could not be saved. Please try again.", null, null);
    }

    @ExceptionHandler(LetterWorkflowException.class)
    ResponseEntity<ApiError> handleWorkflow(LetterWorkflowException ex) {
        log.error("Unhandled workflow error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Workflow error", ex.getMessage(), null, null);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String error, String message,
                                                    List<String> errors, Map<String, Object> details) {
        return ResponseEntity.status(status).body(new ApiError(error, message, errors, details, Instant.now()));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ApiError(String error, String message, List<String> errors, Map<String, Object> details, Instant timestamp) {}
}
