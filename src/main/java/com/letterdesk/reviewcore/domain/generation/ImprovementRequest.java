package com.letterdesk.reviewcore.domain.generation;

import java.util.UUID;

/**
 * A reviewer's request to rework an existing draft. {@code notes} may be null.
 */
public record ImprovementRequest(UUID letterId, String letterType, String originalContent, String notes) {
}
