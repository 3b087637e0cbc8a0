package com.letterdesk.reviewcore.domain;

/**
 * Review actions that can be granted to a role.
 */
public enum Capability {
    CLAIM,
    APPROVE,
    REJECT,
    /** May reject with any free-text reason instead of the fixed taxonomy. */
    FREE_TEXT_REJECTION,
    BULK_OPERATIONS,
    /** May override an existing claim or assign a letter to another reviewer. */
    REASSIGN
}
