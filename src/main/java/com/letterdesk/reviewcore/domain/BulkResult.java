package com.letterdesk.reviewcore.domain;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Per-letter outcome of a bulk review decision.
 */
public record BulkResult(List<UUID> succeeded, Map<UUID, String> failed) {

    public BulkResult {
        succeeded = List.copyOf(succeeded);
        failed = Map.copyOf(failed);
    }

    public int total() {
        return succeeded.size() + failed.size();
    }
}
