package com.letterdesk.reviewcore.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Rejection decision")
public record RejectRequest(
        @Schema(description = "Reason code from /admin/rejection-reasons; super admins may omit it and use reasonDetail",
                example = "needs_more_facts")
        String reason,

        @Schema(description = "Explanation, required when reason is 'other'")
        String reasonDetail,

        String reviewNotes
) {}
