package com.letterdesk.reviewcore.api;

import com.letterdesk.reviewcore.api.dto.ApproveRequest;
import com.letterdesk.reviewcore.api.dto.AssignRequest;
import com.letterdesk.reviewcore.api.dto.BulkApproveRequest;
import com.letterdesk.reviewcore.api.dto.BulkRejectRequest;
import com.letterdesk.reviewcore.api.dto.ImproveRequest;
import com.letterdesk.reviewcore.api.dto.LetterResponse;
import com.letterdesk.reviewcore.api.dto.RejectRequest;
import com.letterdesk.reviewcore.application.ReviewStateMachine;
import com.letterdesk.reviewcore.config.CurrentActor;
import com.letterdesk.reviewcore.domain.BulkResult;
import com.letterdesk.reviewcore.domain.LetterStatus;
import com.letterdesk.reviewcore.domain.RejectionReason;
import com.letterdesk.reviewcore.exception.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/admin")
@Tag(name = "Review", description = "Attorney review queue and decisions")
public class ReviewController {

    private final ReviewStateMachine stateMachine;
    private final CurrentActor currentActor;

    public ReviewController(ReviewStateMachine stateMachine, CurrentActor currentActor) {
        this.stateMachine = stateMachine;
        this.currentActor = currentActor;
    }

    @GetMapping("/letters")
    public List<LetterResponse> queue(@RequestParam(name = "status", required = false) String status) {
        LetterStatus filter = parseStatus(status);
        return stateMachine.reviewQueue(currentActor.get(), filter).stream().map(LetterResponse::from).toList();
    }

    @PostMapping("/letters/{id}/claim")
    public LetterResponse claim(@PathVariable("id") UUID id) {
        return LetterResponse.from(stateMachine.claim(id, currentActor.get()));
    }

    @PostMapping("/letters/{id}/approve")
    public LetterResponse approve(@PathVariable("id") UUID id, @RequestBody @Valid ApproveRequest req) {
        return LetterResponse.from(stateMachine.approve(id, currentActor.get(), req.finalContent(), req.reviewNotes()));
    }

    @PostMapping("/letters/{id}/reject")
    public LetterResponse reject(@PathVariable("id") UUID id, @RequestBody RejectRequest req) {
        return LetterResponse.from(stateMachine.reject(id, currentActor.get(),
                parseReason(req.reason()), req.reasonDetail(), req.reviewNotes()));
    }

    @PostMapping("/letters/{id}/improve")
    @Operation(summary = "Revise the draft with the drafting service", description = "Assigned reviewer only; 502 when the service fails")
    public LetterResponse improve(@PathVariable("id") UUID id, @RequestBody(required = false) ImproveRequest req) {
        return LetterResponse.from(stateMachine.improve(id, currentActor.get(), req == null ? null : req.notes()));
    }

    @PostMapping("/letters/{id}/complete")
    public LetterResponse complete(@PathVariable("id") UUID id) {
        return LetterResponse.from(stateMachine.complete(id, currentActor.get()));
    }

    @PostMapping("/letters/{id}/assign")
    public LetterResponse assign(@PathVariable("id") UUID id, @RequestBody @Valid AssignRequest req) {
        return LetterResponse.from(stateMachine.reassign(id, currentActor.get(), req.reviewerId()));
    }

    @PostMapping("/letters/bulk-approve")
    public BulkResult bulkApprove(@RequestBody @Valid BulkApproveRequest req) {
        return stateMachine.bulkApprove(req.letterIds(), currentActor.get(), req.reviewNotes());
    }

    @PostMapping("/letters/bulk-reject")
    public BulkResult bulkReject(@RequestBody @Valid BulkRejectRequest req) {
        return stateMachine.bulkReject(req.letterIds(), currentActor.get(), req.reason(), req.reviewNotes());
    }

    @GetMapping("/rejection-reasons")
    public List<Map<String, Object>> rejectionReasons() {
        return Arrays.stream(RejectionReason.values())
                .map(r -> {
                    Map<String, Object> m = new LinkedHashMap<>();
                    m.put("code", r.name().toLowerCase(Locale.ROOT));
                    m.put("label", r.label());
                    m.put("requiresDetail", r.requiresDetail());
                    return m;
                })
                .toList();
    }

    private static LetterStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return LetterStatus.fromWire(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }

    private static RejectionReason parseReason(String reason) {
        if (reason == null || reason.isBlank()) {
            return null;
        }
        try {
            return RejectionReason.valueOf(reason.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown rejection reason: " + reason);
        }
    }
}
