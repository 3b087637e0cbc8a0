package com.letterdesk.reviewcore.api;

import com.letterdesk.reviewcore.api.dto.AuditEntryResponse;
import com.letterdesk.reviewcore.api.dto.DraftUpdateRequest;
import com.letterdesk.reviewcore.api.dto.GenerateLetterRequest;
import com.letterdesk.reviewcore.api.dto.LetterResponse;
import com.letterdesk.reviewcore.api.dto.ResubmitRequest;
import com.letterdesk.reviewcore.application.GenerateLetterCommand;
import com.letterdesk.reviewcore.application.GenerationOrchestrator;
import com.letterdesk.reviewcore.application.GenerationOutcome;
import com.letterdesk.reviewcore.application.ReviewStateMachine;
import com.letterdesk.reviewcore.config.CurrentActor;
import com.letterdesk.reviewcore.domain.Actor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/letters")
@Tag(name = "Letters", description = "Letter generation and owner actions")
public class LetterController {

    private static final Logger log = LoggerFactory.getLogger(LetterController.class);

    private final GenerationOrchestrator orchestrator;
    private final ReviewStateMachine stateMachine;
    private final CurrentActor currentActor;

    public LetterController(GenerationOrchestrator orchestrator, ReviewStateMachine stateMachine, CurrentActor currentActor) {
        this.orchestrator = orchestrator;
        this.stateMachine = stateMachine;
        this.currentActor = currentActor;
    }

    @PostMapping("/generate")
    @Operation(summary = "Generate a letter draft", description = "Spends one letter credit; 402 when none is left")
    public ResponseEntity<?> generate(@RequestBody GenerateLetterRequest req) {
        Actor actor = currentActor.get();
        GenerationOutcome outcome = orchestrator.generate(
                new GenerateLetterCommand(actor.userId(), req.letterType(), req.intakeData()));

        if (!outcome.isCreated()) {
            log.info("Generation refused for user {} - no credits", actor.userId());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "Allowance exhausted");
            body.put("message", outcome.deduction().errorMessage());
            body.put("needsSubscription", outcome.deduction().needsSubscription());
            body.put("timestamp", Instant.now());
            return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).body(body);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("letterId", outcome.letter().getId());
        body.put("status", outcome.letter().getStatus().wireValue());
        body.put("isFreeTrial", outcome.isFreeTrial());
        body.put("aiDraft", outcome.letter().getAiDraftContent());
        body.put("generationMethod", outcome.methodUsed().label());
        return ResponseEntity.ok(body);
    }

    @GetMapping
    public List<LetterResponse> list() {
        return stateMachine.listOwn(currentActor.get()).stream().map(LetterResponse::from).toList();
    }

    @GetMapping("/{id}")
    public LetterResponse get(@PathVariable("id") UUID id) {
        return LetterResponse.from(stateMachine.getLetter(id, currentActor.get()));
    }

    @GetMapping("/{id}/history")
    public List<AuditEntryResponse> history(@PathVariable("id") UUID id) {
        return stateMachine.history(id, currentActor.get()).stream().map(AuditEntryResponse::from).toList();
    }

    @PutMapping("/{id}/draft")
    @Operation(summary = "Replace the content of a draft letter")
    public LetterResponse updateDraft(@PathVariable("id") UUID id, @RequestBody @Valid DraftUpdateRequest req) {
        return LetterResponse.from(stateMachine.updateDraft(id, currentActor.get(), req.content()));
    }

    @PostMapping("/{id}/submit")
    public LetterResponse submit(@PathVariable("id") UUID id) {
        return LetterResponse.from(stateMachine.submit(id, currentActor.get()));
    }

    @PostMapping("/{id}/resubmit")
    public LetterResponse resubmit(@PathVariable("id") UUID id, @RequestBody @Valid ResubmitRequest req) {
        return LetterResponse.from(stateMachine.resubmit(id, currentActor.get(), req.content()));
    }

    @PostMapping("/{id}/retry")
    public LetterResponse retry(@PathVariable("id") UUID id) {
        return LetterResponse.from(stateMachine.retry(id, currentActor.get()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable("id") UUID id) {
        stateMachine.delete(id, currentActor.get());
        return ResponseEntity.ok(Map.of("deleted", true, "letterId", id));
    }
}
