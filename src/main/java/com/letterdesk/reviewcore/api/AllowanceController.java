package com.letterdesk.reviewcore.api;

import com.letterdesk.reviewcore.api.dto.OpenAccountRequest;
import com.letterdesk.reviewcore.api.dto.RefundRequest;
import com.letterdesk.reviewcore.application.AllowanceService;
import com.letterdesk.reviewcore.config.CurrentActor;
import com.letterdesk.reviewcore.domain.AllowanceAccount;
import com.letterdesk.reviewcore.domain.AllowanceCheck;
import com.letterdesk.reviewcore.domain.RefundResult;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@RestController
@Tag(name = "Allowance", description = "Letter credit balance")
public class AllowanceController {

    private static final Logger log = LoggerFactory.getLogger(AllowanceController.class);

    private final AllowanceService allowance;
    private final CurrentActor currentActor;

    public AllowanceController(AllowanceService allowance, CurrentActor currentActor) {
        this.allowance = allowance;
        this.currentActor = currentActor;
    }

    @GetMapping("/allowance")
    public AllowanceCheck check() {
        return allowance.checkAllowance(currentActor.get().userId());
    }

    @PostMapping("/admin/allowance/{userId}")
    public ResponseEntity<?> open(@PathVariable("userId") UUID userId, @RequestBody @Valid OpenAccountRequest req) {
        log.info("Super admin {} opening allowance account for {}", currentActor.get().userId(), userId);
        AllowanceAccount account = allowance.openAccount(userId, req.monthlyAllowance(), req.periodStart(), req.periodEnd());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", account.getUserId());
        body.put("monthlyAllowance", account.getMonthlyAllowance());
        body.put("creditsRemaining", account.getCreditsRemaining());
        body.put("periodStart", account.getPeriodStart());
        body.put("periodEnd", account.getPeriodEnd());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/admin/allowance/{userId}/refund")
    public ResponseEntity<?> refund(@PathVariable("userId") UUID userId, @RequestBody(required = false) RefundRequest req) {
        int amount = req == null ? 1 : req.amountOrDefault();
        RefundResult result = allowance.refundAllowance(userId, amount);
        if (!result.success()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Refund failed", "message", result.error()));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("remaining", result.remaining());
        return ResponseEntity.ok(body);
    }
}
