package com.letterdesk.reviewcore.application;

import com.letterdesk.reviewcore.domain.AllowanceAccount;
import com.letterdesk.reviewcore.domain.AllowanceCheck;
import com.letterdesk.reviewcore.domain.DeductionResult;
import com.letterdesk.reviewcore.domain.RefundResult;
import com.letterdesk.reviewcore.domain.Role;
import com.letterdesk.reviewcore.domain.ports.AllowanceRepository;
import com.letterdesk.reviewcore.domain.ports.LetterRepository;
import com.letterdesk.reviewcore.domain.ports.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Letter credit ledger. Deduction is a single locked, guarded update per user so that concurrent
 * requests can never spend the same credit twice.
 */
@Service
public class AllowanceService {

    private static final Logger log = LoggerFactory.getLogger(AllowanceService.class);

    static final int MAX_REFUND = 10;

    private final AllowanceRepository accounts;
    private final LetterRepository letters;
    private final UserDirectory users;

    public AllowanceService(AllowanceRepository accounts, LetterRepository letters, UserDirectory users) {
        this.accounts = accounts;
        this.letters = letters;
        this.users = users;
    }

    @Transactional(readOnly = true)
    public AllowanceCheck checkAllowance(UUID userId) {
        if (isSuperAdmin(userId)) {
            return new AllowanceCheck(true, null);
        }
        Optional<AllowanceAccount> account = accounts.findByUserId(userId);
        if (account.isPresent() && account.get().hasCredit()) {
            return new AllowanceCheck(true, account.get().getCreditsRemaining());
        }
        if (isTrialEligible(userId, account)) {
            // The free letter itself
            return new AllowanceCheck(true, 1);
        }
        return new AllowanceCheck(false, account.map(AllowanceAccount::getCreditsRemaining).orElse(0));
    }

    @Transactional
    public DeductionResult checkAndDeductAllowance(UUID userId) {
        if (isSuperAdmin(userId)) {
            log.info("Allowance bypass for super admin {}", userId);
            return DeductionResult.unlimited();
        }

        Optional<AllowanceAccount> locked = accounts.findByUserIdForUpdate(userId);
        if (locked.isPresent()) {
            AllowanceAccount account = locked.get();
            if (account.isUnlimited()) {
                log.info("Allowance bypass for unlimited account {}", userId);
                return DeductionResult.unlimited();
            }
            if (accounts.decrementIfAvailable(userId) == 1) {
                int remaining = account.getCreditsRemaining() - 1;
                log.info("Deducted 1 letter credit from user {} - remaining: {}", userId, remaining);
                return DeductionResult.charged(remaining);
            }
        }

        if (letters.countByOwner(userId) == 0) {
            if (locked.isEmpty()) {
                accounts.createTrialAccountIfAbsent(userId);
            }
            if (accounts.consumeFreeTrial(userId) == 1) {
                log.info("Free trial letter granted to user {}", userId);
                return DeductionResult.trial();
            }
        }

        log.info("Allowance exhausted for user {}", userId);
        return DeductionResult.exhausted();
    }

    /**
     * Gives credits back, never above the monthly allowance. Not atomic with the deduction it reverses.
     */
    @Transactional
    public RefundResult refundAllowance(UUID userId, int amount) {
        if (amount < 1 || amount > MAX_REFUND) {
            return RefundResult.failed("Invalid refund amount");
        }
        Optional<AllowanceAccount> locked = accounts.findByUserIdForUpdate(userId);
        if (locked.isEmpty()) {
            log.warn("Refund of {} credit(s) for user {} skipped - no account", amount, userId);
            return RefundResult.failed("No active subscription found");
        }
        AllowanceAccount a = locked.get();
        if (a.isUnlimited()) {
            return RefundResult.refunded(null);
        }
        int current = a.getCreditsRemaining();
        int restored = Math.max(current, Math.min(current + amount, a.getMonthlyAllowance()));
        accounts.save(new AllowanceAccount(a.getUserId(), a.getMonthlyAllowance(), restored, a.isFreeTrial(),
                a.getPeriodStart(), a.getPeriodEnd()));
        log.info("Refunded {} credit(s) to user {} - balance {} -> {}", amount, userId, current, restored);
        return RefundResult.refunded(restored);
    }

    public RefundResult refundAllowance(UUID userId) {
        return refundAllowance(userId, 1);
    }

    /**
     * Opens or resets a paid account with a full balance for the given period.
     */
    @Transactional
    public AllowanceAccount openAccount(UUID userId, int monthlyAllowance, OffsetDateTime periodStart, OffsetDateTime periodEnd) {
        if (monthlyAllowance < 0) {
            throw new IllegalArgumentException("monthlyAllowance must be >= 0");
        }
        AllowanceAccount account = accounts.save(new AllowanceAccount(userId, monthlyAllowance, monthlyAllowance, false,
                periodStart, periodEnd));
        log.info("Allowance account for user {} set to {} letters ({} - {})", userId, monthlyAllowance, periodStart, periodEnd);
        return account;
    }

    private boolean isSuperAdmin(UUID userId) {
        return users.findRole(userId).map(r -> r == Role.SUPER_ADMIN).orElse(false);
    }

    private boolean isTrialEligible(UUID userId, Optional<AllowanceAccount> account) {
        boolean trialOpen = account.map(AllowanceAccount::isFreeTrial).orElse(true);
        return trialOpen && letters.countByOwner(userId) == 0;
    }
}
