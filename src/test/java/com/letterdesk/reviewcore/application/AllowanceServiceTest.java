package com.letterdesk.reviewcore.application;

import com.letterdesk.reviewcore.domain.AllowanceCheck;
import com.letterdesk.reviewcore.domain.DeductionResult;
import com.letterdesk.reviewcore.domain.RefundResult;
import com.letterdesk.reviewcore.domain.ports.AllowanceRepository;
import com.letterdesk.reviewcore.infrastructure.jpa.SpringUserRepository;
import com.letterdesk.reviewcore.infrastructure.jpa.UserEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class AllowanceServiceTest {

    @Autowired
    private AllowanceService allowanceService;

    @Autowired
    private AllowanceRepository allowanceRepository;

    @Autowired
    private SpringUserRepository userRepository;

    private UUID subscriberWithCredits(int credits) {
        UUID userId = UUID.randomUUID();
        OffsetDateTime start = OffsetDateTime.now();
        allowanceService.openAccount(userId, credits, start, start.plusMonths(1));
        return userId;
    }

    private int balance(UUID userId) {
        return allowanceRepository.findByUserId(userId).orElseThrow().getCreditsRemaining();
    }

    @Test
    void deductsOneCreditAtATime() {
        UUID userId = subscriberWithCredits(2);

        DeductionResult first = allowanceService.checkAndDeductAllowance(userId);

        assertThat(first.success()).isTrue();
        assertThat(first.remaining()).isEqualTo(1);
        assertThat(first.isRefundable()).isTrue();
        assertThat(balance(userId)).isEqualTo(1);
    }

    @Test
    void concurrentDeductionsNeverOverspend() throws Exception {
        UUID userId = subscriberWithCredits(5);
        int requests = 10;
        ExecutorService pool = Executors.newFixedThreadPool(requests);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<DeductionResult>> futures = new ArrayList<>();
            for (int i = 0; i < requests; i++) {
                Callable<DeductionResult> call = () -> {
                    start.await();
                    return allowanceService.checkAndDeductAllowance(userId);
                };
                futures.add(pool.submit(call));
            }
            start.countDown();

            int granted = 0;
            for (Future<DeductionResult> f : futures) {
                if (f.get(30, TimeUnit.SECONDS).success()) {
                    granted++;
                }
            }

            assertThat(granted).isEqualTo(5);
            assertThat(balance(userId)).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void exhaustedAccountAsksForSubscription() {
        UUID userId = subscriberWithCredits(0);

        DeductionResult result = allowanceService.checkAndDeductAllowance(userId);

        assertThat(result.success()).isFalse();
        assertThat(result.needsSubscription()).isTrue();
        assertThat(result.errorMessage()).isEqualTo(DeductionResult.NO_CREDITS_MESSAGE);
        assertThat(allowanceService.checkAllowance(userId).hasAllowance()).isFalse();
    }

    @Test
    void freeTrialIsGrantedOnlyOnce() {
        UUID newUser = UUID.randomUUID();

        AllowanceCheck before = allowanceService.checkAllowance(newUser);
        DeductionResult first = allowanceService.checkAndDeductAllowance(newUser);
        DeductionResult second = allowanceService.checkAndDeductAllowance(newUser);

        assertThat(before.hasAllowance()).isTrue();
        assertThat(first.success()).isTrue();
        assertThat(first.freeTrial()).isTrue();
        assertThat(first.isRefundable()).isFalse();
        assertThat(second.success()).isFalse();
        assertThat(allowanceService.checkAllowance(newUser).hasAllowance()).isFalse();
    }

    @Test
    void superAdminIsNeverCharged() {
        UserEntity admin = new UserEntity();
        admin.setId(UUID.randomUUID());
        admin.setEmail("root-" + admin.getId() + "@letterdesk.test");
        admin.setPasswordHash("{noop}unused");
        admin.setRoles(Set.of("SUPER_ADMIN"));
        userRepository.save(admin);

        DeductionResult result = allowanceService.checkAndDeductAllowance(admin.getId());

        assertThat(result.success()).isTrue();
        assertThat(result.superAdmin()).isTrue();
        assertThat(result.remaining()).isNull();
        assertThat(allowanceRepository.findByUserId(admin.getId())).isEmpty();
    }

    @Test
    void refundNeverExceedsMonthlyAllowance() {
        UUID userId = subscriberWithCredits(3);
        allowanceService.checkAndDeductAllowance(userId);

        RefundResult refund = allowanceService.refundAllowance(userId, 5);

        assertThat(refund.success()).isTrue();
        assertThat(refund.remaining()).isEqualTo(3);
        assertThat(balance(userId)).isEqualTo(3);
    }

    @Test
    void refundOnFullBalanceIsANoOp() {
        UUID userId = subscriberWithCredits(3);

        RefundResult refund = allowanceService.refundAllowance(userId);

        assertThat(refund.success()).isTrue();
        assertThat(refund.remaining()).isEqualTo(3);
    }

    @Test
    void refundRejectsOutOfRangeAmounts() {
        UUID userId = subscriberWithCredits(3);

        assertThat(allowanceService.refundAllowance(userId, 0).error()).isEqualTo("Invalid refund amount");
        assertThat(allowanceService.refundAllowance(userId, AllowanceService.MAX_REFUND + 1).error())
                .isEqualTo("Invalid refund amount");
    }

    @Test
    void refundWithoutAccountFails() {
        RefundResult refund = allowanceService.refundAllowance(UUID.randomUUID(), 1);

        assertThat(refund.success()).isFalse();
        assertThat(refund.error()).isEqualTo("No active subscription found");
    }
}
