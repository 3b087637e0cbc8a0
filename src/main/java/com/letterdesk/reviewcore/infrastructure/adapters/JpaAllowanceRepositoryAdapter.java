package com.letterdesk.reviewcore.infrastructure.adapters;

import com.letterdesk.reviewcore.domain.AllowanceAccount;
import com.letterdesk.reviewcore.domain.ports.AllowanceRepository;
import com.letterdesk.reviewcore.infrastructure.jpa.AllowanceAccountEntity;
import com.letterdesk.reviewcore.infrastructure.jpa.SpringAllowanceRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaAllowanceRepositoryAdapter implements AllowanceRepository {

    private final SpringAllowanceRepository accounts;
    private final Clock clock;

    public JpaAllowanceRepositoryAdapter(SpringAllowanceRepository accounts, Clock clock) {
        this.accounts = accounts;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AllowanceAccount> findByUserId(UUID userId) {
        return accounts.findById(userId).map(JpaAllowanceRepositoryAdapter::toDomain);
    }

    @Override
    @Transactional
    public Optional<AllowanceAccount> findByUserIdForUpdate(UUID userId) {
        return accounts.findByUserIdForUpdate(userId).map(JpaAllowanceRepositoryAdapter::toDomain);
    }

    @Override
    @Transactional
    public AllowanceAccount save(AllowanceAccount a) {
        AllowanceAccountEntity e = accounts.findById(a.getUserId()).orElseGet(AllowanceAccountEntity::new);
        e.setUserId(a.getUserId());
        e.setMonthlyAllowance(a.getMonthlyAllowance());
        e.setCreditsRemaining(a.getCreditsRemaining());
        e.setFreeTrial(a.isFreeTrial());
        e.setPeriodStart(a.getPeriodStart());
        e.setPeriodEnd(a.getPeriodEnd());
        e.setUpdatedAt(OffsetDateTime.now(clock));
        accounts.save(e);
        return a;
    }

    @Override
    @Transactional
    public int decrementIfAvailable(UUID userId) {
        return accounts.decrementIfAvailable(userId, OffsetDateTime.now(clock));
    }

    @Override
    @Transactional
    public int consumeFreeTrial(UUID userId) {
        return accounts.consumeFreeTrial(userId, OffsetDateTime.now(clock));
    }

    @Override
    @Transactional
    public void createTrialAccountIfAbsent(UUID userId) {
        if (accounts.existsById(userId)) {
            return;
        }
        AllowanceAccountEntity e = new AllowanceAccountEntity();
        e.setUserId(userId);
        e.setMonthlyAllowance(0);
        e.setCreditsRemaining(0);
        e.setFreeTrial(true);
        e.setUpdatedAt(OffsetDateTime.now(clock));
        accounts.saveAndFlush(e);
    }

    private static AllowanceAccount toDomain(AllowanceAccountEntity e) {
        return new AllowanceAccount(e.getUserId(), e.getMonthlyAllowance(), e.getCreditsRemaining(),
                e.isFreeTrial(), e.getPeriodStart(), e.getPeriodEnd());
    }
}
