package com.letterdesk.reviewcore.domain.ports;

import com.letterdesk.reviewcore.domain.AllowanceAccount;

import java.util.Optional;
import java.util.UUID;

public interface AllowanceRepository {

    Optional<AllowanceAccount> findByUserId(UUID userId);

    /** Reads the account holding a write lock until the surrounding transaction ends. */
    Optional<AllowanceAccount> findByUserIdForUpdate(UUID userId);

    AllowanceAccount save(AllowanceAccount account);

    /** Atomically takes one credit if at least one is left. Returns the affected row count. */
    int decrementIfAvailable(UUID userId);

    /** Atomically consumes the free trial flag. Returns the affected row count. */
    int consumeFreeTrial(UUID userId);

    /** Creates a zero-credit trial account unless one already exists. */
    void createTrialAccountIfAbsent(UUID userId);
}
