package com.example.inboxsync.service;

import com.example.inboxsync.config.SyncProperties;
import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.SyncState;
import com.example.inboxsync.service.exception.SyncErrorType;
import com.example.inboxsync.service.exception.SyncException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

/**
 * Runs backfills off the caller's thread, at most one per account at a time.
 */
@Slf4j
@Component
public class BackfillScheduler {

    private final TaskScheduler taskScheduler;
    private final BackfillService backfillService;
    private final SyncStore store;
    private final SyncProperties syncProperties;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public BackfillScheduler(
            @Qualifier("backfillTaskScheduler") TaskScheduler taskScheduler,
            BackfillService backfillService,
            SyncStore store,
            SyncProperties syncProperties) {
        this.taskScheduler = taskScheduler;
        this.backfillService = backfillService;
        this.store = store;
        this.syncProperties = syncProperties;
    }

    public boolean schedule(String accountId) {
        SyncProperties.Backfill backfill = syncProperties.getBackfill();
        return schedule(accountId, BackfillLimits.from(backfill), backfill.getInitialDelay());
    }

    /**
     * @return {@code false} when a backfill for the account is already pending or running
     * @throws SyncException of type {@code TRANSIENT} when the executor rejects the task
     */
    public boolean schedule(String accountId, BackfillLimits limits, Duration delay) {
        if (!inFlight.add(accountId)) {
            log.info("Backfill for account {} already pending; not scheduling another", accountId);
            return false;
        }
        Duration effectiveDelay = delay != null && !delay.isNegative() ? delay : Duration.ZERO;
        log.info("Scheduling backfill for account {} in {}", accountId, effectiveDelay);
        try {
            taskScheduler.schedule(() -> run(accountId, limits), Instant.now().plus(effectiveDelay));
        } catch (TaskRejectedException ex) {
            inFlight.remove(accountId);
            log.warn("Backfill executor rejected account {}", accountId, ex);
            throw new SyncException(SyncErrorType.TRANSIENT,
                    "Backfill executor is saturated; retry later", "backfill_rejected", ex);
        }
        return true;
    }

    public boolean isPending(String accountId) {
        return inFlight.contains(accountId);
    }

    void run(String accountId, BackfillLimits limits) {
        try {
            Optional<Account> account = store.findAccount(accountId).filter(candidate -> !candidate.isDeleted());
            if (account.isEmpty()) {
                log.info("Skipping backfill for missing or disconnected account {}", accountId);
                return;
            }
            backfillService.backfill(account.get(), limits);
        } catch (Exception ex) {
            log.error("Backfill for account {} failed", accountId, ex);
        } finally {
            inFlight.remove(accountId);
        }
    }

    /**
     * Marks runs abandoned by a crashed node as failed so the account can be backfilled again.
     */
    @Scheduled(fixedDelayString = "${sync.backfill.housekeeping-interval:PT5M}")
    public void failAbandonedRuns() {
        Duration staleAfter = syncProperties.getBackfill().getStaleAfter();
        if (staleAfter == null || staleAfter.isZero() || staleAfter.isNegative()) {
            return;
        }
        List<Account> running = store.findAccountsBySyncState(SyncState.RUNNING);
        if (CollectionUtils.isEmpty(running)) {
            return;
        }
        Instant cutoff = Instant.now().minus(staleAfter);
        for (Account account : running) {
            if (inFlight.contains(account.getAccountId())
                    || account.getSyncStartedAt() == null
                    || account.getSyncStartedAt().isAfter(cutoff)) {
                continue;
            }
            try {
                log.debug("Marking abandoned backfill of account {} (started {}) as failed",
                        account.getAccountId(), account.getSyncStartedAt());
                account.setSyncState(SyncState.FAILED);
                account.setSyncError("Backfill abandoned");
                account.setSyncCompletedAt(Instant.now());
                account.setUpdatedAt(Instant.now());
                store.saveAccount(account);
            } catch (Exception ex) {
                log.warn("Failed to reset abandoned backfill of account {}", account.getAccountId(), ex);
            }
        }
    }
}
