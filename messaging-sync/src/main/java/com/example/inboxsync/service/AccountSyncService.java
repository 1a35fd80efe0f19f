package com.example.inboxsync.service;

import com.example.inboxsync.config.SyncProperties;
import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.AccountStatus;
import com.example.inboxsync.domain.SyncState;
import com.example.inboxsync.dto.AccountLifecyclePayload;
import com.example.inboxsync.dto.AccountStatusPayload;
import com.example.inboxsync.event.SyncEventPublisher;
import com.example.inboxsync.event.SyncEventType;
import com.example.inboxsync.normalize.FieldResolver;
import com.example.inboxsync.service.exception.SyncException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Slf4j
@Service
@RequiredArgsConstructor
public class AccountSyncService {

    private final SyncStore store;
    private final BackfillScheduler backfillScheduler;
    private final SyncEventPublisher eventPublisher;
    private final SyncProperties syncProperties;

    /**
     * Handles {@code account.connected} and {@code account.updated}: creates or restores the
     * account and, on a transition into {@code CONNECTED}, schedules its historical backfill.
     */
    public Account connect(AccountLifecyclePayload payload) {
        if (payload == null || !StringUtils.hasText(payload.getAccountId())) {
            throw SyncException.invalidEvent("account_id is required");
        }
        Instant now = Instant.now();
        Account existing = store.findAccount(payload.getAccountId()).orElse(null);
        boolean wasConnected = existing != null
                && !existing.isDeleted()
                && existing.getStatus() == AccountStatus.CONNECTED;
        AccountStatus status = StringUtils.hasText(payload.getStatus())
                ? AccountStatus.fromProvider(payload.getStatus())
                : AccountStatus.CONNECTED;

        Account account = existing != null
                ? existing
                : Account.builder()
                        .id(UUID.randomUUID().toString())
                        .accountId(payload.getAccountId())
                        .syncState(SyncState.IDLE)
                        .createdAt(now)
                        .build();
        account.setProvider(normalizeProvider(FieldResolver.firstText(payload.getProvider(), account.getProvider())));
        if (StringUtils.hasText(payload.getUserIdentifier())) {
            account.setOwnerId(payload.getUserIdentifier());
        }
        if (StringUtils.hasText(payload.getProviderUserId())) {
            account.setProviderUserId(payload.getProviderUserId());
        }
        AccountStatus previous = existing != null ? existing.getStatus() : null;
        account.setStatus(status);
        account.setDeleted(false);
        account.setLastActivity(now);
        account.setUpdatedAt(now);
        Account saved = store.saveAccount(account);
        log.info("Account {} ({}) is {}", saved.getAccountId(), saved.getProvider(), status);

        if (previous != status) {
            publishStatus(saved, previous);
        }
        if (status == AccountStatus.CONNECTED && !wasConnected && !saved.isSyncRunning()) {
            try {
                backfillScheduler.schedule(saved.getAccountId());
            } catch (SyncException ex) {
                // the account stays IDLE and can be backfilled through the manual trigger
                log.warn("Backfill for account {} not scheduled: {}", saved.getAccountId(), ex.getMessage());
            }
        }
        return saved;
    }

    public Account updateStatus(AccountStatusPayload payload) {
        if (payload == null || !StringUtils.hasText(payload.getAccountId())) {
            throw SyncException.invalidEvent("account_id is required");
        }
        Account account = store.findAccount(payload.getAccountId())
                .orElseThrow(() -> SyncException.notFound("Account not found: " + payload.getAccountId()));
        AccountStatus previous = account.getStatus();
        AccountStatus status = AccountStatus.fromProvider(FieldResolver.firstText(payload.getStatus(), payload.getMessage()));
        Instant now = Instant.now();
        account.setStatus(status);
        account.setLastActivity(Objects.requireNonNullElse(FieldResolver.parseInstant(payload.getLastActivity()), now));
        account.setUpdatedAt(now);
        Account saved = store.saveAccount(account);
        if (StringUtils.hasText(payload.getErrorMessage())) {
            log.warn("Account {} reported {}: {}", saved.getAccountId(), status, payload.getErrorMessage());
        } else {
            log.info("Account {} moved from {} to {}", saved.getAccountId(), previous, status);
        }
        if (previous != status) {
            publishStatus(saved, previous);
        }
        return saved;
    }

    /**
     * Soft-deletes the account. Synchronized data stays in place.
     */
    public Account disconnect(AccountLifecyclePayload payload) {
        if (payload == null || !StringUtils.hasText(payload.getAccountId())) {
            throw SyncException.invalidEvent("account_id is required");
        }
        Account account = store.findAccount(payload.getAccountId())
                .orElseThrow(() -> SyncException.notFound("Account not found: " + payload.getAccountId()));
        AccountStatus previous = account.getStatus();
        Instant now = Instant.now();
        account.setDeleted(true);
        account.setStatus(AccountStatus.DISCONNECTED);
        account.setLastActivity(now);
        account.setUpdatedAt(now);
        Account saved = store.saveAccount(account);
        log.info("Account {} disconnected", saved.getAccountId());
        if (previous != AccountStatus.DISCONNECTED) {
            publishStatus(saved, previous);
        }
        return saved;
    }

    private void publishStatus(Account account, AccountStatus previous) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", account.getStatus().name());
        if (previous != null) {
            payload.put("previousStatus", previous.name());
        }
        payload.put("deleted", account.isDeleted());
        eventPublisher.publish(SyncEventType.ACCOUNT_STATUS_CHANGED, account.getAccountId(), null, payload);
    }

    private String normalizeProvider(String provider) {
        String value = StringUtils.hasText(provider) ? provider : syncProperties.getDefaultProvider();
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
