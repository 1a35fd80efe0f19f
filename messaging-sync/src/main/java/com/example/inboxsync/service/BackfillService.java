package com.example.inboxsync.service;

import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.AccountStatus;
import com.example.inboxsync.domain.Chat;
import com.example.inboxsync.domain.SyncState;
import com.example.inboxsync.event.SyncEventPublisher;
import com.example.inboxsync.event.SyncEventType;
import com.example.inboxsync.normalize.EventNormalizer;
import com.example.inboxsync.normalize.NormalizedChat;
import com.example.inboxsync.provider.ProviderAttendee;
import com.example.inboxsync.provider.ProviderChat;
import com.example.inboxsync.provider.ProviderClient;
import com.example.inboxsync.provider.ProviderMessage;
import com.example.inboxsync.provider.ProviderPage;
import com.example.inboxsync.service.exception.SyncErrorType;
import com.example.inboxsync.service.exception.SyncException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Walks an account's chat history page by page within {@link BackfillLimits}. The walk ends
 * on an empty page, a missing cursor or the chat cap, whichever comes first. A failing chat
 * is logged and counted and the walk moves on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackfillService {

    private final SyncStore store;
    private final ProviderClient providerClient;
    private final EventNormalizer normalizer;
    private final ChatLockManager lockManager;
    private final MessageSyncService messageSyncService;
    private final ParticipantSyncService participantSyncService;
    private final SyncEventPublisher eventPublisher;

    public BackfillReport backfill(Account account, BackfillLimits limits) {
        Instant startedAt = Instant.now();
        Account tracked = markStarted(account, startedAt);
        log.info("Starting backfill for account {} with {}", tracked.getAccountId(), limits);
        eventPublisher.publish(SyncEventType.BACKFILL_STARTED, tracked.getAccountId(), null, Map.of());

        Progress progress = new Progress();
        String cursor = null;
        try {
            while (progress.chatsVisited() < limits.maxChats()) {
                int remaining = limits.maxChats() - progress.chatsVisited();
                ProviderPage<ProviderChat> page = providerClient.listChats(
                        tracked.getAccountId(), cursor, Math.min(limits.pageSize(), remaining));
                progress.pages++;
                if (page.items().isEmpty()) {
                    break;
                }
                List<ProviderChat> inBudget = page.items().subList(0, Math.min(remaining, page.items().size()));
                for (ProviderChat chat : inBudget) {
                    backfillChatSafely(tracked, chat, limits, progress);
                }
                tracked = recordProgress(tracked, progress);
                if (!page.hasMore()) {
                    break;
                }
                cursor = page.cursor();
            }
        } catch (RuntimeException ex) {
            log.error("Backfill for account {} aborted after {} pages", tracked.getAccountId(), progress.pages, ex);
            return markFailed(tracked, progress, startedAt, ex);
        }
        return markCompleted(tracked, progress, startedAt);
    }

    private void backfillChatSafely(Account account, ProviderChat providerChat, BackfillLimits limits, Progress progress) {
        try {
            NormalizedChat normalized = normalizer.normalize(providerChat);
            lockManager.withChatLock(account.getId(), normalized.externalId(), () -> {
                Chat chat = messageSyncService.upsertChat(account, normalized);
                progress.attendees += syncAttendees(account, chat, limits);
                progress.messages += syncMessages(account, chat, limits);
                return chat;
            });
            progress.chatsSynced++;
        } catch (RuntimeException ex) {
            progress.chatsFailed++;
            log.warn("Backfill of chat {} for account {} failed; continuing",
                    providerChat != null ? providerChat.getId() : null, account.getAccountId(), ex);
        }
    }

    private int syncAttendees(Account account, Chat chat, BackfillLimits limits) {
        ProviderPage<ProviderAttendee> page = providerClient.listAttendees(
                account.getAccountId(), chat.getExternalId(), limits.maxAttendeesPerChat());
        List<ProviderAttendee> attendees = page.items()
                .subList(0, Math.min(limits.maxAttendeesPerChat(), page.items().size()));
        for (ProviderAttendee attendee : attendees) {
            participantSyncService.syncParticipant(
                    account, chat, normalizer.normalize(attendee, account.getProviderUserId()), null);
        }
        return attendees.size();
    }

    private int syncMessages(Account account, Chat chat, BackfillLimits limits) {
        int synced = 0;
        String cursor = null;
        while (synced < limits.maxMessagesPerChat()) {
            int remaining = limits.maxMessagesPerChat() - synced;
            ProviderPage<ProviderMessage> page = providerClient.listMessages(
                    account.getAccountId(), chat.getExternalId(), cursor, Math.min(limits.messageBatchSize(), remaining));
            if (page.items().isEmpty()) {
                break;
            }
            for (ProviderMessage message : page.items().subList(0, Math.min(remaining, page.items().size()))) {
                try {
                    messageSyncService.apply(account, normalizer.normalize(message, chat.getExternalId()));
                    synced++;
                } catch (SyncException ex) {
                    if (ex.getType() != SyncErrorType.INVALID_EVENT) {
                        throw ex;
                    }
                    log.warn("Skipping malformed message in chat {}: {}", chat.getExternalId(), ex.getMessage());
                }
            }
            if (!page.hasMore()) {
                break;
            }
            cursor = page.cursor();
        }
        return synced;
    }

    private Account markStarted(Account account, Instant startedAt) {
        return saveTracking(account, fresh -> {
            fresh.setSyncState(SyncState.RUNNING);
            fresh.setSyncStartedAt(startedAt);
            fresh.setSyncCompletedAt(null);
            fresh.setSyncError(null);
            fresh.setChatsSynced(0);
            fresh.setMessagesSynced(0);
            fresh.setAttendeesSynced(0);
            fresh.setUpdatedAt(startedAt);
        });
    }

    private Account recordProgress(Account account, Progress progress) {
        return saveTracking(account, fresh -> {
            applyCounters(fresh, progress);
            fresh.setUpdatedAt(Instant.now());
        });
    }

    private BackfillReport markCompleted(Account account, Progress progress, Instant startedAt) {
        Instant completedAt = Instant.now();
        Account saved = saveTracking(account, fresh -> {
            fresh.setSyncState(SyncState.COMPLETED);
            fresh.setSyncCompletedAt(completedAt);
            applyCounters(fresh, progress);
            fresh.setUpdatedAt(completedAt);
            // a disconnect that landed mid-run wins over the completed walk
            if (!fresh.isDeleted() && fresh.getStatus() != AccountStatus.DISCONNECTED) {
                fresh.setStatus(AccountStatus.CONNECTED);
                fresh.setLastActivity(completedAt);
            }
        });
        BackfillReport report = report(saved, SyncState.COMPLETED, progress, startedAt, completedAt, null);
        log.info("Backfill for account {} completed: {} chats ({} failed), {} messages, {} attendees",
                saved.getAccountId(), progress.chatsSynced, progress.chatsFailed, progress.messages, progress.attendees);
        eventPublisher.publish(SyncEventType.BACKFILL_COMPLETED, saved.getAccountId(), null, Map.of(
                "chatsSynced", progress.chatsSynced,
                "chatsFailed", progress.chatsFailed,
                "messagesSynced", progress.messages));
        return report;
    }

    private BackfillReport markFailed(Account account, Progress progress, Instant startedAt, RuntimeException cause) {
        Instant completedAt = Instant.now();
        String error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        Account saved = saveTracking(account, fresh -> {
            fresh.setSyncState(SyncState.FAILED);
            fresh.setSyncCompletedAt(completedAt);
            fresh.setSyncError(error);
            applyCounters(fresh, progress);
            fresh.setUpdatedAt(completedAt);
        });
        eventPublisher.publish(SyncEventType.BACKFILL_FAILED, saved.getAccountId(), null, Map.of("error", error));
        return report(saved, SyncState.FAILED, progress, startedAt, completedAt, error);
    }

    /**
     * Applies sync-tracking fields to the latest stored row so that status, deletion and
     * profile changes made while the walk runs are kept.
     */
    private Account saveTracking(Account account, Consumer<Account> tracking) {
        Account fresh = store.findAccount(account.getAccountId()).orElse(account);
        tracking.accept(fresh);
        return store.saveAccount(fresh);
    }

    private static void applyCounters(Account account, Progress progress) {
        account.setChatsSynced(progress.chatsSynced);
        account.setMessagesSynced(progress.messages);
        account.setAttendeesSynced(progress.attendees);
    }

    private BackfillReport report(
            Account account, SyncState outcome, Progress progress, Instant startedAt, Instant completedAt, String error) {
        return new BackfillReport(
                account.getAccountId(),
                outcome,
                progress.pages,
                progress.chatsSynced,
                progress.chatsFailed,
                progress.messages,
                progress.attendees,
                startedAt,
                completedAt,
                error);
    }

    private static final class Progress {
        private int pages;
        private int chatsSynced;
        private int chatsFailed;
        private int messages;
        private int attendees;

        int chatsVisited() {
            return chatsSynced + chatsFailed;
        }
    }
}
