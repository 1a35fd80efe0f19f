package com.example.inboxsync.service;

import static org.mockito.Mockito.mock;

import com.example.inboxsync.config.SyncProperties;
import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.AccountStatus;
import com.example.inboxsync.domain.SyncState;
import com.example.inboxsync.event.SyncEventPublisher;
import com.example.inboxsync.normalize.EventNormalizer;
import com.example.inboxsync.provider.ProviderClient;
import java.time.Instant;

/**
 * Wires the sync services by hand against an in-memory store, a local lock and mocked
 * platform, cache and event sink.
 */
class SyncTestFixture {

    static final String ACCOUNT_ID = "acc-1";
    static final String OWNER_PROVIDER_ID = "owner-urn";

    final SyncProperties properties = new SyncProperties();
    final InMemorySyncStore store;
    final ProviderClient providerClient = mock(ProviderClient.class);
    final AttachmentCacheStorage cacheStorage = mock(AttachmentCacheStorage.class);
    final SyncEventPublisher eventPublisher = mock(SyncEventPublisher.class);
    final EventNormalizer normalizer = new EventNormalizer();
    final LocalChatLockManager lockManager = new LocalChatLockManager(new RedisKeyFactory(properties));
    final AccountResolver accountResolver;
    final AttachmentFreshnessService freshnessService;
    final ParticipantSyncService participantSyncService;
    final MessageSyncService messageSyncService;
    final BackfillService backfillService;

    SyncTestFixture() {
        this(new InMemorySyncStore());
    }

    SyncTestFixture(InMemorySyncStore store) {
        this.store = store;
        this.accountResolver = new AccountResolver(store);
        this.freshnessService = new AttachmentFreshnessService(
                store, lockManager, providerClient, cacheStorage, new AttachmentKeyFactory(properties), properties);
        this.participantSyncService = new ParticipantSyncService(store, providerClient, normalizer, properties);
        this.messageSyncService = new MessageSyncService(
                store, lockManager, normalizer, accountResolver, participantSyncService, freshnessService, eventPublisher);
        this.backfillService = new BackfillService(
                store, providerClient, normalizer, lockManager, messageSyncService, participantSyncService, eventPublisher);
    }

    Account connectedAccount() {
        return store.saveAccount(Account.builder()
                .accountId(ACCOUNT_ID)
                .provider("linkedin")
                .providerUserId(OWNER_PROVIDER_ID)
                .status(AccountStatus.CONNECTED)
                .syncState(SyncState.IDLE)
                .createdAt(Instant.now())
                .build());
    }
}
