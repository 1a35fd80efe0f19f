package com.example.inboxsync.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.AccountStatus;
import com.example.inboxsync.domain.SyncState;
import com.example.inboxsync.dto.AccountLifecyclePayload;
import com.example.inboxsync.dto.AccountStatusPayload;
import com.example.inboxsync.event.SyncEventType;
import com.example.inboxsync.service.exception.SyncErrorType;
import com.example.inboxsync.service.exception.SyncException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AccountSyncServiceTest {

    private SyncTestFixture fixture;
    private BackfillScheduler backfillScheduler;
    private AccountSyncService service;

    @BeforeEach
    void setUp() {
        fixture = new SyncTestFixture();
        backfillScheduler = mock(BackfillScheduler.class);
        service = new AccountSyncService(fixture.store, backfillScheduler, fixture.eventPublisher, fixture.properties);
    }

    @Test
    void connect_createsAccountAndSchedulesBackfill_whenAccountIsNew() {
        Account account = service.connect(lifecycle("acc-9", null));

        assertEquals(AccountStatus.CONNECTED, account.getStatus());
        assertEquals("linkedin", account.getProvider());
        assertEquals(SyncState.IDLE, account.getSyncState());
        verify(backfillScheduler).schedule("acc-9");
        verify(fixture.eventPublisher).publish(eq(SyncEventType.ACCOUNT_STATUS_CHANGED), eq("acc-9"), isNull(), any());
    }

    @Test
    void connect_keepsAccount_whenBackfillExecutorRejectsRun() {
        when(backfillScheduler.schedule("acc-9")).thenThrow(new SyncException(
                SyncErrorType.TRANSIENT, "Backfill executor is saturated; retry later", "backfill_rejected"));

        Account account = service.connect(lifecycle("acc-9", null));

        assertEquals(AccountStatus.CONNECTED, account.getStatus());
        assertEquals(SyncState.IDLE, fixture.store.account("acc-9").getSyncState());
    }

    @Test
    void connect_doesNotRescheduleBackfill_whenAlreadyConnected() {
        service.connect(lifecycle("acc-9", "OK"));
        service.connect(lifecycle("acc-9", "OK"));

        verify(backfillScheduler, times(1)).schedule("acc-9");
    }

    @Test
    void connect_restoresDisconnectedAccount_andSchedulesBackfillAgain() {
        service.connect(lifecycle("acc-9", null));
        service.disconnect(lifecycle("acc-9", null));

        Account restored = service.connect(lifecycle("acc-9", "RECONNECTED"));

        assertFalse(restored.isDeleted());
        assertEquals(AccountStatus.CONNECTED, restored.getStatus());
        verify(backfillScheduler, times(2)).schedule("acc-9");
    }

    @Test
    void connect_skipsBackfill_whenStatusIsNotConnected() {
        Account account = service.connect(lifecycle("acc-9", "CREDENTIALS"));

        assertEquals(AccountStatus.ERROR, account.getStatus());
        verify(backfillScheduler, never()).schedule(anyString());
    }

    @Test
    void connect_rejectsPayload_withoutAccountId() {
        SyncException ex = assertThrows(SyncException.class, () -> service.connect(lifecycle(" ", null)));

        assertEquals(SyncErrorType.INVALID_EVENT, ex.getType());
    }

    @Test
    void updateStatus_mapsProviderStatus_andPublishesTransition() {
        service.connect(lifecycle("acc-9", null));

        Account updated = service.updateStatus(AccountStatusPayload.builder()
                .accountId("acc-9")
                .message("DISCONNECTED")
                .lastActivity("2024-05-01T08:00:00Z")
                .build());

        assertEquals(AccountStatus.DISCONNECTED, updated.getStatus());
        assertEquals("2024-05-01T08:00:00Z", updated.getLastActivity().toString());
        verify(fixture.eventPublisher, times(2))
                .publish(eq(SyncEventType.ACCOUNT_STATUS_CHANGED), eq("acc-9"), isNull(), any());
    }

    @Test
    void updateStatus_throwsNotFound_whenAccountUnknown() {
        SyncException ex = assertThrows(SyncException.class, () -> service.updateStatus(
                AccountStatusPayload.builder().accountId("ghost").status("OK").build()));

        assertEquals(SyncErrorType.NOT_FOUND, ex.getType());
    }

    @Test
    void disconnect_softDeletesAccount_andResolverRejectsIt() {
        service.connect(lifecycle("acc-9", null));

        Account disconnected = service.disconnect(lifecycle("acc-9", null));

        assertTrue(disconnected.isDeleted());
        assertEquals(AccountStatus.DISCONNECTED, disconnected.getStatus());
        SyncException ex = assertThrows(SyncException.class,
                () -> new AccountResolver(fixture.store).requireActiveAccount("acc-9"));
        assertEquals(SyncErrorType.NOT_FOUND, ex.getType());
    }

    private AccountLifecyclePayload lifecycle(String accountId, String status) {
        return AccountLifecyclePayload.builder()
                .accountId(accountId)
                .status(status)
                .providerUserId("owner-urn")
                .build();
    }
}
