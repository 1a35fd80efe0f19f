package com.example.inboxsync.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.Contact;
import com.example.inboxsync.domain.ProfileView;
import com.example.inboxsync.dto.ProfileViewPayload;
import com.example.inboxsync.event.SyncEventType;
import com.example.inboxsync.service.exception.SyncErrorType;
import com.example.inboxsync.service.exception.SyncException;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProfileViewServiceTest {

    private SyncTestFixture fixture;
    private ProfileViewService service;
    private Account account;

    @BeforeEach
    void setUp() {
        fixture = new SyncTestFixture();
        service = new ProfileViewService(fixture.store, fixture.accountResolver,
                fixture.participantSyncService, fixture.normalizer, fixture.eventPublisher);
        account = fixture.connectedAccount();
    }

    @Test
    void recordView_storesViewAndUpsertsViewerContact() {
        ProfileViewPayload payload = ProfileViewPayload.builder()
                .accountId(SyncTestFixture.ACCOUNT_ID)
                .viewedAt("2024-05-01T09:30:00Z")
                .viewer(ProfileViewPayload.Viewer.builder()
                        .id("viewer-1")
                        .firstName("Grace")
                        .lastName("Hopper")
                        .headline("Rear Admiral")
                        .avatarUrl("https://img/grace.png")
                        .build())
                .build();

        ProfileView view = service.recordView(payload);

        assertEquals("viewer-1", view.getViewerExternalId());
        assertEquals("https://img/grace.png", view.getViewerImageUrl());
        assertEquals(Instant.parse("2024-05-01T09:30:00Z"), view.getViewedAt());
        assertEquals(1, fixture.store.profileViews.size());

        Contact contact = fixture.store.findContact(account.getId(), "viewer-1").orElseThrow();
        assertEquals("Grace Hopper", contact.getFullName());
        assertEquals("Rear Admiral", contact.getHeadline());
        assertEquals(Instant.parse("2024-05-01T09:30:00Z"), contact.getLastInteraction());
        verify(fixture.eventPublisher).publish(eq(SyncEventType.PROFILE_VIEWED), eq(SyncTestFixture.ACCOUNT_ID), isNull(), anyMap());
    }

    @Test
    void recordView_appendsEachView_evenFromSameViewer() {
        ProfileViewPayload payload = ProfileViewPayload.builder()
                .accountId(SyncTestFixture.ACCOUNT_ID)
                .viewer(ProfileViewPayload.Viewer.builder().id("viewer-1").name("Grace").build())
                .build();

        service.recordView(payload);
        service.recordView(payload);

        assertEquals(2, fixture.store.profileViews.size());
        assertEquals(1, fixture.store.contacts.size());
    }

    @Test
    void recordView_skipsContact_whenViewerIsAnonymous() {
        Instant before = Instant.now();

        ProfileView view = service.recordView(ProfileViewPayload.builder()
                .accountId(SyncTestFixture.ACCOUNT_ID)
                .build());

        assertNull(view.getViewerExternalId());
        assertNotNull(view.getViewedAt());
        assertFalse(view.getViewedAt().isBefore(before));
        assertTrue(fixture.store.contacts.isEmpty());
    }

    @Test
    void recordView_rejectsUnknownAccount() {
        ProfileViewPayload payload = ProfileViewPayload.builder().accountId("missing").build();

        SyncException ex = assertThrows(SyncException.class, () -> service.recordView(payload));

        assertEquals(SyncErrorType.NOT_FOUND, ex.getType());
        assertTrue(fixture.store.profileViews.isEmpty());
        verify(fixture.eventPublisher, never()).publish(eq(SyncEventType.PROFILE_VIEWED), eq("missing"), isNull(), anyMap());
    }
}
