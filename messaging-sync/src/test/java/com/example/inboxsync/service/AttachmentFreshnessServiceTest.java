package com.example.inboxsync.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.Attachment;
import com.example.inboxsync.domain.AttachmentKind;
import com.example.inboxsync.domain.AttachmentState;
import com.example.inboxsync.domain.Message;
import com.example.inboxsync.dto.AttachmentView;
import com.example.inboxsync.provider.AttachmentContent;
import com.example.inboxsync.provider.ProviderException;
import com.example.inboxsync.service.exception.SyncErrorType;
import com.example.inboxsync.service.exception.SyncException;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AttachmentFreshnessServiceTest {

    private static final byte[] BYTES = {10, 20, 30};

    private SyncTestFixture fixture;
    private Message message;

    @BeforeEach
    void setUp() {
        fixture = new SyncTestFixture();
        Account account = fixture.connectedAccount();
        message = fixture.store.upsertMessage(Message.builder()
                .accountId(account.getId())
                .externalId("msg-1")
                .chatId("chat-row")
                .externalChatId("C1")
                .createdAt(Instant.now())
                .build());
    }

    @Test
    void ensureAvailable_returnsCachedAttachmentUntouched() {
        Attachment cached = stored(Attachment.builder()
                .cacheUrl("https://cache.example.com/a.jpg")
                .sourceUrl("https://media.example.com/a.jpg")
                .sourceUrlExpiresAt(Instant.now().minusSeconds(3600)));

        Attachment result = fixture.freshnessService.ensureAvailable(cached);

        assertSame(cached, result);
        verifyNoInteractions(fixture.providerClient, fixture.cacheStorage);
    }

    @Test
    void ensureAvailable_returnsLiveAttachment_whenUrlOutsideSafetyMargin() {
        Attachment live = stored(Attachment.builder()
                .sourceUrl("https://media.example.com/a.jpg")
                .sourceUrlExpiresAt(Instant.now().plus(Duration.ofHours(1))));

        assertEquals(AttachmentState.LIVE, fixture.freshnessService.stateOf(live));
        assertSame(live, fixture.freshnessService.ensureAvailable(live));
        verifyNoInteractions(fixture.providerClient);
    }

    @Test
    void ensureAvailable_refreshesIntoCache_whenUrlInsideSafetyMargin() {
        Attachment expiring = stored(Attachment.builder()
                .filename("photo.jpg")
                .mimeType("image/jpeg")
                .sourceUrl("https://media.example.com/a.jpg")
                .sourceUrlExpiresAt(Instant.now().plus(Duration.ofMinutes(2))));
        when(fixture.providerClient.getAttachmentContent("msg-1", "att-1", SyncTestFixture.ACCOUNT_ID))
                .thenReturn(new AttachmentContent(BYTES, "image/jpeg"));
        when(fixture.cacheStorage.upload(anyString(), any(), any())).thenReturn("https://cache.example.com/new.jpg");

        Attachment result = fixture.freshnessService.ensureAvailable(expiring);

        assertEquals(AttachmentState.CACHED, fixture.freshnessService.stateOf(result));
        assertEquals("https://cache.example.com/new.jpg", result.getCacheUrl());
        assertTrue(result.getCacheKey().startsWith("attachments/" + message.getId() + "/"));
        assertTrue(result.getCacheKey().endsWith(".jpg"));
        assertNotNull(result.getCacheUploadedAt());
    }

    @Test
    void ensureAvailable_keepsContentInline_whenUploadFails() {
        Attachment unavailable = stored(Attachment.builder()
                .mimeType("image/png")
                .unavailable(true));
        when(fixture.providerClient.getAttachmentContent("msg-1", "att-1", SyncTestFixture.ACCOUNT_ID))
                .thenReturn(new AttachmentContent(BYTES, "image/png"));
        when(fixture.cacheStorage.upload(anyString(), any(), any()))
                .thenThrow(new AttachmentCacheException("bucket unreachable", null));

        Attachment result = fixture.freshnessService.ensureAvailable(unavailable);

        assertFalse(result.isUnavailable());
        assertEquals(Base64.getEncoder().encodeToString(BYTES), result.getContent());
        assertNull(result.getCacheUrl());
        assertNotNull(result.getCacheKey());
        assertEquals(result.getCacheKey(), fixture.store.findAttachmentById(result.getId()).orElseThrow().getCacheKey());
    }

    @Test
    void ensureAvailable_marksUnavailable_whenFetchFails() {
        Attachment expired = stored(Attachment.builder()
                .sourceUrl("https://media.example.com/a.jpg")
                .sourceUrlExpiresAt(Instant.now().minusSeconds(60)));
        when(fixture.providerClient.getAttachmentContent("msg-1", "att-1", SyncTestFixture.ACCOUNT_ID))
                .thenThrow(new ProviderException("gone", 404, null));

        Attachment result = fixture.freshnessService.ensureAvailable(expired);

        assertTrue(result.isUnavailable());
        assertTrue(fixture.store.findAttachmentById(expired.getId()).orElseThrow().isUnavailable());
        verify(fixture.cacheStorage, never()).upload(anyString(), any(), any());
    }

    @Test
    void ensureAvailable_returnsOriginal_whenMessageMissing() {
        Attachment orphan = Attachment.builder()
                .id("orphan")
                .messageId("no-such-message")
                .externalId("att-x")
                .unavailable(true)
                .build();

        Attachment result = fixture.freshnessService.ensureAvailable(orphan);

        assertSame(orphan, result);
        verifyNoInteractions(fixture.providerClient);
    }

    @Test
    void ensureAvailable_reusesCacheKey_onRetry() {
        Attachment retried = stored(Attachment.builder()
                .cacheKey("attachments/fixed/key.png")
                .content("AAAA")
                .sourceUrlExpiresAt(Instant.now().minusSeconds(10)));
        when(fixture.providerClient.getAttachmentContent("msg-1", "att-1", SyncTestFixture.ACCOUNT_ID))
                .thenReturn(new AttachmentContent(BYTES, "image/png"));
        when(fixture.cacheStorage.upload("attachments/fixed/key.png", BYTES, "image/png"))
                .thenReturn("https://cache.example.com/fixed/key.png");

        Attachment result = fixture.freshnessService.ensureAvailable(retried);

        assertEquals("https://cache.example.com/fixed/key.png", result.getCacheUrl());
        assertNull(result.getContent());
    }

    @Test
    void ensureAvailable_returnsStoredCacheEntry_whenCallerHoldsPreRefreshCopy() {
        Attachment expired = stored(Attachment.builder()
                .filename("photo.jpg")
                .mimeType("image/jpeg")
                .sourceUrl("https://media.example.com/a.jpg")
                .sourceUrlExpiresAt(Instant.now().minusSeconds(60)));
        when(fixture.providerClient.getAttachmentContent("msg-1", "att-1", SyncTestFixture.ACCOUNT_ID))
                .thenReturn(new AttachmentContent(BYTES, "image/jpeg"));
        when(fixture.cacheStorage.upload(anyString(), any(), any()))
                .thenReturn("https://cache.example.com/first.jpg", "https://cache.example.com/second.jpg");
        AttachmentView first = fixture.freshnessService.resolve(expired.getId());

        Attachment result = fixture.freshnessService.ensureAvailable(expired);

        assertEquals("https://cache.example.com/first.jpg", first.getUrl());
        assertEquals("https://cache.example.com/first.jpg", result.getCacheUrl());
        Attachment persisted = fixture.store.findAttachmentById(expired.getId()).orElseThrow();
        assertEquals("https://cache.example.com/first.jpg", persisted.getCacheUrl());
        assertEquals(result.getCacheKey(), persisted.getCacheKey());
        verify(fixture.cacheStorage, times(1)).upload(anyString(), any(), any());
        verify(fixture.providerClient, times(1)).getAttachmentContent("msg-1", "att-1", SyncTestFixture.ACCOUNT_ID);
    }

    @Test
    void resolve_returnsInlineContent_whenRefreshFailsButContentKept() {
        Attachment inline = stored(Attachment.builder()
                .cacheKey("attachments/k.bin")
                .content("AQID"));
        when(fixture.providerClient.getAttachmentContent("msg-1", "att-1", SyncTestFixture.ACCOUNT_ID))
                .thenThrow(new ProviderException("timeout", null));

        AttachmentView view = fixture.freshnessService.resolve(inline.getId());

        assertEquals(AttachmentView.Source.INLINE, view.getSource());
        assertEquals("AQID", view.getContent());
        assertNull(view.getUrl());
    }

    @Test
    void resolve_throwsNotFound_whenAttachmentUnknown() {
        SyncException ex = assertThrows(SyncException.class, () -> fixture.freshnessService.resolve("missing"));

        assertEquals(SyncErrorType.NOT_FOUND, ex.getType());
    }

    private Attachment stored(Attachment.AttachmentBuilder builder) {
        return fixture.store.upsertAttachment(builder
                .messageId(message.getId())
                .externalId("att-1")
                .kind(AttachmentKind.IMAGE)
                .createdAt(Instant.now())
                .build());
    }
}
