package com.example.inboxsync.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.Attachment;
import com.example.inboxsync.domain.Chat;
import com.example.inboxsync.domain.ChatType;
import com.example.inboxsync.domain.Message;
import com.example.inboxsync.domain.MessageType;
import com.example.inboxsync.dto.AttachmentView;
import com.example.inboxsync.dto.BulkSyncPayload;
import com.example.inboxsync.dto.MessageDeletedPayload;
import com.example.inboxsync.dto.MessageEditedPayload;
import com.example.inboxsync.dto.MessageReadPayload;
import com.example.inboxsync.dto.MessageReceivedPayload;
import com.example.inboxsync.dto.WebhookAttachmentPayload;
import com.example.inboxsync.dto.WebhookParticipantPayload;
import com.example.inboxsync.event.SyncEventType;
import com.example.inboxsync.provider.AttachmentContent;
import com.example.inboxsync.provider.ProviderException;
import com.example.inboxsync.provider.ProviderMessage;
import com.example.inboxsync.service.exception.SyncErrorType;
import com.example.inboxsync.service.exception.SyncException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MessageSyncServiceTest {

    private SyncTestFixture fixture;
    private Account account;

    @BeforeEach
    void setUp() {
        fixture = new SyncTestFixture();
        account = fixture.connectedAccount();
        when(fixture.providerClient.getAttachmentContent(anyString(), anyString(), anyString()))
                .thenThrow(new ProviderException("platform down", null));
    }

    @Test
    void applyMessageEvent_persistsChatContactMessageAndAttachment_forNewChat() {
        MessageReceivedPayload payload = incoming("msg-1", "C1", "S1", "Sam Sender", "");
        payload.setAttachments(List.of(WebhookAttachmentPayload.builder()
                .type("img")
                .contentUrl("https://media.example.com/c1/photo.jpg")
                .build()));

        Message message = fixture.messageSyncService.applyMessageEvent(payload);

        assertEquals(1, fixture.store.chats.size());
        Chat chat = fixture.store.findChat(account.getId(), "C1").orElseThrow();
        assertEquals("Sam Sender", chat.getName());
        assertEquals(ChatType.DIRECT, chat.getType());

        assertEquals(1, fixture.store.contacts.size());
        assertTrue(fixture.store.findContact(account.getId(), "S1").isPresent());
        assertTrue(fixture.store.findContact(account.getId(), SyncTestFixture.OWNER_PROVIDER_ID).isEmpty());

        assertEquals(MessageType.IMAGE, message.getMessageType());
        assertFalse(message.isOutgoing());

        List<Attachment> attachments = fixture.store.allAttachments();
        assertEquals(1, attachments.size());
        assertEquals("msg-1_0", attachments.get(0).getExternalId());
        AttachmentView view = fixture.freshnessService.resolve(attachments.get(0).getId());
        assertEquals("https://media.example.com/c1/photo.jpg", view.getUrl());
        assertEquals(AttachmentView.Source.PLATFORM, view.getSource());

        verify(fixture.eventPublisher).publish(eq(SyncEventType.MESSAGE_SYNCED), eq(SyncTestFixture.ACCOUNT_ID),
                eq("C1"), any());
    }

    @Test
    void applyMessageEvent_isIdempotent_whenSameEventDeliveredTwice() {
        MessageReceivedPayload payload = incoming("msg-1", "C1", "S1", "Sam Sender", "hello");
        payload.setAttachments(List.of(WebhookAttachmentPayload.builder()
                .id("att-1")
                .url("https://media.example.com/file.pdf")
                .mimeType("application/pdf")
                .build()));

        fixture.messageSyncService.applyMessageEvent(payload);
        fixture.messageSyncService.applyMessageEvent(payload);

        assertEquals(1, fixture.store.chats.size());
        assertEquals(1, fixture.store.messages.size());
        assertEquals(1, fixture.store.contacts.size());
        assertEquals(2, fixture.store.attendees.size());
        assertEquals(1, fixture.store.attachments.size());
        verify(fixture.providerClient, times(1)).getAttachmentContent("msg-1", "att-1", SyncTestFixture.ACCOUNT_ID);
    }

    @Test
    void applyMessageEvent_marksOutgoingAndRead_whenSenderIsAccountOwner() {
        MessageReceivedPayload payload = incoming("msg-2", "C1", SyncTestFixture.OWNER_PROVIDER_ID, "Me", "hi");
        payload.setAttendees(List.of(
                participant(SyncTestFixture.OWNER_PROVIDER_ID, "Me"),
                participant("S1", "Sam Sender")));

        Message message = fixture.messageSyncService.applyMessageEvent(payload);

        assertTrue(message.isOutgoing());
        assertTrue(message.isRead());
        assertEquals("Sam Sender", fixture.store.findChat(account.getId(), "C1").orElseThrow().getName());
        assertEquals(1, fixture.store.contacts.size());
    }

    @Test
    void applyMessageEvent_throwsNotFound_whenAccountUnknown() {
        MessageReceivedPayload payload = incoming("msg-1", "C1", "S1", "Sam", "hi");
        payload.setAccountId("missing");

        SyncException ex = assertThrows(SyncException.class,
                () -> fixture.messageSyncService.applyMessageEvent(payload));

        assertEquals(SyncErrorType.NOT_FOUND, ex.getType());
        assertTrue(fixture.store.messages.isEmpty());
    }

    @Test
    void applyMessageEvent_keepsTombstone_whenDeletedMessageRedelivered() {
        MessageReceivedPayload payload = incoming("msg-1", "C1", "S1", "Sam", "original");
        fixture.messageSyncService.applyMessageEvent(payload);
        fixture.messageSyncService.applyDelete(MessageDeletedPayload.builder()
                .accountId(SyncTestFixture.ACCOUNT_ID)
                .messageId("msg-1")
                .build());

        payload.setMessage("resurrected");
        Message result = fixture.messageSyncService.applyMessageEvent(payload);

        assertTrue(result.isDeleted());
        assertEquals("original", fixture.store.message(account.getId(), "msg-1").getContent());
    }

    @Test
    void markRead_neverUnreadsMessage_whenOlderStateRedelivered() {
        fixture.messageSyncService.applyMessageEvent(incoming("msg-1", "C1", "S1", "Sam", "hi"));

        fixture.messageSyncService.markRead(MessageReadPayload.builder()
                .accountId(SyncTestFixture.ACCOUNT_ID)
                .messageId("msg-1")
                .build());
        fixture.messageSyncService.applyMessageEvent(incoming("msg-1", "C1", "S1", "Sam", "hi"));

        assertTrue(fixture.store.message(account.getId(), "msg-1").isRead());
    }

    @Test
    void applyEdit_keepsEditedContent_whenOriginalRedelivered() {
        fixture.messageSyncService.applyMessageEvent(incoming("msg-1", "C1", "S1", "Sam", "first"));
        fixture.messageSyncService.applyEdit(MessageEditedPayload.builder()
                .accountId(SyncTestFixture.ACCOUNT_ID)
                .messageId("msg-1")
                .newContent("second")
                .editedAt("2024-05-01T10:00:00Z")
                .build());

        fixture.messageSyncService.applyMessageEvent(incoming("msg-1", "C1", "S1", "Sam", "first"));

        Message stored = fixture.store.message(account.getId(), "msg-1");
        assertEquals("second", stored.getContent());
        assertTrue(stored.isEdited());
        assertEquals("2024-05-01T10:00:00Z", stored.getEditedAt().toString());
    }

    @Test
    void applyEdit_ignoresChange_whenMessageDeleted() {
        fixture.messageSyncService.applyMessageEvent(incoming("msg-1", "C1", "S1", "Sam", "first"));
        fixture.messageSyncService.applyDelete(MessageDeletedPayload.builder()
                .accountId(SyncTestFixture.ACCOUNT_ID)
                .messageId("msg-1")
                .build());

        Message result = fixture.messageSyncService.applyEdit(MessageEditedPayload.builder()
                .accountId(SyncTestFixture.ACCOUNT_ID)
                .messageId("msg-1")
                .newContent("too late")
                .build());

        assertEquals("first", result.getContent());
        assertFalse(result.isEdited());
    }

    @Test
    void markRead_throwsNotFound_whenMessageUnknown() {
        SyncException ex = assertThrows(SyncException.class, () -> fixture.messageSyncService.markRead(
                MessageReadPayload.builder().accountId(SyncTestFixture.ACCOUNT_ID).messageId("nope").build()));

        assertEquals(SyncErrorType.NOT_FOUND, ex.getType());
    }

    @Test
    void applyMessageEvent_leavesCachedAttachmentCached_whenMetadataRedelivered() {
        MessageReceivedPayload payload = incoming("msg-1", "C1", "S1", "Sam", "");
        payload.setAttachments(List.of(WebhookAttachmentPayload.builder()
                .id("att-1")
                .type("image")
                .url("https://media.example.com/a.png")
                .build()));
        fixture.messageSyncService.applyMessageEvent(payload);
        Attachment stored = fixture.store.allAttachments().get(0);
        stored.setCacheUrl("https://cache.example.com/attachments/a.png");
        stored.setCacheKey("attachments/x/a.png");
        fixture.store.upsertAttachment(stored);

        payload.getAttachments().get(0).setUnavailable(true);
        fixture.messageSyncService.applyMessageEvent(payload);

        Attachment after = fixture.store.allAttachments().get(0);
        assertEquals("https://cache.example.com/attachments/a.png", after.getCacheUrl());
        assertFalse(after.isUnavailable());
    }

    @Test
    void applyMessageEvent_cachesNewAttachment_whenFetchAndUploadSucceed() {
        doReturn(new AttachmentContent(new byte[] {1, 2, 3}, "image/png"))
                .when(fixture.providerClient).getAttachmentContent("msg-1", "att-1", SyncTestFixture.ACCOUNT_ID);
        when(fixture.cacheStorage.upload(anyString(), any(), eq("image/png")))
                .thenReturn("https://cache.example.com/attachments/msg/abc.png");
        MessageReceivedPayload payload = incoming("msg-1", "C1", "S1", "Sam", "");
        payload.setAttachments(List.of(WebhookAttachmentPayload.builder()
                .id("att-1")
                .mimeType("image/png")
                .url("https://media.example.com/a.png")
                .build()));

        fixture.messageSyncService.applyMessageEvent(payload);

        Attachment stored = fixture.store.allAttachments().get(0);
        assertEquals("https://cache.example.com/attachments/msg/abc.png", stored.getCacheUrl());
        assertNull(stored.getContent());
        assertTrue(stored.getCacheKey().endsWith(".png"));
    }

    @Test
    void applyMessageEvent_skipsIngestCaching_whenPlatformFlagsUnavailable() {
        MessageReceivedPayload payload = incoming("msg-1", "C1", "S1", "Sam", "");
        payload.setAttachments(List.of(WebhookAttachmentPayload.builder().id("att-1").unavailable(true).build()));

        fixture.messageSyncService.applyMessageEvent(payload);

        assertTrue(fixture.store.allAttachments().get(0).isUnavailable());
        verify(fixture.providerClient, never()).getAttachmentContent(anyString(), anyString(), anyString());
    }

    @Test
    void applyBulkSync_appliesValidItems_whenOneItemIsMalformed() {
        BulkSyncPayload payload = BulkSyncPayload.builder()
                .accountId(SyncTestFixture.ACCOUNT_ID)
                .messages(List.of(
                        ProviderMessage.builder().id("m-1").chatId("C1").text("one").senderId("S1").build(),
                        ProviderMessage.builder().id("m-2").text("no chat").build(),
                        ProviderMessage.builder().id("m-3").chatId("C2").text("three").isSender(true).build()))
                .build();

        int applied = fixture.messageSyncService.applyBulkSync(payload);

        assertEquals(2, applied);
        assertEquals(2, fixture.store.messages.size());
        assertTrue(fixture.store.message(account.getId(), "m-3").isRead());
    }

    @Test
    void applyMessageEvent_keepsMessageAndSiblingAttachment_whenOneAttachmentFailsToPersist() {
        InMemorySyncStore failingStore = new InMemorySyncStore() {
            @Override
            public Attachment upsertAttachment(Attachment attachment) {
                if ("att-bad".equals(attachment.getExternalId())) {
                    throw new IllegalStateException("constraint violation");
                }
                return super.upsertAttachment(attachment);
            }
        };
        SyncTestFixture isolated = new SyncTestFixture(failingStore);
        isolated.connectedAccount();
        when(isolated.providerClient.getAttachmentContent(anyString(), anyString(), anyString()))
                .thenThrow(new ProviderException("platform down", null));
        MessageReceivedPayload payload = incoming("msg-1", "C1", "S1", "Sam Sender", "two files");
        payload.setAttachments(List.of(
                WebhookAttachmentPayload.builder()
                        .id("att-bad")
                        .type("img")
                        .contentUrl("https://media.example.com/c1/bad.jpg")
                        .build(),
                WebhookAttachmentPayload.builder()
                        .id("att-good")
                        .type("file")
                        .filename("report.pdf")
                        .contentUrl("https://media.example.com/c1/report.pdf")
                        .build()));

        Message message = isolated.messageSyncService.applyMessageEvent(payload);

        Message stored = failingStore.message(message.getAccountId(), "msg-1");
        assertEquals("two files", stored.getContent());
        List<Attachment> attachments = failingStore.allAttachments();
        assertEquals(1, attachments.size());
        assertEquals("att-good", attachments.get(0).getExternalId());
        assertEquals("report.pdf", attachments.get(0).getFilename());
        verify(isolated.eventPublisher).publish(eq(SyncEventType.MESSAGE_SYNCED), eq(SyncTestFixture.ACCOUNT_ID),
                eq("C1"), any());
    }

    private MessageReceivedPayload incoming(
            String messageId, String chatId, String senderId, String senderName, String text) {
        return MessageReceivedPayload.builder()
                .accountId(SyncTestFixture.ACCOUNT_ID)
                .accountInfo(new MessageReceivedPayload.AccountInfo("LINKEDIN", "classic", SyncTestFixture.OWNER_PROVIDER_ID))
                .chatId(chatId)
                .messageId(messageId)
                .message(text)
                .timestamp("2024-05-01T09:00:00Z")
                .sender(participant(senderId, senderName))
                .attendees(List.of(participant(SyncTestFixture.OWNER_PROVIDER_ID, "Me")))
                .build();
    }

    private WebhookParticipantPayload participant(String providerId, String name) {
        return WebhookParticipantPayload.builder()
                .attendeeId("att-" + providerId)
                .attendeeProviderId(providerId)
                .attendeeName(name)
                .build();
    }
}
