package com.example.inboxsync.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.Chat;
import com.example.inboxsync.domain.ChatType;
import com.example.inboxsync.dto.MessageReceivedPayload;
import com.example.inboxsync.dto.SimulatedMessageRequest;
import com.example.inboxsync.service.exception.SyncErrorType;
import com.example.inboxsync.service.exception.SyncException;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class DevTriggerServiceTest {

    private SyncTestFixture fixture;
    private WebhookDispatcher dispatcher;
    private DevTriggerService service;
    private Account account;

    @BeforeEach
    void setUp() {
        fixture = new SyncTestFixture();
        dispatcher = mock(WebhookDispatcher.class);
        service = new DevTriggerService(fixture.store, fixture.accountResolver, dispatcher);
        account = fixture.connectedAccount();
    }

    @Test
    void simulateIncoming_dispatchesNumberedMessagesIntoChat() {
        storeChat("chat-1");
        when(dispatcher.dispatch(eq("message_received"), any())).thenReturn(true);

        DevTriggerService.SimulationResult result =
                service.simulateIncoming(new SimulatedMessageRequest(SyncTestFixture.ACCOUNT_ID, "chat-1", "Hello", 2));

        ArgumentCaptor<Object> payloads = ArgumentCaptor.forClass(Object.class);
        verify(dispatcher, times(2)).dispatch(eq("message_received"), payloads.capture());
        MessageReceivedPayload first = (MessageReceivedPayload) payloads.getAllValues().get(0);
        assertEquals("chat-1", first.getChatId());
        assertEquals("Hello #1", first.getMessage());
        assertEquals(SyncTestFixture.ACCOUNT_ID, first.getAccountId());
        assertTrue(first.getMessageId().startsWith("sim-"));

        assertEquals("chat-1", result.chatId());
        assertEquals(2, result.messageIds().size());
        assertEquals(2, result.dispatched());
        assertEquals(0, result.failed());
    }

    @Test
    void simulateIncoming_reportsUndeliveredMessages() {
        storeChat("chat-1");
        when(dispatcher.dispatch(eq("message_received"), any())).thenReturn(true, false, false);

        DevTriggerService.SimulationResult result =
                service.simulateIncoming(new SimulatedMessageRequest(SyncTestFixture.ACCOUNT_ID, null, null, 3));

        assertEquals(1, result.dispatched());
        assertEquals(2, result.failed());
    }

    @Test
    void simulateIncoming_rejectsUnknownChat() {
        storeChat("chat-1");

        SyncException ex = assertThrows(SyncException.class, () -> service.simulateIncoming(
                new SimulatedMessageRequest(SyncTestFixture.ACCOUNT_ID, "chat-404", "Hi", 1)));

        assertEquals(SyncErrorType.NOT_FOUND, ex.getType());
        verify(dispatcher, never()).dispatch(any(), any());
    }

    @Test
    void simulateIncoming_rejectsAccountWithoutChats() {
        SyncException ex = assertThrows(SyncException.class, () -> service.simulateIncoming(
                new SimulatedMessageRequest(SyncTestFixture.ACCOUNT_ID, null, "Hi", 1)));

        assertEquals(SyncErrorType.NOT_FOUND, ex.getType());
        assertTrue(fixture.store.findChats(account.getId()).isEmpty());
    }

    private void storeChat(String externalId) {
        fixture.store.upsertChat(Chat.builder()
                .accountId(account.getId())
                .externalId(externalId)
                .type(ChatType.DIRECT)
                .createdAt(Instant.now())
                .build());
    }
}
