package com.example.inboxsync.service;

import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.Chat;
import com.example.inboxsync.domain.ChatType;
import com.example.inboxsync.dto.MessageReceivedPayload;
import com.example.inboxsync.dto.SimulatedMessageRequest;
import com.example.inboxsync.dto.WebhookParticipantPayload;
import com.example.inboxsync.service.exception.SyncException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Fabricates incoming-message webhooks for a stored chat and sends them through the
 * dispatcher, so the full inbound path can be exercised without the platform.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "sync.simulation", name = "enabled", havingValue = "true")
public class DevTriggerService {

    static final String EVENT_NAME = "message_received";
    static final String SIMULATED_SENDER_ID = "simulated-sender";

    private final SyncStore store;
    private final AccountResolver accountResolver;
    private final WebhookDispatcher dispatcher;

    public record SimulationResult(String accountId, String chatId, List<String> messageIds, int dispatched, int failed) {
    }

    public SimulationResult simulateIncoming(SimulatedMessageRequest request) {
        Account account = accountResolver.requireActiveAccount(request.getAccountId());
        Chat chat = resolveChat(account, request.getChatId());
        int count = Math.max(1, request.getCount());

        List<String> messageIds = new ArrayList<>(count);
        int dispatched = 0;
        for (int i = 0; i < count; i++) {
            MessageReceivedPayload payload = buildPayload(account, chat, request.getText(), i, count);
            messageIds.add(payload.getMessageId());
            if (dispatcher.dispatch(EVENT_NAME, payload)) {
                dispatched++;
            }
        }
        int failed = count - dispatched;
        if (failed > 0) {
            log.warn("Simulated {} messages for chat {}; {} could not be dispatched", count, chat.getExternalId(), failed);
        } else {
            log.info("Simulated {} messages for chat {}", count, chat.getExternalId());
        }
        return new SimulationResult(account.getAccountId(), chat.getExternalId(), List.copyOf(messageIds), dispatched, failed);
    }

    private Chat resolveChat(Account account, String chatExternalId) {
        if (StringUtils.hasText(chatExternalId)) {
            return store.findChat(account.getId(), chatExternalId)
                    .orElseThrow(() -> SyncException.notFound("Chat not found: " + chatExternalId));
        }
        List<Chat> chats = store.findChats(account.getId());
        if (chats.isEmpty()) {
            throw SyncException.notFound("Account " + account.getAccountId() + " has no chats to simulate into");
        }
        return chats.get(ThreadLocalRandom.current().nextInt(chats.size()));
    }

    private MessageReceivedPayload buildPayload(Account account, Chat chat, String text, int index, int count) {
        String body = StringUtils.hasText(text) ? text : "Simulated message";
        if (count > 1) {
            body = body + " #" + (index + 1);
        }
        WebhookParticipantPayload sender = WebhookParticipantPayload.builder()
                .attendeeId(SIMULATED_SENDER_ID)
                .attendeeProviderId(SIMULATED_SENDER_ID)
                .attendeeName("Simulated Sender")
                .build();
        return MessageReceivedPayload.builder()
                .accountId(account.getAccountId())
                .accountType(account.getProvider())
                .accountInfo(new MessageReceivedPayload.AccountInfo(
                        account.getProvider(), "classic", account.getProviderUserId()))
                .event(EVENT_NAME)
                .chatId(chat.getExternalId())
                .messageId("sim-" + UUID.randomUUID())
                .message(body)
                .timestamp(Instant.now().toString())
                .isGroup(chat.getType() == ChatType.GROUP)
                .sender(sender)
                .attendees(List.of(sender))
                .build();
    }
}
