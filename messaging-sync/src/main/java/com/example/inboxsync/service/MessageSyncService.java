package com.example.inboxsync.service;

import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.Attachment;
import com.example.inboxsync.domain.Chat;
import com.example.inboxsync.domain.Message;
import com.example.inboxsync.dto.BulkSyncPayload;
import com.example.inboxsync.dto.MessageDeletedPayload;
import com.example.inboxsync.dto.MessageEditedPayload;
import com.example.inboxsync.dto.MessageReadPayload;
import com.example.inboxsync.dto.MessageReceivedPayload;
import com.example.inboxsync.event.SyncEventPublisher;
import com.example.inboxsync.event.SyncEventType;
import com.example.inboxsync.normalize.EventNormalizer;
import com.example.inboxsync.normalize.FieldResolver;
import com.example.inboxsync.normalize.NormalizedAttachment;
import com.example.inboxsync.normalize.NormalizedChat;
import com.example.inboxsync.normalize.NormalizedMessage;
import com.example.inboxsync.provider.ProviderMessage;
import com.example.inboxsync.service.exception.SyncException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

/**
 * Applies messages and message state changes. Everything touching a chat runs under that
 * chat's lock, in the order chat, attendees and contacts, message, attachments, so a row is
 * never written before the rows it references.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageSyncService {

    private final SyncStore store;
    private final ChatLockManager lockManager;
    private final EventNormalizer normalizer;
    private final AccountResolver accountResolver;
    private final ParticipantSyncService participantSyncService;
    private final AttachmentFreshnessService attachmentFreshnessService;
    private final SyncEventPublisher eventPublisher;

    public Message applyMessageEvent(MessageReceivedPayload payload) {
        if (payload == null) {
            throw SyncException.invalidEvent("Message event without payload");
        }
        Account account = accountResolver.requireActiveAccount(payload.getAccountId());
        NormalizedMessage normalized = normalizer.normalize(payload);
        Message message = apply(account, normalized);
        eventPublisher.publish(SyncEventType.MESSAGE_SYNCED, account.getAccountId(), normalized.chatExternalId(),
                Map.of("messageId", message.getExternalId(), "outgoing", message.isOutgoing()));
        return message;
    }

    /**
     * Applies a batch of platform messages. Items are independent: one bad item is logged and
     * skipped.
     *
     * @return number of messages applied
     */
    public int applyBulkSync(BulkSyncPayload payload) {
        if (payload == null) {
            throw SyncException.invalidEvent("Bulk sync event without payload");
        }
        Account account = accountResolver.requireActiveAccount(payload.getAccountId());
        if (CollectionUtils.isEmpty(payload.getMessages())) {
            return 0;
        }
        int applied = 0;
        for (ProviderMessage item : payload.getMessages()) {
            try {
                apply(account, normalizer.normalize(item, null));
                applied++;
            } catch (RuntimeException ex) {
                log.warn("Skipping bulk-synced message {} for account {}",
                        item != null ? item.getId() : null, account.getAccountId(), ex);
            }
        }
        log.info("Bulk sync applied {}/{} messages for account {}", applied, payload.getMessages().size(),
                account.getAccountId());
        return applied;
    }

    /**
     * Idempotently applies one normalized message under its chat's lock.
     */
    public Message apply(Account account, NormalizedMessage normalized) {
        return lockManager.withChatLock(account.getId(), normalized.chatExternalId(), () -> {
            Chat chat = ensureChat(account, normalized.chat());
            participantSyncService.syncParticipants(account, chat, normalized.participants(), normalized.sentAt());
            Message message = upsertMessage(account, chat, normalized);
            if (!message.isDeleted()) {
                applyAttachments(account, message, normalized);
            }
            return message;
        });
    }

    /**
     * Writes authoritative chat data, as listed by the platform. Callers hold the chat lock.
     */
    public Chat upsertChat(Account account, NormalizedChat normalized) {
        Instant now = Instant.now();
        Chat chat = store.findChat(account.getId(), normalized.externalId())
                .orElseGet(() -> newChat(account, normalized, now));
        if (normalized.type() != null) {
            chat.setType(normalized.type());
        }
        if (StringUtils.hasText(normalized.name())) {
            chat.setName(normalized.name());
        }
        advanceLastMessage(chat, normalized.lastMessageAt());
        if (normalized.unreadCount() != null) {
            chat.setUnreadCount(normalized.unreadCount());
        }
        if (normalized.archived() != null) {
            chat.setArchived(normalized.archived());
        }
        if (normalized.readOnly() != null) {
            chat.setReadOnly(normalized.readOnly());
        }
        if (StringUtils.hasText(normalized.contentType())) {
            chat.setContentType(normalized.contentType());
        }
        chat.setUpdatedAt(now);
        return store.upsertChat(chat);
    }

    public Message markRead(MessageReadPayload payload) {
        Account account = accountResolver.requireActiveAccount(payload.getAccountId());
        return updateMessage(account, payload.getMessageId(), message -> message.setRead(true), Message::isRead);
    }

    public Message applyEdit(MessageEditedPayload payload) {
        Account account = accountResolver.requireActiveAccount(payload.getAccountId());
        Instant editedAt = Objects.requireNonNullElseGet(FieldResolver.parseInstant(payload.getEditedAt()), Instant::now);
        return updateMessage(account, payload.getMessageId(), message -> {
            message.setContent(payload.getNewContent());
            message.setEdited(true);
            message.setEditedAt(editedAt);
        }, message -> message.isEdited() && Objects.equals(message.getContent(), payload.getNewContent()));
    }

    public Message applyDelete(MessageDeletedPayload payload) {
        Account account = accountResolver.requireActiveAccount(payload.getAccountId());
        Instant deletedAt = Objects.requireNonNullElseGet(FieldResolver.parseInstant(payload.getDeletedAt()), Instant::now);
        return updateMessage(account, payload.getMessageId(), message -> {
            message.setDeleted(true);
            message.setDeletedAt(deletedAt);
        }, message -> false);
    }

    private Message updateMessage(
            Account account,
            String messageExternalId,
            Consumer<Message> change,
            Predicate<Message> alreadyApplied) {
        if (!StringUtils.hasText(messageExternalId)) {
            throw SyncException.invalidEvent("message_id is required");
        }
        Message located = findMessageOrThrow(account, messageExternalId);
        return lockManager.withChatLock(account.getId(), located.getExternalChatId(), () -> {
            Message current = findMessageOrThrow(account, messageExternalId);
            if (current.isDeleted()) {
                log.debug("Message {} is deleted; ignoring update", messageExternalId);
                return current;
            }
            if (alreadyApplied.test(current)) {
                return current;
            }
            change.accept(current);
            current.setUpdatedAt(Instant.now());
            Message saved = store.upsertMessage(current);
            eventPublisher.publish(SyncEventType.MESSAGE_UPDATED, account.getAccountId(), saved.getExternalChatId(),
                    Map.of("messageId", saved.getExternalId(),
                            "read", saved.isRead(),
                            "edited", saved.isEdited(),
                            "deleted", saved.isDeleted()));
            return saved;
        });
    }

    private Message findMessageOrThrow(Account account, String messageExternalId) {
        return store.findMessage(account.getId(), messageExternalId)
                .orElseThrow(() -> SyncException.notFound("Message not found: " + messageExternalId));
    }

    private Chat ensureChat(Account account, NormalizedChat normalized) {
        Optional<Chat> existing = store.findChat(account.getId(), normalized.externalId());
        Instant now = Instant.now();
        if (existing.isEmpty()) {
            log.debug("Creating chat {} for account {}", normalized.externalId(), account.getAccountId());
            return store.upsertChat(newChat(account, normalized, now));
        }
        Chat chat = existing.get();
        boolean changed = advanceLastMessage(chat, normalized.lastMessageAt());
        if (!StringUtils.hasText(chat.getName()) && StringUtils.hasText(normalized.name())) {
            chat.setName(normalized.name());
            changed = true;
        }
        if (!changed) {
            return chat;
        }
        chat.setUpdatedAt(now);
        return store.upsertChat(chat);
    }

    private Chat newChat(Account account, NormalizedChat normalized, Instant now) {
        return Chat.builder()
                .id(UUID.randomUUID().toString())
                .accountId(account.getId())
                .externalId(normalized.externalId())
                .type(normalized.type())
                .name(normalized.name())
                .lastMessageAt(normalized.lastMessageAt())
                .unreadCount(normalized.unreadCount() != null ? normalized.unreadCount() : 0)
                .archived(Boolean.TRUE.equals(normalized.archived()))
                .readOnly(Boolean.TRUE.equals(normalized.readOnly()))
                .contentType(normalized.contentType())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private boolean advanceLastMessage(Chat chat, Instant candidate) {
        if (candidate != null && (chat.getLastMessageAt() == null || candidate.isAfter(chat.getLastMessageAt()))) {
            chat.setLastMessageAt(candidate);
            return true;
        }
        return false;
    }

    private Message upsertMessage(Account account, Chat chat, NormalizedMessage normalized) {
        Instant now = Instant.now();
        Optional<Message> existing = store.findMessage(account.getId(), normalized.externalId());
        if (existing.isPresent() && existing.get().isDeleted()) {
            log.debug("Message {} is deleted; keeping tombstone", normalized.externalId());
            return existing.get();
        }
        Message message = existing.orElseGet(() -> Message.builder()
                .id(UUID.randomUUID().toString())
                .accountId(account.getId())
                .externalId(normalized.externalId())
                .createdAt(now)
                .build());
        message.setChatId(chat.getId());
        message.setExternalChatId(chat.getExternalId());
        if (StringUtils.hasText(normalized.senderExternalId())) {
            message.setSenderId(normalized.senderExternalId());
        }
        if (!message.isEdited() || normalized.edited()) {
            message.setContent(normalized.content());
        }
        message.setMessageType(normalized.messageType());
        if (StringUtils.hasText(normalized.subject())) {
            message.setSubject(normalized.subject());
        }
        message.setSentAt(normalized.sentAt());
        message.setOutgoing(normalized.outgoing());
        message.setEvent(normalized.event());
        message.setRead(message.isRead() || normalized.read());
        message.setEdited(message.isEdited() || normalized.edited());
        message.setMetadata(mergeMetadata(message.getMetadata(), normalized.metadata()));
        if (normalized.deleted()) {
            message.setDeleted(true);
            message.setDeletedAt(now);
        }
        message.setUpdatedAt(now);
        return store.upsertMessage(message);
    }

    private Map<String, Object> mergeMetadata(Map<String, Object> current, Map<String, Object> incoming) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (current != null) {
            merged.putAll(current);
        }
        merged.putAll(incoming);
        return merged;
    }

    private void applyAttachments(Account account, Message message, NormalizedMessage normalized) {
        for (NormalizedAttachment attachment : normalized.attachments()) {
            try {
                applyAttachment(account, message, attachment);
            } catch (RuntimeException ex) {
                log.warn("Failed to apply attachment {} of message {}", attachment.externalId(), message.getExternalId(), ex);
            }
        }
    }

    private void applyAttachment(Account account, Message message, NormalizedAttachment normalized) {
        Instant now = Instant.now();
        Attachment incoming = Attachment.builder()
                .kind(normalized.kind())
                .filename(normalized.filename())
                .mimeType(normalized.mimeType())
                .fileSize(normalized.fileSize())
                .width(normalized.width())
                .height(normalized.height())
                .sourceUrl(normalized.sourceUrl())
                .sourceUrlExpiresAt(normalized.sourceUrlExpiresAt())
                .unavailable(normalized.unavailable())
                .build();
        Optional<Attachment> existing = store.findAttachment(message.getId(), normalized.externalId());
        Attachment attachment = existing
                .map(stored -> stored.mergeFrom(incoming))
                .orElseGet(() -> incoming.toBuilder()
                        .id(UUID.randomUUID().toString())
                        .messageId(message.getId())
                        .externalId(normalized.externalId())
                        .createdAt(now)
                        .build());
        attachment.setUpdatedAt(now);
        Attachment saved = store.upsertAttachment(attachment);
        if (existing.isEmpty()) {
            attachmentFreshnessService.cacheOnIngest(account, message, saved);
        }
    }
}
