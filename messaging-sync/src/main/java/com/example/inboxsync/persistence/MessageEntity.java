package com.example.inboxsync.persistence;

import com.example.inboxsync.domain.MessageType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "sync_messages",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_sync_messages_account_external", columnNames = {"account_id", "external_id"}),
        indexes = @Index(name = "idx_sync_messages_chat_sent", columnList = "chat_id, sent_at"))
public class MessageEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "external_id", nullable = false, length = 128)
    private String externalId;

    @Column(name = "chat_id", nullable = false, length = 64)
    private String chatId;

    @Column(name = "external_chat_id", length = 128)
    private String externalChatId;

    @Column(name = "sender_id", length = 128)
    private String senderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "message_type", length = 16)
    private MessageType messageType;

    @Column(name = "content", columnDefinition = "text")
    private String content;

    @Column(name = "subject", columnDefinition = "text")
    private String subject;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "outgoing", nullable = false)
    private boolean outgoing;

    @Column(name = "is_event", nullable = false)
    private boolean event;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Column(name = "metadata", columnDefinition = "text")
    private String metadata;

    @Column(name = "edited", nullable = false)
    private boolean edited;

    @Column(name = "edited_at")
    private Instant editedAt;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
