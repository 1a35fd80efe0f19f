package com.example.inboxsync.persistence;

import com.example.inboxsync.domain.ChatType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "sync_chats",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_sync_chats_account_external", columnNames = {"account_id", "external_id"}))
public class ChatEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "external_id", nullable = false, length = 128)
    private String externalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", length = 16)
    private ChatType type;

    @Column(name = "name", length = 512)
    private String name;

    @Column(name = "last_message_at")
    private Instant lastMessageAt;

    @Column(name = "unread_count", nullable = false)
    private int unreadCount;

    @Column(name = "archived", nullable = false)
    private boolean archived;

    @Column(name = "read_only", nullable = false)
    private boolean readOnly;

    @Column(name = "content_type", length = 64)
    private String contentType;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
