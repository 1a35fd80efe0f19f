package com.example.inboxsync.persistence;

import com.example.inboxsync.domain.AccountStatus;
import com.example.inboxsync.domain.SyncState;
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
        name = "sync_accounts",
        uniqueConstraints = @UniqueConstraint(name = "uk_sync_accounts_account_id", columnNames = "account_id"),
        indexes = @Index(name = "idx_sync_accounts_sync_state", columnList = "sync_state"))
public class AccountEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "account_id", nullable = false, length = 128)
    private String accountId;

    @Column(name = "provider", length = 64)
    private String provider;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 32)
    private AccountStatus status;

    @Column(name = "owner_id", length = 128)
    private String ownerId;

    @Column(name = "provider_user_id", length = 128)
    private String providerUserId;

    @Column(name = "last_activity")
    private Instant lastActivity;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Enumerated(EnumType.STRING)
    @Column(name = "sync_state", length = 32)
    private SyncState syncState;

    @Column(name = "sync_started_at")
    private Instant syncStartedAt;

    @Column(name = "sync_completed_at")
    private Instant syncCompletedAt;

    @Column(name = "sync_error", columnDefinition = "text")
    private String syncError;

    @Column(name = "chats_synced", nullable = false)
    private int chatsSynced;

    @Column(name = "messages_synced", nullable = false)
    private int messagesSynced;

    @Column(name = "attendees_synced", nullable = false)
    private int attendeesSynced;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
