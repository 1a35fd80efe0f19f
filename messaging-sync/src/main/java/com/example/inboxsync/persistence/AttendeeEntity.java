package com.example.inboxsync.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
        name = "sync_attendees",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_sync_attendees_chat_external", columnNames = {"chat_id", "external_id"}))
public class AttendeeEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "chat_id", nullable = false, length = 64)
    private String chatId;

    @Column(name = "external_id", nullable = false, length = 128)
    private String externalId;

    @Column(name = "contact_id", length = 64)
    private String contactId;

    @Column(name = "display_name", length = 255)
    private String displayName;

    @Column(name = "is_self", nullable = false)
    private boolean self;

    @Column(name = "hidden", nullable = false)
    private boolean hidden;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
