package com.example.inboxsync.persistence;

import com.example.inboxsync.domain.AttachmentKind;
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
        name = "sync_attachments",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_sync_attachments_message_external", columnNames = {"message_id", "external_id"}))
public class AttachmentEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "message_id", nullable = false, length = 64)
    private String messageId;

    @Column(name = "external_id", nullable = false, length = 255)
    private String externalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", length = 32)
    private AttachmentKind kind;

    @Column(name = "filename", length = 512)
    private String filename;

    @Column(name = "mime_type", length = 128)
    private String mimeType;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "width")
    private Integer width;

    @Column(name = "height")
    private Integer height;

    @Column(name = "cache_url", columnDefinition = "text")
    private String cacheUrl;

    @Column(name = "cache_key", length = 512)
    private String cacheKey;

    @Column(name = "cache_uploaded_at")
    private Instant cacheUploadedAt;

    @Column(name = "source_url", columnDefinition = "text")
    private String sourceUrl;

    @Column(name = "source_url_expires_at")
    private Instant sourceUrlExpiresAt;

    @Column(name = "content", columnDefinition = "text")
    private String content;

    @Column(name = "unavailable", nullable = false)
    private boolean unavailable;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
