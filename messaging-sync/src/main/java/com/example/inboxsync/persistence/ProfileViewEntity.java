package com.example.inboxsync.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "sync_profile_views",
        indexes = @Index(name = "idx_sync_profile_views_account", columnList = "account_id, viewed_at"))
public class ProfileViewEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "viewer_external_id", length = 128)
    private String viewerExternalId;

    @Column(name = "viewer_name", length = 255)
    private String viewerName;

    @Column(name = "viewer_headline", columnDefinition = "text")
    private String viewerHeadline;

    @Column(name = "viewer_image_url", columnDefinition = "text")
    private String viewerImageUrl;

    @Column(name = "viewed_at", nullable = false)
    private Instant viewedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
