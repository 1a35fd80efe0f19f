package com.example.inboxsync.domain;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.StringUtils;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Attachment implements Serializable {

    private String id;
    private String messageId;
    private String externalId;
    private AttachmentKind kind;
    private String filename;
    private String mimeType;
    private Long fileSize;
    private Integer width;
    private Integer height;

    private String cacheUrl;
    private String cacheKey;
    private Instant cacheUploadedAt;

    private String sourceUrl;
    private Instant sourceUrlExpiresAt;

    /** Base64 content kept inline when the durable cache upload failed. */
    private String content;
    private boolean unavailable;

    private Instant createdAt;
    private Instant updatedAt;

    public AttachmentState state(Instant now, Duration safetyMargin) {
        if (StringUtils.hasText(cacheUrl) && !unavailable) {
            return AttachmentState.CACHED;
        }
        if (unavailable || !StringUtils.hasText(sourceUrl)) {
            return AttachmentState.STALE_OR_MISSING;
        }
        if (sourceUrlExpiresAt == null) {
            return AttachmentState.LIVE;
        }
        Duration margin = safetyMargin != null ? safetyMargin : Duration.ZERO;
        return sourceUrlExpiresAt.minus(margin).isAfter(now)
                ? AttachmentState.LIVE
                : AttachmentState.STALE_OR_MISSING;
    }

    /**
     * Applies freshly delivered platform metadata. Cache fields are only ever set, never
     * cleared, so a cached attachment stays cached across re-deliveries.
     */
    public Attachment mergeFrom(Attachment incoming) {
        if (incoming == null) {
            return this;
        }
        boolean wasCached = StringUtils.hasText(cacheUrl) && !unavailable;
        if (incoming.getKind() != null) {
            kind = incoming.getKind();
        }
        if (StringUtils.hasText(incoming.getFilename())) {
            filename = incoming.getFilename();
        }
        if (StringUtils.hasText(incoming.getMimeType())) {
            mimeType = incoming.getMimeType();
        }
        if (incoming.getFileSize() != null) {
            fileSize = incoming.getFileSize();
        }
        if (incoming.getWidth() != null) {
            width = incoming.getWidth();
        }
        if (incoming.getHeight() != null) {
            height = incoming.getHeight();
        }
        if (StringUtils.hasText(incoming.getSourceUrl())) {
            sourceUrl = incoming.getSourceUrl();
            sourceUrlExpiresAt = incoming.getSourceUrlExpiresAt();
        }
        if (StringUtils.hasText(incoming.getCacheUrl())) {
            cacheUrl = incoming.getCacheUrl();
            cacheKey = incoming.getCacheKey();
            cacheUploadedAt = incoming.getCacheUploadedAt();
            content = null;
        } else if (StringUtils.hasText(incoming.getContent()) && !StringUtils.hasText(cacheUrl)) {
            content = incoming.getContent();
        }
        if (!StringUtils.hasText(cacheKey) && StringUtils.hasText(incoming.getCacheKey())) {
            cacheKey = incoming.getCacheKey();
        }
        unavailable = !wasCached && !StringUtils.hasText(incoming.getCacheUrl()) && incoming.isUnavailable();
        return this;
    }
}
