package com.example.inboxsync.normalize;

import com.example.inboxsync.domain.AttachmentKind;
import java.time.Instant;

public record NormalizedAttachment(
        String externalId,
        AttachmentKind kind,
        String filename,
        String mimeType,
        Long fileSize,
        Integer width,
        Integer height,
        String sourceUrl,
        Instant sourceUrlExpiresAt,
        boolean unavailable) {
}
