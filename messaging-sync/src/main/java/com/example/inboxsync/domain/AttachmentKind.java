package com.example.inboxsync.domain;

import java.util.Locale;
import org.springframework.util.StringUtils;

public enum AttachmentKind {
    IMAGE,
    VIDEO,
    AUDIO,
    FILE,
    LINKEDIN_POST,
    VIDEO_MEETING;

    public static AttachmentKind fromProvider(String value, String mimeType) {
        if (StringUtils.hasText(value)) {
            switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "img", "image", "photo":
                    return IMAGE;
                case "video":
                    return VIDEO;
                case "audio", "voice":
                    return AUDIO;
                case "linkedin_post":
                    return LINKEDIN_POST;
                case "video_meeting":
                    return VIDEO_MEETING;
                default:
                    break;
            }
        }
        if (StringUtils.hasText(mimeType)) {
            String mime = mimeType.toLowerCase(Locale.ROOT);
            if (mime.startsWith("image/")) {
                return IMAGE;
            }
            if (mime.startsWith("video/")) {
                return VIDEO;
            }
            if (mime.startsWith("audio/")) {
                return AUDIO;
            }
        }
        return FILE;
    }

    public MessageType messageType() {
        return switch (this) {
            case IMAGE -> MessageType.IMAGE;
            case VIDEO -> MessageType.VIDEO;
            case AUDIO -> MessageType.AUDIO;
            default -> MessageType.ATTACHMENT;
        };
    }
}
