package com.example.inboxsync.normalize;

import com.example.inboxsync.domain.ChatType;
import java.time.Instant;

/**
 * Chat fields as known at ingest time. Null counters and flags mean "not reported".
 */
public record NormalizedChat(
        String externalId,
        ChatType type,
        String name,
        Instant lastMessageAt,
        Integer unreadCount,
        Boolean archived,
        Boolean readOnly,
        String contentType) {

    public static NormalizedChat provisional(String externalId, ChatType type, String name, Instant lastMessageAt) {
        return new NormalizedChat(externalId, type, name, lastMessageAt, null, null, null, null);
    }
}
