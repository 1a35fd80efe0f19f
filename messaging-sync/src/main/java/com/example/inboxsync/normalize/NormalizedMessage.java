package com.example.inboxsync.normalize;

import com.example.inboxsync.domain.MessageType;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record NormalizedMessage(
        String externalId,
        NormalizedChat chat,
        String senderExternalId,
        String content,
        String subject,
        MessageType messageType,
        Instant sentAt,
        boolean read,
        boolean outgoing,
        boolean event,
        boolean edited,
        boolean deleted,
        Map<String, Object> metadata,
        List<NormalizedParticipant> participants,
        List<NormalizedAttachment> attachments) {

    public NormalizedMessage {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        participants = participants != null ? List.copyOf(participants) : List.of();
        attachments = attachments != null ? List.copyOf(attachments) : List.of();
    }

    public String chatExternalId() {
        return chat.externalId();
    }
}
