package com.example.inboxsync.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message implements Serializable {

    private String id;
    private String accountId;
    private String externalId;
    private String chatId;
    private String externalChatId;
    private String senderId;
    private MessageType messageType;
    private String content;
    private String subject;
    private boolean read;
    private boolean outgoing;
    private boolean event;
    private Instant sentAt;
    private Map<String, Object> metadata;
    private boolean edited;
    private Instant editedAt;
    private boolean deleted;
    private Instant deletedAt;
    private Instant createdAt;
    private Instant updatedAt;
}
