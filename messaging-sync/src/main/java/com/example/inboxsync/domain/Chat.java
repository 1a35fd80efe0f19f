package com.example.inboxsync.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Chat implements Serializable {

    private String id;
    /** Internal id of the owning account. */
    private String accountId;
    private String externalId;
    private ChatType type;
    private String name;
    private Instant lastMessageAt;
    private int unreadCount;
    private boolean archived;
    private boolean readOnly;
    private String contentType;
    private Instant createdAt;
    private Instant updatedAt;
}
