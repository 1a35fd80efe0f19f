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
public class Attendee implements Serializable {

    private String id;
    private String chatId;
    private String externalId;
    /** Null for the account owner, who is never stored as a contact. */
    private String contactId;
    private String displayName;
    private boolean self;
    private boolean hidden;
    private Instant createdAt;
    private Instant updatedAt;
}
