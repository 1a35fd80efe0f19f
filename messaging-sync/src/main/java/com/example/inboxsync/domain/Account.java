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
public class Account implements Serializable {

    private String id;
    private String accountId;
    private String provider;
    private AccountStatus status;
    private String ownerId;
    private String providerUserId;
    private Instant lastActivity;
    private boolean deleted;

    private SyncState syncState;
    private Instant syncStartedAt;
    private Instant syncCompletedAt;
    private String syncError;
    private int chatsSynced;
    private int messagesSynced;
    private int attendeesSynced;

    private Instant createdAt;
    private Instant updatedAt;

    public boolean isSyncRunning() {
        return syncState == SyncState.RUNNING;
    }
}
