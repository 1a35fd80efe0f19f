package com.example.inboxsync.service;

import com.example.inboxsync.domain.SyncState;
import java.time.Instant;

public record BackfillReport(
        String accountId,
        SyncState outcome,
        int pagesFetched,
        int chatsSynced,
        int chatsFailed,
        int messagesSynced,
        int attendeesSynced,
        Instant startedAt,
        Instant completedAt,
        String error) {
}
