package com.example.inboxsync.event;

public enum SyncEventType {
    MESSAGE_SYNCED,
    MESSAGE_UPDATED,
    ACCOUNT_STATUS_CHANGED,
    BACKFILL_STARTED,
    BACKFILL_COMPLETED,
    BACKFILL_FAILED,
    PROFILE_VIEWED
}
