package com.example.inboxsync.domain;

public enum SyncState {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED
}
