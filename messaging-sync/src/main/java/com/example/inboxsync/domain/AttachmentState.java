package com.example.inboxsync.domain;

public enum AttachmentState {
    /** Durable cache URL present and not flagged unavailable. Never re-checked. */
    CACHED,
    /** Platform URL present and outside the expiry safety window. */
    LIVE,
    STALE_OR_MISSING
}
