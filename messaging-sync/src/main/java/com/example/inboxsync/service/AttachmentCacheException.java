package com.example.inboxsync.service;

import com.example.inboxsync.service.exception.SyncErrorType;
import com.example.inboxsync.service.exception.SyncException;

public class AttachmentCacheException extends SyncException {

    public AttachmentCacheException(String message, Throwable cause) {
        super(SyncErrorType.TRANSIENT, message, "cache_upload_failed", cause);
    }
}
