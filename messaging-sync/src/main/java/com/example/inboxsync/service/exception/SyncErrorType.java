package com.example.inboxsync.service.exception;

import org.springframework.http.HttpStatus;

public enum SyncErrorType {
    /** Addressing error (unknown account or message). Permanent, never retried. */
    NOT_FOUND(HttpStatus.NOT_FOUND),
    /** Provider, store or cache I/O failure. Handled locally or retried. */
    TRANSIENT(HttpStatus.SERVICE_UNAVAILABLE),
    /** Payload is missing data required to apply it. */
    INVALID_EVENT(HttpStatus.UNPROCESSABLE_ENTITY);

    private final HttpStatus status;

    SyncErrorType(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
