package com.example.inboxsync.service.exception;

import org.springframework.http.HttpStatus;

public class SyncException extends RuntimeException {

    private final SyncErrorType type;
    private final String errorCode;

    public SyncException(SyncErrorType type, String message) {
        this(type, message, null, null);
    }

    public SyncException(SyncErrorType type, String message, Throwable cause) {
        this(type, message, null, cause);
    }

    public SyncException(SyncErrorType type, String message, String errorCode) {
        this(type, message, errorCode, null);
    }

    public SyncException(SyncErrorType type, String message, String errorCode, Throwable cause) {
        super(message, cause, false, type == SyncErrorType.TRANSIENT);
        this.type = type;
        this.errorCode = errorCode;
    }

    public static SyncException notFound(String message) {
        return new SyncException(SyncErrorType.NOT_FOUND, message, "not_found");
    }

    public static SyncException invalidEvent(String message) {
        return new SyncException(SyncErrorType.INVALID_EVENT, message, "invalid_event");
    }

    public SyncErrorType getType() {
        return type;
    }

    public HttpStatus getStatus() {
        return type.getStatus();
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return type == SyncErrorType.TRANSIENT;
    }
}
