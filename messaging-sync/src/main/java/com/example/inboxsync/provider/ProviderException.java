package com.example.inboxsync.provider;

import com.example.inboxsync.service.exception.SyncErrorType;
import com.example.inboxsync.service.exception.SyncException;

/**
 * A failed call to the messaging platform. Always transient from the engine's point of view.
 */
public class ProviderException extends SyncException {

    private final int statusCode;

    public ProviderException(String message, int statusCode, Throwable cause) {
        super(SyncErrorType.TRANSIENT, message, "provider_error", cause);
        this.statusCode = statusCode;
    }

    public ProviderException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public int getStatusCode() {
        return statusCode;
    }
}
