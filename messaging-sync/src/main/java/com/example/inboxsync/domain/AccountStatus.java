package com.example.inboxsync.domain;

import java.util.Locale;
import org.springframework.util.StringUtils;

public enum AccountStatus {
    CONNECTED,
    DISCONNECTED,
    ERROR,
    PENDING;

    /**
     * Maps both the plain status values and the platform's lifecycle messages
     * ({@code OK}, {@code CREDENTIALS}, {@code SYNC_SUCCESS}, ...) to a local status.
     */
    public static AccountStatus fromProvider(String value) {
        if (!StringUtils.hasText(value)) {
            return PENDING;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "CONNECTED", "OK", "RECONNECTED", "CREATION_SUCCESS", "SYNC_SUCCESS" -> CONNECTED;
            case "DISCONNECTED", "DELETED", "STOPPED" -> DISCONNECTED;
            case "ERROR", "CREDENTIALS" -> ERROR;
            default -> PENDING;
        };
    }
}
