package com.example.inboxsync.service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.util.StringUtils;

public enum WebhookEventType {
    ACCOUNT_CONNECTED("account.connected", "account.updated"),
    ACCOUNT_STATUS("account.status"),
    ACCOUNT_DISCONNECTED("account.disconnected"),
    MESSAGE_RECEIVED("message_received", "message.received"),
    MESSAGE_READ("message_read", "message.read"),
    MESSAGE_EDITED("message_edited", "message.edited"),
    MESSAGE_DELETED("message_deleted", "message.deleted"),
    BULK_SYNC("messages.bulk_sync"),
    PROFILE_VIEW("profile.view");

    private final List<String> names;

    WebhookEventType(String... names) {
        this.names = List.of(names);
    }

    public List<String> getNames() {
        return names;
    }

    public static Optional<WebhookEventType> fromName(String name) {
        if (!StringUtils.hasText(name)) {
            return Optional.empty();
        }
        String candidate = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.names.contains(candidate))
                .findFirst();
    }
}
