package com.example.inboxsync.domain;

import java.util.Locale;

public enum MessageType {
    TEXT,
    IMAGE,
    VIDEO,
    AUDIO,
    ATTACHMENT;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
