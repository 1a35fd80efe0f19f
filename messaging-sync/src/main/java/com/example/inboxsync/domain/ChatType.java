package com.example.inboxsync.domain;

public enum ChatType {
    DIRECT,
    GROUP
}
