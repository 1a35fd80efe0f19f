package com.example.inboxsync.service;

import com.example.inboxsync.config.SyncProperties;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final SyncProperties syncProperties;

    public RedisKeyFactory(SyncProperties syncProperties) {
        this.syncProperties = syncProperties;
    }

    private String prefix() {
        return syncProperties.getRedis().getKeyPrefix();
    }

    public String chatLockKey(String accountId, String chatExternalId) {
        return "%s:account:%s:chat:%s:lock".formatted(prefix(), accountId, chatExternalId);
    }
}
