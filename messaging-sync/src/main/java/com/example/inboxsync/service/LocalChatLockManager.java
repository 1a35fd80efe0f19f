package com.example.inboxsync.service;

import com.example.inboxsync.service.exception.SyncException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * In-process chat lock for single-node deployments. Entries are reference counted and
 * dropped once no thread holds or waits for them.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "sync.lock", name = "mode", havingValue = "local")
public class LocalChatLockManager implements ChatLockManager {

    private final RedisKeyFactory keyFactory;
    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();

    @Override
    public <T> T withChatLock(String accountId, String chatExternalId, Supplier<T> action) {
        if (!StringUtils.hasText(accountId) || !StringUtils.hasText(chatExternalId)) {
            throw SyncException.invalidEvent("Account and chat id are required");
        }
        String key = keyFactory.chatLockKey(accountId, chatExternalId);
        LockEntry entry = locks.compute(key, (ignored, existing) -> {
            LockEntry target = existing != null ? existing : new LockEntry();
            target.holders++;
            return target;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (ignored, existing) -> --existing.holders == 0 ? null : existing);
        }
    }

    int activeKeys() {
        return locks.size();
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
