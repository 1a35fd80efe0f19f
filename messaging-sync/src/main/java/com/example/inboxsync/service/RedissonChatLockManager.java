package com.example.inboxsync.service;

import com.example.inboxsync.config.SyncProperties;
import com.example.inboxsync.service.exception.SyncErrorType;
import com.example.inboxsync.service.exception.SyncException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "sync.lock", name = "mode", havingValue = "redis", matchIfMissing = true)
public class RedissonChatLockManager implements ChatLockManager {

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final SyncProperties syncProperties;

    @Override
    public <T> T withChatLock(String accountId, String chatExternalId, Supplier<T> action) {
        if (!StringUtils.hasText(accountId) || !StringUtils.hasText(chatExternalId)) {
            throw SyncException.invalidEvent("Account and chat id are required");
        }
        String key = keyFactory.chatLockKey(accountId, chatExternalId);
        RLock lock = redissonClient.getLock(key);
        acquire(lock, key);
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void acquire(RLock lock, String key) {
        long waitMillis = syncProperties.getLock().getAcquireTimeout().toMillis();
        try {
            // no lease time: the watchdog keeps the lock while this node is alive
            if (!lock.tryLock(waitMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Timed out after {} ms waiting for {}", waitMillis, key);
                throw new SyncException(SyncErrorType.TRANSIENT, "Chat is busy: " + key, "chat_busy");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SyncException(SyncErrorType.TRANSIENT, "Interrupted waiting for " + key, "chat_busy", ex);
        }
    }
}
