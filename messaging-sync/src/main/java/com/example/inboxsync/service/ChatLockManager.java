package com.example.inboxsync.service;

import java.util.function.Supplier;

/**
 * Serializes all writes touching one chat. At most one holder per {@code (accountId,
 * chatExternalId)} at a time; different chats proceed in parallel. Locks are reentrant
 * so a backfill holding a chat may apply messages through the regular path.
 */
public interface ChatLockManager {

    <T> T withChatLock(String accountId, String chatExternalId, Supplier<T> action);
}
