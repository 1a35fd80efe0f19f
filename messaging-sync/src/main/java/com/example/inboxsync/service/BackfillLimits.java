package com.example.inboxsync.service;

import com.example.inboxsync.config.SyncProperties;
import com.example.inboxsync.dto.BackfillRequest;

/**
 * Hard caps of one historical backfill run. All values are positive.
 */
public record BackfillLimits(
        int maxChats,
        int pageSize,
        int maxMessagesPerChat,
        int messageBatchSize,
        int maxAttendeesPerChat) {

    public BackfillLimits {
        requirePositive("maxChats", maxChats);
        requirePositive("pageSize", pageSize);
        requirePositive("maxMessagesPerChat", maxMessagesPerChat);
        requirePositive("messageBatchSize", messageBatchSize);
        requirePositive("maxAttendeesPerChat", maxAttendeesPerChat);
    }

    public static BackfillLimits from(SyncProperties.Backfill backfill) {
        return new BackfillLimits(
                backfill.getMaxChats(),
                backfill.getPageSize(),
                backfill.getMaxMessagesPerChat(),
                backfill.getMessageBatchSize(),
                backfill.getMaxAttendeesPerChat());
    }

    public BackfillLimits withOverrides(BackfillRequest request) {
        if (request == null) {
            return this;
        }
        return new BackfillLimits(
                request.getMaxChats() != null ? request.getMaxChats() : maxChats,
                request.getPageSize() != null ? request.getPageSize() : pageSize,
                request.getMaxMessagesPerChat() != null ? request.getMaxMessagesPerChat() : maxMessagesPerChat,
                request.getMessageBatchSize() != null ? request.getMessageBatchSize() : messageBatchSize,
                request.getMaxAttendeesPerChat() != null ? request.getMaxAttendeesPerChat() : maxAttendeesPerChat);
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive but was " + value);
        }
    }
}
