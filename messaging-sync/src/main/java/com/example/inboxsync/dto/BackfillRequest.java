package com.example.inboxsync.dto;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional per-run overrides of the configured backfill limits.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BackfillRequest {

    @Positive
    private Integer maxChats;

    @Positive
    private Integer pageSize;

    @Positive
    private Integer maxMessagesPerChat;

    @Positive
    private Integer messageBatchSize;

    @Positive
    private Integer maxAttendeesPerChat;
}
