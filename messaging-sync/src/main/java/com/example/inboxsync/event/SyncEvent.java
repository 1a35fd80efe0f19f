package com.example.inboxsync.event;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncEvent implements Serializable {

    private String eventId;
    private SyncEventType type;
    /** External account id; also the Kafka record key. */
    private String accountId;
    private String chatId;
    private Instant occurredAt;
    private Map<String, Object> payload;
}
