package com.example.inboxsync.event;

import com.example.inboxsync.config.SyncProperties;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes sync outcomes for downstream consumers. Publishing is fire-and-forget:
 * a broker failure is logged and never fails the sync step that produced the event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncEventPublisher {

    private final KafkaTemplate<String, SyncEvent> syncEventKafkaTemplate;
    private final SyncProperties syncProperties;

    public void publish(SyncEventType type, String accountId, String chatId, Map<String, Object> payload) {
        SyncEvent event = SyncEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .accountId(accountId)
                .chatId(chatId)
                .occurredAt(Instant.now())
                .payload(payload != null ? payload : Map.of())
                .build();
        publish(event);
    }

    public void publish(SyncEvent event) {
        String topic = syncProperties.getKafka().getEventTopic();
        try {
            syncEventKafkaTemplate.send(topic, event.getAccountId(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to publish {} event for account {}", event.getType(), event.getAccountId(), ex);
                        }
                    });
        } catch (RuntimeException ex) {
            log.warn("Failed to hand {} event for account {} to Kafka", event.getType(), event.getAccountId(), ex);
        }
    }
}
