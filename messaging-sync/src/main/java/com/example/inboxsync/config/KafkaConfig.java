package com.example.inboxsync.config;

import com.example.inboxsync.event.SyncEvent;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, SyncEvent> syncEventProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties(null));
    }

    @Bean
    public KafkaTemplate<String, SyncEvent> syncEventKafkaTemplate(
            ProducerFactory<String, SyncEvent> syncEventProducerFactory) {
        return new KafkaTemplate<>(syncEventProducerFactory);
    }

    /**
     * Keyed by account id so one account's events stay ordered within a partition.
     */
    @Bean
    public NewTopic syncEventTopic(SyncProperties syncProperties) {
        return TopicBuilder.name(syncProperties.getKafka().getEventTopic())
                .partitions(12)
                .replicas(1)
                .build();
    }
}
