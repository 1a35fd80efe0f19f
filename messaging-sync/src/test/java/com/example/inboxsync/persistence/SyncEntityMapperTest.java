package com.example.inboxsync.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.inboxsync.domain.Contact;
import com.example.inboxsync.domain.Message;
import com.example.inboxsync.domain.MessageType;
import com.example.inboxsync.domain.NetworkDistance;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SyncEntityMapperTest {

    private final SyncEntityMapper mapper = new SyncEntityMapper(new ObjectMapper());

    @Test
    void copyInto_keepsEntityIdentity() {
        MessageEntity entity = new MessageEntity();
        entity.setId("row-1");
        Instant created = Instant.parse("2024-01-01T00:00:00Z");
        entity.setCreatedAt(created);

        mapper.copyInto(Message.builder()
                .id("other-id")
                .accountId("acc")
                .externalId("m-1")
                .messageType(MessageType.TEXT)
                .content("hi")
                .createdAt(Instant.now())
                .build(), entity);

        assertEquals("row-1", entity.getId());
        assertEquals(created, entity.getCreatedAt());
        assertEquals("m-1", entity.getExternalId());
        assertNull(entity.getMetadata());
    }

    @Test
    void message_metadataSurvivesJsonColumn() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reactions", List.of("like"));
        metadata.put("quoted", Map.of("id", "m-0"));
        MessageEntity entity = new MessageEntity();
        entity.setId("row-1");

        mapper.copyInto(Message.builder()
                .accountId("acc")
                .externalId("m-1")
                .messageType(MessageType.TEXT)
                .read(true)
                .outgoing(true)
                .metadata(metadata)
                .build(), entity);
        Message restored = mapper.toDomain(entity);

        assertEquals("row-1", restored.getId());
        assertTrue(restored.isRead());
        assertTrue(restored.isOutgoing());
        assertEquals(List.of("like"), restored.getMetadata().get("reactions"));
        assertEquals(Map.of("id", "m-0"), restored.getMetadata().get("quoted"));
    }

    @Test
    void toDomain_returnsEmptyMetadata_whenColumnUnreadable() {
        MessageEntity entity = new MessageEntity();
        entity.setId("row-1");
        entity.setMetadata("{not json");

        assertTrue(mapper.toDomain(entity).getMetadata().isEmpty());
    }

    @Test
    void contact_roundTripsThroughEntity() {
        ContactEntity entity = new ContactEntity();
        entity.setId("row-2");

        mapper.copyInto(Contact.builder()
                .accountId("acc")
                .externalId("c-1")
                .fullName("Ada Lovelace")
                .networkDistance(NetworkDistance.FIRST)
                .connection(true)
                .build(), entity);
        Contact restored = mapper.toDomain(entity);

        assertEquals("row-2", restored.getId());
        assertEquals("Ada Lovelace", restored.getFullName());
        assertEquals(NetworkDistance.FIRST, restored.getNetworkDistance());
        assertTrue(restored.isConnection());
    }
}
