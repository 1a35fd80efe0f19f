package com.example.inboxsync.service;

import com.example.inboxsync.dto.AccountLifecyclePayload;
import com.example.inboxsync.dto.AccountStatusPayload;
import com.example.inboxsync.dto.BulkSyncPayload;
import com.example.inboxsync.dto.MessageDeletedPayload;
import com.example.inboxsync.dto.MessageEditedPayload;
import com.example.inboxsync.dto.MessageReadPayload;
import com.example.inboxsync.dto.MessageReceivedPayload;
import com.example.inboxsync.dto.ProfileViewPayload;
import com.example.inboxsync.dto.WebhookEnvelope;
import com.example.inboxsync.service.exception.SyncErrorType;
import com.example.inboxsync.service.exception.SyncException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Binds a webhook body to its typed payload and hands it to the owning service.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InboundEventRouter {

    private final ObjectMapper objectMapper;
    private final AccountSyncService accountSyncService;
    private final MessageSyncService messageSyncService;
    private final ProfileViewService profileViewService;

    /**
     * @return {@code false} when the event is not one this service handles
     */
    public boolean route(WebhookEnvelope envelope) {
        WebhookEventType type = WebhookEventType.fromName(envelope.getEvent()).orElse(null);
        if (type == null) {
            log.info("Ignoring unsupported webhook event {}", envelope.getEvent());
            return false;
        }
        JsonNode data = envelope.getData();
        switch (type) {
            case ACCOUNT_CONNECTED -> accountSyncService.connect(bind(data, AccountLifecyclePayload.class, type));
            case ACCOUNT_STATUS -> accountSyncService.updateStatus(bind(unwrapAccountStatus(data), AccountStatusPayload.class, type));
            case ACCOUNT_DISCONNECTED -> accountSyncService.disconnect(bind(data, AccountLifecyclePayload.class, type));
            case MESSAGE_RECEIVED -> messageSyncService.applyMessageEvent(bind(data, MessageReceivedPayload.class, type));
            case MESSAGE_READ -> messageSyncService.markRead(bind(data, MessageReadPayload.class, type));
            case MESSAGE_EDITED -> messageSyncService.applyEdit(bind(data, MessageEditedPayload.class, type));
            case MESSAGE_DELETED -> messageSyncService.applyDelete(bind(data, MessageDeletedPayload.class, type));
            case BULK_SYNC -> messageSyncService.applyBulkSync(bind(data, BulkSyncPayload.class, type));
            case PROFILE_VIEW -> profileViewService.recordView(bind(data, ProfileViewPayload.class, type));
            default -> throw new IllegalStateException("Unhandled webhook event type " + type);
        }
        return true;
    }

    private <T> T bind(JsonNode data, Class<T> payloadType, WebhookEventType type) {
        if (data == null || data.isNull() || !data.isObject()) {
            throw SyncException.invalidEvent("Event " + type + " has no data object");
        }
        try {
            return objectMapper.treeToValue(data, payloadType);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new SyncException(
                    SyncErrorType.INVALID_EVENT,
                    "Malformed " + type + " payload",
                    "invalid_event",
                    ex);
        }
    }

    /**
     * The platform's lifecycle webhook nests the fields under {@code AccountStatus}.
     */
    private JsonNode unwrapAccountStatus(JsonNode data) {
        if (data != null && data.has("AccountStatus")) {
            return data.get("AccountStatus");
        }
        return data;
    }
}
