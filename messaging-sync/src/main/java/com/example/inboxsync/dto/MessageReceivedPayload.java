package com.example.inboxsync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MessageReceivedPayload {

    private String accountId;
    private String accountType;
    private AccountInfo accountInfo;
    private String event;
    private String chatId;
    private String providerChatId;
    private String messageId;
    private String providerMessageId;
    private String message;
    private String subject;
    private String timestamp;
    private String messageType;
    private Boolean isEvent;
    private Boolean isGroup;
    private String chatContentType;
    private List<String> folder;
    private Map<String, Object> quoted;
    private WebhookParticipantPayload sender;
    private List<WebhookParticipantPayload> attendees;
    private List<WebhookAttachmentPayload> attachments;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class AccountInfo {
        private String type;
        private String feature;
        private String userId;
    }
}
