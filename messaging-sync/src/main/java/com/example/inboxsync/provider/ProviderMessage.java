package com.example.inboxsync.provider;

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
public class ProviderMessage {

    private String id;
    private String chatId;
    private String senderId;
    private String senderAttendeeId;
    private String text;
    private String subject;
    private String timestamp;
    private Boolean isSender;
    private Boolean seen;
    private Boolean deleted;
    private Boolean edited;
    private Boolean isEvent;
    private String messageType;
    private List<ProviderAttachment> attachments;
    private Map<String, Object> quoted;
    private List<Map<String, Object>> reactions;
}
