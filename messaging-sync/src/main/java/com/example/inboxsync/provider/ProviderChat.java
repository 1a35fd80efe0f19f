package com.example.inboxsync.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A chat as listed by the messaging platform. {@code type} is {@code 0} for direct and {@code 1} for group chats.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProviderChat {

    private String id;
    private String accountId;
    private String name;
    private Integer type;
    private String timestamp;
    private Integer unreadCount;
    private Integer unread;
    private Boolean archived;
    private Boolean readOnly;
    private String contentType;
    private String attendeeProviderId;
}
