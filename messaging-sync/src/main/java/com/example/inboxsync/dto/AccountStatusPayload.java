package com.example.inboxsync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
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
public class AccountStatusPayload {

    private String accountId;
    private String provider;
    private String accountType;
    private String status;
    /** Lifecycle message such as {@code OK} or {@code CREDENTIALS}; used when {@code status} is absent. */
    private String message;
    private String lastActivity;
    private String errorMessage;
}
