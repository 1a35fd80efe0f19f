package com.example.inboxsync.provider;

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
public class ProviderProfile {

    private String providerId;
    private String publicIdentifier;
    private String firstName;
    private String lastName;
    private String headline;
    private String summary;
    private String location;
    private String profilePictureUrl;
    private String profilePictureUrlLarge;
    private String publicProfileUrl;
    private String networkDistance;
}
