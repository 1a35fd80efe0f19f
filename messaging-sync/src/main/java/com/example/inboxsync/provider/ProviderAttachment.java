package com.example.inboxsync.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attachment metadata from the platform API. {@code url_expires_at} arrives as epoch milliseconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProviderAttachment {

    private String id;
    private String type;
    private Long fileSize;
    private Boolean unavailable;
    private String mimetype;
    @JsonProperty("mime_type")
    private String mimeTypeAlias;
    private String url;
    private String urlExpiresAt;
    private String fileName;
    @JsonProperty("filename")
    private String filenameAlias;
    private Dimensions size;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Dimensions {
        private Integer width;
        private Integer height;
    }
}
