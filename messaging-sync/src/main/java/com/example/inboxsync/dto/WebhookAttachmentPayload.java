package com.example.inboxsync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attachment as pushed by webhooks. The platform is inconsistent about field names, so
 * every known alias is bound and resolved in priority order by the normalizer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WebhookAttachmentPayload {

    private String id;
    private String attachmentId;
    private String type;
    private String attachmentType;
    private String url;
    private String contentUrl;
    private String downloadUrl;
    private String mediaUrl;
    private String src;
    private String href;
    private String filename;
    @JsonProperty("file_name")
    private String fileNameAlias;
    private String name;
    private Long fileSize;
    private Long size;
    private String mimeType;
    @JsonProperty("mimetype")
    private String mimetypeAlias;
    private Boolean unavailable;
    private String urlExpiresAt;
}
