package com.example.inboxsync.dto;

import com.example.inboxsync.domain.AttachmentKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttachmentView {

    public enum Source {
        CACHE,
        PLATFORM,
        INLINE,
        NONE
    }

    private String id;
    private String messageId;
    private AttachmentKind kind;
    private String filename;
    private String mimeType;
    private Long fileSize;
    private String url;
    private Source source;
    /** Base64 content, only when no URL is available. */
    private String content;
    private boolean unavailable;
}
