package com.example.inboxsync.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileView implements Serializable {

    private String id;
    private String accountId;
    private String viewerExternalId;
    private String viewerName;
    private String viewerHeadline;
    private String viewerImageUrl;
    private Instant viewedAt;
    private Instant createdAt;
}
