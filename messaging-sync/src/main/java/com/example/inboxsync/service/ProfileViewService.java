package com.example.inboxsync.service;

import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.ProfileView;
import com.example.inboxsync.dto.ProfileViewPayload;
import com.example.inboxsync.event.SyncEventPublisher;
import com.example.inboxsync.event.SyncEventType;
import com.example.inboxsync.normalize.EventNormalizer;
import com.example.inboxsync.normalize.FieldResolver;
import com.example.inboxsync.service.exception.SyncException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Records profile views. Each view is a new row; identified viewers also become contacts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileViewService {

    private final SyncStore store;
    private final AccountResolver accountResolver;
    private final ParticipantSyncService participantSyncService;
    private final EventNormalizer normalizer;
    private final SyncEventPublisher eventPublisher;

    public ProfileView recordView(ProfileViewPayload payload) {
        if (payload == null) {
            throw SyncException.invalidEvent("Profile view event without payload");
        }
        Account account = accountResolver.requireActiveAccount(payload.getAccountId());
        ProfileViewPayload.Viewer viewer = payload.getViewer();
        Instant now = Instant.now();
        Instant viewedAt = Objects.requireNonNullElse(FieldResolver.parseInstant(payload.getViewedAt()), now);

        ProfileView view = ProfileView.builder()
                .id(UUID.randomUUID().toString())
                .accountId(account.getId())
                .viewerExternalId(viewer != null ? viewer.getId() : null)
                .viewerName(viewer != null ? FieldResolver.firstText(viewer.getDisplayName(), viewer.getName()) : null)
                .viewerHeadline(viewer != null ? viewer.getHeadline() : null)
                .viewerImageUrl(viewer != null
                        ? FieldResolver.firstText(viewer.getProfilePictureUrl(), viewer.getAvatarUrl())
                        : null)
                .viewedAt(viewedAt)
                .createdAt(now)
                .build();
        ProfileView saved = store.appendProfileView(view);

        if (viewer != null && StringUtils.hasText(viewer.getId())) {
            try {
                participantSyncService.upsertContact(account, normalizer.normalize(viewer), viewedAt);
            } catch (RuntimeException ex) {
                log.warn("Recorded view by {} but could not update the contact", viewer.getId(), ex);
            }
        }

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("viewedAt", viewedAt.toString());
        if (saved.getViewerExternalId() != null) {
            event.put("viewerId", saved.getViewerExternalId());
        }
        eventPublisher.publish(SyncEventType.PROFILE_VIEWED, account.getAccountId(), null, event);
        return saved;
    }
}
