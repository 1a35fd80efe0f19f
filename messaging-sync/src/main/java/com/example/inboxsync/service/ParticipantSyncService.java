package com.example.inboxsync.service;

import com.example.inboxsync.config.SyncProperties;
import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.Attendee;
import com.example.inboxsync.domain.Chat;
import com.example.inboxsync.domain.Contact;
import com.example.inboxsync.domain.NetworkDistance;
import com.example.inboxsync.normalize.EventNormalizer;
import com.example.inboxsync.normalize.NormalizedParticipant;
import com.example.inboxsync.provider.ProviderClient;
import com.example.inboxsync.provider.ProviderProfile;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Materializes chat attendees and the contacts behind them. The account owner is recorded
 * as a self attendee and never becomes a contact.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParticipantSyncService {

    private final SyncStore store;
    private final ProviderClient providerClient;
    private final EventNormalizer normalizer;
    private final SyncProperties syncProperties;

    public void syncParticipants(Account account, Chat chat, List<NormalizedParticipant> participants, Instant interactionAt) {
        for (NormalizedParticipant participant : participants) {
            syncParticipant(account, chat, participant, interactionAt);
        }
    }

    public Attendee syncParticipant(Account account, Chat chat, NormalizedParticipant participant, Instant interactionAt) {
        String contactId = null;
        if (!participant.self()) {
            contactId = upsertContact(account, participant, interactionAt).getId();
        }
        Instant now = Instant.now();
        Attendee attendee = store.findAttendee(chat.getId(), participant.externalId())
                .orElseGet(() -> Attendee.builder()
                        .id(UUID.randomUUID().toString())
                        .chatId(chat.getId())
                        .externalId(participant.externalId())
                        .createdAt(now)
                        .build());
        if (StringUtils.hasText(participant.displayName())) {
            attendee.setDisplayName(participant.displayName());
        }
        if (contactId != null) {
            attendee.setContactId(contactId);
        }
        attendee.setSelf(participant.self());
        attendee.setHidden(participant.hidden());
        attendee.setUpdatedAt(now);
        return store.upsertAttendee(attendee);
    }

    /**
     * Additively merges the participant into the account's contact list. New contacts are
     * enriched with the full platform profile when enrichment is enabled.
     */
    public Contact upsertContact(Account account, NormalizedParticipant participant, Instant interactionAt) {
        NormalizedParticipant source = participant;
        if (syncProperties.getEnrichment().isEnabled()
                && store.findContact(account.getId(), participant.externalId()).isEmpty()) {
            source = enrich(account, participant);
        }
        Contact incoming = Contact.builder()
                .accountId(account.getId())
                .externalId(source.externalId())
                .fullName(source.displayName())
                .firstName(source.firstName())
                .lastName(source.lastName())
                .headline(source.headline())
                .occupation(source.occupation())
                .location(source.location())
                .profileImageUrl(source.profileImageUrl())
                .providerUrl(source.profileUrl())
                .networkDistance(source.networkDistance())
                .connection(source.networkDistance() == NetworkDistance.FIRST)
                .lastInteraction(interactionAt)
                .build();
        return store.upsertContact(incoming);
    }

    private NormalizedParticipant enrich(Account account, NormalizedParticipant participant) {
        try {
            ProviderProfile profile = providerClient.getProfile(participant.externalId(), account.getAccountId());
            return normalizer.enrich(participant, profile);
        } catch (RuntimeException ex) {
            log.warn("Profile enrichment failed for {}; using event data", participant.externalId(), ex);
            return participant;
        }
    }
}
