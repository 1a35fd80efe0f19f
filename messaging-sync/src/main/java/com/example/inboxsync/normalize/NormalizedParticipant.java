package com.example.inboxsync.normalize;

import com.example.inboxsync.domain.NetworkDistance;

/**
 * A chat member or profile viewer. {@code externalId} is the member's platform-wide
 * provider id, which is also the natural key of the matching contact.
 */
public record NormalizedParticipant(
        String externalId,
        String displayName,
        String firstName,
        String lastName,
        String headline,
        String occupation,
        String location,
        String profileImageUrl,
        String profileUrl,
        NetworkDistance networkDistance,
        boolean self,
        boolean hidden) {

    public static NormalizedParticipant basic(String externalId, String displayName, String profileUrl, boolean self) {
        return new NormalizedParticipant(
                externalId, displayName, null, null, null, null, null, null, profileUrl, null, self, false);
    }
}
