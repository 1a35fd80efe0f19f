package com.example.inboxsync.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.function.Consumer;
import java.util.function.Supplier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.StringUtils;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Contact implements Serializable {

    private String id;
    private String accountId;
    private String externalId;
    private String fullName;
    private String firstName;
    private String lastName;
    private String headline;
    private String occupation;
    private String location;
    private String profileImageUrl;
    private String providerUrl;
    private boolean connection;
    private NetworkDistance networkDistance;
    private Instant lastInteraction;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Additive merge: only non-blank incoming values overwrite, so a sparse payload
     * never erases richer data captured earlier. {@code lastInteraction} only moves forward.
     */
    public Contact mergeFrom(Contact incoming) {
        if (incoming == null) {
            return this;
        }
        mergeText(incoming::getFullName, this::setFullName);
        mergeText(incoming::getFirstName, this::setFirstName);
        mergeText(incoming::getLastName, this::setLastName);
        mergeText(incoming::getHeadline, this::setHeadline);
        mergeText(incoming::getOccupation, this::setOccupation);
        mergeText(incoming::getLocation, this::setLocation);
        mergeText(incoming::getProfileImageUrl, this::setProfileImageUrl);
        mergeText(incoming::getProviderUrl, this::setProviderUrl);
        if (incoming.getNetworkDistance() != null) {
            networkDistance = incoming.getNetworkDistance();
            connection = incoming.getNetworkDistance() == NetworkDistance.FIRST;
        } else if (incoming.isConnection()) {
            connection = true;
        }
        if (incoming.getLastInteraction() != null
                && (lastInteraction == null || incoming.getLastInteraction().isAfter(lastInteraction))) {
            lastInteraction = incoming.getLastInteraction();
        }
        return this;
    }

    private static void mergeText(Supplier<String> source, Consumer<String> target) {
        String value = source.get();
        if (StringUtils.hasText(value)) {
            target.accept(value);
        }
    }
}
