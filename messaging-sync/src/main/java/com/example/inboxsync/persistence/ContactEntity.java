package com.example.inboxsync.persistence;

import com.example.inboxsync.domain.NetworkDistance;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "sync_contacts",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_sync_contacts_account_external", columnNames = {"account_id", "external_id"}))
public class ContactEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "external_id", nullable = false, length = 128)
    private String externalId;

    @Column(name = "full_name", length = 255)
    private String fullName;

    @Column(name = "first_name", length = 128)
    private String firstName;

    @Column(name = "last_name", length = 128)
    private String lastName;

    @Column(name = "headline", columnDefinition = "text")
    private String headline;

    @Column(name = "occupation", columnDefinition = "text")
    private String occupation;

    @Column(name = "location", length = 255)
    private String location;

    @Column(name = "profile_image_url", columnDefinition = "text")
    private String profileImageUrl;

    @Column(name = "provider_url", columnDefinition = "text")
    private String providerUrl;

    @Column(name = "is_connection", nullable = false)
    private boolean connection;

    @Enumerated(EnumType.STRING)
    @Column(name = "network_distance", length = 32)
    private NetworkDistance networkDistance;

    @Column(name = "last_interaction")
    private Instant lastInteraction;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
