package com.example.inboxsync.normalize;

import com.example.inboxsync.domain.AttachmentKind;
import com.example.inboxsync.domain.ChatType;
import com.example.inboxsync.domain.MessageType;
import com.example.inboxsync.domain.NetworkDistance;
import com.example.inboxsync.dto.MessageReceivedPayload;
import com.example.inboxsync.dto.ProfileViewPayload;
import com.example.inboxsync.dto.WebhookAttachmentPayload;
import com.example.inboxsync.dto.WebhookParticipantPayload;
import com.example.inboxsync.provider.ProviderAttachment;
import com.example.inboxsync.provider.ProviderAttendee;
import com.example.inboxsync.provider.ProviderChat;
import com.example.inboxsync.provider.ProviderMessage;
import com.example.inboxsync.provider.ProviderProfile;
import com.example.inboxsync.service.exception.SyncException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

/**
 * Turns webhook pushes, bulk-sync items and backfill page items into the canonical shapes
 * the sync services apply. Stateless.
 */
@Component
public class EventNormalizer {

    public static final String GROUP_CHAT_NAME = "Group Chat";
    public static final String UNKNOWN_CONTACT_NAME = "Unknown Contact";

    public NormalizedMessage normalize(MessageReceivedPayload payload) {
        if (payload == null || !StringUtils.hasText(payload.getMessageId()) || !StringUtils.hasText(payload.getChatId())) {
            throw SyncException.invalidEvent("Message event requires message_id and chat_id");
        }
        String ownerProviderId = payload.getAccountInfo() != null ? payload.getAccountInfo().getUserId() : null;
        WebhookParticipantPayload sender = payload.getSender();
        String senderId = sender != null ? sender.getAttendeeProviderId() : null;
        boolean outgoing = StringUtils.hasText(senderId) && senderId.equals(ownerProviderId);

        List<NormalizedParticipant> participants = webhookParticipants(payload, ownerProviderId);
        List<NormalizedAttachment> attachments = normalizeWebhookAttachments(
                payload.getMessageId(), payload.getAttachments());
        Instant sentAt = Objects.requireNonNullElseGet(FieldResolver.parseInstant(payload.getTimestamp()), Instant::now);

        ChatType chatType = FieldResolver.isTrue(payload.getIsGroup()) ? ChatType.GROUP : ChatType.DIRECT;
        NormalizedChat chat = new NormalizedChat(
                payload.getChatId(),
                chatType,
                provisionalChatName(chatType, sender, participants, outgoing),
                sentAt,
                null,
                null,
                null,
                payload.getChatContentType());

        Map<String, Object> metadata = new LinkedHashMap<>();
        putIfPresent(metadata, "provider_message_id", payload.getProviderMessageId());
        putIfPresent(metadata, "provider_chat_id", payload.getProviderChatId());
        putIfPresent(metadata, "message_type", payload.getMessageType());
        putIfPresent(metadata, "quoted", payload.getQuoted());
        putIfPresent(metadata, "folder", payload.getFolder());

        return new NormalizedMessage(
                payload.getMessageId(),
                chat,
                senderId,
                payload.getMessage(),
                payload.getSubject(),
                inferMessageType(payload.getMessage(), attachments),
                sentAt,
                outgoing,
                outgoing,
                FieldResolver.isTrue(payload.getIsEvent()),
                false,
                false,
                metadata,
                participants,
                attachments);
    }

    /**
     * Normalizes a message from the platform API, as found in backfill pages and bulk-sync batches.
     *
     * @param chatExternalId chat to attach the message to when the item does not name one
     */
    public NormalizedMessage normalize(ProviderMessage message, String chatExternalId) {
        if (message == null || !StringUtils.hasText(message.getId())) {
            throw SyncException.invalidEvent("Provider message without id");
        }
        String chatId = FieldResolver.firstText(message.getChatId(), chatExternalId);
        if (!StringUtils.hasText(chatId)) {
            throw SyncException.invalidEvent("Provider message " + message.getId() + " has no chat id");
        }
        boolean outgoing = FieldResolver.isTrue(message.getIsSender());
        List<NormalizedAttachment> attachments = normalizeProviderAttachments(message.getId(), message.getAttachments());
        Instant sentAt = Objects.requireNonNullElseGet(FieldResolver.parseInstant(message.getTimestamp()), Instant::now);

        List<NormalizedParticipant> participants = StringUtils.hasText(message.getSenderId())
                ? List.of(NormalizedParticipant.basic(message.getSenderId(), null, null, outgoing))
                : List.of();

        Map<String, Object> metadata = new LinkedHashMap<>();
        putIfPresent(metadata, "message_type", message.getMessageType());
        putIfPresent(metadata, "sender_attendee_id", message.getSenderAttendeeId());
        putIfPresent(metadata, "quoted", message.getQuoted());
        if (!CollectionUtils.isEmpty(message.getReactions())) {
            metadata.put("reactions", message.getReactions());
        }

        return new NormalizedMessage(
                message.getId(),
                NormalizedChat.provisional(chatId, ChatType.DIRECT, null, sentAt),
                message.getSenderId(),
                message.getText(),
                message.getSubject(),
                inferMessageType(message.getText(), attachments),
                sentAt,
                outgoing || FieldResolver.isTrue(message.getSeen()),
                outgoing,
                FieldResolver.isTrue(message.getIsEvent()),
                FieldResolver.isTrue(message.getEdited()),
                FieldResolver.isTrue(message.getDeleted()),
                metadata,
                participants,
                attachments);
    }

    public NormalizedChat normalize(ProviderChat chat) {
        if (chat == null || !StringUtils.hasText(chat.getId())) {
            throw SyncException.invalidEvent("Provider chat without id");
        }
        ChatType type = chat.getType() != null && chat.getType() == 1 ? ChatType.GROUP : ChatType.DIRECT;
        return new NormalizedChat(
                chat.getId(),
                type,
                chat.getName(),
                FieldResolver.parseInstant(chat.getTimestamp()),
                FieldResolver.firstPresent(chat.getUnreadCount(), chat.getUnread()),
                chat.getArchived(),
                chat.getReadOnly(),
                chat.getContentType());
    }

    public NormalizedParticipant normalize(ProviderAttendee attendee, String ownerProviderId) {
        String externalId = FieldResolver.firstText(attendee.getProviderId(), attendee.getId());
        if (!StringUtils.hasText(externalId)) {
            throw SyncException.invalidEvent("Provider attendee without id");
        }
        boolean self = FieldResolver.isTrue(attendee.getIsSelf())
                || (StringUtils.hasText(ownerProviderId) && ownerProviderId.equals(externalId));
        ProviderAttendee.Specifics specifics = attendee.getSpecifics();
        return new NormalizedParticipant(
                externalId,
                attendee.getName(),
                null,
                null,
                specifics != null ? specifics.getHeadline() : null,
                specifics != null ? specifics.getOccupation() : null,
                specifics != null ? specifics.getLocation() : null,
                attendee.getPictureUrl(),
                attendee.getProfileUrl(),
                specifics != null ? NetworkDistance.fromProvider(specifics.getNetworkDistance()) : null,
                self,
                FieldResolver.isTrue(attendee.getHidden()));
    }

    public NormalizedParticipant normalize(ProfileViewPayload.Viewer viewer) {
        String fullName = FieldResolver.firstText(
                viewer.getDisplayName(), viewer.getName(), joinName(viewer.getFirstName(), viewer.getLastName()));
        return new NormalizedParticipant(
                viewer.getId(),
                fullName,
                viewer.getFirstName(),
                viewer.getLastName(),
                viewer.getHeadline(),
                null,
                null,
                FieldResolver.firstText(viewer.getProfilePictureUrl(), viewer.getAvatarUrl()),
                viewer.getProfileUrl(),
                null,
                false,
                false);
    }

    /**
     * Overlays a fetched profile on what the event itself said about the person.
     */
    public NormalizedParticipant enrich(NormalizedParticipant basic, ProviderProfile profile) {
        if (profile == null) {
            return basic;
        }
        String fullName = FieldResolver.firstText(joinName(profile.getFirstName(), profile.getLastName()), basic.displayName());
        String profileUrl = FieldResolver.firstText(profile.getPublicProfileUrl(), basic.profileUrl());
        if (!StringUtils.hasText(profileUrl) && StringUtils.hasText(profile.getPublicIdentifier())) {
            profileUrl = "https://www.linkedin.com/in/" + profile.getPublicIdentifier();
        }
        return new NormalizedParticipant(
                basic.externalId(),
                fullName,
                FieldResolver.firstText(profile.getFirstName(), basic.firstName()),
                FieldResolver.firstText(profile.getLastName(), basic.lastName()),
                FieldResolver.firstText(profile.getHeadline(), basic.headline()),
                basic.occupation(),
                FieldResolver.firstText(profile.getLocation(), basic.location()),
                FieldResolver.firstText(
                        profile.getProfilePictureUrlLarge(), profile.getProfilePictureUrl(), basic.profileImageUrl()),
                profileUrl,
                FieldResolver.firstPresent(NetworkDistance.fromProvider(profile.getNetworkDistance()), basic.networkDistance()),
                basic.self(),
                basic.hidden());
    }

    public List<NormalizedAttachment> normalizeWebhookAttachments(
            String messageExternalId, List<WebhookAttachmentPayload> attachments) {
        if (CollectionUtils.isEmpty(attachments)) {
            return List.of();
        }
        List<NormalizedAttachment> result = new ArrayList<>(attachments.size());
        for (int index = 0; index < attachments.size(); index++) {
            WebhookAttachmentPayload attachment = attachments.get(index);
            if (attachment == null) {
                continue;
            }
            String mimeType = FieldResolver.firstText(attachment.getMimeType(), attachment.getMimetypeAlias());
            result.add(new NormalizedAttachment(
                    FieldResolver.firstText(
                            attachment.getId(), attachment.getAttachmentId(), syntheticId(messageExternalId, index)),
                    AttachmentKind.fromProvider(
                            FieldResolver.firstText(attachment.getType(), attachment.getAttachmentType()), mimeType),
                    FieldResolver.firstText(attachment.getFilename(), attachment.getFileNameAlias(), attachment.getName()),
                    mimeType,
                    FieldResolver.firstPresent(attachment.getFileSize(), attachment.getSize()),
                    null,
                    null,
                    FieldResolver.firstText(
                            attachment.getUrl(),
                            attachment.getContentUrl(),
                            attachment.getDownloadUrl(),
                            attachment.getMediaUrl(),
                            attachment.getSrc(),
                            attachment.getHref()),
                    FieldResolver.parseInstant(attachment.getUrlExpiresAt()),
                    FieldResolver.isTrue(attachment.getUnavailable())));
        }
        return result;
    }

    public List<NormalizedAttachment> normalizeProviderAttachments(
            String messageExternalId, List<ProviderAttachment> attachments) {
        if (CollectionUtils.isEmpty(attachments)) {
            return List.of();
        }
        List<NormalizedAttachment> result = new ArrayList<>(attachments.size());
        for (int index = 0; index < attachments.size(); index++) {
            ProviderAttachment attachment = attachments.get(index);
            if (attachment == null) {
                continue;
            }
            String mimeType = FieldResolver.firstText(attachment.getMimetype(), attachment.getMimeTypeAlias());
            ProviderAttachment.Dimensions size = attachment.getSize();
            result.add(new NormalizedAttachment(
                    FieldResolver.firstText(attachment.getId(), syntheticId(messageExternalId, index)),
                    AttachmentKind.fromProvider(attachment.getType(), mimeType),
                    FieldResolver.firstText(attachment.getFileName(), attachment.getFilenameAlias()),
                    mimeType,
                    attachment.getFileSize(),
                    size != null ? size.getWidth() : null,
                    size != null ? size.getHeight() : null,
                    attachment.getUrl(),
                    FieldResolver.parseInstant(attachment.getUrlExpiresAt()),
                    FieldResolver.isTrue(attachment.getUnavailable())));
        }
        return result;
    }

    public static MessageType inferMessageType(String content, List<NormalizedAttachment> attachments) {
        if (!StringUtils.hasText(content) && !CollectionUtils.isEmpty(attachments)) {
            return attachments.get(0).kind().messageType();
        }
        return MessageType.TEXT;
    }

    static String syntheticId(String messageExternalId, int index) {
        return messageExternalId + "_" + index;
    }

    private List<NormalizedParticipant> webhookParticipants(MessageReceivedPayload payload, String ownerProviderId) {
        Map<String, NormalizedParticipant> byId = new LinkedHashMap<>();
        if (payload.getAttendees() != null) {
            payload.getAttendees().stream()
                    .filter(Objects::nonNull)
                    .forEach(attendee -> addParticipant(byId, attendee, ownerProviderId));
        }
        if (payload.getSender() != null) {
            addParticipant(byId, payload.getSender(), ownerProviderId);
        }
        return new ArrayList<>(byId.values());
    }

    private void addParticipant(
            Map<String, NormalizedParticipant> byId, WebhookParticipantPayload attendee, String ownerProviderId) {
        String externalId = FieldResolver.firstText(attendee.getAttendeeProviderId(), attendee.getAttendeeId());
        if (!StringUtils.hasText(externalId) || byId.containsKey(externalId)) {
            return;
        }
        boolean self = StringUtils.hasText(ownerProviderId) && ownerProviderId.equals(externalId);
        byId.put(externalId, NormalizedParticipant.basic(
                externalId, attendee.getAttendeeName(), attendee.getAttendeeProfileUrl(), self));
    }

    private String provisionalChatName(
            ChatType type,
            WebhookParticipantPayload sender,
            List<NormalizedParticipant> participants,
            boolean outgoing) {
        if (type == ChatType.GROUP) {
            return GROUP_CHAT_NAME;
        }
        String name = outgoing
                ? participants.stream()
                        .filter(participant -> !participant.self())
                        .map(NormalizedParticipant::displayName)
                        .filter(StringUtils::hasText)
                        .findFirst()
                        .orElse(null)
                : sender != null ? sender.getAttendeeName() : null;
        return StringUtils.hasText(name) ? name : UNKNOWN_CONTACT_NAME;
    }

    private static String joinName(String firstName, String lastName) {
        String joined = ((firstName != null ? firstName : "") + " " + (lastName != null ? lastName : "")).trim();
        return joined.isEmpty() ? null : joined;
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
