package com.example.inboxsync.persistence;

import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.Attachment;
import com.example.inboxsync.domain.Attendee;
import com.example.inboxsync.domain.Chat;
import com.example.inboxsync.domain.Contact;
import com.example.inboxsync.domain.Message;
import com.example.inboxsync.domain.ProfileView;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Copies between domain objects and JPA entities. The entity passed to {@code copyInto}
 * keeps its id and creation time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncEntityMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public Account toDomain(AccountEntity entity) {
        return Account.builder()
                .id(entity.getId())
                .accountId(entity.getAccountId())
                .provider(entity.getProvider())
                .status(entity.getStatus())
                .ownerId(entity.getOwnerId())
                .providerUserId(entity.getProviderUserId())
                .lastActivity(entity.getLastActivity())
                .deleted(entity.isDeleted())
                .syncState(entity.getSyncState())
                .syncStartedAt(entity.getSyncStartedAt())
                .syncCompletedAt(entity.getSyncCompletedAt())
                .syncError(entity.getSyncError())
                .chatsSynced(entity.getChatsSynced())
                .messagesSynced(entity.getMessagesSynced())
                .attendeesSynced(entity.getAttendeesSynced())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    public void copyInto(Account account, AccountEntity entity) {
        entity.setAccountId(account.getAccountId());
        entity.setProvider(account.getProvider());
        entity.setStatus(account.getStatus());
        entity.setOwnerId(account.getOwnerId());
        entity.setProviderUserId(account.getProviderUserId());
        entity.setLastActivity(account.getLastActivity());
        entity.setDeleted(account.isDeleted());
        entity.setSyncState(account.getSyncState());
        entity.setSyncStartedAt(account.getSyncStartedAt());
        entity.setSyncCompletedAt(account.getSyncCompletedAt());
        entity.setSyncError(account.getSyncError());
        entity.setChatsSynced(account.getChatsSynced());
        entity.setMessagesSynced(account.getMessagesSynced());
        entity.setAttendeesSynced(account.getAttendeesSynced());
        entity.setUpdatedAt(account.getUpdatedAt());
    }

    public Chat toDomain(ChatEntity entity) {
        return Chat.builder()
                .id(entity.getId())
                .accountId(entity.getAccountId())
                .externalId(entity.getExternalId())
                .type(entity.getType())
                .name(entity.getName())
                .lastMessageAt(entity.getLastMessageAt())
                .unreadCount(entity.getUnreadCount())
                .archived(entity.isArchived())
                .readOnly(entity.isReadOnly())
                .contentType(entity.getContentType())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    public void copyInto(Chat chat, ChatEntity entity) {
        entity.setAccountId(chat.getAccountId());
        entity.setExternalId(chat.getExternalId());
        entity.setType(chat.getType());
        entity.setName(chat.getName());
        entity.setLastMessageAt(chat.getLastMessageAt());
        entity.setUnreadCount(chat.getUnreadCount());
        entity.setArchived(chat.isArchived());
        entity.setReadOnly(chat.isReadOnly());
        entity.setContentType(chat.getContentType());
        entity.setUpdatedAt(chat.getUpdatedAt());
    }

    public Attendee toDomain(AttendeeEntity entity) {
        return Attendee.builder()
                .id(entity.getId())
                .chatId(entity.getChatId())
                .externalId(entity.getExternalId())
                .contactId(entity.getContactId())
                .displayName(entity.getDisplayName())
                .self(entity.isSelf())
                .hidden(entity.isHidden())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    public void copyInto(Attendee attendee, AttendeeEntity entity) {
        entity.setChatId(attendee.getChatId());
        entity.setExternalId(attendee.getExternalId());
        entity.setContactId(attendee.getContactId());
        entity.setDisplayName(attendee.getDisplayName());
        entity.setSelf(attendee.isSelf());
        entity.setHidden(attendee.isHidden());
        entity.setUpdatedAt(attendee.getUpdatedAt());
    }

    public Contact toDomain(ContactEntity entity) {
        return Contact.builder()
                .id(entity.getId())
                .accountId(entity.getAccountId())
                .externalId(entity.getExternalId())
                .fullName(entity.getFullName())
                .firstName(entity.getFirstName())
                .lastName(entity.getLastName())
                .headline(entity.getHeadline())
                .occupation(entity.getOccupation())
                .location(entity.getLocation())
                .profileImageUrl(entity.getProfileImageUrl())
                .providerUrl(entity.getProviderUrl())
                .connection(entity.isConnection())
                .networkDistance(entity.getNetworkDistance())
                .lastInteraction(entity.getLastInteraction())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    public void copyInto(Contact contact, ContactEntity entity) {
        entity.setAccountId(contact.getAccountId());
        entity.setExternalId(contact.getExternalId());
        entity.setFullName(contact.getFullName());
        entity.setFirstName(contact.getFirstName());
        entity.setLastName(contact.getLastName());
        entity.setHeadline(contact.getHeadline());
        entity.setOccupation(contact.getOccupation());
        entity.setLocation(contact.getLocation());
        entity.setProfileImageUrl(contact.getProfileImageUrl());
        entity.setProviderUrl(contact.getProviderUrl());
        entity.setConnection(contact.isConnection());
        entity.setNetworkDistance(contact.getNetworkDistance());
        entity.setLastInteraction(contact.getLastInteraction());
        entity.setUpdatedAt(contact.getUpdatedAt());
    }

    public Message toDomain(MessageEntity entity) {
        return Message.builder()
                .id(entity.getId())
                .accountId(entity.getAccountId())
                .externalId(entity.getExternalId())
                .chatId(entity.getChatId())
                .externalChatId(entity.getExternalChatId())
                .senderId(entity.getSenderId())
                .messageType(entity.getMessageType())
                .content(entity.getContent())
                .subject(entity.getSubject())
                .read(entity.isRead())
                .outgoing(entity.isOutgoing())
                .event(entity.isEvent())
                .sentAt(entity.getSentAt())
                .metadata(readMap(entity.getMetadata()))
                .edited(entity.isEdited())
                .editedAt(entity.getEditedAt())
                .deleted(entity.isDeleted())
                .deletedAt(entity.getDeletedAt())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    public void copyInto(Message message, MessageEntity entity) {
        entity.setAccountId(message.getAccountId());
        entity.setExternalId(message.getExternalId());
        entity.setChatId(message.getChatId());
        entity.setExternalChatId(message.getExternalChatId());
        entity.setSenderId(message.getSenderId());
        entity.setMessageType(message.getMessageType());
        entity.setContent(message.getContent());
        entity.setSubject(message.getSubject());
        entity.setRead(message.isRead());
        entity.setOutgoing(message.isOutgoing());
        entity.setEvent(message.isEvent());
        entity.setSentAt(message.getSentAt());
        entity.setMetadata(writeJson(message.getMetadata()));
        entity.setEdited(message.isEdited());
        entity.setEditedAt(message.getEditedAt());
        entity.setDeleted(message.isDeleted());
        entity.setDeletedAt(message.getDeletedAt());
        entity.setUpdatedAt(message.getUpdatedAt());
    }

    public Attachment toDomain(AttachmentEntity entity) {
        return Attachment.builder()
                .id(entity.getId())
                .messageId(entity.getMessageId())
                .externalId(entity.getExternalId())
                .kind(entity.getKind())
                .filename(entity.getFilename())
                .mimeType(entity.getMimeType())
                .fileSize(entity.getFileSize())
                .width(entity.getWidth())
                .height(entity.getHeight())
                .cacheUrl(entity.getCacheUrl())
                .cacheKey(entity.getCacheKey())
                .cacheUploadedAt(entity.getCacheUploadedAt())
                .sourceUrl(entity.getSourceUrl())
                .sourceUrlExpiresAt(entity.getSourceUrlExpiresAt())
                .content(entity.getContent())
                .unavailable(entity.isUnavailable())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    public void copyInto(Attachment attachment, AttachmentEntity entity) {
        entity.setMessageId(attachment.getMessageId());
        entity.setExternalId(attachment.getExternalId());
        entity.setKind(attachment.getKind());
        entity.setFilename(attachment.getFilename());
        entity.setMimeType(attachment.getMimeType());
        entity.setFileSize(attachment.getFileSize());
        entity.setWidth(attachment.getWidth());
        entity.setHeight(attachment.getHeight());
        entity.setCacheUrl(attachment.getCacheUrl());
        entity.setCacheKey(attachment.getCacheKey());
        entity.setCacheUploadedAt(attachment.getCacheUploadedAt());
        entity.setSourceUrl(attachment.getSourceUrl());
        entity.setSourceUrlExpiresAt(attachment.getSourceUrlExpiresAt());
        entity.setContent(attachment.getContent());
        entity.setUnavailable(attachment.isUnavailable());
        entity.setUpdatedAt(attachment.getUpdatedAt());
    }

    public ProfileView toDomain(ProfileViewEntity entity) {
        return ProfileView.builder()
                .id(entity.getId())
                .accountId(entity.getAccountId())
                .viewerExternalId(entity.getViewerExternalId())
                .viewerName(entity.getViewerName())
                .viewerHeadline(entity.getViewerHeadline())
                .viewerImageUrl(entity.getViewerImageUrl())
                .viewedAt(entity.getViewedAt())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public ProfileViewEntity toEntity(ProfileView view) {
        ProfileViewEntity entity = new ProfileViewEntity();
        entity.setId(view.getId());
        entity.setAccountId(view.getAccountId());
        entity.setViewerExternalId(view.getViewerExternalId());
        entity.setViewerName(view.getViewerName());
        entity.setViewerHeadline(view.getViewerHeadline());
        entity.setViewerImageUrl(view.getViewerImageUrl());
        entity.setViewedAt(view.getViewedAt());
        entity.setCreatedAt(view.getCreatedAt());
        return entity;
    }

    private String writeJson(Map<String, Object> value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize message metadata", e);
        }
    }

    private Map<String, Object> readMap(String json) {
        if (!StringUtils.hasText(json)) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable message metadata: {}", e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }
}
