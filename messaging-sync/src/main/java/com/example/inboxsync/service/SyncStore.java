package com.example.inboxsync.service;

import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.Attachment;
import com.example.inboxsync.domain.Attendee;
import com.example.inboxsync.domain.Chat;
import com.example.inboxsync.domain.Contact;
import com.example.inboxsync.domain.Message;
import com.example.inboxsync.domain.ProfileView;
import com.example.inboxsync.domain.SyncState;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of synchronized entities. Every {@code upsert*} is atomic per natural key:
 * it inserts the row when the key is new and otherwise overwrites the stored row in place,
 * preserving its internal id and creation time. Parent references are internal ids.
 */
public interface SyncStore {

    Optional<Account> findAccount(String accountExternalId);

    Optional<Account> findAccountById(String id);

    List<Account> findAccountsBySyncState(SyncState syncState);

    /** Upserts by external account id. */
    Account saveAccount(Account account);

    Optional<Chat> findChat(String accountId, String chatExternalId);

    List<Chat> findChats(String accountId);

    /** Upserts by {@code (accountId, externalId)}. */
    Chat upsertChat(Chat chat);

    Optional<Attendee> findAttendee(String chatId, String externalId);

    /** Upserts by {@code (chatId, externalId)}. */
    Attendee upsertAttendee(Attendee attendee);

    Optional<Contact> findContact(String accountId, String externalId);

    /**
     * Merges {@code contact} into the stored contact with the same {@code (accountId, externalId)}
     * using {@link Contact#mergeFrom(Contact)}, or inserts it.
     */
    Contact upsertContact(Contact contact);

    Optional<Message> findMessage(String accountId, String externalId);

    Optional<Message> findMessageById(String id);

    /** Upserts by {@code (accountId, externalId)}. */
    Message upsertMessage(Message message);

    Optional<Attachment> findAttachment(String messageId, String externalId);

    Optional<Attachment> findAttachmentById(String id);

    List<Attachment> findAttachments(String messageId);

    /** Upserts by {@code (messageId, externalId)}. */
    Attachment upsertAttachment(Attachment attachment);

    /** Always inserts a new row. */
    ProfileView appendProfileView(ProfileView profileView);
}
