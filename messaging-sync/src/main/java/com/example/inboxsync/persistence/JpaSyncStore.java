package com.example.inboxsync.persistence;

import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.Attachment;
import com.example.inboxsync.domain.Attendee;
import com.example.inboxsync.domain.Chat;
import com.example.inboxsync.domain.Contact;
import com.example.inboxsync.domain.Message;
import com.example.inboxsync.domain.ProfileView;
import com.example.inboxsync.domain.SyncState;
import com.example.inboxsync.service.SyncStore;
import com.example.inboxsync.service.exception.SyncErrorType;
import com.example.inboxsync.service.exception.SyncException;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

/**
 * Relational {@link SyncStore}. Each upsert runs in its own transaction; when two writers
 * race to insert the same natural key, the loser retries once and updates the winner's row.
 */
@Slf4j
@Repository
public class JpaSyncStore implements SyncStore {

    private final AccountJpaRepository accounts;
    private final ChatJpaRepository chats;
    private final AttendeeJpaRepository attendees;
    private final ContactJpaRepository contacts;
    private final MessageJpaRepository messages;
    private final AttachmentJpaRepository attachments;
    private final ProfileViewJpaRepository profileViews;
    private final SyncEntityMapper mapper;
    private final TransactionTemplate transactionTemplate;

    public JpaSyncStore(
            AccountJpaRepository accounts,
            ChatJpaRepository chats,
            AttendeeJpaRepository attendees,
            ContactJpaRepository contacts,
            MessageJpaRepository messages,
            AttachmentJpaRepository attachments,
            ProfileViewJpaRepository profileViews,
            SyncEntityMapper mapper,
            PlatformTransactionManager transactionManager) {
        this.accounts = accounts;
        this.chats = chats;
        this.attendees = attendees;
        this.contacts = contacts;
        this.messages = messages;
        this.attachments = attachments;
        this.profileViews = profileViews;
        this.mapper = mapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findAccount(String accountExternalId) {
        if (!StringUtils.hasText(accountExternalId)) {
            return Optional.empty();
        }
        return accounts.findByAccountId(accountExternalId).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findAccountById(String id) {
        if (!StringUtils.hasText(id)) {
            return Optional.empty();
        }
        return accounts.findById(id).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Account> findAccountsBySyncState(SyncState syncState) {
        if (syncState == null) {
            return Collections.emptyList();
        }
        return accounts.findBySyncState(syncState).stream().map(mapper::toDomain).toList();
    }

    @Override
    public Account saveAccount(Account account) {
        return upsert("account " + account.getAccountId(), () -> {
            AccountEntity entity = accounts.findByAccountId(account.getAccountId()).orElseGet(() -> {
                AccountEntity created = new AccountEntity();
                created.setId(newId(account.getId()));
                created.setCreatedAt(createdAt(account.getCreatedAt()));
                return created;
            });
            mapper.copyInto(account, entity);
            entity.setUpdatedAt(updatedAt(account.getUpdatedAt()));
            return mapper.toDomain(accounts.saveAndFlush(entity));
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Chat> findChat(String accountId, String chatExternalId) {
        if (!StringUtils.hasText(accountId) || !StringUtils.hasText(chatExternalId)) {
            return Optional.empty();
        }
        return chats.findByAccountIdAndExternalId(accountId, chatExternalId).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Chat> findChats(String accountId) {
        if (!StringUtils.hasText(accountId)) {
            return Collections.emptyList();
        }
        return chats.findByAccountIdOrderByLastMessageAtDesc(accountId).stream().map(mapper::toDomain).toList();
    }

    @Override
    public Chat upsertChat(Chat chat) {
        return upsert("chat " + chat.getExternalId(), () -> {
            ChatEntity entity = chats.findByAccountIdAndExternalId(chat.getAccountId(), chat.getExternalId())
                    .orElseGet(() -> {
                        ChatEntity created = new ChatEntity();
                        created.setId(newId(chat.getId()));
                        created.setCreatedAt(createdAt(chat.getCreatedAt()));
                        return created;
                    });
            mapper.copyInto(chat, entity);
            entity.setUpdatedAt(updatedAt(chat.getUpdatedAt()));
            return mapper.toDomain(chats.saveAndFlush(entity));
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Attendee> findAttendee(String chatId, String externalId) {
        if (!StringUtils.hasText(chatId) || !StringUtils.hasText(externalId)) {
            return Optional.empty();
        }
        return attendees.findByChatIdAndExternalId(chatId, externalId).map(mapper::toDomain);
    }

    @Override
    public Attendee upsertAttendee(Attendee attendee) {
        return upsert("attendee " + attendee.getExternalId(), () -> {
            AttendeeEntity entity = attendees.findByChatIdAndExternalId(attendee.getChatId(), attendee.getExternalId())
                    .orElseGet(() -> {
                        AttendeeEntity created = new AttendeeEntity();
                        created.setId(newId(attendee.getId()));
                        created.setCreatedAt(createdAt(attendee.getCreatedAt()));
                        return created;
                    });
            mapper.copyInto(attendee, entity);
            entity.setUpdatedAt(updatedAt(attendee.getUpdatedAt()));
            return mapper.toDomain(attendees.saveAndFlush(entity));
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Contact> findContact(String accountId, String externalId) {
        if (!StringUtils.hasText(accountId) || !StringUtils.hasText(externalId)) {
            return Optional.empty();
        }
        return contacts.findByAccountIdAndExternalId(accountId, externalId).map(mapper::toDomain);
    }

    @Override
    public Contact upsertContact(Contact contact) {
        return upsert("contact " + contact.getExternalId(), () -> {
            Optional<ContactEntity> existing =
                    contacts.findByAccountIdAndExternalId(contact.getAccountId(), contact.getExternalId());
            ContactEntity entity;
            Contact merged;
            if (existing.isPresent()) {
                entity = existing.get();
                merged = mapper.toDomain(entity).mergeFrom(contact);
            } else {
                entity = new ContactEntity();
                entity.setId(newId(contact.getId()));
                entity.setCreatedAt(createdAt(contact.getCreatedAt()));
                merged = contact;
            }
            mapper.copyInto(merged, entity);
            entity.setUpdatedAt(Instant.now());
            return mapper.toDomain(contacts.saveAndFlush(entity));
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Message> findMessage(String accountId, String externalId) {
        if (!StringUtils.hasText(accountId) || !StringUtils.hasText(externalId)) {
            return Optional.empty();
        }
        return messages.findByAccountIdAndExternalId(accountId, externalId).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Message> findMessageById(String id) {
        if (!StringUtils.hasText(id)) {
            return Optional.empty();
        }
        return messages.findById(id).map(mapper::toDomain);
    }

    @Override
    public Message upsertMessage(Message message) {
        return upsert("message " + message.getExternalId(), () -> {
            MessageEntity entity = messages.findByAccountIdAndExternalId(message.getAccountId(), message.getExternalId())
                    .orElseGet(() -> {
                        MessageEntity created = new MessageEntity();
                        created.setId(newId(message.getId()));
                        created.setCreatedAt(createdAt(message.getCreatedAt()));
                        return created;
                    });
            mapper.copyInto(message, entity);
            entity.setUpdatedAt(updatedAt(message.getUpdatedAt()));
            return mapper.toDomain(messages.saveAndFlush(entity));
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Attachment> findAttachment(String messageId, String externalId) {
        if (!StringUtils.hasText(messageId) || !StringUtils.hasText(externalId)) {
            return Optional.empty();
        }
        return attachments.findByMessageIdAndExternalId(messageId, externalId).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Attachment> findAttachmentById(String id) {
        if (!StringUtils.hasText(id)) {
            return Optional.empty();
        }
        return attachments.findById(id).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Attachment> findAttachments(String messageId) {
        if (!StringUtils.hasText(messageId)) {
            return Collections.emptyList();
        }
        return attachments.findByMessageId(messageId).stream().map(mapper::toDomain).toList();
    }

    @Override
    public Attachment upsertAttachment(Attachment attachment) {
        return upsert("attachment " + attachment.getExternalId(), () -> {
            AttachmentEntity entity = attachments
                    .findByMessageIdAndExternalId(attachment.getMessageId(), attachment.getExternalId())
                    .orElseGet(() -> {
                        AttachmentEntity created = new AttachmentEntity();
                        created.setId(newId(attachment.getId()));
                        created.setCreatedAt(createdAt(attachment.getCreatedAt()));
                        return created;
                    });
            mapper.copyInto(attachment, entity);
            entity.setUpdatedAt(updatedAt(attachment.getUpdatedAt()));
            return mapper.toDomain(attachments.saveAndFlush(entity));
        });
    }

    @Override
    public ProfileView appendProfileView(ProfileView profileView) {
        ProfileViewEntity entity = mapper.toEntity(profileView);
        entity.setId(newId(profileView.getId()));
        entity.setCreatedAt(createdAt(profileView.getCreatedAt()));
        try {
            return transactionTemplate.execute(status -> mapper.toDomain(profileViews.save(entity)));
        } catch (DataAccessException ex) {
            throw storeFailure("profile view", ex);
        }
    }

    private <T> T upsert(String what, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataIntegrityViolationException conflict) {
            log.debug("Concurrent insert of {}; retrying as update", what);
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (DataAccessException ex) {
                throw storeFailure(what, ex);
            }
        } catch (DataAccessException ex) {
            throw storeFailure(what, ex);
        }
    }

    private SyncException storeFailure(String what, DataAccessException ex) {
        return new SyncException(SyncErrorType.TRANSIENT, "Failed to store " + what, "store_unavailable", ex);
    }

    private String newId(String requested) {
        return StringUtils.hasText(requested) ? requested : UUID.randomUUID().toString();
    }

    private Instant createdAt(Instant requested) {
        return requested != null ? requested : Instant.now();
    }

    private Instant updatedAt(Instant requested) {
        return requested != null ? requested : Instant.now();
    }
}
