package com.example.inboxsync.service;

import com.example.inboxsync.config.SyncProperties;
import com.example.inboxsync.domain.Account;
import com.example.inboxsync.domain.Attachment;
import com.example.inboxsync.domain.AttachmentState;
import com.example.inboxsync.domain.Message;
import com.example.inboxsync.dto.AttachmentView;
import com.example.inboxsync.provider.AttachmentContent;
import com.example.inboxsync.provider.ProviderClient;
import com.example.inboxsync.service.exception.SyncException;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Keeps attachment content reachable. Cached attachments are final; live platform URLs are
 * used until they come within the safety margin of expiring; anything else is refetched
 * from the platform and moved to the durable cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttachmentFreshnessService {

    private final SyncStore store;
    private final ChatLockManager lockManager;
    private final ProviderClient providerClient;
    private final AttachmentCacheStorage cacheStorage;
    private final AttachmentKeyFactory keyFactory;
    private final SyncProperties syncProperties;

    public AttachmentState stateOf(Attachment attachment) {
        return attachment.state(Instant.now(), syncProperties.getAttachments().getExpirySafetyMargin());
    }

    /**
     * Returns a usable version of {@code attachment}, refreshing it when stale. Never throws:
     * whatever goes wrong, the caller gets the best record available, at worst the one passed in.
     */
    public Attachment ensureAvailable(Attachment attachment) {
        try {
            if (stateOf(attachment) != AttachmentState.STALE_OR_MISSING) {
                return attachment;
            }
            Optional<Message> message = store.findMessageById(attachment.getMessageId());
            if (message.isEmpty()) {
                log.warn("Attachment {} references unknown message {}", attachment.getId(), attachment.getMessageId());
                return attachment;
            }
            Optional<Account> account = store.findAccountById(message.get().getAccountId());
            if (account.isEmpty()) {
                log.warn("Message {} references unknown account {}", message.get().getId(), message.get().getAccountId());
                return attachment;
            }
            return lockManager.withChatLock(account.get().getId(), message.get().getExternalChatId(),
                    () -> refreshLatest(attachment, message.get(), account.get()));
        } catch (RuntimeException ex) {
            log.warn("Could not refresh attachment {}; returning stored record", attachment.getId(), ex);
            return attachment;
        }
    }

    /**
     * Moves a freshly ingested attachment into the durable cache. A failed fetch leaves the
     * record as ingested; access-time refresh will retry.
     */
    public Attachment cacheOnIngest(Account account, Message message, Attachment attachment) {
        if (!syncProperties.getAttachments().isCacheOnIngest()
                || attachment.isUnavailable()
                || stateOf(attachment) == AttachmentState.CACHED) {
            return attachment;
        }
        try {
            AttachmentContent content = providerClient.getAttachmentContent(
                    message.getExternalId(), attachment.getExternalId(), account.getAccountId());
            return storeContent(attachment, content);
        } catch (RuntimeException ex) {
            log.debug("Deferred caching of attachment {} on message {}", attachment.getExternalId(), message.getExternalId(), ex);
            return attachment;
        }
    }

    public AttachmentView resolve(String attachmentId) {
        Attachment stored = store.findAttachmentById(attachmentId)
                .orElseThrow(() -> SyncException.notFound("Attachment not found: " + attachmentId));
        return toView(ensureAvailable(stored));
    }

    /**
     * Re-reads the attachment under the chat lock; a concurrent refresh may already have
     * cached it, in which case that row is returned untouched.
     */
    private Attachment refreshLatest(Attachment attachment, Message message, Account account) {
        Attachment latest = StringUtils.hasText(attachment.getId())
                ? store.findAttachmentById(attachment.getId()).orElse(attachment)
                : attachment;
        if (stateOf(latest) != AttachmentState.STALE_OR_MISSING) {
            return latest;
        }
        return refresh(latest, message, account);
    }

    private Attachment refresh(Attachment attachment, Message message, Account account) {
        AttachmentContent content;
        try {
            content = providerClient.getAttachmentContent(
                    message.getExternalId(), attachment.getExternalId(), account.getAccountId());
        } catch (RuntimeException ex) {
            log.warn("Attachment {} of message {} could not be fetched; marking unavailable",
                    attachment.getExternalId(), message.getExternalId(), ex);
            return markUnavailable(attachment);
        }
        return storeContent(attachment, content);
    }

    private Attachment markUnavailable(Attachment attachment) {
        try {
            return store.upsertAttachment(attachment.toBuilder()
                    .unavailable(true)
                    .updatedAt(Instant.now())
                    .build());
        } catch (RuntimeException ex) {
            log.warn("Could not persist unavailable flag for attachment {}", attachment.getId(), ex);
            return attachment;
        }
    }

    private Attachment storeContent(Attachment attachment, AttachmentContent content) {
        Instant now = Instant.now();
        String mimeType = StringUtils.hasText(attachment.getMimeType()) ? attachment.getMimeType() : content.mimeType();
        String cacheKey = StringUtils.hasText(attachment.getCacheKey())
                ? attachment.getCacheKey()
                : keyFactory.attachmentKey(attachment.getMessageId(), attachment.getFilename(), mimeType);
        Attachment.AttachmentBuilder updated = attachment.toBuilder()
                .mimeType(mimeType)
                .cacheKey(cacheKey)
                .unavailable(false)
                .updatedAt(now);
        try {
            String url = cacheStorage.upload(cacheKey, content.bytes(), mimeType);
            updated.cacheUrl(url)
                    .cacheUploadedAt(now)
                    .content(null);
        } catch (RuntimeException ex) {
            log.warn("Upload of attachment {} to {} failed; keeping content inline", attachment.getId(), cacheKey, ex);
            updated.content(content.base64());
        }
        return store.upsertAttachment(updated.build());
    }

    private AttachmentView toView(Attachment attachment) {
        AttachmentView.AttachmentViewBuilder view = AttachmentView.builder()
                .id(attachment.getId())
                .messageId(attachment.getMessageId())
                .kind(attachment.getKind())
                .filename(attachment.getFilename())
                .mimeType(attachment.getMimeType())
                .fileSize(attachment.getFileSize())
                .unavailable(attachment.isUnavailable());
        AttachmentState state = stateOf(attachment);
        if (state == AttachmentState.CACHED) {
            return view.url(attachment.getCacheUrl()).source(AttachmentView.Source.CACHE).build();
        }
        if (state == AttachmentState.LIVE) {
            return view.url(attachment.getSourceUrl()).source(AttachmentView.Source.PLATFORM).build();
        }
        if (StringUtils.hasText(attachment.getContent())) {
            return view.content(attachment.getContent()).source(AttachmentView.Source.INLINE).build();
        }
        return view.source(AttachmentView.Source.NONE).build();
    }
}
