package com.example.inboxsync.provider;

/**
 * Read access to the messaging platform. Every method throws {@link ProviderException}
 * on transport or HTTP failure.
 */
public interface ProviderClient {

    ProviderPage<ProviderChat> listChats(String accountId, String cursor, int limit);

    ProviderPage<ProviderMessage> listMessages(String accountId, String chatId, String cursor, int limit);

    ProviderPage<ProviderAttendee> listAttendees(String accountId, String chatId, int limit);

    AttachmentContent getAttachmentContent(String messageExternalId, String attachmentExternalId, String accountId);

    ProviderProfile getProfile(String identifier, String accountId);
}
