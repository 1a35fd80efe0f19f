package com.example.inboxsync.service;

/**
 * Durable blob storage for attachment content. Objects are never expired.
 */
public interface AttachmentCacheStorage {

    /**
     * Stores {@code content} under {@code key} and returns its public URL.
     *
     * @throws AttachmentCacheException when the upload fails
     */
    String upload(String key, byte[] content, String contentType);

    String publicUrl(String key);
}
