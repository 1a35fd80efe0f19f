package com.example.inboxsync.service;

import com.example.inboxsync.config.SyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * Attachment cache on S3-compatible object storage (R2, MinIO, Spaces).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class S3AttachmentCacheStorage implements AttachmentCacheStorage {

    private final S3Client attachmentCacheS3Client;
    private final SyncProperties syncProperties;

    @Override
    public String upload(String key, byte[] content, String contentType) {
        SyncProperties.Storage storage = syncProperties.getStorage();
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(storage.getBucket())
                .key(key)
                .contentType(StringUtils.hasText(contentType) ? contentType : "application/octet-stream")
                .contentLength((long) content.length)
                .build();
        try {
            attachmentCacheS3Client.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException ex) {
            throw new AttachmentCacheException("Failed to upload " + key + " to bucket " + storage.getBucket(), ex);
        }
        log.debug("Uploaded {} bytes to {}/{}", content.length, storage.getBucket(), key);
        return publicUrl(key);
    }

    @Override
    public String publicUrl(String key) {
        SyncProperties.Storage storage = syncProperties.getStorage();
        String base = StringUtils.hasText(storage.getPublicBaseUrl())
                ? storage.getPublicBaseUrl()
                : storage.getEndpoint() + "/" + storage.getBucket();
        return StringUtils.trimTrailingCharacter(base, '/') + "/" + key;
    }
}
