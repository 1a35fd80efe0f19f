package com.example.inboxsync.service;

import com.example.inboxsync.config.SyncProperties;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Builds durable cache keys of the form {@code attachments/{messageId}/{suffix}.{ext}}.
 */
@Component
public class AttachmentKeyFactory {

    private static final String SUFFIX_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int SUFFIX_LENGTH = 6;

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
            Map.entry("image/jpeg", "jpg"),
            Map.entry("image/jpg", "jpg"),
            Map.entry("image/png", "png"),
            Map.entry("image/gif", "gif"),
            Map.entry("image/webp", "webp"),
            Map.entry("image/svg+xml", "svg"),
            Map.entry("video/mp4", "mp4"),
            Map.entry("video/webm", "webm"),
            Map.entry("video/quicktime", "mov"),
            Map.entry("audio/mpeg", "mp3"),
            Map.entry("audio/wav", "wav"),
            Map.entry("audio/ogg", "ogg"),
            Map.entry("application/pdf", "pdf"),
            Map.entry("text/plain", "txt"),
            Map.entry("application/msword", "doc"),
            Map.entry("application/vnd.openxmlformats-officedocument.wordprocessingml.document", "docx"));

    private final SyncProperties syncProperties;

    public AttachmentKeyFactory(SyncProperties syncProperties) {
        this.syncProperties = syncProperties;
    }

    public String attachmentKey(String messageId, String filename, String mimeType) {
        return "%s/%s/%s.%s".formatted(
                syncProperties.getAttachments().getKeyPrefix(), messageId, randomSuffix(), extension(filename, mimeType));
    }

    static String extension(String filename, String mimeType) {
        String fromName = StringUtils.getFilenameExtension(filename);
        if (StringUtils.hasText(fromName) && fromName.length() <= 8 && fromName.chars().allMatch(Character::isLetterOrDigit)) {
            return fromName.toLowerCase(Locale.ROOT);
        }
        if (StringUtils.hasText(mimeType)) {
            String baseType = mimeType.split(";")[0].trim().toLowerCase(Locale.ROOT);
            String mapped = EXTENSIONS.get(baseType);
            if (mapped != null) {
                return mapped;
            }
        }
        return "bin";
    }

    private String randomSuffix() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(SUFFIX_ALPHABET.charAt(random.nextInt(SUFFIX_ALPHABET.length())));
        }
        return suffix.toString();
    }
}
