package com.example.inboxsync.provider;

import java.util.Base64;

public record AttachmentContent(byte[] bytes, String mimeType) {

    public String base64() {
        return Base64.getEncoder().encodeToString(bytes);
    }

    public static AttachmentContent fromBase64(String base64, String mimeType) {
        return new AttachmentContent(Base64.getDecoder().decode(base64), mimeType);
    }
}
