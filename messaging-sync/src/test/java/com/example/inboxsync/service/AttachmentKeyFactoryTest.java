package com.example.inboxsync.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.inboxsync.config.SyncProperties;
import org.junit.jupiter.api.Test;

class AttachmentKeyFactoryTest {

    private final AttachmentKeyFactory keyFactory = new AttachmentKeyFactory(new SyncProperties());

    @Test
    void attachmentKey_usesPrefixMessageIdAndRandomSuffix() {
        String first = keyFactory.attachmentKey("msg-1", "report.PDF", null);
        String second = keyFactory.attachmentKey("msg-1", "report.PDF", null);

        assertTrue(first.matches("attachments/msg-1/[a-z0-9]{6}\\.pdf"), first);
        assertNotEquals(first, second);
    }

    @Test
    void extension_fallsBackToMimeType_whenFilenameHasNone() {
        assertEquals("jpg", AttachmentKeyFactory.extension("photo", "image/jpeg; charset=binary"));
        assertEquals("mp4", AttachmentKeyFactory.extension(null, "video/mp4"));
    }

    @Test
    void extension_returnsBin_whenNothingKnown() {
        assertEquals("bin", AttachmentKeyFactory.extension(null, "application/x-unknown"));
        assertEquals("bin", AttachmentKeyFactory.extension(null, null));
    }
}
