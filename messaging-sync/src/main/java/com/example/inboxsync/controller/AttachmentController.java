package com.example.inboxsync.controller;

import com.example.inboxsync.dto.AttachmentView;
import com.example.inboxsync.service.AttachmentFreshnessService;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "sync")
@RestController
@RequestMapping("/api/attachments")
public class AttachmentController {

    private final AttachmentFreshnessService freshnessService;

    public AttachmentController(AttachmentFreshnessService freshnessService) {
        this.freshnessService = freshnessService;
    }

    @GetMapping("/{attachmentId}")
    public ResponseEntity<AttachmentView> getAttachment(@PathVariable String attachmentId) {
        return ResponseEntity.ok(freshnessService.resolve(attachmentId));
    }
}
